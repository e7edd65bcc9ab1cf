package edu.uw.easyconllu.dependencies;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import edu.uw.easyconllu.corpora.TokenId;

/**
 * Old id to new id, for one renumbering of one sentence. An old id that occurs twice keeps its first mapping and is
 * remembered as a duplicate.
 */
public class IdMap {
	private final Map<TokenId, TokenId> oldToNew = new LinkedHashMap<>();
	private final Set<TokenId> duplicates = new LinkedHashSet<>();

	void put(final TokenId oldId, final TokenId newId) {
		if (oldToNew.containsKey(oldId)) {
			duplicates.add(oldId);
		} else {
			oldToNew.put(oldId, newId);
		}
	}

	public TokenId get(final TokenId oldId) {
		return oldToNew.get(oldId);
	}

	public boolean contains(final TokenId oldId) {
		return oldToNew.containsKey(oldId);
	}

	public int size() {
		return oldToNew.size();
	}

	public Set<TokenId> getDuplicates() {
		return Collections.unmodifiableSet(duplicates);
	}

	/**
	 * True if no id changes.
	 */
	public boolean isIdentity() {
		for (final Map.Entry<TokenId, TokenId> entry : oldToNew.entrySet()) {
			if (!entry.getKey().equals(entry.getValue())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return oldToNew.toString();
	}
}
