package edu.uw.easyconllu.dependencies;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;

/**
 * Lookup tables over one sentence: id to token, and head id to dependents. The index reflects the sentence at the time
 * it was built; any edit that changes ids or heads requires a new index.
 */
public class TreeIndex {

	public enum Direction {
		LEFT, RIGHT, ANY
	}

	private final List<Token> tokens;
	private final Map<TokenId, Integer> idToPosition = new HashMap<>();
	private final ListMultimap<TokenId, Integer> headToDependents = ArrayListMultimap.create();
	private final List<Integer> roots = new ArrayList<>();

	public TreeIndex(final Sentence sentence) {
		this.tokens = ImmutableList.copyOf(sentence.getTokens());
		for (int i = 0; i < tokens.size(); i++) {
			final Token token = tokens.get(i);
			if (token.isPassThrough()) {
				continue;
			}
			idToPosition.put(token.getId(), i);
			if (token.isSpan()) {
				continue;
			}

			if (token.getHead().isToken()) {
				headToDependents.put(token.getHead().getTarget(), i);
			} else if (token.getHead().isRoot()) {
				roots.add(i);
			}
		}
	}

	public static TreeIndex of(final Sentence sentence) {
		return new TreeIndex(sentence);
	}

	public boolean contains(final TokenId id) {
		return idToPosition.containsKey(id);
	}

	public Token getToken(final TokenId id) {
		final Integer position = idToPosition.get(id);
		return position == null ? null : tokens.get(position);
	}

	/**
	 * Position in the token list the index was built from, or -1.
	 */
	public int getPosition(final TokenId id) {
		final Integer position = idToPosition.get(id);
		return position == null ? -1 : position;
	}

	public Token getHead(final Token token) {
		return token.getHead().isToken() ? getToken(token.getHead().getTarget()) : null;
	}

	/**
	 * Dependents in surface order.
	 */
	public List<Token> dependents(final TokenId id) {
		final List<Token> result = new ArrayList<>();
		for (final int position : headToDependents.get(id)) {
			result.add(tokens.get(position));
		}
		return result;
	}

	/**
	 * The first dependent, in surface order, whose relation is one of {@code relations}. LEFT and RIGHT only consider
	 * dependents before or after the head.
	 */
	public Token firstDependentWithRelation(final TokenId id, final Collection<String> relations,
			final Direction direction) {
		final int headPosition = getPosition(id);
		for (final int position : headToDependents.get(id)) {
			if (direction == Direction.LEFT && position > headPosition
					|| direction == Direction.RIGHT && position < headPosition) {
				continue;
			}
			final Token dependent = tokens.get(position);
			if (relations.contains(dependent.getDeprel())) {
				return dependent;
			}
		}
		return null;
	}

	public boolean hasDependentWithPOS(final TokenId id, final String pos) {
		for (final int position : headToDependents.get(id)) {
			if (tokens.get(position).getUpos().equals(pos)) {
				return true;
			}
		}
		return false;
	}

	public List<Token> roots() {
		final List<Token> result = new ArrayList<>(roots.size());
		for (final int position : roots) {
			result.add(tokens.get(position));
		}
		return result;
	}

	public List<Token> getTokens() {
		return tokens;
	}
}
