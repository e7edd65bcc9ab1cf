package edu.uw.easyconllu.dependencies;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;

/**
 * Gives the tokens of a sentence the ids 1..N in their current order and rewrites every reference to the old ids.
 *
 * The first pass numbers atomic tokens, gives each span the range of the atomic tokens that follow it, numbers empty
 * nodes after the word they follow, and records old to new ids. The second pass rewrites heads (and the heads named in
 * DEPS) through that map, and resolves {@link Head#SPAN_FIRST}. A head that cannot be resolved is left as it was and
 * reported in the result. Running it on a sentence that is already numbered 1..N changes nothing.
 */
public class Renumberer {

	private static final Splitter PIPE = Splitter.on('|');
	private static final Joiner PIPE_JOINER = Joiner.on('|');

	public static class Result {
		private final IdMap idMap;
		private final List<Token> unresolvedHeads;
		private final List<String> problems;

		Result(final IdMap idMap, final List<Token> unresolvedHeads, final List<String> problems) {
			this.idMap = idMap;
			this.unresolvedHeads = unresolvedHeads;
			this.problems = problems;
		}

		public IdMap getIdMap() {
			return idMap;
		}

		/**
		 * Tokens whose head did not resolve. Their heads still hold the old value.
		 */
		public List<Token> getUnresolvedHeads() {
			return unresolvedHeads;
		}

		/**
		 * Spans that did not match their members, and ids that occurred twice.
		 */
		public List<String> getProblems() {
			return problems;
		}

		public boolean isClean() {
			return unresolvedHeads.isEmpty() && problems.isEmpty();
		}
	}

	public Result renumber(final Sentence sentence) {
		final IdMap idMap = new IdMap();
		final List<String> problems = new ArrayList<>();
		final Map<Token, TokenId> firstOfSpan = new IdentityHashMap<>();

		// Pass 1: assign ids.
		final List<Token> tokens = sentence.getTokens();
		final List<Token> spansToDrop = new ArrayList<>();
		int next = 1;
		int lastWord = 0;
		int emptyCount = 0;
		for (final Token token : tokens) {
			if (token.isPassThrough()) {
				continue;
			}

			final TokenId oldId = token.getId();
			if (oldId.isSpan()) {
				final List<Token> members = sentence.getSpanMembers(token);
				if (members.size() != oldId.getSpanSize()) {
					problems.add("Span " + oldId + " covers " + oldId.getSpanSize() + " tokens but " + members.size()
							+ " follow it");
				}
				if (members.isEmpty()) {
					spansToDrop.add(token);
					continue;
				}
				final TokenId first = TokenId.word(next);
				for (final Token member : members) {
					firstOfSpan.put(member, first);
				}
				// Pending ranges are not unique, and nothing refers to a span by its id.
				if (oldId.getKind() == TokenId.Kind.RANGE) {
					idMap.put(oldId, TokenId.range(next, next + members.size() - 1));
				}
				token.setId(TokenId.range(next, next + members.size() - 1));
			} else if (oldId.isEmptyNode()) {
				emptyCount++;
				final TokenId newId = TokenId.empty(lastWord, emptyCount);
				idMap.put(oldId, newId);
				token.setId(newId);
			} else {
				final TokenId newId = TokenId.word(next);
				idMap.put(oldId, newId);
				token.setId(newId);
				lastWord = next;
				emptyCount = 0;
				next++;
			}
		}
		tokens.removeAll(spansToDrop);
		for (final TokenId duplicate : idMap.getDuplicates()) {
			problems.add("Id " + duplicate + " occurs more than once");
		}

		// Pass 2: rewrite references.
		final List<Token> unresolved = new ArrayList<>();
		for (final Token token : tokens) {
			if (token.isPassThrough() || token.isSpan()) {
				continue;
			}

			final Head head = token.getHead();
			Head newHead = head;
			if (head.isToken()) {
				final TokenId target = idMap.get(head.getTarget());
				newHead = target == null || target.isSpan() ? null : Head.of(target);
			} else if (head.getKind() == Head.Kind.SPAN_FIRST) {
				final TokenId first = firstOfSpan.get(token);
				newHead = first == null || first.equals(token.getId()) ? null : Head.of(first);
			}

			if (newHead == null) {
				unresolved.add(token);
			} else if (!newHead.equals(head)) {
				token.setHead(newHead);
			}

			final String deps = remapDeps(token.getDeps(), idMap);
			if (!deps.equals(token.getDeps())) {
				token.setDeps(deps);
			}
		}

		return new Result(idMap, unresolved, problems);
	}

	/**
	 * Rewrites "head:relation" entries of the DEPS column. Entries whose head is not in the map are kept.
	 */
	private static String remapDeps(final String deps, final IdMap idMap) {
		if (deps.equals(Token.NONE) || deps.indexOf(':') < 0) {
			return deps;
		}

		final List<String> result = new ArrayList<>();
		for (final String entry : PIPE.split(deps)) {
			final int colon = entry.indexOf(':');
			final TokenId oldHead = colon > 0 ? TokenId.parse(entry.substring(0, colon)) : null;
			if (oldHead != null && idMap.contains(oldHead)) {
				result.add(idMap.get(oldHead) + entry.substring(colon));
			} else {
				result.add(entry);
			}
		}
		return PIPE_JOINER.join(result);
	}
}
