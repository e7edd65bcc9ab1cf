package edu.uw.easyconllu.dependencies;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;

/**
 * Structural checks on a sentence. None of them repair anything.
 */
public class TreeValidator {

	private TreeValidator() {
	}

	/**
	 * Tokens whose head names a token that is not in the sentence.
	 */
	public static List<Token> danglingHeads(final Sentence sentence) {
		final TreeIndex index = TreeIndex.of(sentence);
		final List<Token> result = new ArrayList<>();
		for (final Token token : sentence.getWords()) {
			if (token.getHead().isToken()) {
				final Token head = index.getToken(token.getHead().getTarget());
				if (head == null || head.isSpan()) {
					result.add(token);
				}
			}
		}
		return result;
	}

	/**
	 * The tokens of the first head cycle found, in the order they were walked, or an empty list. Heads that do not
	 * resolve end a walk without counting as a cycle.
	 */
	public static List<Token> findCycle(final Sentence sentence) {
		final TreeIndex index = TreeIndex.of(sentence);
		// Absent: unvisited. FALSE: on the current path. TRUE: known to reach a root.
		final Map<Token, Boolean> state = new IdentityHashMap<>();

		for (final Token start : sentence.getWords()) {
			final List<Token> path = new ArrayList<>();
			Token current = start;
			while (current != null && !state.containsKey(current)) {
				state.put(current, Boolean.FALSE);
				path.add(current);
				current = index.getHead(current);
			}

			if (current != null && state.get(current) == Boolean.FALSE) {
				return new ArrayList<>(path.subList(path.indexOf(current), path.size()));
			}

			for (final Token visited : path) {
				state.put(visited, Boolean.TRUE);
			}
		}

		return Collections.emptyList();
	}

	public static boolean isAcyclic(final Sentence sentence) {
		return findCycle(sentence).isEmpty();
	}

	public static int countRoots(final Sentence sentence) {
		return TreeIndex.of(sentence).roots().size();
	}

	/**
	 * Checks that ids are exactly 1..N, and that every span is a range covering precisely the atomic tokens that follow
	 * it. Returns a description of each problem.
	 */
	public static List<String> checkNumbering(final Sentence sentence) {
		final List<String> problems = new ArrayList<>();
		int expected = 1;
		int spanEnd = 0;
		for (final Token token : sentence.getTokens()) {
			if (token.isPassThrough() || token.getId().isEmptyNode()) {
				continue;
			}

			final TokenId id = token.getId();
			if (id.getKind() == TokenId.Kind.RANGE) {
				if (id.getStart() != expected) {
					problems.add("Span " + id + " should start at " + expected);
				}
				if (id.getStart() <= spanEnd) {
					problems.add("Span " + id + " overlaps the previous span");
				}
				final List<Token> members = sentence.getSpanMembers(token);
				if (members.size() != id.getSpanSize()) {
					problems.add("Span " + id + " is followed by " + members.size() + " tokens");
				}
				spanEnd = id.getEnd();
			} else if (id.getKind() == TokenId.Kind.WORD) {
				if (id.getIndex() != expected) {
					problems.add("Token " + id + " should be " + expected);
				}
				expected = id.getIndex() + 1;
			} else {
				problems.add("Token " + id + " has not been numbered");
			}
		}
		return problems;
	}
}
