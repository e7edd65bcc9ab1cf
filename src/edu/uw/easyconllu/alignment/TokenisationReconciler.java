package edu.uw.easyconllu.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeEdits;
import edu.uw.easyconllu.dependencies.TreeEditException;

/**
 * Brings a sentence to the tokenisation of another source of the same text, by merging neighbouring words whose forms
 * together make up one word of the reference. Words are never split, so a reference that cuts finer than the sentence
 * cannot be reconciled.
 */
public class TokenisationReconciler {

	/**
	 * @param reference
	 *            the forms to match, in order
	 * @return true if the words of {@code sentence} now have exactly the forms of {@code reference}, ignoring case. On
	 *         false the sentence may be partly merged; callers should work on a copy.
	 */
	public boolean reconcile(final List<String> reference, final Sentence sentence) {
		int position = 0;
		for (final String expected : reference) {
			final List<Token> words = words(sentence);
			if (position >= words.size()) {
				return false;
			}

			Token word = words.get(position);
			while (!TextNormalizer.sameForm(word.getForm(), expected)) {
				if (!isPrefix(word.getForm(), expected) || position + 1 >= words(sentence).size()) {
					return false;
				}
				final Token next = words(sentence).get(position + 1);
				if (!isPrefix(word.getForm() + next.getForm(), expected)) {
					return false;
				}

				try {
					word = join(sentence, word, next);
				} catch (final TreeEditException e) {
					return false;
				}
			}
			position++;
		}
		return position == words(sentence).size();
	}

	/**
	 * Merges two neighbouring words into one written word. The one that heads the other, or else the first, survives.
	 */
	private static Token join(final Sentence sentence, final Token first, final Token second) {
		first.setMisc(first.getMisc().set("SpaceAfter", "No"));
		if (first.getHead().pointsTo(second.getId())) {
			TreeEdits.merge(sentence, second, first);
			return second;
		}
		return TreeEdits.merge(sentence, first, second);
	}

	/**
	 * The syntactic words of a sentence, without empty nodes.
	 */
	static List<Token> words(final Sentence sentence) {
		final List<Token> result = new ArrayList<>();
		for (final Token token : sentence.getTokens()) {
			if (token.isAtomic() && !token.isEmptyNode()) {
				result.add(token);
			}
		}
		return result;
	}

	private static boolean isPrefix(final String prefix, final String word) {
		return word.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT));
	}
}
