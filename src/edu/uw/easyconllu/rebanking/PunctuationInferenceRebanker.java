package edu.uw.easyconllu.rebanking;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TokenTemplate;
import edu.uw.easyconllu.dependencies.TreeEdits;

/**
 * The legacy treebank keeps punctuation out of the token list, in the presentation-after attribute of the preceding
 * word. A single punctuation character there (other than "?", which marks questions) becomes a token of its own, right
 * after the word. It attaches to the nearest other token without a head; when two are equally near, the earlier one
 * wins. Without such a token nothing is inserted.
 */
public class PunctuationInferenceRebanker extends Rebanker {

	static final String QUESTION = "?";

	@Override
	public String getName() {
		return "punctuation-inference";
	}

	@Override
	protected List<TokenRule> getRules() {
		return ImmutableList.of(TokenRule.of("punctuation-from-presentation-after",
				(token, context) -> inferredPunctuation(token, context.getSnapshot()) != null
						&& nearestHeadless(context.getSnapshot(), token) != null,
				this::insert));
	}

	/**
	 * The punctuation to insert after a token, or null.
	 */
	static String inferredPunctuation(final Token token, final Sentence sentence) {
		if (!token.isAtomic()) {
			return null;
		}
		final String presentationAfter = token.getAttribute(Token.PRESENTATION_AFTER);
		if (presentationAfter == null) {
			return null;
		}
		final String mark = presentationAfter.trim();
		if (mark.length() != 1 || mark.equals(QUESTION) || Character.isLetterOrDigit(mark.charAt(0))) {
			return null;
		}

		// Already inserted by an earlier run.
		final Token next = next(sentence, sentence.indexOf(token));
		if (next != null && next.getForm().equals(mark) && "PUNCT".equals(next.getUpos())) {
			return null;
		}
		return mark;
	}

	private void insert(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		if (live == null) {
			return;
		}
		final String mark = inferredPunctuation(token, context.getSnapshot());
		final Token head = nearestHeadless(context.getSnapshot(), token);
		final TokenTemplate template = TokenTemplate.of(mark).lemma(mark).upos("PUNCT").deprel("punct")
				.head(Head.of(head.getId()));

		final Sentence sentence = context.getSentence();
		final Token span = sentence.getSpanOf(live);
		final List<Token> members = span == null ? ImmutableList.of(live) : sentence.getSpanMembers(span);
		TreeEdits.insertSynthetic(sentence, sentence.indexOf(members.get(members.size() - 1)) + 1, template);
	}

	/**
	 * The token without a head closest to {@code token}, looking both ways and never at {@code token} itself. Ties go
	 * to the earlier token.
	 *
	 * @return the token, or null if there is none
	 */
	static Token nearestHeadless(final Sentence sentence, final Token token) {
		final List<Token> tokens = sentence.getTokens();
		final int position = sentence.indexOf(token);
		for (int distance = 1; distance < tokens.size(); distance++) {
			final int before = position - distance;
			final int after = position + distance;
			if (before < 0 && after >= tokens.size()) {
				break;
			}
			if (before >= 0 && isHeadless(tokens.get(before))) {
				return tokens.get(before);
			}
			if (after < tokens.size() && isHeadless(tokens.get(after))) {
				return tokens.get(after);
			}
		}
		return null;
	}

	private static boolean isHeadless(final Token token) {
		return token.isAtomic() && (token.getHead().isUndefined() || token.getHead().isRoot());
	}

	private static Token next(final Sentence sentence, final int position) {
		final List<Token> tokens = sentence.getTokens();
		for (int i = position + 1; i < tokens.size(); i++) {
			if (!tokens.get(i).isPassThrough()) {
				return tokens.get(i);
			}
		}
		return null;
	}
}
