package edu.uw.easyconllu.rebanking;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import edu.uw.easyconllu.corpora.FeatureSet;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TokenTemplate;
import edu.uw.easyconllu.dependencies.TreeEdits;

/**
 * Armenian writes the emphasis (U+055B), exclamation (U+055C) and question (U+055E) marks on the stressed vowel,
 * inside the word. Each word carrying them becomes a multiword token: the word without the marks, followed by one
 * punctuation token per mark, in the order they were written, all attached to the word. A leading guillemet is split
 * off the same way.
 *
 * A token made of marks alone is punctuation already and only gets annotated as such, one token per mark.
 *
 * Scraped text sometimes has a mark and the rest of the word as a token of its own, e.g. "Աւա" "՜ղ". Such a pair is
 * first joined into one word.
 */
public class ExclamationRebanker extends Rebanker {

	public static final String EMPHASIS = "՛";
	public static final String EXCLAMATION = "՜";
	public static final String QUESTION = "՞";
	public static final String GUILLEMET = "«";

	static final String PUNCT = "PUNCT";
	static final String PUNCT_RELATION = "punct";

	private static final CharMatcher MARKS = CharMatcher.anyOf(EMPHASIS + EXCLAMATION + QUESTION);
	private static final String SPACE_AFTER = "SpaceAfter";

	@Override
	public String getName() {
		return "exclamation";
	}

	@Override
	protected List<TokenRule> getRules() {
		return ImmutableList.of(
				TokenRule.of("join-detached-mark", ExclamationRebanker::isJoinHost, this::joinAndSplit),
				TokenRule.of("split-marks", (token, context) -> canSplit(token)
						&& !joinsPrevious(token, context.getSnapshot()), this::split),
				TokenRule.of("annotate-bare-marks", (token, context) -> isBareMarks(context.getSnapshot(), token)
						&& !isAnnotatedMark(token), this::annotateBareMarks));
	}

	private void split(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		if (live != null) {
			TreeEdits.split(context.getSentence(), live, partsFor(token.getForm()), true);
		}
	}

	private void joinAndSplit(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		final Token next = context.live(nextWord(context.getSnapshot(), token));
		if (live == null || next == null) {
			return;
		}

		// The two halves are one written word.
		live.setMisc(live.getMisc().set(SPACE_AFTER, "No"));
		final Token joined = TreeEdits.merge(context.getSentence(), live, next);
		joined.setLemma(token.getLemma());
		TreeEdits.split(context.getSentence(), joined, partsFor(joined.getForm()), true);
	}

	/**
	 * Annotates a token of marks as punctuation, keeping its head. Several marks become one token each, written
	 * without spaces between them.
	 */
	private void annotateBareMarks(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		if (live == null) {
			return;
		}

		final String form = token.getForm();
		live.setLemma(form).setUpos(PUNCT).setXpos(Token.NONE).setFeats(new FeatureSet()).setDeprel(PUNCT_RELATION)
				.setDeps(Token.NONE).setMisc(layoutOnly(live.getMisc()));
		if (form.length() == 1) {
			return;
		}

		final List<TokenTemplate> parts = new ArrayList<>(form.length());
		for (int i = 0; i < form.length(); i++) {
			final String mark = form.substring(i, i + 1);
			final TokenTemplate part = TokenTemplate.of(mark).lemma(mark);
			if (i < form.length() - 1) {
				part.noSpaceAfter();
			}
			parts.add(part);
		}
		TreeEdits.split(context.getSentence(), live, parts, false);
	}

	private static FeatureSet layoutOnly(final FeatureSet misc) {
		final FeatureSet result = new FeatureSet();
		if (misc.has(SPACE_AFTER)) {
			result.set(SPACE_AFTER, misc.get(SPACE_AFTER));
		}
		return result;
	}

	/**
	 * The guillemet if there is one, the word, then one punctuation part per mark.
	 */
	static List<TokenTemplate> partsFor(final String form) {
		final List<TokenTemplate> result = new ArrayList<>();
		final boolean guillemet = hasLeadingGuillemet(form);
		final int word = guillemet ? 1 : 0;
		if (guillemet) {
			result.add(TokenTemplate.punctuation(GUILLEMET, word));
		}
		result.add(TokenTemplate.of(stripMarks(form)));
		for (final char mark : MARKS.retainFrom(form).toCharArray()) {
			result.add(TokenTemplate.punctuation(String.valueOf(mark), word));
		}
		return result;
	}

	static String stripMarks(final String form) {
		final String withoutMarks = MARKS.removeFrom(form);
		return hasLeadingGuillemet(form) ? withoutMarks.substring(GUILLEMET.length()) : withoutMarks;
	}

	private static boolean hasLeadingGuillemet(final String form) {
		return form.startsWith(GUILLEMET) && form.length() > GUILLEMET.length();
	}

	private static boolean canSplit(final Token token) {
		return token.isAtomic() && !token.isEmptyNode() && MARKS.matchesAnyOf(token.getForm())
				&& !stripMarks(token.getForm()).isEmpty();
	}

	/**
	 * A free token written with marks only. Tokens inside a span were split off a word and are left alone.
	 */
	private static boolean isBareMarks(final Sentence snapshot, final Token token) {
		return isFreeWord(snapshot, token) && !token.getForm().isEmpty() && MARKS.matchesAllOf(token.getForm());
	}

	private static boolean isAnnotatedMark(final Token token) {
		return token.getForm().length() == 1 && token.getForm().equals(token.getLemma()) && PUNCT.equals(token
				.getUpos()) && Token.NONE.equals(token.getXpos()) && token.getFeats().isEmpty()
				&& PUNCT_RELATION.equals(token.getDeprel()) && Token.NONE.equals(token.getDeps())
				&& layoutOnly(token.getMisc()).equals(token.getMisc());
	}

	/**
	 * A word without marks, followed by a token that starts with one and goes on with letters.
	 */
	private static boolean isJoinHost(final Token token, final RuleContext context) {
		final Sentence snapshot = context.getSnapshot();
		if (!isFreeWord(snapshot, token) || MARKS.matchesAnyOf(token.getForm())) {
			return false;
		}

		final Token next = nextWord(snapshot, token);
		return next != null && isFreeWord(snapshot, next) && isDetachedHalf(next.getForm());
	}

	private static boolean isDetachedHalf(final String form) {
		return !form.isEmpty() && MARKS.matches(form.charAt(0)) && !stripMarks(form).isEmpty();
	}

	private static boolean joinsPrevious(final Token token, final Sentence snapshot) {
		if (!isDetachedHalf(token.getForm())) {
			return false;
		}
		final int position = snapshot.indexOf(token);
		for (int i = position - 1; i >= 0; i--) {
			final Token previous = snapshot.getTokens().get(i);
			if (!previous.isPassThrough()) {
				return isFreeWord(snapshot, previous) && !MARKS.matchesAnyOf(previous.getForm())
						&& isFreeWord(snapshot, token);
			}
		}
		return false;
	}

	/**
	 * An atomic token outside any multiword span.
	 */
	private static boolean isFreeWord(final Sentence sentence, final Token token) {
		return token.isAtomic() && !token.isEmptyNode() && sentence.getSpanOf(token) == null;
	}

	private static Token nextWord(final Sentence sentence, final Token token) {
		final List<Token> tokens = sentence.getTokens();
		for (int i = sentence.indexOf(token) + 1; i < tokens.size(); i++) {
			if (!tokens.get(i).isPassThrough()) {
				return tokens.get(i);
			}
		}
		return null;
	}
}
