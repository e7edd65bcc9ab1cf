package edu.uw.easyconllu.corpora;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

import edu.uw.easyconllu.dependencies.Renumberer;
import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;

/**
 * Turns sentences read from the legacy treebank into CoNLL-U sentences.
 *
 * Empty tokens are left out, ids are renumbered from 1, and the sentence gets a sent_id and cite comment built from the
 * citation-part of its first and last tokens. A homograph index on a lemma ("ayr#2") moves to MISC as LId=ayr-2.
 */
public class ProielExporter {

	static final String LEMMA_ID = "LId";
	private static final Splitter DOT = Splitter.on('.');

	private final Renumberer renumberer = new Renumberer();

	public Sentence export(final Sentence legacy, final FaultReport faults) {
		final List<Token> tokens = new ArrayList<>();
		String firstCitation = null;
		String lastCitation = null;
		for (final Token token : legacy.getTokens()) {
			if (token.isPassThrough() || token.isEmptyNode()) {
				continue;
			}
			tokens.add(convert(token));

			final String citation = token.getAttribute(Token.CITATION_PART);
			if (citation != null && !citation.isEmpty()) {
				if (firstCitation == null) {
					firstCitation = citation;
				}
				lastCitation = citation;
			}
		}

		final Sentence result = new Sentence(new ArrayList<>(), tokens);
		if (firstCitation != null) {
			result.setMetadata(Sentence.SENT_ID, buildSentenceId(firstCitation, lastCitation));
			result.setMetadata(Sentence.CITE, firstCitation.equals(lastCitation) ? firstCitation
					: firstCitation + " – " + lastCitation);
		}

		final String sentenceId = firstCitation == null ? legacy.getSentenceId() : result.getSentenceId();
		final Renumberer.Result renumbered = renumberer.renumber(result);
		for (final Token dangling : renumbered.getUnresolvedHeads()) {
			faults.add(Fault.Kind.DANGLING_HEAD, sentenceId, "Token " + dangling.getId() + " is headed by "
					+ dangling.getHead() + ", which is not exported");
		}

		result.setMetadata(Sentence.TEXT, surfaceText(result));
		return result;
	}

	private static Token convert(final Token legacy) {
		final Token result = new Token(legacy.getId());
		result.setForm(legacy.getForm());
		result.setUpos(legacy.getUpos());
		result.setXpos(legacy.getXpos());
		result.setFeats(legacy.getFeats());
		result.setHead(legacy.getHead());
		result.setDeprel(legacy.getDeprel());
		result.setDeps(legacy.getDeps());

		final FeatureSet misc = legacy.getMisc();
		final String lemma = legacy.getLemma();
		final int hash = lemma.lastIndexOf('#');
		if (hash > 0 && hash < lemma.length() - 1) {
			final String bare = lemma.substring(0, hash);
			result.setLemma(bare);
			misc.set(LEMMA_ID, bare + "-" + lemma.substring(hash + 1));
		} else {
			result.setLemma(lemma);
		}
		result.setMisc(misc);
		return result;
	}

	/**
	 * "Book 1.2" and "Book 1.5" give "Book_1.2-5". Citations from different chapters or books give the span as text.
	 */
	static String buildSentenceId(final String first, final String last) {
		final Citation from = Citation.parse(first);
		final Citation to = Citation.parse(last);
		if (from == null || to == null) {
			return first.replace(' ', '_');
		}

		if (from.book.equals(to.book) && from.chapter.equals(to.chapter)) {
			final String result = from.book.replace(' ', '_') + "_" + from.chapter + "." + from.verse;
			return from.verse.equals(to.verse) ? result : result + "-" + to.verse;
		}
		return first + " - " + last;
	}

	private static class Citation {
		private final String book;
		private final String chapter;
		private final String verse;

		private Citation(final String book, final String chapter, final String verse) {
			this.book = book;
			this.chapter = chapter;
			this.verse = verse;
		}

		static Citation parse(final String citation) {
			final int space = citation.lastIndexOf(' ');
			if (space < 0) {
				return null;
			}
			final List<String> chapterAndVerse = DOT.splitToList(citation.substring(space + 1));
			if (chapterAndVerse.size() != 2) {
				return null;
			}
			return new Citation(citation.substring(0, space), chapterAndVerse.get(0), chapterAndVerse.get(1));
		}
	}

	/**
	 * The sentence as written: one form per surface token, separated by a space unless SpaceAfter=No.
	 */
	public static String surfaceText(final Sentence sentence) {
		final StringBuilder result = new StringBuilder();
		final List<Token> tokens = sentence.getTokens();
		for (int i = 0; i < tokens.size(); i++) {
			final Token token = tokens.get(i);
			if (token.isPassThrough() || token.isEmptyNode()) {
				continue;
			}
			result.append(token.getForm());
			if (!token.isNoSpaceAfter()) {
				result.append(' ');
			}
			if (token.isSpan()) {
				i += sentence.getSpanMembers(token).size();
			}
		}
		return result.toString().trim();
	}
}
