package edu.uw.easyconllu.alignment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import edu.uw.easyconllu.corpora.FeatureSet;
import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.ProielExporter;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;
import edu.uw.easyconllu.dependencies.Renumberer;
import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;

/**
 * Combines a scraped corpus, whose morphology lists every reading a word could have, with a parsed version of the same
 * text, which has a tree and one reading per word.
 *
 * Sentences are paired by their normalized text. In a pair, every word of the scraped sentence takes its head and
 * relation from the parsed word at the same position. The parsed part of speech is taken only if it is one of the
 * scraped alternatives ("NOUN/VERB"), and then the parsed features resolve ambiguous scraped ones.
 */
public class SentenceAligner {

	private static final Splitter ALTERNATIVES = Splitter.on(FeatureSet.ALTERNATIVE);

	private final TokenisationReconciler reconciler = new TokenisationReconciler();
	private final Renumberer renumberer = new Renumberer();

	/**
	 * Updates the scraped sentences in place. Sentences without a parsed counterpart, or whose words cannot be paired
	 * up, are left as they were and reported.
	 *
	 * @return the number of sentences that were aligned
	 */
	public int align(final List<Sentence> scraped, final List<Sentence> parsed, final FaultReport faults) {
		final ListMultimap<String, Sentence> parsedByText = ArrayListMultimap.create();
		for (final Sentence sentence : parsed) {
			parsedByText.put(TextNormalizer.normalize(textOf(sentence)), sentence);
		}

		int aligned = 0;
		for (final Sentence sentence : scraped) {
			final List<Sentence> candidates = parsedByText.get(TextNormalizer.normalize(textOf(sentence)));
			if (candidates.isEmpty()) {
				faults.add(Fault.Kind.IRRECONCILABLE_MERGE, sentence.getSentenceId(),
						"No parsed sentence has the same text");
			} else if (align(sentence, candidates.get(0), faults)) {
				aligned++;
			}
		}
		return aligned;
	}

	static String textOf(final Sentence sentence) {
		final String text = sentence.getMetadata(Sentence.TEXT);
		return text == null ? ProielExporter.surfaceText(sentence) : text;
	}

	/**
	 * Copies the parsed annotation onto one scraped sentence. The parsed sentence is not changed.
	 */
	public boolean align(final Sentence scraped, final Sentence parsed, final FaultReport faults) {
		final List<Token> scrapedWords = TokenisationReconciler.words(scraped);
		final List<String> forms = new ArrayList<>(scrapedWords.size());
		for (final Token word : scrapedWords) {
			forms.add(word.getForm());
		}

		final Sentence reconciled = parsed.copy();
		if (!reconciler.reconcile(forms, reconciled)) {
			faults.add(Fault.Kind.IRRECONCILABLE_MERGE, scraped.getSentenceId(), "Cannot match the " + forms.size()
					+ " scraped words with the parse " + parsed.getSentenceId());
			return false;
		}
		renumberer.renumber(reconciled);

		final List<Token> parsedWords = TokenisationReconciler.words(reconciled);
		final Map<TokenId, Integer> parsedPositions = new HashMap<>();
		for (int i = 0; i < parsedWords.size(); i++) {
			parsedPositions.put(parsedWords.get(i).getId(), i);
		}

		for (int i = 0; i < scrapedWords.size(); i++) {
			final Token word = scrapedWords.get(i);
			final Token parse = parsedWords.get(i);
			final Head head = mapHead(parse.getHead(), parsedPositions, scrapedWords);
			if (head == null) {
				faults.add(Fault.Kind.DANGLING_HEAD, scraped.getSentenceId(), "Parsed head " + parse.getHead()
						+ " of " + parse.getForm() + " has no scraped counterpart");
			} else if (!head.equals(word.getHead())) {
				word.setHead(head);
			}
			if (!parse.getDeprel().equals(word.getDeprel())) {
				word.setDeprel(parse.getDeprel());
			}

			if (ALTERNATIVES.splitToList(word.getUpos()).contains(parse.getUpos())) {
				if (!parse.getUpos().equals(word.getUpos())) {
					word.setUpos(parse.getUpos());
				}
				final FeatureSet feats = disambiguate(word.getFeats(), parse.getFeats());
				if (!feats.equals(word.getFeats())) {
					word.setFeats(feats);
				}
			}
		}
		return true;
	}

	private static Head mapHead(final Head parsedHead, final Map<TokenId, Integer> parsedPositions,
			final List<Token> scrapedWords) {
		if (!parsedHead.isToken()) {
			return parsedHead;
		}
		final Integer position = parsedPositions.get(parsedHead.getTarget());
		return position == null ? null : Head.of(scrapedWords.get(position).getId());
	}

	/**
	 * Scraped features with several alternatives take the parsed value. Unambiguous scraped features are kept, even
	 * where the parse disagrees.
	 */
	static FeatureSet disambiguate(final FeatureSet scraped, final FeatureSet parsed) {
		if (scraped.isEmpty()) {
			return new FeatureSet(parsed);
		}

		final FeatureSet result = new FeatureSet(scraped);
		for (final String key : scraped.keys()) {
			if (scraped.getAlternatives(key).size() > 1 && parsed.get(key) != null) {
				result.set(key, parsed.get(key));
			}
		}
		return result;
	}
}
