package edu.uw.easyconllu.corpora;

import java.util.Collections;
import java.util.List;

import edu.uw.easyconllu.corpora.SentenceReader.Mode;
import edu.uw.easyconllu.dependencies.Renumberer;
import edu.uw.easyconllu.util.FaultReport;

/**
 * Builds sentences from text for tests.
 */
public class SentenceFixtures {

	private SentenceFixtures() {
	}

	/**
	 * Joins lines, each followed by a newline.
	 */
	public static String lines(final String... lines) {
		final StringBuilder result = new StringBuilder();
		for (final String line : lines) {
			result.append(line).append('\n');
		}
		return result.toString();
	}

	public static Sentence conll(final String... lines) {
		return readAll(Format.CONLLU, lines(lines)).get(0);
	}

	public static Sentence proiel(final String... lines) {
		return readAll(Format.PROIEL, lines(lines)).get(0);
	}

	public static List<Sentence> readAll(final Format format, final String text) {
		return SentenceReader.make(format, Mode.LENIENT, new FaultReport()).readAll(text);
	}

	public static String write(final Format format, final Sentence sentence) {
		return SentenceWriter.make(format).toString(Collections.singletonList(sentence));
	}

	/**
	 * Renumbers the sentence and writes it as CoNLL-U.
	 */
	public static String renumberAndWrite(final Sentence sentence) {
		new Renumberer().renumber(sentence);
		return write(Format.CONLLU, sentence);
	}
}
