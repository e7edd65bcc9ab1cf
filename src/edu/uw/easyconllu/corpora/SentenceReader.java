package edu.uw.easyconllu.corpora;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;
import edu.uw.easyconllu.util.Util;

/**
 * Splits a stream of lines into sentences.
 */
public abstract class SentenceReader {

	public enum Mode {
		/**
		 * Lines that are not tokens are kept and written back unchanged.
		 */
		LENIENT,
		/**
		 * Lines that are not tokens are dropped.
		 */
		STRICT
	}

	private final Mode mode;
	private final FaultReport faults;
	private int sentencesRead = 0;

	protected SentenceReader(final Mode mode, final FaultReport faults) {
		this.mode = mode;
		this.faults = faults;
	}

	public static SentenceReader make(final Format format, final Mode mode, final FaultReport faults) {
		switch (format) {
		case CONLLU:
			return new ConllReader(mode, faults);
		case PROIEL:
			return new ProielReader(mode, faults);
		default:
			throw new IllegalArgumentException("Unknown format: " + format);
		}
	}

	public Iterable<Sentence> readFile(final File input) throws IOException {
		final PeekingIterator<String> lines = Iterators.peekingIterator(Util.readFileLineByLine(input));

		return () -> new Iterator<Sentence>() {
			private Sentence next = readSentence(lines);

			@Override
			public boolean hasNext() {
				return next != null;
			}

			@Override
			public Sentence next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final Sentence result = next;
				next = readSentence(lines);
				return result;
			}

			@Override
			public void remove() {
				throw new UnsupportedOperationException();
			}
		};
	}

	public List<Sentence> readAll(final Iterator<String> input) {
		final PeekingIterator<String> lines = Iterators.peekingIterator(input);
		final List<Sentence> result = new ArrayList<>();
		Sentence sentence;
		while ((sentence = readSentence(lines)) != null) {
			result.add(sentence);
		}
		return result;
	}

	/**
	 * Splits the text into lines the way {@link java.io.BufferedReader#readLine()} would.
	 */
	public List<Sentence> readAll(final String text) {
		if (text.isEmpty()) {
			return new ArrayList<>();
		}
		final String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
		return readAll(Arrays.asList(body.split("\n", -1)).iterator());
	}

	/**
	 * Reads the next sentence, or returns null when the input is exhausted.
	 */
	public Sentence readSentence(final PeekingIterator<String> lines) {
		if (!lines.hasNext()) {
			return null;
		}
		sentencesRead++;
		return read(lines);
	}

	protected abstract Sentence read(PeekingIterator<String> lines);

	/**
	 * Called when a line inside a sentence is not a token line.
	 */
	protected void malformed(final List<Token> tokens, final List<String> comments, final String line,
			final String reason) {
		final String sentenceId = new Sentence(comments, tokens).getMetadata(Sentence.SENT_ID);
		faults.add(Fault.Kind.MALFORMED_LINE, sentenceId == null ? "#" + sentencesRead : sentenceId,
				reason + (mode == Mode.LENIENT ? " (kept)" : " (dropped)") + ": " + line);
		if (mode == Mode.LENIENT) {
			tokens.add(Token.passThrough(line));
		}
	}
}
