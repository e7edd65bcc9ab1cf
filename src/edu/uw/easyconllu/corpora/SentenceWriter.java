package edu.uw.easyconllu.corpora;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import edu.uw.easyconllu.util.Util;

/**
 * Writes sentences back out. Untouched tokens are written as the line they were read from.
 */
public abstract class SentenceWriter {

	public static SentenceWriter make(final Format format) {
		switch (format) {
		case CONLLU:
			return new ConllWriter();
		case PROIEL:
			return new ProielWriter();
		default:
			throw new IllegalArgumentException("Unknown format: " + format);
		}
	}

	public void write(final Sentence sentence, final Writer out) throws IOException {
		for (final String line : sentence.getLinesBefore()) {
			out.write(line);
			out.write('\n');
		}

		for (final String comment : sentence.getComments()) {
			out.write(comment);
			out.write('\n');
		}

		for (final Token token : sentence.getTokens()) {
			out.write(token.isEdited() || token.getLine() == null ? format(token) : token.getLine());
			out.write('\n');
		}

		if (sentence.getClosingLine() != null) {
			out.write(sentence.getClosingLine());
			out.write('\n');
		}

		for (final String line : sentence.getLinesAfter()) {
			out.write(line);
			out.write('\n');
		}
	}

	public void writeFile(final Iterable<Sentence> sentences, final File file) throws IOException {
		try (Writer out = Util.openWriter(file)) {
			for (final Sentence sentence : sentences) {
				write(sentence, out);
			}
		}
	}

	public String toString(final Iterable<Sentence> sentences) {
		final StringWriter result = new StringWriter();
		try {
			for (final Sentence sentence : sentences) {
				write(sentence, result);
			}
		} catch (final IOException e) {
			throw new UncheckedIOException(e);
		}
		return result.toString();
	}

	/**
	 * The line for a token that was created or changed since it was read.
	 */
	protected abstract String format(Token token);
}
