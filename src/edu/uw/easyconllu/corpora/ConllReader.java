package edu.uw.easyconllu.corpora;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.PeekingIterator;

import edu.uw.easyconllu.util.FaultReport;

/**
 * Reads CoNLL-U. Token lines with too few columns are padded with "_", extra columns are ignored; the line itself is
 * kept so an untouched token is written back exactly as it was read. Blank lines around sentences are kept the same
 * way.
 */
public class ConllReader extends SentenceReader {

	public static final int NUMBER_OF_COLUMNS = 10;

	public ConllReader(final Mode mode, final FaultReport faults) {
		super(mode, faults);
	}

	@Override
	protected Sentence read(final PeekingIterator<String> lines) {
		// Stray blank lines in front of the first sentence.
		final List<String> linesBefore = blankLines(lines);

		final List<String> comments = new ArrayList<>();
		final List<Token> tokens = new ArrayList<>();
		while (lines.hasNext() && !isBlank(lines.peek())) {
			final String line = lines.next();
			if (line.startsWith("#")) {
				if (tokens.isEmpty()) {
					comments.add(line);
				} else {
					// A comment between tokens stays where it is.
					tokens.add(Token.passThrough(line));
				}
				continue;
			}

			final Token token = parseToken(line);
			if (token == null) {
				malformed(tokens, comments, line, "Not a token line");
			} else {
				tokens.add(token);
			}
		}

		final Sentence result = new Sentence(comments, tokens);
		result.setLinesBefore(linesBefore);
		result.setLinesAfter(blankLines(lines));
		return result;
	}

	/**
	 * Consumes blank and whitespace-only lines, returning them unchanged.
	 */
	private static List<String> blankLines(final PeekingIterator<String> lines) {
		final List<String> result = new ArrayList<>();
		while (lines.hasNext() && isBlank(lines.peek())) {
			result.add(lines.next());
		}
		return result;
	}

	private static boolean isBlank(final String line) {
		return line.trim().isEmpty();
	}

	/**
	 * Returns null if the line cannot be read as a token.
	 */
	static Token parseToken(final String line) {
		final String[] fields = Arrays.copyOf(line.split("\t", -1), NUMBER_OF_COLUMNS);
		final TokenId id = TokenId.parse(fields[0]);
		if (id == null) {
			return null;
		}

		for (int i = 1; i < NUMBER_OF_COLUMNS; i++) {
			if (fields[i] == null || fields[i].isEmpty()) {
				fields[i] = Token.NONE;
			}
		}

		final Head head;
		try {
			head = Head.parse(fields[6]);
		} catch (final IllegalArgumentException e) {
			return null;
		}

		final Token result = Token.fromLine(line, id);
		result.setForm(fields[1]);
		result.setLemma(fields[2]);
		result.setUpos(fields[3]);
		result.setXpos(fields[4]);
		result.setFeats(FeatureSet.parse(fields[5]));
		result.setHead(head);
		result.setDeprel(fields[7]);
		result.setDeps(fields[8]);
		result.setMisc(FeatureSet.parse(fields[9]));
		result.markRead();
		return result;
	}
}
