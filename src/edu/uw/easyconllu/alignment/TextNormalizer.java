package edu.uw.easyconllu.alignment;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a sentence text to what two sources of the same sentence can be expected to agree on: lower case letters and
 * digits, separated by single spaces.
 */
public class TextNormalizer {

	private static final Pattern AFTER_OPENING_GUILLEMET = Pattern.compile("«\\s+");
	private static final Pattern BEFORE_CLOSING_GUILLEMET = Pattern.compile("\\s+»");
	private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]+", Pattern.UNICODE_CHARACTER_CLASS);
	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private TextNormalizer() {
	}

	public static String normalize(final String text) {
		// Guillemets hug the quoted words, whatever spacing the source used.
		String result = AFTER_OPENING_GUILLEMET.matcher(text).replaceAll("«");
		result = BEFORE_CLOSING_GUILLEMET.matcher(result).replaceAll("»");
		result = result.toLowerCase(Locale.ROOT);
		result = PUNCTUATION.matcher(result).replaceAll("");
		return WHITESPACE.matcher(result).replaceAll(" ").trim();
	}

	/**
	 * True if two forms are the same word, ignoring case.
	 */
	public static boolean sameForm(final String first, final String second) {
		return first.toLowerCase(Locale.ROOT).equals(second.toLowerCase(Locale.ROOT));
	}
}
