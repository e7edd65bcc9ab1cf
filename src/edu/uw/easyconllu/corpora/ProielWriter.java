package edu.uw.easyconllu.corpora;

import static edu.uw.easyconllu.corpora.ProielReader.FEAT;
import static edu.uw.easyconllu.corpora.ProielReader.FORM;
import static edu.uw.easyconllu.corpora.ProielReader.HEAD_ID;
import static edu.uw.easyconllu.corpora.ProielReader.ID;
import static edu.uw.easyconllu.corpora.ProielReader.LEMMA;
import static edu.uw.easyconllu.corpora.ProielReader.MISC;
import static edu.uw.easyconllu.corpora.ProielReader.PART_OF_SPEECH;
import static edu.uw.easyconllu.corpora.ProielReader.REL;
import static edu.uw.easyconllu.corpora.ProielReader.RELATION;
import static edu.uw.easyconllu.corpora.ProielReader.XPOS;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes tokens as {@code <token ... />} tags. Attributes keep the order they were read in; new ones go at the end.
 * A token without a head gets no head-id attribute.
 */
public class ProielWriter extends SentenceWriter {

	private static final List<String> DEFAULT_ORDER = Arrays.asList(ID, FORM, LEMMA, PART_OF_SPEECH, "morphology",
			FEAT, HEAD_ID, RELATION);
	private static final String DEFAULT_INDENT = "      ";

	@Override
	protected String format(final Token token) {
		final Set<String> names = new LinkedHashSet<>(token.getAttributeOrder().isEmpty() ? DEFAULT_ORDER
				: token.getAttributeOrder());
		names.addAll(Arrays.asList(ID, FORM, LEMMA, PART_OF_SPEECH, XPOS, FEAT, HEAD_ID, RELATION, REL, MISC));
		names.addAll(token.getAttributes().keySet());

		final StringBuilder result = new StringBuilder();
		result.append(token.getAttributeOrder().isEmpty() ? DEFAULT_INDENT : token.getIndent());
		result.append("<token");
		for (final String name : names) {
			final String value = valueOf(token, name);
			if (value != null) {
				result.append(' ').append(name).append("=\"").append(value).append('"');
			}
		}
		result.append(" />");
		return result.toString();
	}

	private static String valueOf(final Token token, final String name) {
		final boolean wasPresent = token.getAttributeOrder().contains(name);
		switch (name) {
		case ID:
			return token.getId().toString();
		case HEAD_ID:
			return token.getHead().isUndefined() ? null : token.getHead().toString();
		case FORM:
			return column(token.getForm(), wasPresent);
		case LEMMA:
			return column(token.getLemma(), wasPresent);
		case PART_OF_SPEECH:
			return column(token.getUpos(), wasPresent);
		case XPOS:
			return column(token.getXpos(), wasPresent);
		case FEAT:
			return column(token.getFeats().toString(), wasPresent);
		case RELATION:
			return column(token.getDeprel(), wasPresent);
		case REL:
			return column(token.getDeps(), wasPresent);
		case MISC:
			return column(token.getMisc().toString(), wasPresent);
		default:
			return token.getAttribute(name);
		}
	}

	private static String column(final String value, final boolean wasPresent) {
		return wasPresent || !value.equals(Token.NONE) ? value : null;
	}
}
