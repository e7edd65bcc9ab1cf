package edu.uw.easyconllu.corpora;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.PeekingIterator;

import edu.uw.easyconllu.util.FaultReport;

/**
 * Reads the legacy attribute-bag format:
 *
 * <pre>
 * &lt;sentence id="52548" status="reviewed"&gt;
 *   &lt;token id="1" form="Ew" lemma="ew" part-of-speech="C-" morphology="---------n" head-id="3" relation="aux" /&gt;
 * &lt;/sentence&gt;
 * </pre>
 *
 * Everything up to the first token (the opening tag and any surrounding markup) is kept as the sentence's leading lines.
 */
public class ProielReader extends SentenceReader {

	public static final String ID = "id";
	public static final String HEAD_ID = "head-id";
	public static final String RELATION = "relation";
	public static final String LEMMA = "lemma";
	public static final String FORM = "form";
	public static final String PART_OF_SPEECH = "part-of-speech";
	public static final String FEAT = "FEAT";
	public static final String XPOS = "xpos";
	public static final String REL = "rel";
	public static final String MISC = "misc";

	private static final Pattern TOKEN_TAG = Pattern.compile("^(\\s*)<token\\b");
	private static final Pattern SENTENCE_END = Pattern.compile("^\\s*</sentence\\s*>\\s*$");
	private static final Pattern ATTRIBUTE = Pattern.compile("([-\\w]+)=\"(.*?)\"");

	public ProielReader(final Mode mode, final FaultReport faults) {
		super(mode, faults);
	}

	@Override
	protected Sentence read(final PeekingIterator<String> lines) {
		final List<String> leading = new ArrayList<>();
		final List<Token> tokens = new ArrayList<>();
		String closing = null;
		while (lines.hasNext()) {
			final String line = lines.next();
			if (SENTENCE_END.matcher(line).matches()) {
				closing = line;
				break;
			}

			final Matcher tag = TOKEN_TAG.matcher(line);
			if (tag.find()) {
				final Token token = parseToken(line, tag.group(1));
				if (token == null) {
					malformed(tokens, leading, line, "Token without a numeric id");
				} else {
					tokens.add(token);
				}
			} else if (tokens.isEmpty()) {
				leading.add(line);
			} else {
				tokens.add(Token.passThrough(line));
			}
		}

		final Sentence result = new Sentence(leading, tokens);
		result.setClosingLine(closing);
		result.setLinesAfter(Collections.<String> emptyList());
		return result;
	}

	static Token parseToken(final String line, final String indent) {
		final Map<String, String> attributes = new LinkedHashMap<>();
		final Matcher matcher = ATTRIBUTE.matcher(line);
		while (matcher.find()) {
			attributes.putIfAbsent(matcher.group(1), matcher.group(2));
		}

		final TokenId id = TokenId.parse(attributes.get(ID));
		if (id == null) {
			return null;
		}

		final Head head;
		try {
			head = Head.parse(attributes.get(HEAD_ID));
		} catch (final IllegalArgumentException e) {
			return null;
		}

		final Token result = Token.fromLine(line, id);
		result.setLayout(indent, new ArrayList<>(attributes.keySet()));
		result.setForm(attributes.remove(FORM));
		result.setLemma(attributes.remove(LEMMA));
		result.setUpos(attributes.remove(PART_OF_SPEECH));
		result.setXpos(attributes.remove(XPOS));
		result.setFeats(FeatureSet.parse(attributes.remove(FEAT)));
		result.setHead(head);
		result.setDeprel(attributes.remove(RELATION));
		result.setDeps(attributes.remove(REL));
		result.setMisc(FeatureSet.parse(attributes.remove(MISC)));
		attributes.remove(ID);
		attributes.remove(HEAD_ID);
		for (final Map.Entry<String, String> entry : attributes.entrySet()) {
			result.setAttribute(entry.getKey(), entry.getValue());
		}
		result.markRead();
		return result;
	}
}
