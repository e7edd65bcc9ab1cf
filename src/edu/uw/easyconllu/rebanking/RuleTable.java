package edu.uw.easyconllu.rebanking;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

import com.google.common.base.Splitter;

import edu.uw.easyconllu.util.Util;

/**
 * Lexical data for a stage: values keyed by lemma, part of speech and homograph index, in the order they were declared.
 *
 * A lookup returns the most specific matching entry. When several entries of the same specificity match, the one
 * declared first is used and the match is marked ambiguous.
 *
 * Tables are read from tab-separated files: lemma, part of speech, then the value columns. "*" is a wildcard, and
 * lines starting with "#" are comments.
 */
public class RuleTable<V> {

	private static final Splitter TAB = Splitter.on('\t').trimResults();

	private final List<RuleKey> keys = new ArrayList<>();
	private final List<V> values = new ArrayList<>();

	public static class Match<V> {
		private final RuleKey key;
		private final V value;
		private final boolean ambiguous;

		Match(final RuleKey key, final V value, final boolean ambiguous) {
			this.key = key;
			this.value = value;
			this.ambiguous = ambiguous;
		}

		public RuleKey getKey() {
			return key;
		}

		public V getValue() {
			return value;
		}

		public boolean isAmbiguous() {
			return ambiguous;
		}
	}

	public RuleTable<V> add(final RuleKey key, final V value) {
		keys.add(key);
		values.add(value);
		return this;
	}

	public RuleTable<V> add(final String lemma, final String upos, final V value) {
		return add(RuleKey.parse(lemma, upos), value);
	}

	/**
	 * The best match for a token, or null.
	 */
	public Match<V> find(final String lemma, final String upos) {
		final RuleKey token = RuleKey.forToken(lemma, upos);
		int best = -1;
		int bestSpecificity = -1;
		boolean ambiguous = false;
		for (int i = 0; i < keys.size(); i++) {
			final RuleKey key = keys.get(i);
			if (!key.matches(token)) {
				continue;
			}

			if (key.getSpecificity() > bestSpecificity) {
				best = i;
				bestSpecificity = key.getSpecificity();
				ambiguous = false;
			} else if (key.getSpecificity() == bestSpecificity) {
				ambiguous = true;
			}
		}

		return best < 0 ? null : new Match<>(keys.get(best), values.get(best), ambiguous);
	}

	public V lookup(final String lemma, final String upos) {
		final Match<V> match = find(lemma, upos);
		return match == null ? null : match.getValue();
	}

	public int size() {
		return keys.size();
	}

	public static <V> RuleTable<V> load(final Iterator<String> lines, final Function<List<String>, V> valueParser) {
		final RuleTable<V> result = new RuleTable<>();
		while (lines.hasNext()) {
			final String line = lines.next();
			if (line.trim().isEmpty() || line.startsWith("#")) {
				continue;
			}

			final List<String> fields = TAB.splitToList(line);
			if (fields.size() < 2) {
				throw new IllegalArgumentException("Rule table line needs at least a lemma and a POS column: " + line);
			}
			result.add(fields.get(0), fields.get(1), valueParser.apply(fields.subList(2, fields.size())));
		}
		return result;
	}

	public static <V> RuleTable<V> load(final File file, final Function<List<String>, V> valueParser)
			throws IOException {
		return load(Util.readFileLineByLine(file), valueParser);
	}

	/**
	 * Loads a table from a file if {@code path} names one, and otherwise from the classpath.
	 */
	public static <V> RuleTable<V> load(final String path, final Function<List<String>, V> valueParser)
			throws IOException {
		final File file = Util.getFile(path);
		if (file.exists()) {
			return load(file, valueParser);
		}

		final InputStream stream = RuleTable.class.getClassLoader().getResourceAsStream(path);
		if (stream == null) {
			throw new IOException("Rule table not found: " + path);
		}
		return load(Util.readLines(stream), valueParser);
	}
}
