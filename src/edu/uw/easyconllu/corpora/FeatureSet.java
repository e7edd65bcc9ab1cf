package edu.uw.easyconllu.corpora;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * A FEATS or MISC column: "key=value" pairs and bare flags separated by "|". Treated as a set, so duplicates collapse
 * and {@link #toString()} sorts entries case-insensitively. "_" is the empty set. A key repeated with another value
 * keeps both values as alternatives.
 */
public class FeatureSet implements Serializable, Iterable<String> {
	private static final long serialVersionUID = 1L;

	private static final Splitter PIPE = Splitter.on('|').omitEmptyStrings().trimResults();
	private static final Joiner JOINER = Joiner.on('|');
	public static final String ALTERNATIVE = "/";
	private static final Splitter ALTERNATIVES = Splitter.on(ALTERNATIVE);

	// Bare flags are stored with a null value.
	private final Map<String, String> entries = new LinkedHashMap<>();

	public FeatureSet() {
	}

	public FeatureSet(final FeatureSet other) {
		entries.putAll(other.entries);
	}

	public static FeatureSet parse(final String column) {
		final FeatureSet result = new FeatureSet();
		if (column == null || column.equals("_")) {
			return result;
		}

		for (final String item : PIPE.split(column)) {
			final int equals = item.indexOf('=');
			if (equals > 0) {
				final String key = item.substring(0, equals);
				final String value = item.substring(equals + 1);
				final String previous = result.entries.get(key);
				if (previous == null) {
					result.entries.put(key, value);
				} else if (!result.getAlternatives(key).contains(value)) {
					result.entries.put(key, previous + ALTERNATIVE + value);
				}
			} else {
				result.entries.put(item, null);
			}
		}
		return result;
	}

	public String get(final String key) {
		return entries.get(key);
	}

	/**
	 * The values of a feature that lists alternatives, as in "Case=Nom/Acc". A key given twice in a column is read the
	 * same way.
	 */
	public List<String> getAlternatives(final String key) {
		final String value = entries.get(key);
		return value == null ? Collections.emptyList() : ALTERNATIVES.splitToList(value);
	}

	public boolean has(final String key) {
		return entries.containsKey(key);
	}

	public boolean has(final String key, final String value) {
		return entries.containsKey(key) && value.equals(entries.get(key));
	}

	public FeatureSet set(final String key, final String value) {
		entries.put(key, value);
		return this;
	}

	public FeatureSet remove(final String key) {
		entries.remove(key);
		return this;
	}

	public FeatureSet addAll(final FeatureSet other) {
		entries.putAll(other.entries);
		return this;
	}

	public Collection<String> keys() {
		return entries.keySet();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public int size() {
		return entries.size();
	}

	@Override
	public Iterator<String> iterator() {
		return render().iterator();
	}

	private List<String> render() {
		final List<String> items = new ArrayList<>(entries.size());
		for (final Map.Entry<String, String> entry : entries.entrySet()) {
			items.add(entry.getValue() == null ? entry.getKey() : entry.getKey() + "=" + entry.getValue());
		}
		return items;
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof FeatureSet && entries.equals(((FeatureSet) obj).entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		if (entries.isEmpty()) {
			return "_";
		}

		final List<String> items = render();
		items.sort(String.CASE_INSENSITIVE_ORDER);
		return JOINER.join(items);
	}
}
