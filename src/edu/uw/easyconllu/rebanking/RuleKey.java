package edu.uw.easyconllu.rebanking;

import java.util.Objects;

/**
 * Key of a rule-table entry. Null fields match anything. The index is the homograph number written after the lemma,
 * as in "ayr#2".
 */
public class RuleKey {
	public static final String WILDCARD = "*";

	private final String lemma;
	private final String upos;
	private final Integer index;

	public RuleKey(final String lemma, final String upos, final Integer index) {
		this.lemma = lemma;
		this.upos = upos;
		this.index = index;
	}

	/**
	 * Builds a key from table columns; "*" and "_" are wildcards.
	 */
	public static RuleKey parse(final String lemmaColumn, final String uposColumn) {
		final LemmaWithIndex lemma = LemmaWithIndex.split(lemmaColumn);
		return new RuleKey(wildcard(lemma.lemma), wildcard(uposColumn), lemma.index);
	}

	/**
	 * The key describing an actual token.
	 */
	public static RuleKey forToken(final String lemma, final String upos) {
		final LemmaWithIndex split = LemmaWithIndex.split(lemma);
		return new RuleKey(split.lemma, upos, split.index);
	}

	private static String wildcard(final String column) {
		return column == null || column.equals(WILDCARD) || column.equals("_") || column.isEmpty() ? null : column;
	}

	public boolean matches(final RuleKey token) {
		return (lemma == null || lemma.equals(token.lemma)) && (upos == null || upos.equals(token.upos))
				&& (index == null || index.equals(token.index));
	}

	/**
	 * Higher is more specific: lemma+POS+index, then lemma+index, lemma+POS, lemma, POS. An index only counts together
	 * with its lemma.
	 */
	public int getSpecificity() {
		if (lemma == null) {
			return upos == null ? 0 : 1;
		}
		return (index == null ? 2 : 6) + (upos == null ? 0 : 1);
	}

	public String getLemma() {
		return lemma;
	}

	public String getUpos() {
		return upos;
	}

	public Integer getIndex() {
		return index;
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof RuleKey)) {
			return false;
		}
		final RuleKey other = (RuleKey) obj;
		return Objects.equals(lemma, other.lemma) && Objects.equals(upos, other.upos)
				&& Objects.equals(index, other.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lemma, upos, index);
	}

	@Override
	public String toString() {
		return (lemma == null ? WILDCARD : lemma) + (index == null ? "" : "#" + index) + "/"
				+ (upos == null ? WILDCARD : upos);
	}

	static class LemmaWithIndex {
		final String lemma;
		final Integer index;

		private LemmaWithIndex(final String lemma, final Integer index) {
			this.lemma = lemma;
			this.index = index;
		}

		static LemmaWithIndex split(final String lemma) {
			if (lemma == null) {
				return new LemmaWithIndex(null, null);
			}
			final int hash = lemma.lastIndexOf('#');
			if (hash > 0 && hash < lemma.length() - 1) {
				try {
					return new LemmaWithIndex(lemma.substring(0, hash), Integer.valueOf(lemma.substring(hash + 1)));
				} catch (final NumberFormatException e) {
					return new LemmaWithIndex(lemma, null);
				}
			}
			return new LemmaWithIndex(lemma, null);
		}
	}
}
