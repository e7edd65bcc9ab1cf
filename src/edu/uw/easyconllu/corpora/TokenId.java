package edu.uw.easyconllu.corpora;

import java.io.Serializable;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Identifier of a token within one sentence.
 *
 * Besides the three forms found in CoNLL-U files (a word index, a multiword range "3-4" and an empty node "3.1"),
 * structural edits need ids for tokens that do not have a position yet. Those are TEMPORARY ids (handed out by
 * {@link Sentence#allocateTemporaryId()}) and PENDING_RANGE ids, which only know how many members their span has. Both
 * are replaced during renumbering.
 */
public final class TokenId implements Serializable {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		WORD, RANGE, EMPTY, TEMPORARY, PENDING_RANGE
	}

	private final Kind kind;
	private final int first;
	private final int second;

	private TokenId(final Kind kind, final int first, final int second) {
		this.kind = kind;
		this.first = first;
		this.second = second;
	}

	public static TokenId word(final int index) {
		Preconditions.checkArgument(index >= 0, "Negative word index: %s", index);
		return new TokenId(Kind.WORD, index, index);
	}

	public static TokenId range(final int start, final int end) {
		Preconditions.checkArgument(start <= end, "Bad range: %s-%s", start, end);
		return new TokenId(Kind.RANGE, start, end);
	}

	public static TokenId empty(final int word, final int sub) {
		return new TokenId(Kind.EMPTY, word, sub);
	}

	static TokenId temporary(final int serial) {
		return new TokenId(Kind.TEMPORARY, serial, serial);
	}

	/**
	 * A synthetic multiword span covering the next {@code size} atomic tokens.
	 */
	public static TokenId pendingRange(final int size) {
		Preconditions.checkArgument(size >= 1, "Span must cover at least one token");
		return new TokenId(Kind.PENDING_RANGE, size, size);
	}

	/**
	 * Parses the textual form used in token lines, or returns null if the text is not an id.
	 */
	public static TokenId parse(final String text) {
		if (text == null || text.isEmpty()) {
			return null;
		}

		final int dash = text.indexOf('-');
		final int dot = text.indexOf('.');
		try {
			if (dash > 0) {
				final int start = Integer.parseInt(text.substring(0, dash));
				final int end = Integer.parseInt(text.substring(dash + 1));
				return start <= end && start >= 0 ? range(start, end) : null;
			} else if (dot > 0) {
				return empty(Integer.parseInt(text.substring(0, dot)), Integer.parseInt(text.substring(dot + 1)));
			} else if (isDigits(text)) {
				return word(Integer.parseInt(text));
			}
		} catch (final NumberFormatException e) {
			return null;
		}

		return null;
	}

	private static boolean isDigits(final String text) {
		for (int i = 0; i < text.length(); i++) {
			if (!Character.isDigit(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isSpan() {
		return kind == Kind.RANGE || kind == Kind.PENDING_RANGE;
	}

	public boolean isEmptyNode() {
		return kind == Kind.EMPTY;
	}

	/**
	 * True for ids that denote a syntactic word: numbered words and tokens waiting for a number.
	 */
	public boolean isAtomic() {
		return kind == Kind.WORD || kind == Kind.TEMPORARY;
	}

	public int getStart() {
		Preconditions.checkState(kind == Kind.RANGE, "Not a range: %s", this);
		return first;
	}

	public int getEnd() {
		Preconditions.checkState(kind == Kind.RANGE, "Not a range: %s", this);
		return second;
	}

	public int getIndex() {
		Preconditions.checkState(kind == Kind.WORD || kind == Kind.EMPTY, "Not numbered: %s", this);
		return first;
	}

	/**
	 * Number of atomic tokens a span covers.
	 */
	public int getSpanSize() {
		if (kind == Kind.RANGE) {
			return second - first + 1;
		} else if (kind == Kind.PENDING_RANGE) {
			return first;
		}
		throw new IllegalStateException("Not a span: " + this);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof TokenId)) {
			return false;
		}
		final TokenId other = (TokenId) obj;
		return kind == other.kind && first == other.first && second == other.second;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, first, second);
	}

	@Override
	public String toString() {
		switch (kind) {
		case WORD:
			return Integer.toString(first);
		case RANGE:
			return first + "-" + second;
		case EMPTY:
			return first + "." + second;
		case TEMPORARY:
			return "<new" + first + ">";
		case PENDING_RANGE:
			return "<span" + first + ">";
		default:
			throw new IllegalStateException();
		}
	}
}
