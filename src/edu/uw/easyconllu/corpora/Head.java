package edu.uw.easyconllu.corpora;

import java.io.Serializable;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * The governor of a token: another token of the same sentence, the root marker "0", no head at all ("_" in CoNLL-U, a
 * missing head-id in the legacy format), or SPAN_FIRST, which is resolved during renumbering to the first member of
 * the span the token belongs to.
 */
public final class Head implements Serializable {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		TOKEN, ROOT, UNDEFINED, SPAN_FIRST
	}

	public static final Head ROOT = new Head(Kind.ROOT, null);
	public static final Head UNDEFINED = new Head(Kind.UNDEFINED, null);
	public static final Head SPAN_FIRST = new Head(Kind.SPAN_FIRST, null);

	private final Kind kind;
	private final TokenId target;

	private Head(final Kind kind, final TokenId target) {
		this.kind = kind;
		this.target = target;
	}

	public static Head of(final TokenId target) {
		Preconditions.checkNotNull(target);
		Preconditions.checkArgument(!target.isSpan(), "Cannot attach to a multiword span: %s", target);
		return new Head(Kind.TOKEN, target);
	}

	/**
	 * Reads a HEAD column value. Anything that is neither "0", "_" nor a token id is rejected.
	 */
	public static Head parse(final String text) {
		if (text == null || text.isEmpty() || text.equals("_")) {
			return UNDEFINED;
		} else if (text.equals("0")) {
			return ROOT;
		}

		final TokenId id = TokenId.parse(text);
		if (id == null || id.isSpan()) {
			throw new IllegalArgumentException("Not a head: " + text);
		}
		return of(id);
	}

	public Kind getKind() {
		return kind;
	}

	public TokenId getTarget() {
		return target;
	}

	public boolean isToken() {
		return kind == Kind.TOKEN;
	}

	public boolean isRoot() {
		return kind == Kind.ROOT;
	}

	public boolean isUndefined() {
		return kind == Kind.UNDEFINED;
	}

	public boolean pointsTo(final TokenId id) {
		return kind == Kind.TOKEN && target.equals(id);
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Head)) {
			return false;
		}
		final Head other = (Head) obj;
		return kind == other.kind && Objects.equals(target, other.target);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, target);
	}

	@Override
	public String toString() {
		switch (kind) {
		case TOKEN:
			return target.toString();
		case ROOT:
			return "0";
		case UNDEFINED:
			return "_";
		case SPAN_FIRST:
			return "<span-first>";
		default:
			throw new IllegalStateException();
		}
	}
}
