package edu.uw.easyconllu.util;

import java.io.Serializable;

public class Fault implements Serializable {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		/**
		 * A line that is not a token line; kept or dropped depending on the reader mode.
		 */
		MALFORMED_LINE,
		/**
		 * A head that does not point at any token of the sentence after an edit or renumbering.
		 */
		DANGLING_HEAD,
		/**
		 * More than one rule-table entry of the same specificity matched; the first declared one was used.
		 */
		AMBIGUOUS_RULE_MATCH,
		/**
		 * Two sources could not be aligned.
		 */
		IRRECONCILABLE_MERGE,
		/**
		 * A structural edit refused to run, e.g. deleting a token that still has dependents.
		 */
		INVARIANT_VIOLATION,
		CYCLE,
		/**
		 * A processed sentence without exactly one root.
		 */
		ROOT_COUNT
	}

	private final Kind kind;
	private final String sentenceId;
	private final String detail;

	public Fault(final Kind kind, final String sentenceId, final String detail) {
		this.kind = kind;
		this.sentenceId = sentenceId;
		this.detail = detail;
	}

	public Kind getKind() {
		return kind;
	}

	public String getSentenceId() {
		return sentenceId;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public String toString() {
		return kind + "\t" + sentenceId + "\t" + detail;
	}
}
