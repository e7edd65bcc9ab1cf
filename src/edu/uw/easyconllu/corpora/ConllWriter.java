package edu.uw.easyconllu.corpora;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

public class ConllWriter extends SentenceWriter {
	private static final Joiner TAB = Joiner.on('\t');

	@Override
	protected String format(final Token token) {
		Preconditions.checkState(token.getId().getKind() != TokenId.Kind.TEMPORARY
				&& token.getId().getKind() != TokenId.Kind.PENDING_RANGE, "Token was never renumbered: %s", token);
		return TAB.join(token.getColumns());
	}
}
