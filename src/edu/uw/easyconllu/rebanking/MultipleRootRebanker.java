package edu.uw.easyconllu.rebanking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeEdits;

/**
 * Leaves one root per sentence. The first "root" keeps its place; every later one becomes a ccomp of the root before
 * it.
 */
public class MultipleRootRebanker extends Rebanker {

	static final String ROOT = "root";
	static final String CCOMP = "ccomp";

	@Override
	public String getName() {
		return "multiple-roots";
	}

	@Override
	protected List<TokenRule> getRules() {
		return Collections.emptyList();
	}

	@Override
	protected List<PendingEdit> decideForSentence(final RuleContext context) {
		final List<Token> roots = new ArrayList<>();
		for (final Token token : context.getSnapshot().getTokens()) {
			if (token.isAtomic() && ROOT.equals(token.getDeprel())) {
				roots.add(token);
			}
		}

		final List<PendingEdit> result = new ArrayList<>();
		for (int i = 1; i < roots.size(); i++) {
			final Token root = roots.get(i);
			final Head previous = Head.of(roots.get(i - 1).getId());
			result.add(() -> {
				final Token live = context.live(root);
				if (live != null) {
					TreeEdits.reattach(live, previous, CCOMP);
				}
			});
		}
		return result;
	}
}
