package edu.uw.easyconllu.rebanking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeEditException;
import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;

/**
 * One rewrite stage of the pipeline.
 *
 * A stage is a list of token rules, tried in order on every token of a snapshot of the sentence, and optionally a
 * sentence-wide step. All conditions are evaluated before any edit runs, so no rule ever sees the effect of another
 * rule of the same pass. The first matching token rule wins for each token. If an edit throws a
 * {@link TreeEditException}, the sentence is put back the way it was before the stage and the problem is reported.
 */
public abstract class Rebanker {

	/**
	 * A deferred edit on the live sentence.
	 */
	protected interface PendingEdit {
		void apply();
	}

	public abstract String getName();

	/**
	 * Token rules in priority order.
	 */
	protected abstract List<TokenRule> getRules();

	/**
	 * Sentence-wide edits, decided from the snapshot. Runs after the token rules have been evaluated.
	 */
	protected List<PendingEdit> decideForSentence(final RuleContext context) {
		return Collections.emptyList();
	}

	/**
	 * @return true if any token of the sentence changed
	 */
	public boolean doRebanking(final Sentence sentence, final FaultReport faults) {
		final RuleContext context = new RuleContext(sentence, faults);
		final List<PendingEdit> edits = new ArrayList<>();

		final List<TokenRule> rules = getRules();
		for (final Token token : context.getSnapshot().getTokens()) {
			if (token.isPassThrough()) {
				continue;
			}

			for (final TokenRule rule : rules) {
				if (rule.matches(token, context)) {
					edits.add(() -> rule.apply(token, context));
					break;
				}
			}
		}
		edits.addAll(decideForSentence(context));

		if (edits.isEmpty()) {
			return false;
		}

		try {
			for (final PendingEdit edit : edits) {
				edit.apply();
			}
		} catch (final TreeEditException e) {
			sentence.restore(context.getSnapshot());
			faults.add(Fault.Kind.INVARIANT_VIOLATION, context.getSentenceId(), getName() + ": " + e.getMessage());
			return false;
		}

		return !sameTokens(context.getSnapshot(), sentence);
	}

	private static boolean sameTokens(final Sentence before, final Sentence after) {
		final List<Token> tokensBefore = before.getTokens();
		final List<Token> tokensAfter = after.getTokens();
		if (tokensBefore.size() != tokensAfter.size()) {
			return false;
		}
		for (int i = 0; i < tokensBefore.size(); i++) {
			final Token first = tokensBefore.get(i);
			final Token second = tokensAfter.get(i);
			if (first.isPassThrough() != second.isPassThrough()
					|| !first.isPassThrough() && (!Arrays.equals(first.getColumns(), second.getColumns())
							|| !first.getAttributes().equals(second.getAttributes()))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return getName();
	}
}
