package edu.uw.easyconllu.rebanking;

import edu.uw.easyconllu.corpora.Token;

/**
 * A condition on one token of the snapshot, and the edit to make when it holds.
 */
public class TokenRule {

	public interface Condition {
		boolean test(Token token, RuleContext context);
	}

	public interface Edit {
		/**
		 * @param token
		 *            the snapshot token the condition matched; use {@link RuleContext#live(Token)} to change it
		 */
		void apply(Token token, RuleContext context);
	}

	private final String name;
	private final Condition condition;
	private final Edit edit;

	public TokenRule(final String name, final Condition condition, final Edit edit) {
		this.name = name;
		this.condition = condition;
		this.edit = edit;
	}

	public static TokenRule of(final String name, final Condition condition, final Edit edit) {
		return new TokenRule(name, condition, edit);
	}

	public boolean matches(final Token token, final RuleContext context) {
		return condition.test(token, context);
	}

	public void apply(final Token token, final RuleContext context) {
		edit.apply(token, context);
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return name;
	}
}
