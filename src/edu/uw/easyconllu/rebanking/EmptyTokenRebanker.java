package edu.uw.easyconllu.rebanking;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeEdits;
import edu.uw.easyconllu.dependencies.TreeIndex.Direction;
import edu.uw.easyconllu.util.Fault;

/**
 * Removes the empty tokens of the legacy treebank, which stand for elided coordinators (C), verbs (V) and
 * prepositions (P).
 *
 * An empty coordinator is replaced by its first dependent; the other conjuncts become parataxis under it. An empty verb
 * is replaced by its first xadv or xcomp dependent, and kept if it has none. An empty preposition is dropped when
 * nothing depends on it.
 */
public class EmptyTokenRebanker extends Rebanker {

	static final String COORDINATOR = "C";
	static final String VERB = "V";
	static final String PREPOSITION = "P";

	static final String PARATAXIS = "parataxis";
	static final String PUNCT = "punct";
	private static final Set<String> PREDICATIVE_RELATIONS = ImmutableSet.of("xadv", "xcomp");

	@Override
	public String getName() {
		return "empty-tokens";
	}

	@Override
	protected List<TokenRule> getRules() {
		return ImmutableList.of(
				TokenRule.of("empty-coordinator", (token, context) -> isEmpty(token, COORDINATOR),
						this::replaceCoordinator),
				TokenRule.of("empty-verb", (token, context) -> isEmpty(token, VERB) && context.getIndex()
						.firstDependentWithRelation(token.getId(), PREDICATIVE_RELATIONS, Direction.ANY) != null,
						this::replaceVerb),
				TokenRule.of("empty-preposition", (token, context) -> isEmpty(token, PREPOSITION),
						this::dropPreposition));
	}

	static boolean isEmpty(final Token token, final String sort) {
		return !token.isPassThrough() && sort.equals(token.getAttribute(Token.EMPTY_TOKEN_SORT));
	}

	private void replaceCoordinator(final Token token, final RuleContext context) {
		final Sentence sentence = context.getSentence();
		final Token empty = context.live(token);
		if (empty == null) {
			return;
		}

		final List<Token> dependents = context.getIndex().dependents(token.getId());
		final Token first = dependents.isEmpty() ? null : context.live(dependents.get(0));
		if (first == null) {
			TreeEdits.delete(sentence, empty);
			return;
		}

		for (final Token moved : TreeEdits.promote(sentence, first, empty)) {
			if (!PUNCT.equals(moved.getDeprel())) {
				TreeEdits.relabel(moved, PARATAXIS);
			}
		}
	}

	private void replaceVerb(final Token token, final RuleContext context) {
		final Token empty = context.live(token);
		final Token child = context.live(context.getIndex().firstDependentWithRelation(token.getId(),
				PREDICATIVE_RELATIONS, Direction.ANY));
		if (empty == null || child == null) {
			return;
		}

		final String childRelation = child.getDeprel();
		TreeEdits.promote(context.getSentence(), child, empty);
		if (token.getDeprel().equals(Token.NONE)) {
			TreeEdits.relabel(child, childRelation);
		}
	}

	private void dropPreposition(final Token token, final RuleContext context) {
		final Token empty = context.live(token);
		if (empty == null) {
			return;
		}

		final int dependents = context.getIndex().dependents(token.getId()).size();
		if (dependents == 0) {
			TreeEdits.delete(context.getSentence(), empty);
		} else {
			context.getFaults().add(Fault.Kind.INVARIANT_VIOLATION, context.getSentenceId(),
					"Empty preposition " + token.getId() + " kept, it heads " + dependents + " tokens");
		}
	}
}
