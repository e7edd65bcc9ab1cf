package edu.uw.easyconllu.rebanking;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeEdits;

/**
 * Refines the catch-all "obl" relation: datives without a preposition are indirect objects, adverbs are advmod, nominal
 * obliques stay obl, and anything else is taken to be an adverbial clause.
 */
public class OblRelationRebanker extends Rebanker {

	static final String OBL = "obl";
	private static final Set<String> NOMINAL_POS = ImmutableSet.of("NOUN", "PROPN", "PRON", "DET", "ADJ", "NUM");

	@Override
	public String getName() {
		return "obl-relations";
	}

	@Override
	protected List<TokenRule> getRules() {
		return ImmutableList.of(
				TokenRule.of("dative-to-iobj", (token, context) -> isObl(token) && token.hasFeature("Case", "Dat")
						&& !context.getIndex().hasDependentWithPOS(token.getId(), "ADP"), relabel("iobj")),
				TokenRule.of("adverb-to-advmod", (token, context) -> isObl(token) && token.getUpos().equals("ADV"),
						relabel("advmod")),
				TokenRule.of("nominal-stays-obl", (token, context) -> isObl(token) && isNominal(token),
						(token, context) -> {
						}),
				TokenRule.of("other-to-advcl", (token, context) -> isObl(token), relabel("advcl")));
	}

	private static boolean isObl(final Token token) {
		return token.isAtomic() && OBL.equals(token.getDeprel());
	}

	private static boolean isNominal(final Token token) {
		return NOMINAL_POS.contains(token.getUpos()) || token.hasFeature("VerbForm", "Vnoun")
				|| EmptyTokenRebanker.isEmpty(token, EmptyTokenRebanker.PREPOSITION);
	}

	private static TokenRule.Edit relabel(final String relation) {
		return (token, context) -> {
			final Token live = context.live(token);
			if (live != null) {
				TreeEdits.relabel(live, relation);
			}
		};
	}
}
