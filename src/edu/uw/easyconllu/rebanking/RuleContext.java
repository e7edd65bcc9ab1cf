package edu.uw.easyconllu.rebanking;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TreeIndex;
import edu.uw.easyconllu.util.FaultReport;

/**
 * What a rule sees while a stage runs on one sentence. Conditions read the snapshot, which no edit of the current pass
 * ever changes; edits change the live sentence, reaching its tokens through {@link #live(Token)}.
 */
public class RuleContext {
	private final Sentence snapshot;
	private final Sentence sentence;
	private final TreeIndex index;
	private final FaultReport faults;
	private final Map<Token, Token> snapshotToLive = new IdentityHashMap<>();

	RuleContext(final Sentence sentence, final FaultReport faults) {
		this.sentence = sentence;
		this.snapshot = sentence.copy();
		this.index = TreeIndex.of(snapshot);
		this.faults = faults;
		final List<Token> liveTokens = sentence.getTokens();
		final List<Token> snapshotTokens = snapshot.getTokens();
		for (int i = 0; i < liveTokens.size(); i++) {
			snapshotToLive.put(snapshotTokens.get(i), liveTokens.get(i));
		}
	}

	public Sentence getSnapshot() {
		return snapshot;
	}

	/**
	 * Index over the snapshot.
	 */
	public TreeIndex getIndex() {
		return index;
	}

	/**
	 * The sentence being edited.
	 */
	public Sentence getSentence() {
		return sentence;
	}

	public FaultReport getFaults() {
		return faults;
	}

	public String getSentenceId() {
		return snapshot.getSentenceId();
	}

	/**
	 * The live token corresponding to a snapshot token, or null if an earlier edit of this pass removed it.
	 */
	public Token live(final Token snapshotToken) {
		final Token result = snapshotToLive.get(snapshotToken);
		return result == null || sentence.indexOf(result) < 0 ? null : result;
	}
}
