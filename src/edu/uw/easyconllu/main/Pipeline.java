package edu.uw.easyconllu.main;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;

import edu.uw.easyconllu.corpora.Format;
import edu.uw.easyconllu.corpora.ProielExporter;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;
import edu.uw.easyconllu.dependencies.Renumberer;
import edu.uw.easyconllu.dependencies.TreeValidator;
import edu.uw.easyconllu.rebanking.EmptyTokenRebanker;
import edu.uw.easyconllu.rebanking.ExclamationRebanker;
import edu.uw.easyconllu.rebanking.MultipleRootRebanker;
import edu.uw.easyconllu.rebanking.MultiwordLemmaRebanker;
import edu.uw.easyconllu.rebanking.OblRelationRebanker;
import edu.uw.easyconllu.rebanking.PunctuationInferenceRebanker;
import edu.uw.easyconllu.rebanking.Rebanker;
import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;

/**
 * Runs a sequence of stages over a corpus, one sentence at a time.
 *
 * After a stage changes a sentence, the sentence is renumbered so the next stage sees sequential ids. Sentences of the
 * legacy format keep their original ids unless a stage created tokens. Once all stages have run, heads that do not
 * resolve, and optionally head cycles, are reported.
 */
public class Pipeline {

	public static final String EXCLAMATION = "exclamation";
	public static final String MULTIWORD_LEMMA = "multiword-lemma";
	public static final String PUNCTUATION_INFERENCE = "punctuation-inference";
	public static final String EMPTY_TOKENS = "empty-tokens";
	public static final String OBL_RELATIONS = "obl-relations";
	public static final String MULTIPLE_ROOTS = "multiple-roots";

	public static final List<String> STAGE_NAMES = ImmutableList.of(EXCLAMATION, MULTIWORD_LEMMA,
			PUNCTUATION_INFERENCE, EMPTY_TOKENS, OBL_RELATIONS, MULTIPLE_ROOTS);

	static final String MULTIWORD_LEMMA_TABLE = "rules.multiwordLemmas";
	private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

	private final List<Rebanker> stages;
	private final Format format;
	private final boolean checkCycles;
	private final FaultReport faults;
	private final Renumberer renumberer = new Renumberer();
	private final Multiset<String> changedSentences = HashMultiset.create();

	public Pipeline(final List<Rebanker> stages, final Format format, final boolean checkCycles,
			final FaultReport faults) {
		this.stages = ImmutableList.copyOf(stages);
		this.format = format;
		this.checkCycles = checkCycles;
		this.faults = faults;
	}

	/**
	 * Builds stages from a comma-separated list of names.
	 */
	public static List<Rebanker> makeStages(final String names, final Properties properties) throws IOException {
		final List<Rebanker> result = new ArrayList<>();
		for (final String name : COMMA.split(names)) {
			result.add(makeStage(name, properties));
		}
		return result;
	}

	public static Rebanker makeStage(final String name, final Properties properties) throws IOException {
		switch (name) {
		case EXCLAMATION:
			return new ExclamationRebanker();
		case MULTIWORD_LEMMA:
			return new MultiwordLemmaRebanker(MultiwordLemmaRebanker.loadTable(properties.getProperty(
					MULTIWORD_LEMMA_TABLE, MultiwordLemmaRebanker.DEFAULT_TABLE)));
		case PUNCTUATION_INFERENCE:
			return new PunctuationInferenceRebanker();
		case EMPTY_TOKENS:
			return new EmptyTokenRebanker();
		case OBL_RELATIONS:
			return new OblRelationRebanker();
		case MULTIPLE_ROOTS:
			return new MultipleRootRebanker();
		default:
			throw new IllegalArgumentException("Unknown stage: " + name + ". Stages are: "
					+ Joiner.on(", ").join(STAGE_NAMES));
		}
	}

	/**
	 * Runs every stage on one sentence, in order.
	 */
	public void process(final Sentence sentence) {
		for (final Rebanker stage : stages) {
			if (stage.doRebanking(sentence, faults)) {
				changedSentences.add(stage.getName());
				renumber(sentence, stage.getName());
			}
		}
		validate(sentence);
	}

	public List<Sentence> processCorpus(final Iterable<Sentence> corpus) {
		final List<Sentence> result = new ArrayList<>();
		for (final Sentence sentence : corpus) {
			process(sentence);
			result.add(sentence);
		}
		return result;
	}

	/**
	 * Converts processed legacy sentences to CoNLL-U. Markup outside sentences, and sentences without words, are not
	 * exported.
	 */
	public List<Sentence> export(final List<Sentence> legacy) {
		final ProielExporter exporter = new ProielExporter();
		final List<Sentence> result = new ArrayList<>(legacy.size());
		for (final Sentence sentence : legacy) {
			final Sentence exported = exporter.export(sentence, faults);
			if (!exported.getWords().isEmpty()) {
				result.add(exported);
			}
		}
		return result;
	}

	private void renumber(final Sentence sentence, final String stage) {
		if (format == Format.PROIEL && !hasUnnumberedTokens(sentence)) {
			return;
		}

		final Renumberer.Result result = renumberer.renumber(sentence);
		for (final String problem : result.getProblems()) {
			faults.add(Fault.Kind.INVARIANT_VIOLATION, sentence.getSentenceId(), stage + ": " + problem);
		}
		for (final String problem : TreeValidator.checkNumbering(sentence)) {
			faults.add(Fault.Kind.INVARIANT_VIOLATION, sentence.getSentenceId(), stage + ": " + problem);
		}
	}

	private static boolean hasUnnumberedTokens(final Sentence sentence) {
		for (final Token token : sentence.getTokens()) {
			if (!token.isPassThrough() && (token.getId().getKind() == TokenId.Kind.TEMPORARY
					|| token.getId().getKind() == TokenId.Kind.PENDING_RANGE)) {
				return true;
			}
		}
		return false;
	}

	private void validate(final Sentence sentence) {
		for (final Token token : TreeValidator.danglingHeads(sentence)) {
			faults.add(Fault.Kind.DANGLING_HEAD, sentence.getSentenceId(), "Token " + token.getId() + " ("
					+ token.getForm() + ") is headed by " + token.getHead() + ", which is not in the sentence");
		}

		if (checkCycles) {
			final List<Token> cycle = TreeValidator.findCycle(sentence);
			if (!cycle.isEmpty()) {
				final List<TokenId> ids = new ArrayList<>();
				for (final Token token : cycle) {
					ids.add(token.getId());
				}
				faults.add(Fault.Kind.CYCLE, sentence.getSentenceId(), "Head cycle through " + ids);
			}
		}

		if (!sentence.getWords().isEmpty()) {
			final int roots = countRoots(sentence, format);
			if (roots != 1) {
				faults.add(Fault.Kind.ROOT_COUNT, sentence.getSentenceId(), "Sentence has " + roots + " roots");
			}
		}
	}

	/**
	 * Words attached to the root. Legacy sentences mark their roots by leaving the head out, so there every headless
	 * token counts, empty ones included.
	 */
	static int countRoots(final Sentence sentence, final Format format) {
		if (format != Format.PROIEL) {
			return TreeValidator.countRoots(sentence);
		}
		int result = 0;
		for (final Token token : sentence.getTokens()) {
			if (token.isAtomic() && (token.getHead().isUndefined() || token.getHead().isRoot())) {
				result++;
			}
		}
		return result;
	}

	/**
	 * How many sentences each stage changed.
	 */
	public Multiset<String> getChangedSentences() {
		return changedSentences;
	}

	public FaultReport getFaults() {
		return faults;
	}
}
