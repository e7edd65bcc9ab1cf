package edu.uw.easyconllu.rebanking;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.dependencies.TokenTemplate;
import edu.uw.easyconllu.dependencies.TreeEdits;
import edu.uw.easyconllu.dependencies.TreeIndex;
import edu.uw.easyconllu.util.Fault;

/**
 * Splits tokens whose lemma is several words ("ibrew z", "mi tʼe") into one token per word, and reduplicated forms
 * ("bar bar") into two tokens.
 *
 * How the parts are annotated comes from a table of multiword lemmas. A lemma missing from the table is split with the
 * first word as head and the others attached to it as "fixed".
 */
public class MultiwordLemmaRebanker extends Rebanker {

	public static final String DEFAULT_TABLE = "rules/multiword_lemmas.tsv";
	static final String FIXED = "fixed";
	static final String REDUPLICATION = "compound:redup";

	private static final Splitter SPACE = Splitter.on(' ').omitEmptyStrings();
	private static final Splitter SLASH = Splitter.on('/');

	/**
	 * Where the parts of a split lemma attach.
	 */
	public enum Attachment {
		/**
		 * Later parts attach to the first one, which keeps the token's head.
		 */
		FIXED,
		/**
		 * Every part keeps the token's head.
		 */
		SIBLINGS,
		/**
		 * The token's first dependent takes over its head and relation, and every part attaches to that dependent. Used
		 * for circumpositions, whose object is the real head of the phrase.
		 */
		DEPENDENT
	}

	/**
	 * Annotation for one word of a multiword lemma. Null fields keep the token's value.
	 */
	public static class Part {
		private final String lemma;
		private final String pos;
		private final String relation;

		public Part(final String lemma, final String pos, final String relation) {
			this.lemma = lemma;
			this.pos = pos;
			this.relation = relation;
		}

		/**
		 * Reads "lemma/part-of-speech/relation"; "*" keeps the token's value.
		 */
		static Part parse(final String column) {
			final List<String> fields = SLASH.splitToList(column);
			if (fields.size() != 3) {
				throw new IllegalArgumentException("Expected lemma/part-of-speech/relation but got: " + column);
			}
			return new Part(orNull(fields.get(0)), orNull(fields.get(1)), orNull(fields.get(2)));
		}

		private static String orNull(final String field) {
			return field.equals(RuleKey.WILDCARD) || field.isEmpty() ? null : field;
		}
	}

	public static class MultiwordLemma {
		private final Attachment attachment;
		private final List<Part> parts;

		public MultiwordLemma(final Attachment attachment, final List<Part> parts) {
			this.attachment = attachment;
			this.parts = ImmutableList.copyOf(parts);
		}

		static MultiwordLemma parse(final List<String> columns) {
			if (columns.size() < 3) {
				throw new IllegalArgumentException("Expected an attachment and at least two parts: " + columns);
			}
			final List<Part> parts = new ArrayList<>();
			for (final String column : columns.subList(1, columns.size())) {
				parts.add(Part.parse(column));
			}
			return new MultiwordLemma(Attachment.valueOf(columns.get(0).toUpperCase()), parts);
		}

		public Attachment getAttachment() {
			return attachment;
		}

		public List<Part> getParts() {
			return parts;
		}
	}

	private final RuleTable<MultiwordLemma> table;

	public MultiwordLemmaRebanker(final RuleTable<MultiwordLemma> table) {
		this.table = table;
	}

	public MultiwordLemmaRebanker() throws IOException {
		this(loadTable(DEFAULT_TABLE));
	}

	public static RuleTable<MultiwordLemma> loadTable(final String path) throws IOException {
		return RuleTable.load(path, MultiwordLemma::parse);
	}

	@Override
	public String getName() {
		return "multiword-lemma";
	}

	@Override
	protected List<TokenRule> getRules() {
		return ImmutableList.of(
				TokenRule.of("split-multiword-lemma", this::isSplittableLemma, this::splitLemma),
				TokenRule.of("split-reduplication", (token, context) -> isReduplication(token),
						this::splitReduplication));
	}

	private boolean isSplittableLemma(final Token token, final RuleContext context) {
		if (!token.isAtomic() || token.isEmptyNode()) {
			return false;
		}
		final List<String> lemmas = SPACE.splitToList(token.getLemma());
		if (lemmas.size() < 2) {
			return false;
		}

		// The form has to show where one word ends and the next starts.
		final List<String> forms = SPACE.splitToList(token.getForm());
		if (forms.size() != lemmas.size() || !token.getForm().equals(String.join(" ", forms))) {
			return false;
		}

		final MultiwordLemma entry = lookup(token, context);
		return entry == null || entry.getParts().size() == forms.size();
	}

	private MultiwordLemma lookup(final Token token, final RuleContext context) {
		final RuleTable.Match<MultiwordLemma> match = table.find(token.getLemma(), token.getUpos());
		if (match == null) {
			return null;
		}
		if (match.isAmbiguous()) {
			context.getFaults().add(Fault.Kind.AMBIGUOUS_RULE_MATCH, context.getSentenceId(),
					token.getLemma() + " matches several entries as specific as " + match.getKey());
		}
		return match.getValue();
	}

	private void splitLemma(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		if (live == null) {
			return;
		}

		final List<String> forms = SPACE.splitToList(token.getForm());
		final List<String> lemmas = SPACE.splitToList(token.getLemma());
		final MultiwordLemma entry = table.lookup(token.getLemma(), token.getUpos());
		final Attachment attachment = entry == null ? Attachment.FIXED : entry.getAttachment();

		Head partHead = null;
		if (attachment == Attachment.DEPENDENT) {
			final TreeIndex index = context.getIndex();
			final List<Token> dependents = index.dependents(token.getId());
			if (!dependents.isEmpty()) {
				final Token dependent = context.live(dependents.get(0));
				if (dependent != null) {
					TreeEdits.reattach(dependent, token.getHead(), token.getDeprel());
					partHead = Head.of(dependent.getId());
				}
			}
		}

		final List<TokenTemplate> parts = new ArrayList<>(forms.size());
		for (int i = 0; i < forms.size(); i++) {
			final Part part = entry == null ? null : entry.getParts().get(i);
			final TokenTemplate template = TokenTemplate.of(forms.get(i));
			template.lemma(part == null || part.lemma == null ? lemmas.get(i) : part.lemma);
			if (part != null && part.pos != null) {
				template.upos(part.pos);
			}
			if (part != null && part.relation != null) {
				template.deprel(part.relation);
			} else if (attachment == Attachment.FIXED && i > 0) {
				template.deprel(FIXED);
			}

			if (partHead != null) {
				template.head(partHead);
			} else if (attachment != Attachment.SIBLINGS && i > 0) {
				template.headOnPart(0);
			}
			parts.add(template);
		}

		TreeEdits.split(context.getSentence(), live, parts, false, dependent -> false, 0);
	}

	/**
	 * A form made of the same word twice, with a one-word lemma.
	 */
	private static boolean isReduplication(final Token token) {
		if (!token.isAtomic() || token.isEmptyNode() || token.getLemma().contains(" ")) {
			return false;
		}
		final List<String> forms = SPACE.splitToList(token.getForm());
		return forms.size() == 2 && forms.get(0).equals(forms.get(1))
				&& token.getForm().equals(forms.get(0) + " " + forms.get(1));
	}

	/**
	 * The first copy attaches to the second, which keeps the token's head, relation and dependents.
	 */
	private void splitReduplication(final Token token, final RuleContext context) {
		final Token live = context.live(token);
		if (live == null) {
			return;
		}
		final String word = SPACE.splitToList(token.getForm()).get(0);
		final List<TokenTemplate> parts = ImmutableList.of(
				TokenTemplate.of(word).deprel(REDUPLICATION).headOnPart(1),
				TokenTemplate.of(word));
		TreeEdits.split(context.getSentence(), live, parts, false, dependent -> true, 1);
	}
}
