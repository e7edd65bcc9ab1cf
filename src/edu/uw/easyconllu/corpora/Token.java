package edu.uw.easyconllu.corpora;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * One row of a sentence: a syntactic word, a multiword span or an empty node.
 *
 * A token remembers the line it was read from. As long as none of its setters has been called it is written back as
 * that exact line, so reading and writing an untouched corpus is lossless.
 */
public class Token implements Serializable {
	private static final long serialVersionUID = 1L;

	public static final String NONE = "_";

	private TokenId id;
	private String form = NONE;
	private String lemma = NONE;
	private String upos = NONE;
	private String xpos = NONE;
	private FeatureSet feats = new FeatureSet();
	private Head head = Head.UNDEFINED;
	private String deprel = NONE;
	private String deps = NONE;
	private FeatureSet misc = new FeatureSet();

	// Attributes of the legacy format with no CoNLL-U column, e.g. citation-part or empty-token-sort.
	private final Map<String, String> attributes = new LinkedHashMap<>();
	private List<String> attributeOrder = Collections.emptyList();
	private String indent = "";

	private String line;
	private boolean edited;
	private final boolean passThrough;

	public Token(final TokenId id) {
		Preconditions.checkNotNull(id);
		this.id = id;
		this.edited = true;
		this.passThrough = false;
	}

	private Token(final String line, final boolean passThrough) {
		this.line = line;
		this.passThrough = passThrough;
	}

	/**
	 * A line that could not be read as a token. It is written back unchanged and is invisible to tree operations.
	 */
	public static Token passThrough(final String line) {
		return new Token(line, true);
	}

	/**
	 * Used by readers: the fields are filled in afterwards, and the token only counts as edited once something else
	 * changes it.
	 */
	static Token fromLine(final String line, final TokenId id) {
		final Token result = new Token(line, false);
		result.id = id;
		return result;
	}

	/**
	 * Deep copy, including the original line and edit state.
	 */
	public Token copy() {
		final Token result = new Token(line, passThrough);
		result.id = id;
		result.form = form;
		result.lemma = lemma;
		result.upos = upos;
		result.xpos = xpos;
		result.feats = new FeatureSet(feats);
		result.head = head;
		result.deprel = deprel;
		result.deps = deps;
		result.misc = new FeatureSet(misc);
		result.attributes.putAll(attributes);
		result.attributeOrder = attributeOrder;
		result.indent = indent;
		result.edited = edited;
		return result;
	}

	void markRead() {
		edited = false;
	}

	private void touch() {
		edited = true;
	}

	public boolean isEdited() {
		return edited;
	}

	public boolean isPassThrough() {
		return passThrough;
	}

	public String getLine() {
		return line;
	}

	public TokenId getId() {
		return id;
	}

	public Token setId(final TokenId id) {
		Preconditions.checkNotNull(id);
		if (!id.equals(this.id)) {
			this.id = id;
			touch();
		}
		return this;
	}

	public boolean isSpan() {
		return !passThrough && id.isSpan();
	}

	public boolean isAtomic() {
		return !passThrough && id.isAtomic();
	}

	public boolean isEmptyNode() {
		return !passThrough && (id.isEmptyNode() || attributes.containsKey(EMPTY_TOKEN_SORT));
	}

	public String getForm() {
		return form;
	}

	public Token setForm(final String form) {
		this.form = orNone(form);
		touch();
		return this;
	}

	public String getLemma() {
		return lemma;
	}

	public Token setLemma(final String lemma) {
		this.lemma = orNone(lemma);
		touch();
		return this;
	}

	public String getUpos() {
		return upos;
	}

	public Token setUpos(final String upos) {
		this.upos = orNone(upos);
		touch();
		return this;
	}

	public String getXpos() {
		return xpos;
	}

	public Token setXpos(final String xpos) {
		this.xpos = orNone(xpos);
		touch();
		return this;
	}

	/**
	 * A copy; use {@link #setFeats(FeatureSet)} to change features.
	 */
	public FeatureSet getFeats() {
		return new FeatureSet(feats);
	}

	public boolean hasFeature(final String key, final String value) {
		return feats.has(key, value);
	}

	public Token setFeats(final FeatureSet feats) {
		this.feats = new FeatureSet(feats);
		touch();
		return this;
	}

	public Head getHead() {
		return head;
	}

	public Token setHead(final Head head) {
		Preconditions.checkNotNull(head);
		this.head = head;
		touch();
		return this;
	}

	public String getDeprel() {
		return deprel;
	}

	public Token setDeprel(final String deprel) {
		this.deprel = orNone(deprel);
		touch();
		return this;
	}

	public String getDeps() {
		return deps;
	}

	public Token setDeps(final String deps) {
		this.deps = orNone(deps);
		touch();
		return this;
	}

	public FeatureSet getMisc() {
		return new FeatureSet(misc);
	}

	public Token setMisc(final FeatureSet misc) {
		this.misc = new FeatureSet(misc);
		touch();
		return this;
	}

	/**
	 * True if MISC says the next token follows without a space.
	 */
	public boolean isNoSpaceAfter() {
		return misc.has("SpaceAfter", "No");
	}

	public static final String EMPTY_TOKEN_SORT = "empty-token-sort";
	public static final String CITATION_PART = "citation-part";
	public static final String PRESENTATION_AFTER = "presentation-after";

	public String getAttribute(final String name) {
		return attributes.get(name);
	}

	public Map<String, String> getAttributes() {
		return Collections.unmodifiableMap(attributes);
	}

	public Token setAttribute(final String name, final String value) {
		if (value == null) {
			attributes.remove(name);
		} else {
			attributes.put(name, value);
		}
		touch();
		return this;
	}

	/**
	 * Attribute names in the order they appeared in a legacy token line.
	 */
	public List<String> getAttributeOrder() {
		return attributeOrder;
	}

	public String getIndent() {
		return indent;
	}

	void setLayout(final String indent, final List<String> attributeOrder) {
		this.indent = indent;
		this.attributeOrder = Collections.unmodifiableList(new ArrayList<>(attributeOrder));
	}

	/**
	 * The CoNLL-U columns as they should be written now.
	 */
	public String[] getColumns() {
		return new String[] { id.toString(), form, lemma, upos, xpos, feats.toString(), head.toString(), deprel, deps,
				misc.toString() };
	}

	private static String orNone(final String value) {
		return value == null || value.isEmpty() ? NONE : value;
	}

	@Override
	public String toString() {
		if (passThrough) {
			return line;
		}
		return String.join("\t", getColumns());
	}
}
