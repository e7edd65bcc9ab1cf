package edu.uw.easyconllu.dependencies;

import edu.uw.easyconllu.corpora.FeatureSet;
import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Token;

/**
 * Describes a token to be created by {@link TreeEdits#split} or {@link TreeEdits#insertSynthetic}. Fields left unset
 * are inherited from the token being split (or left as "_" for an inserted token).
 */
public class TokenTemplate {
	private final String form;
	private String lemma;
	private String upos;
	private String xpos;
	private FeatureSet feats;
	private String deprel;
	private Head head;
	private int headPart = -1;
	private boolean noSpaceAfter;

	private TokenTemplate(final String form) {
		this.form = form;
	}

	public static TokenTemplate of(final String form) {
		return new TokenTemplate(form);
	}

	/**
	 * A punctuation token attached to another part of the same split.
	 */
	public static TokenTemplate punctuation(final String form, final int headPart) {
		return of(form).lemma(form).upos("PUNCT").xpos(Token.NONE).feats(new FeatureSet()).deprel("punct")
				.headOnPart(headPart);
	}

	public TokenTemplate lemma(final String lemma) {
		this.lemma = lemma;
		return this;
	}

	public TokenTemplate upos(final String upos) {
		this.upos = upos;
		return this;
	}

	public TokenTemplate xpos(final String xpos) {
		this.xpos = xpos;
		return this;
	}

	public TokenTemplate feats(final FeatureSet feats) {
		this.feats = feats;
		return this;
	}

	public TokenTemplate deprel(final String deprel) {
		this.deprel = deprel;
		return this;
	}

	public TokenTemplate head(final Head head) {
		this.head = head;
		this.headPart = -1;
		return this;
	}

	/**
	 * Attach to another part of the same split, by its position in the part list.
	 */
	public TokenTemplate headOnPart(final int part) {
		this.headPart = part;
		this.head = null;
		return this;
	}

	/**
	 * The next part follows this one without a space in the original form.
	 */
	public TokenTemplate noSpaceAfter() {
		this.noSpaceAfter = true;
		return this;
	}

	public String getForm() {
		return form;
	}

	public boolean isNoSpaceAfter() {
		return noSpaceAfter;
	}

	public int getHeadPart() {
		return headPart;
	}

	public boolean isPunctuation() {
		return "PUNCT".equals(upos);
	}

	/**
	 * Copies every field that was set onto {@code token}. Heads given as part positions are left to the caller.
	 */
	void applyTo(final Token token) {
		token.setForm(form);
		if (lemma != null) {
			token.setLemma(lemma);
		}
		if (upos != null) {
			token.setUpos(upos);
		}
		if (xpos != null) {
			token.setXpos(xpos);
		}
		if (feats != null) {
			token.setFeats(feats);
		}
		if (deprel != null) {
			token.setDeprel(deprel);
		}
		if (head != null) {
			token.setHead(head);
		}
	}
}
