package edu.uw.easyconllu.corpora;

public enum Format {
	/**
	 * Ten tab-separated columns per token, sentences separated by blank lines.
	 */
	CONLLU,
	/**
	 * The legacy attribute-bag format: one {@code <token ... />} tag per line, sentences closed by
	 * {@code </sentence>}.
	 */
	PROIEL
}
