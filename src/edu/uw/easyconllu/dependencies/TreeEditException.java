package edu.uw.easyconllu.dependencies;

/**
 * Thrown when an edit would leave the sentence inconsistent. The sentence is unchanged when this is thrown.
 */
public class TreeEditException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public TreeEditException(final String message) {
		super(message);
	}
}
