package edu.uw.easyconllu.corpora;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * A sentence: the lines in front of its tokens (comments, or the opening tag and surrounding markup in the legacy
 * format), the tokens themselves in surface order, and whatever closes the sentence.
 */
public class Sentence implements Serializable {
	private static final long serialVersionUID = 1L;

	public static final String SENT_ID = "sent_id";
	public static final String TEXT = "text";
	public static final String TRANSLATED_TEXT = "translated_text";
	public static final String TRANSLITERATED_TEXT = "transliterated_text";
	public static final String CITE = "cite";

	private static final Pattern METADATA = Pattern.compile("^#\\s*([\\w.-]+)\\s*=\\s?(.*)$");

	private final List<String> comments = new ArrayList<>();
	private final List<Token> tokens = new ArrayList<>();
	private String closingLine;
	private final List<String> linesBefore = new ArrayList<>();
	private final List<String> linesAfter = new ArrayList<>(Collections.singletonList(""));
	private int nextTemporaryId = 1;

	public Sentence() {
	}

	public Sentence(final List<String> comments, final List<Token> tokens) {
		this.comments.addAll(comments);
		this.tokens.addAll(tokens);
	}

	/**
	 * Deep copy. Edits on the copy never reach this sentence, which is what makes it usable as a snapshot.
	 */
	public Sentence copy() {
		final Sentence result = new Sentence();
		result.comments.addAll(comments);
		for (final Token token : tokens) {
			result.tokens.add(token.copy());
		}
		result.closingLine = closingLine;
		result.setLinesBefore(linesBefore);
		result.setLinesAfter(linesAfter);
		result.nextTemporaryId = nextTemporaryId;
		return result;
	}

	/**
	 * Replaces the content of this sentence by a copy of {@code saved}.
	 */
	public void restore(final Sentence saved) {
		final Sentence copy = saved.copy();
		comments.clear();
		comments.addAll(copy.comments);
		tokens.clear();
		tokens.addAll(copy.tokens);
		closingLine = copy.closingLine;
		setLinesBefore(copy.linesBefore);
		setLinesAfter(copy.linesAfter);
		nextTemporaryId = copy.nextTemporaryId;
	}

	public List<String> getComments() {
		return comments;
	}

	/**
	 * Live, ordered token list, spans and pass-through lines included.
	 */
	public List<Token> getTokens() {
		return tokens;
	}

	/**
	 * Tokens that take part in the tree: neither spans nor pass-through lines.
	 */
	public List<Token> getWords() {
		final List<Token> result = new ArrayList<>(tokens.size());
		for (final Token token : tokens) {
			if (token.isAtomic() || token.isEmptyNode() && !token.isSpan()) {
				result.add(token);
			}
		}
		return result;
	}

	public int size() {
		return tokens.size();
	}

	public int indexOf(final Token token) {
		for (int i = 0; i < tokens.size(); i++) {
			if (tokens.get(i) == token) {
				return i;
			}
		}
		return -1;
	}

	public Token findById(final TokenId id) {
		for (final Token token : tokens) {
			if (!token.isPassThrough() && token.getId().equals(id)) {
				return token;
			}
		}
		return null;
	}

	/**
	 * The multiword span a token belongs to, if any.
	 */
	public Token getSpanOf(final Token member) {
		final int position = indexOf(member);
		Preconditions.checkArgument(position >= 0, "Token not in sentence: %s", member);
		int atomicBefore = 0;
		for (int i = position - 1; i >= 0; i--) {
			final Token candidate = tokens.get(i);
			if (candidate.isSpan()) {
				return candidate.getId().getSpanSize() > atomicBefore ? candidate : null;
			} else if (!candidate.isPassThrough()) {
				atomicBefore++;
			}
		}
		return null;
	}

	/**
	 * The atomic tokens directly following a span.
	 */
	public List<Token> getSpanMembers(final Token span) {
		Preconditions.checkArgument(span.isSpan(), "Not a span: %s", span);
		final List<Token> result = new ArrayList<>();
		for (int i = indexOf(span) + 1; i < tokens.size() && result.size() < span.getId().getSpanSize(); i++) {
			final Token candidate = tokens.get(i);
			if (candidate.isSpan()) {
				break;
			} else if (!candidate.isPassThrough()) {
				result.add(candidate);
			}
		}
		return result;
	}

	/**
	 * A fresh id for a token created by an edit. It never collides with ids read from a file and is replaced by
	 * renumbering.
	 */
	public TokenId allocateTemporaryId() {
		return TokenId.temporary(nextTemporaryId++);
	}

	public String getMetadata(final String key) {
		for (final String comment : comments) {
			final Matcher matcher = METADATA.matcher(comment);
			if (matcher.matches() && matcher.group(1).equals(key)) {
				return matcher.group(2);
			}
		}
		return null;
	}

	/**
	 * Replaces the "# key = value" line in place, or appends a new one after the existing comments.
	 */
	public void setMetadata(final String key, final String value) {
		final String newLine = "# " + key + " = " + value;
		for (int i = 0; i < comments.size(); i++) {
			final Matcher matcher = METADATA.matcher(comments.get(i));
			if (matcher.matches() && matcher.group(1).equals(key)) {
				comments.set(i, newLine);
				return;
			}
		}
		comments.add(newLine);
	}

	public String getSentenceId() {
		final String result = getMetadata(SENT_ID);
		return result == null ? "?" : result;
	}

	public String getClosingLine() {
		return closingLine;
	}

	public void setClosingLine(final String closingLine) {
		this.closingLine = closingLine;
	}

	/**
	 * Blank lines in front of the sentence, as they were read.
	 */
	public List<String> getLinesBefore() {
		return Collections.unmodifiableList(linesBefore);
	}

	public void setLinesBefore(final List<String> lines) {
		final List<String> saved = new ArrayList<>(lines);
		linesBefore.clear();
		linesBefore.addAll(saved);
	}

	/**
	 * The lines separating this sentence from the next one, as they were read. A new sentence has one empty line.
	 */
	public List<String> getLinesAfter() {
		return Collections.unmodifiableList(linesAfter);
	}

	public void setLinesAfter(final List<String> lines) {
		final List<String> saved = new ArrayList<>(lines);
		linesAfter.clear();
		linesAfter.addAll(saved);
	}

	public int getBlankLinesAfter() {
		return linesAfter.size();
	}

	public boolean isEdited() {
		for (final Token token : tokens) {
			if (token.isEdited()) {
				return true;
			}
		}
		return false;
	}

	public List<String> getForms() {
		final List<String> result = new ArrayList<>();
		for (final Token token : getWords()) {
			result.add(token.getForm());
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		for (final String comment : comments) {
			result.append(comment).append('\n');
		}
		for (final Token token : tokens) {
			result.append(token).append('\n');
		}
		return result.toString();
	}
}
