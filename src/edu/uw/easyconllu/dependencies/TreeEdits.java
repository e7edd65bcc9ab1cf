package edu.uw.easyconllu.dependencies;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.google.common.base.Joiner;

import edu.uw.easyconllu.corpora.FeatureSet;
import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;

/**
 * Structural edits on a sentence. Every operation checks its preconditions before touching anything, so a
 * {@link TreeEditException} leaves the sentence as it was.
 *
 * Edits do not renumber. New tokens get temporary ids and new spans get pending ranges; run {@link Renumberer} once the
 * edits of a stage are done.
 */
public class TreeEdits {

	private static final String SPACE_AFTER = "SpaceAfter";

	private TreeEdits() {
	}

	/**
	 * Splits a token, moving every dependent to the first part that is not punctuation.
	 */
	public static List<Token> split(final Sentence sentence, final Token token, final List<TokenTemplate> parts,
			final boolean withSpan) {
		int target = 0;
		for (int i = 0; i < parts.size(); i++) {
			if (!parts.get(i).isPunctuation()) {
				target = i;
				break;
			}
		}
		return split(sentence, token, parts, withSpan, dependent -> true, target);
	}

	/**
	 * Replaces {@code token} by one token per part, in order. The first part keeps the token's id; the others get
	 * temporary ids. With {@code withSpan}, a multiword span carrying the original form is put in front of the parts;
	 * a token that is already inside a span makes that span grow instead.
	 *
	 * Without a span the parts must spell the original form: their forms joined by a space, or by nothing after a part
	 * marked {@link TokenTemplate#noSpaceAfter()}.
	 *
	 * @param dependentSelector
	 *            which dependents of the original token move to {@code dependentTarget}; the rest stay on the first
	 *            part
	 * @return the new tokens, in order
	 */
	public static List<Token> split(final Sentence sentence, final Token token, final List<TokenTemplate> parts,
			final boolean withSpan, final Predicate<Token> dependentSelector, final int dependentTarget) {
		final int position = sentence.indexOf(token);
		check(position >= 0, "Token is not in the sentence: " + token);
		check(token.isAtomic(), "Only atomic tokens can be split: " + token);
		check(!parts.isEmpty(), "No parts given for " + token);
		check(dependentTarget >= 0 && dependentTarget < parts.size(), "No part " + dependentTarget);
		for (int i = 0; i < parts.size(); i++) {
			final int headPart = parts.get(i).getHeadPart();
			check(headPart < parts.size() && headPart != i, "Part " + i + " has an invalid head part " + headPart);
		}

		final Token existingSpan = sentence.getSpanOf(token);
		if (existingSpan == null && !withSpan) {
			final String spelled = spell(parts);
			check(spelled.equals(token.getForm()), "Parts spell '" + spelled + "', not '" + token.getForm() + "'");
		}

		final TreeIndex index = TreeIndex.of(sentence);
		final Token original = token.copy();
		final FeatureSet originalMisc = original.getMisc();

		final List<Token> result = new ArrayList<>(parts.size());
		for (int i = 0; i < parts.size(); i++) {
			final Token part = i == 0 ? token : original.copy().setId(sentence.allocateTemporaryId());
			parts.get(i).applyTo(part);
			// Legacy presentation text belongs after the last part only.
			if (i < parts.size() - 1 && part.getAttribute(Token.PRESENTATION_AFTER) != null) {
				part.setAttribute(Token.PRESENTATION_AFTER, null);
			}
			result.add(part);
		}

		for (int i = 0; i < parts.size(); i++) {
			final Token part = result.get(i);
			final int headPart = parts.get(i).getHeadPart();
			if (headPart >= 0) {
				part.setHead(Head.of(result.get(headPart).getId()));
			}

			if (existingSpan == null && !withSpan) {
				final FeatureSet misc = part.getMisc().remove(SPACE_AFTER);
				if (parts.get(i).isNoSpaceAfter()) {
					misc.set(SPACE_AFTER, "No");
				} else if (i == parts.size() - 1 && originalMisc.has(SPACE_AFTER)) {
					misc.set(SPACE_AFTER, originalMisc.get(SPACE_AFTER));
				}
				part.setMisc(misc);
			} else if (originalMisc.has(SPACE_AFTER)) {
				part.setMisc(part.getMisc().remove(SPACE_AFTER));
			}
		}

		if (dependentTarget != 0) {
			final TokenId targetId = result.get(dependentTarget).getId();
			for (final Token dependent : index.dependents(token.getId())) {
				if (!result.contains(dependent) && dependentSelector.test(dependent)) {
					dependent.setHead(Head.of(targetId));
				}
			}
		}

		final List<Token> tokens = sentence.getTokens();
		tokens.addAll(position + 1, result.subList(1, result.size()));
		if (existingSpan != null) {
			existingSpan.setId(TokenId.pendingRange(existingSpan.getId().getSpanSize() + parts.size() - 1));
		} else if (withSpan) {
			final Token span = new Token(TokenId.pendingRange(parts.size()));
			span.setForm(original.getForm());
			if (originalMisc.has(SPACE_AFTER)) {
				span.setMisc(new FeatureSet().set(SPACE_AFTER, originalMisc.get(SPACE_AFTER)));
			}
			tokens.add(position, span);
		}

		return result;
	}

	/**
	 * The form the parts of a split without a span stand for.
	 */
	public static String spell(final List<TokenTemplate> parts) {
		final StringBuilder result = new StringBuilder();
		for (int i = 0; i < parts.size(); i++) {
			result.append(parts.get(i).getForm());
			if (i < parts.size() - 1 && !parts.get(i).isNoSpaceAfter()) {
				result.append(' ');
			}
		}
		return result.toString();
	}

	/**
	 * Joins two neighbouring tokens. The survivor keeps its id and annotation; its form becomes the two forms in surface
	 * order, joined by a space unless the first one has SpaceAfter=No, and its lemma likewise. If the two tokens are the
	 * only members of a span, the span is removed and the survivor takes the span's form instead. Dependents of the
	 * absorbed token move to the survivor.
	 */
	public static Token merge(final Sentence sentence, final Token survivor, final Token absorbed) {
		final int survivorPosition = sentence.indexOf(survivor);
		final int absorbedPosition = sentence.indexOf(absorbed);
		check(survivorPosition >= 0 && absorbedPosition >= 0, "Both tokens must be in the sentence");
		check(survivor.isAtomic() && absorbed.isAtomic(), "Only atomic tokens can be merged");
		check(survivor != absorbed, "Cannot merge a token with itself");

		final int from = Math.min(survivorPosition, absorbedPosition);
		final int to = Math.max(survivorPosition, absorbedPosition);
		for (int i = from + 1; i < to; i++) {
			final Token between = sentence.getTokens().get(i);
			check(between.isPassThrough(), "Merged tokens must be neighbours: " + survivor + " / " + absorbed);
		}

		final Token span = sentence.getSpanOf(survivor);
		check(span == sentence.getSpanOf(absorbed), "Cannot merge across a span boundary");

		final Token left = survivorPosition < absorbedPosition ? survivor : absorbed;
		final Token right = left == survivor ? absorbed : survivor;
		final TreeIndex index = TreeIndex.of(sentence);

		if (span != null && span.getId().getSpanSize() == 2) {
			survivor.setForm(span.getForm());
			final FeatureSet misc = survivor.getMisc().remove(SPACE_AFTER);
			if (span.isNoSpaceAfter()) {
				misc.set(SPACE_AFTER, "No");
			}
			survivor.setMisc(misc);
			sentence.getTokens().remove(sentence.indexOf(span));
		} else {
			final String separator = span != null || left.isNoSpaceAfter() ? "" : " ";
			survivor.setForm(left.getForm() + separator + right.getForm());
			survivor.setLemma(join(separator, left.getLemma(), right.getLemma()));
			if (span == null) {
				final FeatureSet misc = survivor.getMisc().remove(SPACE_AFTER);
				if (right.isNoSpaceAfter()) {
					misc.set(SPACE_AFTER, "No");
				}
				survivor.setMisc(misc);
			} else {
				span.setId(TokenId.pendingRange(span.getId().getSpanSize() - 1));
			}
		}

		if (survivor.getHead().pointsTo(absorbed.getId())) {
			survivor.setHead(absorbed.getHead());
			survivor.setDeprel(absorbed.getDeprel());
		}
		for (final Token dependent : index.dependents(absorbed.getId())) {
			if (dependent != survivor) {
				dependent.setHead(Head.of(survivor.getId()));
			}
		}

		sentence.getTokens().remove(sentence.indexOf(absorbed));
		return survivor;
	}

	private static String join(final String separator, final String first, final String second) {
		if (first.equals(Token.NONE)) {
			return second;
		} else if (second.equals(Token.NONE)) {
			return first;
		}
		return Joiner.on(separator).join(first, second);
	}

	/**
	 * Sets the head of a token, and its relation unless {@code relation} is null. {@link Head#UNDEFINED} removes the
	 * head. Cycles are not checked here; see {@link TreeValidator#findCycle}.
	 */
	public static void reattach(final Token token, final Head head, final String relation) {
		check(!head.pointsTo(token.getId()), "A token cannot head itself: " + token);
		check(!token.isSpan(), "Spans have no head: " + token);
		token.setHead(head);
		if (relation != null) {
			token.setDeprel(relation);
		}
	}

	public static void relabel(final Token token, final String relation) {
		token.setDeprel(relation);
	}

	/**
	 * Puts {@code node} in the place of one of its ancestors, which is deleted: the node takes the ancestor's head and
	 * relation, and the ancestor's other dependents attach to the node.
	 *
	 * @return the dependents that were moved to {@code node}
	 */
	public static List<Token> promote(final Sentence sentence, final Token node, final Token removedAncestor) {
		check(sentence.indexOf(node) >= 0 && sentence.indexOf(removedAncestor) >= 0, "Both tokens must be in the sentence");
		final TreeIndex index = TreeIndex.of(sentence);
		check(isAncestor(index, removedAncestor, node), removedAncestor.getId() + " is not above " + node.getId());

		node.setHead(removedAncestor.getHead());
		node.setDeprel(removedAncestor.getDeprel());

		final List<Token> moved = new ArrayList<>();
		for (final Token dependent : index.dependents(removedAncestor.getId())) {
			if (dependent != node) {
				dependent.setHead(Head.of(node.getId()));
				moved.add(dependent);
			}
		}

		remove(sentence, removedAncestor);
		return moved;
	}

	private static boolean isAncestor(final TreeIndex index, final Token ancestor, final Token node) {
		Token current = index.getHead(node);
		// Bounded so a cycle cannot keep us here.
		for (int steps = 0; current != null && steps < index.getTokens().size(); steps++) {
			if (current == ancestor) {
				return true;
			}
			current = index.getHead(current);
		}
		return false;
	}

	/**
	 * Inserts a new token at {@code position} of the token list. Its head must be given explicitly.
	 */
	public static Token insertSynthetic(final Sentence sentence, final int position, final TokenTemplate template) {
		check(position >= 0 && position <= sentence.size(), "No position " + position);
		check(template.getHeadPart() < 0, "Inserted tokens cannot refer to split parts");
		for (final Token span : sentence.getTokens()) {
			if (span.isSpan()) {
				final List<Token> members = sentence.getSpanMembers(span);
				final int start = sentence.indexOf(span);
				final int end = members.isEmpty() ? start : sentence.indexOf(members.get(members.size() - 1));
				check(position <= start || position > end, "Position " + position + " is inside span " + span.getId());
			}
		}

		final Token result = new Token(sentence.allocateTemporaryId());
		template.applyTo(result);
		sentence.getTokens().add(position, result);
		return result;
	}

	/**
	 * Removes a token that nothing depends on. Removing a span keeps its members.
	 */
	public static void delete(final Sentence sentence, final Token token) {
		check(sentence.indexOf(token) >= 0, "Token is not in the sentence: " + token);
		if (!token.isSpan() && !token.isPassThrough()) {
			final List<Token> dependents = TreeIndex.of(sentence).dependents(token.getId());
			check(dependents.isEmpty(), "Cannot delete " + token.getId() + ", it still heads " + dependents.size()
					+ " tokens");
		}
		remove(sentence, token);
	}

	private static void remove(final Sentence sentence, final Token token) {
		if (token.isAtomic()) {
			final Token span = sentence.getSpanOf(token);
			if (span != null) {
				final int remaining = span.getId().getSpanSize() - 1;
				if (remaining < 2) {
					sentence.getTokens().remove(sentence.indexOf(span));
				} else {
					span.setId(TokenId.pendingRange(remaining));
				}
			}
		}
		sentence.getTokens().remove(sentence.indexOf(token));
	}

	private static void check(final boolean condition, final String message) {
		if (!condition) {
			throw new TreeEditException(message);
		}
	}
}
