package edu.uw.easyconllu.rebanking;

import static edu.uw.easyconllu.corpora.SentenceFixtures.proiel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.uw.easyconllu.corpora.Head;
import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;
import edu.uw.easyconllu.corpora.TokenId;
import edu.uw.easyconllu.dependencies.Renumberer;
import edu.uw.easyconllu.util.FaultReport;

public class PunctuationInferenceRebankerTest {

	private final PunctuationInferenceRebanker rebanker = new PunctuationInferenceRebanker();

	private static Sentence sentence(final String presentationAfter) {
		return proiel("<sentence id=\"1\">",
				"<token id=\"1\" form=\"Ew\" lemma=\"ew\" part-of-speech=\"C-\" head-id=\"2\" relation=\"aux\" />",
				"<token id=\"2\" form=\"asē\" lemma=\"asem\" part-of-speech=\"V-\" relation=\"pred\" presentation-after=\""
						+ presentationAfter + "\" />",
				"<token id=\"3\" form=\"ayl\" lemma=\"ayl\" part-of-speech=\"C-\" relation=\"pred\" />",
				"</sentence>");
	}

	@Test
	public void testInsertsPunctuation() {
		final Sentence sentence = sentence(". ");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		new Renumberer().renumber(sentence);
		assertEquals(4, sentence.size());

		final Token inserted = sentence.getTokens().get(2);
		assertEquals(TokenId.word(3), inserted.getId());
		assertEquals(".", inserted.getForm());
		assertEquals(".", inserted.getLemma());
		assertEquals("PUNCT", inserted.getUpos());
		assertEquals("punct", inserted.getDeprel());
		assertEquals(Head.of(TokenId.word(4)), inserted.getHead());
		assertFalse(sentence.getTokens().get(0).isEdited());
	}

	@Test
	public void testSecondRunChangesNothing() {
		final Sentence sentence = sentence(",");
		rebanker.doRebanking(sentence, new FaultReport());
		new Renumberer().renumber(sentence);

		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(4, sentence.size());
	}

	@Test
	public void testQuestionMarksAndWordsAreNotPunctuation() {
		assertFalse(rebanker.doRebanking(sentence("?"), new FaultReport()));
		assertFalse(rebanker.doRebanking(sentence(" a "), new FaultReport()));
		assertFalse(rebanker.doRebanking(sentence(", «"), new FaultReport()));
		assertFalse(rebanker.doRebanking(sentence(""), new FaultReport()));
	}

	@Test
	public void testNearestHeadlessTokenWins() {
		final Sentence sentence = proiel("<sentence id=\"1\">",
				"<token id=\"1\" form=\"a\" lemma=\"a\" part-of-speech=\"Nb\" relation=\"pred\" />",
				"<token id=\"2\" form=\"b\" lemma=\"b\" part-of-speech=\"Nb\" head-id=\"1\" relation=\"atr\" presentation-after=\";\" />",
				"<token id=\"3\" form=\"c\" lemma=\"c\" part-of-speech=\"V-\" relation=\"pred\" />",
				"<token id=\"4\" form=\"d\" lemma=\"d\" part-of-speech=\"Nb\" head-id=\"3\" relation=\"obj\" />",
				"</sentence>");

		final Token b = sentence.getTokens().get(1);
		assertEquals("a", PunctuationInferenceRebanker.nearestHeadless(sentence, b).getForm());
		assertEquals("c", PunctuationInferenceRebanker.nearestHeadless(sentence, sentence.getTokens().get(3))
				.getForm());

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(";", sentence.getTokens().get(2).getForm());
		assertEquals(Head.of(TokenId.word(1)), sentence.getTokens().get(2).getHead());
	}

	@Test
	public void testNoHeadlessToken() {
		final Sentence sentence = proiel("<sentence id=\"1\">",
				"<token id=\"1\" form=\"a\" lemma=\"a\" part-of-speech=\"Nb\" head-id=\"2\" relation=\"sub\" presentation-after=\".\" />",
				"<token id=\"2\" form=\"b\" lemma=\"b\" part-of-speech=\"Nb\" head-id=\"1\" relation=\"atr\" />",
				"</sentence>");

		assertNull(PunctuationInferenceRebanker.nearestHeadless(sentence, sentence.getTokens().get(0)));
		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(2, sentence.size());
	}

	@Test
	public void testTokenIsNeverItsOwnPunctuationHead() {
		final Sentence sentence = proiel("<sentence id=\"1\">",
				"<token id=\"1\" form=\"Ew\" lemma=\"ew\" part-of-speech=\"C-\" head-id=\"2\" relation=\"aux\" />",
				"<token id=\"2\" form=\"asē\" lemma=\"asem\" part-of-speech=\"V-\" relation=\"pred\" presentation-after=\".\" />",
				"</sentence>");

		assertNull(PunctuationInferenceRebanker.nearestHeadless(sentence, sentence.getTokens().get(1)));
		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(2, sentence.size());
		assertFalse(sentence.isEdited());
	}
}
