package edu.uw.easyconllu.corpora;

import static edu.uw.easyconllu.corpora.SentenceFixtures.lines;
import static edu.uw.easyconllu.corpora.SentenceFixtures.readAll;
import static edu.uw.easyconllu.corpora.SentenceFixtures.write;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import edu.uw.easyconllu.dependencies.TreeEdits;

public class ProielReaderTest {

	private static final String TOKEN_1 = "      <token id=\"1\" form=\"Ew\" lemma=\"ew\" part-of-speech=\"C-\" morphology=\"---------n\" head-id=\"2\" relation=\"aux\" />";
	private static final String TOKEN_2 = "      <token id=\"2\" form=\"asē\" lemma=\"asem\" part-of-speech=\"V-\" morphology=\"3spia----i\" relation=\"pred\" presentation-after=\", \" citation-part=\"MATT 5.1\" />";
	private static final String TOKEN_3 = "      <token id=\"3\" empty-token-sort=\"C\" head-id=\"2\" relation=\"pred\" />";

	private static final String CORPUS = lines(
			"<proiel>",
			"  <source id=\"matt\">",
			"    <sentence id=\"52548\" status=\"reviewed\">",
			TOKEN_1,
			TOKEN_2,
			TOKEN_3,
			"    </sentence>",
			"  </source>",
			"</proiel>");

	@Test
	public void testUntouchedCorpusIsWrittenBackUnchanged() {
		final List<Sentence> sentences = readAll(Format.PROIEL, CORPUS);
		assertEquals(2, sentences.size());
		assertEquals(CORPUS, new ProielWriter().toString(sentences));
	}

	@Test
	public void testAttributes() {
		final Sentence sentence = readAll(Format.PROIEL, CORPUS).get(0);
		assertEquals(3, sentence.getComments().size());
		assertEquals("    </sentence>", sentence.getClosingLine());

		final List<Token> tokens = sentence.getTokens();
		assertEquals(3, tokens.size());
		assertEquals("asē", tokens.get(1).getForm());
		assertEquals("V-", tokens.get(1).getUpos());
		assertEquals(Head.UNDEFINED, tokens.get(1).getHead());
		assertEquals(", ", tokens.get(1).getAttribute(Token.PRESENTATION_AFTER));
		assertEquals("MATT 5.1", tokens.get(1).getAttribute(Token.CITATION_PART));
		assertEquals("---------n", tokens.get(0).getAttribute("morphology"));
		assertEquals(Head.of(TokenId.word(2)), tokens.get(0).getHead());

		assertTrue(tokens.get(2).isEmptyNode());
		assertTrue(tokens.get(2).isAtomic());
		assertEquals(Token.NONE, tokens.get(2).getForm());
	}

	@Test
	public void testRemovedHeadDropsHeadId() {
		final Sentence sentence = readAll(Format.PROIEL, CORPUS).get(0);
		TreeEdits.reattach(sentence.getTokens().get(0), Head.UNDEFINED, null);

		final String written = write(Format.PROIEL, sentence);
		assertTrue(written.contains("      <token id=\"1\" form=\"Ew\" lemma=\"ew\" part-of-speech=\"C-\" "
				+ "morphology=\"---------n\" relation=\"aux\" />\n"));
		assertTrue(written.contains(TOKEN_2 + "\n"));
	}

	@Test
	public void testChangedAttributesKeepTheirOrder() {
		final Sentence sentence = readAll(Format.PROIEL, CORPUS).get(0);
		sentence.getTokens().get(1).setDeprel("xobj").setAttribute(Token.PRESENTATION_AFTER, null)
				.setAttribute("information-status", "new");

		assertTrue(write(Format.PROIEL, sentence).contains("      <token id=\"2\" form=\"asē\" lemma=\"asem\" "
				+ "part-of-speech=\"V-\" morphology=\"3spia----i\" relation=\"xobj\" citation-part=\"MATT 5.1\" "
				+ "information-status=\"new\" />\n"));
	}

	@Test
	public void testNewTokenUsesDefaultLayout() {
		final Token token = new Token(TokenId.word(4)).setForm(".").setLemma(".").setUpos("PUNCT")
				.setHead(Head.of(TokenId.word(2))).setDeprel("punct");
		assertEquals("      <token id=\"4\" form=\".\" lemma=\".\" part-of-speech=\"PUNCT\" head-id=\"2\" "
				+ "relation=\"punct\" />", new ProielWriter().format(token));
	}

	@Test
	public void testTokenWithoutIdIsMalformed() {
		final String text = lines("<sentence id=\"1\">", "<token form=\"x\" />", "</sentence>");
		final Sentence sentence = readAll(Format.PROIEL, text).get(0);
		assertTrue(sentence.getTokens().get(0).isPassThrough());
		assertNull(sentence.findById(TokenId.word(1)));
		assertEquals(text, write(Format.PROIEL, sentence));
	}
}
