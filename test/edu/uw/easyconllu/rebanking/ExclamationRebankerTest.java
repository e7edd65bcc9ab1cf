package edu.uw.easyconllu.rebanking;

import static edu.uw.easyconllu.corpora.SentenceFixtures.conll;
import static edu.uw.easyconllu.corpora.SentenceFixtures.lines;
import static edu.uw.easyconllu.corpora.SentenceFixtures.renumberAndWrite;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.util.FaultReport;

public class ExclamationRebankerTest {

	private static final String SPLIT = lines(
			"# sent_id = 1",
			"1-2	Աւա՜ղ	_	_	_	_	_	_	_	_",
			"1	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_",
			"2	՜	՜	PUNCT	_	_	1	punct	_	_",
			"");

	private final ExclamationRebanker rebanker = new ExclamationRebanker();

	@Test
	public void testSplit() {
		final Sentence sentence = conll("# sent_id = 1", "1	Աւա՜ղ	աւաղ	INTJ	_	_	0	root	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(SPLIT, renumberAndWrite(sentence));
	}

	@Test
	public void testSecondRunChangesNothing() {
		final Sentence sentence = conll("# sent_id = 1", "1	Աւա՜ղ	աւաղ	INTJ	_	_	0	root	_	_", "");
		rebanker.doRebanking(sentence, new FaultReport());
		renumberAndWrite(sentence);

		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(SPLIT, renumberAndWrite(sentence));
	}

	@Test
	public void testLeadingGuillemet() {
		final Sentence sentence = conll("1	«Աւա՜ղ	աւաղ	INTJ	_	_	0	root	_	_", "2	է	եմ	AUX	_	_	1	cop	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(lines(
				"1-3	«Աւա՜ղ	_	_	_	_	_	_	_	_",
				"1	«	«	PUNCT	_	_	2	punct	_	_",
				"2	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_",
				"3	՜	՜	PUNCT	_	_	2	punct	_	_",
				"4	է	եմ	AUX	_	_	2	cop	_	_",
				""), renumberAndWrite(sentence));
	}

	@Test
	public void testDetachedMarkIsJoinedFirst() {
		final Sentence sentence = conll("# sent_id = 1", "1	Աւա	աւաղ	INTJ	_	_	0	root	_	_",
				"2	՜ղ	_	X	_	_	1	dep	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(SPLIT, renumberAndWrite(sentence));
	}

	@Test
	public void testWordsWithoutTheMarkAreLeftAlone() {
		final Sentence sentence = conll("1	ասէ	ասեմ	VERB	_	_	0	root	_	_", "2	.	.	PUNCT	_	_	1	punct	_	_", "");
		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
		assertFalse(sentence.isEdited());
	}

	@Test
	public void testOnePunctuationTokenPerMark() {
		final Sentence sentence = conll("1	ո՜վ՜	ով	PRON	_	PronType=Int	2	nsubj	_	_", "2	է	եմ	AUX	_	_	0	root	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(lines(
				"1-3	ո՜վ՜	_	_	_	_	_	_	_	_",
				"1	ով	ով	PRON	_	PronType=Int	4	nsubj	_	_",
				"2	՜	՜	PUNCT	_	_	1	punct	_	_",
				"3	՜	՜	PUNCT	_	_	1	punct	_	_",
				"4	է	եմ	AUX	_	_	0	root	_	_",
				""), renumberAndWrite(sentence));
	}

	@Test
	public void testQuestionAndEmphasisMarks() {
		final Sentence question = conll("1	Աւա՞ղ	աւաղ	INTJ	_	_	0	root	_	_", "");
		assertTrue(rebanker.doRebanking(question, new FaultReport()));
		assertEquals(lines(
				"1-2	Աւա՞ղ	_	_	_	_	_	_	_	_",
				"1	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_",
				"2	՞	՞	PUNCT	_	_	1	punct	_	_",
				""), renumberAndWrite(question));

		final Sentence emphasis = conll("1	Աւա՛ղ	աւաղ	INTJ	_	_	0	root	_	_", "");
		assertTrue(rebanker.doRebanking(emphasis, new FaultReport()));
		assertEquals(lines(
				"1-2	Աւա՛ղ	_	_	_	_	_	_	_	_",
				"1	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_",
				"2	՛	՛	PUNCT	_	_	1	punct	_	_",
				""), renumberAndWrite(emphasis));
	}

	@Test
	public void testMixedMarksKeepTheirOrder() {
		final Sentence sentence = conll("1	Զի՞նչ՛	զինչ	PRON	_	_	0	root	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(lines(
				"1-3	Զի՞նչ՛	_	_	_	_	_	_	_	_",
				"1	Զինչ	զինչ	PRON	_	_	0	root	_	_",
				"2	՞	՞	PUNCT	_	_	1	punct	_	_",
				"3	՛	՛	PUNCT	_	_	1	punct	_	_",
				""), renumberAndWrite(sentence));
	}

	@Test
	public void testBareMarkBecomesPunctuation() {
		final Sentence sentence = conll("1	ասէ	ասեմ	VERB	_	_	0	root	_	_",
				"2	՜	՜	INTJ	I	Case=Nom	1	discourse	1:discourse	Gloss=oh",
				"");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(lines(
				"1	ասէ	ասեմ	VERB	_	_	0	root	_	_",
				"2	՜	՜	PUNCT	_	_	1	punct	_	_",
				""), renumberAndWrite(sentence));

		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
	}

	@Test
	public void testSeveralBareMarksBecomeSeveralTokens() {
		final Sentence sentence = conll("1	ասէ	ասեմ	VERB	_	_	0	root	_	_", "2	՜՞	_	X	_	_	1	dep	_	_", "");

		assertTrue(rebanker.doRebanking(sentence, new FaultReport()));
		assertEquals(lines(
				"1	ասէ	ասեմ	VERB	_	_	0	root	_	_",
				"2	՜	՜	PUNCT	_	_	1	punct	_	SpaceAfter=No",
				"3	՞	՞	PUNCT	_	_	1	punct	_	_",
				""), renumberAndWrite(sentence));

		assertFalse(rebanker.doRebanking(sentence, new FaultReport()));
	}

	@Test
	public void testStripMarks() {
		assertEquals("Աւաղ", ExclamationRebanker.stripMarks("«Աւա՜ղ"));
		assertEquals("", ExclamationRebanker.stripMarks("՜"));
		assertEquals(3, ExclamationRebanker.partsFor("«Աւա՜ղ").size());
		assertEquals(2, ExclamationRebanker.partsFor("Աւա՜ղ").size());
		assertEquals("ով", ExclamationRebanker.stripMarks("ո՜վ՜"));
		assertEquals(3, ExclamationRebanker.partsFor("ո՜վ՜").size());
	}
}
