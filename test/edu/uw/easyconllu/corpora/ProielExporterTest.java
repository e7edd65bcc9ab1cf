package edu.uw.easyconllu.corpora;

import static edu.uw.easyconllu.corpora.SentenceFixtures.conll;
import static edu.uw.easyconllu.corpora.SentenceFixtures.lines;
import static edu.uw.easyconllu.corpora.SentenceFixtures.proiel;
import static edu.uw.easyconllu.corpora.SentenceFixtures.write;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.uw.easyconllu.util.Fault;
import edu.uw.easyconllu.util.FaultReport;

public class ProielExporterTest {

	@Test
	public void testExport() {
		final Sentence legacy = proiel("<sentence id=\"52548\">",
				"<token id=\"10\" form=\"Ew\" lemma=\"ew\" part-of-speech=\"C-\" head-id=\"11\" relation=\"aux\" citation-part=\"MATT 5.1\" />",
				"<token id=\"11\" form=\"asē\" lemma=\"asem#2\" part-of-speech=\"V-\" relation=\"pred\" citation-part=\"MATT 5.2\" />",
				"<token id=\"12\" empty-token-sort=\"C\" relation=\"pred\" />",
				"</sentence>");
		final FaultReport faults = new FaultReport();

		final Sentence exported = new ProielExporter().export(legacy, faults);
		assertTrue(faults.isEmpty());
		assertEquals(lines(
				"# sent_id = MATT_5.1-2",
				"# cite = MATT 5.1 – MATT 5.2",
				"# text = Ew asē",
				"1	Ew	ew	C-	_	_	2	aux	_	_",
				"2	asē	asem	V-	_	_	_	pred	_	LId=asem-2",
				""), write(Format.CONLLU, exported));
	}

	@Test
	public void testHeadOnEmptyTokenIsReported() {
		final Sentence legacy = proiel("<sentence id=\"1\">",
				"<token id=\"1\" form=\"a\" lemma=\"a\" part-of-speech=\"Nb\" head-id=\"2\" relation=\"pred\" citation-part=\"MARK 1.1\" />",
				"<token id=\"2\" empty-token-sort=\"V\" />",
				"</sentence>");
		final FaultReport faults = new FaultReport();

		new ProielExporter().export(legacy, faults);
		assertEquals(1, faults.count(Fault.Kind.DANGLING_HEAD));
		assertEquals("MARK_1.1", faults.get(Fault.Kind.DANGLING_HEAD).get(0).getSentenceId());
	}

	@Test
	public void testSentenceIds() {
		assertEquals("MATT_5.48", ProielExporter.buildSentenceId("MATT 5.48", "MATT 5.48"));
		assertEquals("MATT_5.47-48", ProielExporter.buildSentenceId("MATT 5.47", "MATT 5.48"));
		assertEquals("MATT 5.48 - MATT 6.1", ProielExporter.buildSentenceId("MATT 5.48", "MATT 6.1"));
		assertEquals("1_COR_2.3", ProielExporter.buildSentenceId("1 COR 2.3", "1 COR 2.3"));
		assertEquals("Preface", ProielExporter.buildSentenceId("Preface", "Preface"));
	}

	@Test
	public void testSurfaceText() {
		final Sentence sentence = conll("1-2	Աւա՜ղ	_	_	_	_	_	_	_	_",
				"1	Աւաղ	աւաղ	INTJ	_	_	0	root	_	_", "2	՜	՜	PUNCT	_	_	1	punct	_	_",
				"3	ասէ	ասեմ	VERB	_	_	1	parataxis	_	SpaceAfter=No", "4	.	.	PUNCT	_	_	1	punct	_	_",
				"");
		assertEquals("Աւա՜ղ ասէ.", ProielExporter.surfaceText(sentence));
	}
}
