package edu.uw.easyconllu.rebanking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.Arrays;

import org.junit.Test;

import com.google.common.base.Joiner;

import edu.uw.easyconllu.rebanking.MultiwordLemmaRebanker.Attachment;
import edu.uw.easyconllu.rebanking.MultiwordLemmaRebanker.MultiwordLemma;

public class RuleTableTest {

	private static RuleTable<String> table() {
		return new RuleTable<String>().add("*", "NOUN", "pos").add("ayr", "*", "lemma").add("ayr", "NOUN", "both")
				.add("ayr#2", "*", "indexed");
	}

	@Test
	public void testMostSpecificEntryWins() {
		final RuleTable<String> table = table();
		assertEquals("both", table.lookup("ayr", "NOUN"));
		assertEquals("lemma", table.lookup("ayr", "VERB"));
		assertEquals("indexed", table.lookup("ayr#2", "NOUN"));
		assertEquals("pos", table.lookup("kin", "NOUN"));
		assertNull(table.lookup("kin", "VERB"));
		assertFalse(table.find("ayr", "NOUN").isAmbiguous());
	}

	@Test
	public void testTiesGoToTheFirstEntry() {
		final RuleTable<String> table = new RuleTable<String>().add("ayr", "*", "first").add("*", "NOUN", "weaker")
				.add("ayr", "_", "second");

		final RuleTable.Match<String> match = table.find("ayr", "NOUN");
		assertEquals("first", match.getValue());
		assertTrue(match.isAmbiguous());
		assertEquals(new RuleKey("ayr", null, null), match.getKey());
	}

	@Test
	public void testKeys() {
		assertEquals(6, RuleKey.parse("ayr#2", "*").getSpecificity());
		assertEquals(3, RuleKey.parse("ayr", "NOUN").getSpecificity());
		assertEquals(1, RuleKey.parse("*", "NOUN").getSpecificity());
		assertEquals("ayr#2/*", RuleKey.parse("ayr#2", "*").toString());
		assertEquals(new RuleKey("ayr#x", null, null), RuleKey.parse("ayr#x", "*"));
	}

	@Test
	public void testIndexWithoutLemmaIsNotSpecific() {
		assertEquals(0, RuleKey.parse("*#2", "*").getSpecificity());
		assertEquals(1, RuleKey.parse("*#2", "NOUN").getSpecificity());

		final RuleTable<String> table = new RuleTable<String>().add("*#2", "*", "any second homograph").add("ayr",
				"NOUN", "noun");
		assertEquals("noun", table.lookup("ayr#2", "NOUN"));
		assertFalse(table.find("ayr#2", "NOUN").isAmbiguous());
		assertEquals("any second homograph", table.lookup("kin#2", "VERB"));
	}

	@Test
	public void testLoad() {
		final RuleTable<String> table = RuleTable.load(Arrays.asList("# lemma	pos	values", "", "ayr	NOUN	a	b",
				"kin	*	c").iterator(), columns -> Joiner.on(',').join(columns));

		assertEquals(2, table.size());
		assertEquals("a,b", table.lookup("ayr", "NOUN"));
		assertEquals("c", table.lookup("kin", "ADJ"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLineWithoutPartOfSpeech() {
		RuleTable.load(Arrays.asList("ayr").iterator(), columns -> "");
	}

	@Test
	public void testBundledMultiwordLemmas() throws IOException {
		final RuleTable<MultiwordLemma> table = MultiwordLemmaRebanker.loadTable(MultiwordLemmaRebanker.DEFAULT_TABLE);
		assertEquals(3, table.size());
		assertEquals(Attachment.DEPENDENT, table.lookup("ibrew z", "R-").getAttachment());
		assertEquals(Attachment.SIBLINGS, table.lookup("mi tʼe", "Df").getAttachment());
		assertEquals(2, table.lookup("mi tʼe", "Df").getParts().size());
	}

	@Test
	public void testTableFromClasspath() throws IOException {
		final RuleTable<String> table = RuleTable.load("rules/relation_overrides.tsv", columns -> columns.get(0));
		assertEquals(3, table.size());
		assertEquals("vocative", table.lookup("ayr#2", "NOUN"));
		assertEquals("nsubj", table.lookup("ayr", "NOUN"));
		assertEquals("nsubj", table.lookup("ayr", "ADV"));
		assertEquals("advmod", table.lookup("ayžm", "ADV"));
		assertNull(table.lookup("tun", "NOUN"));
	}

	@Test(expected = IOException.class)
	public void testMissingTable() throws IOException {
		MultiwordLemmaRebanker.loadTable("rules/no_such_table.tsv");
	}
}
