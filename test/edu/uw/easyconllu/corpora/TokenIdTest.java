package edu.uw.easyconllu.corpora;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TokenIdTest {

	@Test
	public void testParse() {
		assertEquals(TokenId.word(3), TokenId.parse("3"));
		assertEquals(TokenId.range(3, 4), TokenId.parse("3-4"));
		assertEquals(TokenId.empty(3, 1), TokenId.parse("3.1"));

		assertNull(TokenId.parse("4-3"));
		assertNull(TokenId.parse("x"));
		assertNull(TokenId.parse(""));
		assertNull(TokenId.parse("3.x"));
	}

	@Test
	public void testToStringMatchesParse() {
		for (final String id : new String[] { "1", "12-14", "7.2" }) {
			assertEquals(id, TokenId.parse(id).toString());
		}
	}

	@Test
	public void testKinds() {
		assertTrue(TokenId.range(1, 3).isSpan());
		assertEquals(3, TokenId.range(1, 3).getSpanSize());
		assertTrue(TokenId.pendingRange(2).isSpan());
		assertEquals(2, TokenId.pendingRange(2).getSpanSize());

		assertTrue(TokenId.empty(1, 1).isEmptyNode());
		assertFalse(TokenId.empty(1, 1).isAtomic());

		final TokenId temporary = new Sentence().allocateTemporaryId();
		assertEquals(TokenId.Kind.TEMPORARY, temporary.getKind());
		assertTrue(temporary.isAtomic());
	}

	@Test
	public void testTemporaryIdsAreFresh() {
		final Sentence sentence = new Sentence();
		assertFalse(sentence.allocateTemporaryId().equals(sentence.allocateTemporaryId()));
	}

	@Test(expected = IllegalStateException.class)
	public void testPendingRangeHasNoStart() {
		TokenId.pendingRange(2).getStart();
	}
}
