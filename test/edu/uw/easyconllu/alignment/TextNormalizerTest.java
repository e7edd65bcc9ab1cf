package edu.uw.easyconllu.alignment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TextNormalizerTest {

	@Test
	public void testNormalize() {
		assertEquals("hello world", TextNormalizer.normalize("  Hello,   World! "));
		assertEquals("աւաղ ասէ", TextNormalizer.normalize("« Աւա՜ղ », ասէ."));
		assertEquals("աւաղ ասէ", TextNormalizer.normalize("«Աւա՜ղ» ասէ"));
		assertEquals("", TextNormalizer.normalize("…"));
	}

	@Test
	public void testSameForm() {
		assertTrue(TextNormalizer.sameForm("Ասէ", "ասէ"));
		assertFalse(TextNormalizer.sameForm("ասէ", "ասէ."));
	}
}
