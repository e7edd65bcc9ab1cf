package edu.uw.easyconllu.dependencies;

import static edu.uw.easyconllu.corpora.SentenceFixtures.conll;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.uw.easyconllu.corpora.Sentence;
import edu.uw.easyconllu.corpora.Token;

public class TreeValidatorTest {

	@Test
	public void testCycle() {
		final Sentence sentence = conll("1	a	a	X	_	_	3	dep	_	_", "2	b	b	X	_	_	3	dep	_	_",
				"3	c	c	X	_	_	2	dep	_	_", "4	d	d	X	_	_	0	root	_	_", "");

		final List<Token> cycle = TreeValidator.findCycle(sentence);
		assertEquals(2, cycle.size());
		assertEquals(Arrays.asList("c", "b"), Arrays.asList(cycle.get(0).getForm(), cycle.get(1).getForm()));
		assertFalse(TreeValidator.isAcyclic(sentence));
	}

	@Test
	public void testTree() {
		final Sentence sentence = conll("1	a	a	X	_	_	2	dep	_	_", "2	b	b	X	_	_	0	root	_	_",
				"3	c	c	X	_	_	9	dep	_	_", "");

		assertTrue(TreeValidator.isAcyclic(sentence));
		assertEquals(1, TreeValidator.countRoots(sentence));
		assertEquals(Collections.singletonList(sentence.getTokens().get(2)), TreeValidator.danglingHeads(sentence));
	}

	@Test
	public void testWellNumberedSentence() {
		final Sentence sentence = conll("1-2	ab	_	_	_	_	_	_	_	_", "1	a	a	X	_	_	0	root	_	_",
				"2	b	b	X	_	_	1	dep	_	_", "2.1	e	e	X	_	_	_	_	_	_", "");
		assertTrue(TreeValidator.danglingHeads(sentence).isEmpty());
		assertTrue(TreeValidator.checkNumbering(sentence).isEmpty());
	}

	@Test
	public void testNumbering() {
		final Sentence sentence = conll("1	a	a	X	_	_	0	root	_	_", "3	b	b	X	_	_	1	dep	_	_",
				"4-5	cd	_	_	_	_	_	_	_	_", "4	c	c	X	_	_	1	dep	_	_", "");

		assertEquals(Arrays.asList("Token 3 should be 2", "Span 4-5 is followed by 1 tokens"),
				TreeValidator.checkNumbering(sentence));
	}
}
