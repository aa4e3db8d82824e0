package edu.isi.corrigo;

import static org.junit.Assert.*;

import org.junit.Test;

public class EarleyRecognizerTest {

	@Test
	public void palindromes() throws Exception {
		EarleyRecognizer r = new EarleyRecognizer(Grammars.palindrome());
		assertTrue(r.recognize(Grammars.word("b")));
		assertTrue(r.recognize(Grammars.word("a a b a a")));
		assertFalse(r.recognize(Grammars.word("a b")));
		assertFalse(r.recognize(Grammars.word("")));
	}

	@Test
	public void nullableTails() throws Exception {
		EarleyRecognizer r = new EarleyRecognizer(Grammars.expressions());
		assertTrue(r.recognize(Grammars.word("x")));
		assertTrue(r.recognize(Grammars.word("( x + x ) + x")));
		assertFalse(r.recognize(Grammars.word("x +")));
		assertFalse(r.recognize(Grammars.word("( x")));
	}

	@Test
	public void cyclesAndEmptyRules() throws Exception {
		EarleyRecognizer r = new EarleyRecognizer(Grammars.cyclic());
		assertTrue(r.recognize(Grammars.word("b")));
		assertTrue(r.recognize(Grammars.word("a a b")));
		assertFalse(r.recognize(Grammars.word("b a")));
	}
}
