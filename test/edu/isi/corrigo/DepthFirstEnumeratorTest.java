package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.List;

import org.junit.Test;

public class DepthFirstEnumeratorTest {

	private static CorrectionParse parse(Grammar g, String text) throws Exception {
		return new EarleyCorrectionParser(g).parse(Grammars.word(text));
	}

	@Test
	public void loopFreeWalkEnds() throws Exception {
		Grammar g = Grammars.palindrome();
		List<Symbol> w = Grammars.word("a b");
		DepthFirstEnumerator en = new DepthFirstEnumerator(new EarleyCorrectionParser(g).parse(w),
				DepthFirstEnumerator.UNBOUNDED, DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT);
		List<Correction> l = Grammars.take(en, 100000);
		assertFalse(en.hasNext());
		assertFalse(en.isTruncated());
		EarleyRecognizer rec = new EarleyRecognizer(g);
		HashSet<String> words = new HashSet<String>();
		HashSet<Correction> seen = new HashSet<Correction>();
		for (Correction c : l) {
			assertTrue(seen.add(c));
			assertTrue(rec.recognize(c.apply(w)));
			if (c.getCost() == 1)
				words.add(Grammars.str(c.getCorrected()));
		}
		assertTrue(words.contains("b"));
		assertTrue(words.contains("aba"));
	}

	@Test
	public void depthCutoff() throws Exception {
		DepthFirstEnumerator en = new DepthFirstEnumerator(parse(Grammars.palindrome(), "a b"),
				3, DepthFirstEnumerator.CyclePolicy.ALLOW_REPEAT);
		Grammars.take(en, 100000);
		assertFalse(en.hasNext());
		assertTrue(en.isTruncated());
		try {
			en.next();
			fail("cut off");
		}
		catch (EnumerationLimitExceededException e) {
			assertEquals("depth", e.getLimit());
		}
	}

	@Test
	public void deeperBoundFindsMore() throws Exception {
		CorrectionParse p = parse(Grammars.palindrome(), "a b");
		int shallow = Grammars.take(new DepthFirstEnumerator(p, 3, DepthFirstEnumerator.CyclePolicy.ALLOW_REPEAT), 100000).size();
		int deep = Grammars.take(new DepthFirstEnumerator(p, 6, DepthFirstEnumerator.CyclePolicy.ALLOW_REPEAT), 100000).size();
		assertTrue(shallow+" vs "+deep, deep > shallow);
	}

	@Test
	public void bothPoliciesTogether() throws Exception {
		CorrectionParse p = parse(Grammars.cyclic(), "a b");
		DepthFirstEnumerator en = new DepthFirstEnumerator(p.getForest(), p.getRoots(), 50,
				DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT, EditLimits.NONE);
		List<Correction> l = Grammars.take(en, 100000);
		assertFalse(l.isEmpty());
		boolean exact = false;
		for (Correction c : l)
			exact |= c.getCost() == 0;
		assertTrue(exact);
	}

	@Test
	public void editLimitsApply() throws Exception {
		CorrectionParse p = parse(Grammars.palindrome(), "a b");
		DepthFirstEnumerator en = new DepthFirstEnumerator(p.getForest(), p.getRoots(), DepthFirstEnumerator.UNBOUNDED,
				DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT, new EditLimits(0, EditLimits.UNLIMITED, 0, EditLimits.UNLIMITED));
		List<Correction> l = Grammars.take(en, 100000);
		assertEquals(1, l.size());
		assertEquals("[Delete(a)@0, Match(b)@1]", l.get(0).getOperations().toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void repeatingNeedsADepthBound() throws Exception {
		new DepthFirstEnumerator(parse(Grammars.palindrome(), "b"), DepthFirstEnumerator.UNBOUNDED,
				DepthFirstEnumerator.CyclePolicy.ALLOW_REPEAT);
	}

	@Test(expected = IllegalArgumentException.class)
	public void zeroDepthIsRejected() throws Exception {
		new DepthFirstEnumerator(parse(Grammars.palindrome(), "b"), 0, DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT);
	}
}
