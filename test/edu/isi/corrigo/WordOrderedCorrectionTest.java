package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.isi.corrigo.WordOrderedCorrection.Comparison;

public class WordOrderedCorrectionTest {

	private static Symbol t(String s) { return SymbolFactory.getTerminal(s); }

	private static List<Symbol> w(String text) { return SymbolFactory.getCharWord(text); }

	// one-symbol corrections: insertion before, the step, insertion after
	private static WordOrderedCorrection one(String before, EditOperation step, String after) {
		List<List<Symbol>> ins = new ArrayList<List<Symbol>>();
		ins.add(w(before));
		ins.add(w(after));
		return new WordOrderedCorrection(ins, Arrays.asList(step));
	}

	private static WordOrderedCorrection none(String inserted) {
		List<List<Symbol>> ins = new ArrayList<List<Symbol>>();
		ins.add(w(inserted));
		return new WordOrderedCorrection(ins, new ArrayList<EditOperation>());
	}

	@Test
	public void fromAlignedCorrection() {
		Correction c = new Correction(Arrays.asList(
				EditOperation.insert(t("c"), 0),
				EditOperation.match(t("a"), 0),
				EditOperation.delete(t("b"), 1),
				EditOperation.insert(t("d"), 2),
				EditOperation.insert(t("e"), 2)));
		WordOrderedCorrection woc = WordOrderedCorrection.of(c);
		assertEquals(2, woc.getNumSteps());
		assertEquals(5, woc.length());
		assertEquals(w("c"), woc.getInsertion(0));
		assertTrue(woc.getInsertion(1).isEmpty());
		assertEquals(w("de"), woc.getInsertion(2));
		assertEquals(c.getCorrected(), woc.apply());
		assertEquals(c.getCost(), woc.getCost());
	}

	@Test
	public void emptyCorrection() {
		WordOrderedCorrection e = WordOrderedCorrection.empty();
		assertEquals(1, e.length());
		assertTrue(e.apply().isEmpty());
		assertEquals(0, e.getCost());
	}

	@Test(expected = IllegalArgumentException.class)
	public void insertionsAreNotSteps() {
		one("", EditOperation.insert(t("a"), 0), "");
	}

	@Test
	public void matchBeatsDeletionAndSubstitution() {
		WordOrderedCorrection m = one("", EditOperation.match(t("a"), 0), "");
		WordOrderedCorrection d = one("", EditOperation.delete(t("a"), 0), "");
		WordOrderedCorrection s = one("", EditOperation.substitute(t("b"), t("a"), 0), "");
		assertEquals(Comparison.SMALLER, m.compare(d));
		assertEquals(Comparison.BIGGER, d.compare(m));
		assertEquals(Comparison.SMALLER, m.compare(s));
		assertEquals(Comparison.INCOMPARABLE, d.compare(s));
		assertEquals(Comparison.EQUAL, m.compare(one("", EditOperation.match(t("a"), 0), "")));
	}

	@Test
	public void insertionsCompareAsSubsequences() {
		WordOrderedCorrection small = one("ac", EditOperation.match(t("a"), 0), "");
		WordOrderedCorrection big = one("abc", EditOperation.match(t("a"), 0), "");
		WordOrderedCorrection other = one("ca", EditOperation.match(t("a"), 0), "");
		assertEquals(Comparison.SMALLER, small.compare(big));
		assertEquals(Comparison.BIGGER, big.compare(small));
		assertEquals(Comparison.INCOMPARABLE, other.compare(big));
	}

	@Test
	public void mixedDirectionsAreIncomparable() {
		WordOrderedCorrection x = one("", EditOperation.delete(t("a"), 0), "");
		WordOrderedCorrection y = one("b", EditOperation.match(t("a"), 0), "");
		assertEquals(Comparison.INCOMPARABLE, x.compare(y));
		assertEquals(Comparison.INCOMPARABLE, y.compare(x));
	}

	@Test(expected = IllegalArgumentException.class)
	public void differentLengthsDontCompare() {
		none("a").compare(one("", EditOperation.match(t("a"), 0), ""));
	}

	@Test
	public void concatenationJoinsTheSeam() {
		WordOrderedCorrection x = one("a", EditOperation.match(t("b"), 0), "c");
		WordOrderedCorrection y = one("d", EditOperation.match(t("e"), 1), "");
		WordOrderedCorrection xy = x.concatenate(y, false);
		assertEquals(2, xy.getNumSteps());
		assertEquals(w("cd"), xy.getInsertion(1));
		assertEquals(w("abcde"), xy.apply());
		// both sides insert at the seam, nothing to simplify
		assertNotNull(x.concatenate(y, true));
	}

	@Test
	public void wastefulSeamsAreSimplified() {
		WordOrderedCorrection insert = none("a");
		WordOrderedCorrection delete = one("", EditOperation.delete(t("b"), 0), "");
		assertTrue(insert.canSimplify(delete));
		assertNull(insert.concatenate(delete, true));
		assertNotNull(insert.concatenate(delete, false));
		assertTrue(delete.canSimplify(insert));

		// inserting x, then substituting the input x away
		WordOrderedCorrection subX = one("", EditOperation.substitute(t("y"), t("x"), 0), "");
		assertTrue(none("x").canSimplify(subX));
		assertFalse(none("z").canSimplify(subX));

		// substituting to y, then inserting y
		assertTrue(subX.canSimplify(none("y")));
		assertFalse(subX.canSimplify(none("x")));

		// substituting to y, then deleting an input y
		WordOrderedCorrection delY = one("", EditOperation.delete(t("y"), 1), "");
		assertTrue(subX.canSimplify(delY));
		assertFalse(subX.canSimplify(one("", EditOperation.match(t("y"), 1), "")));

		WordOrderedCorrection match = one("", EditOperation.match(t("a"), 0), "");
		assertFalse(match.canSimplify(match));
		assertFalse(WordOrderedCorrection.empty().canSimplify(match));
	}
}
