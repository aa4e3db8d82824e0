package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class CorrectionTest {

	private static Symbol t(String s) { return SymbolFactory.getTerminal(s); }

	@Test
	public void operationCosts() {
		assertEquals(0, EditOperation.match(t("a"), 0).getCost());
		assertEquals(1, EditOperation.substitute(t("b"), t("a"), 0).getCost());
		assertEquals(1, EditOperation.insert(t("a"), 0).getCost());
		assertEquals(1, EditOperation.delete(t("a"), 0).getCost());
		assertFalse(EditOperation.insert(t("a"), 0).consumesInput());
		assertNull(EditOperation.delete(t("a"), 0).getOutput());
		assertEquals("Substitute(b,a)@3", EditOperation.substitute(t("b"), t("a"), 3).toString());
		assertEquals(EditOperation.insert(t("a"), 1), EditOperation.insert(t("a"), 1));
		assertFalse(EditOperation.insert(t("a"), 1).equals(EditOperation.insert(t("a"), 2)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void substitutionMustChangeTheSymbol() {
		EditOperation.substitute(t("a"), t("a"), 0);
	}

	@Test
	public void scriptReadsBothWords() {
		Correction c = new Correction(Arrays.asList(
				EditOperation.insert(t("c"), 0),
				EditOperation.match(t("a"), 0),
				EditOperation.substitute(t("d"), t("b"), 1),
				EditOperation.delete(t("a"), 2)));
		assertEquals(Arrays.asList(t("a"), t("b"), t("a")), c.getOriginal());
		assertEquals(Arrays.asList(t("c"), t("a"), t("d")), c.getCorrected());
		assertEquals(3, c.getCost());
		assertEquals(1, c.getInsertions());
		assertEquals(1, c.getDeletions());
		assertEquals(1, c.getSubstitutions());
		assertEquals(3, c.getEdits().size());
		assertEquals(4, c.getOperations().size());
		assertEquals(c.getCorrected(), c.apply(c.getOriginal()));
		assertEquals("3\tc a d\t[Insert(c)@0, Substitute(d,b)@1, Delete(a)@2]", c.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void scriptRejectsOtherWords() {
		Correction c = new Correction(Arrays.asList(EditOperation.match(t("a"), 0)));
		c.apply(Arrays.asList(t("b")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void scriptMustConsumeTheWholeWord() {
		Correction c = new Correction(Arrays.asList(EditOperation.match(t("a"), 0)));
		c.apply(Arrays.asList(t("a"), t("a")));
	}

	@Test
	public void limits() {
		EditLimits l = new EditLimits(1, EditLimits.UNLIMITED, 0, 2);
		assertTrue(l.allows(1, 1, 0));
		assertFalse(l.allows(2, 0, 0));
		assertFalse(l.allows(0, 0, 1));
		assertFalse(l.allows(1, 2, 0));
		assertFalse(l.isUnlimited());
		assertTrue(EditLimits.NONE.isUnlimited());
		assertTrue(EditLimits.NONE.allows(100, 100, 100));
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeLimitIsRejected() {
		new EditLimits(-2, 0, 0, 0);
	}
}
