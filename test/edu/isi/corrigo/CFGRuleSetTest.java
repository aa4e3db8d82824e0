package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.io.StringReader;

import org.junit.Test;

public class CFGRuleSetTest {

	@Test
	public void readsStartSymbolRulesAndComments() throws Exception {
		CFGRuleSet rs = new CFGRuleSet(new StringReader(
				"% a comment\n\n  S   % start\nS -> a S b % trailing\nS -> *e*\n"));
		assertEquals("S", rs.getStartSymbol());
		assertEquals(2, rs.getNumRules());
		assertTrue(rs.getNonterminals().contains("S"));
		assertTrue(rs.getTerminals().contains("a"));
		assertTrue(rs.getTerminals().contains("b"));
		assertFalse(rs.getTerminals().contains("S"));
		assertEquals(0, rs.getRawRules().get(1).rhs.length);
	}

	@Test
	public void quotedTokensAreTerminals() throws Exception {
		CFGRuleSet rs = new CFGRuleSet(new StringReader("S\nS -> \"S\" x\n"));
		assertTrue(rs.getTerminals().contains("S"));
		assertTrue(rs.getRawRules().get(0).quoted[0]);
		assertFalse(rs.getRawRules().get(0).quoted[1]);
	}

	@Test(expected = DataFormatException.class)
	public void emptyTextHasNoStartSymbol() throws Exception {
		new CFGRuleSet(new StringReader("% nothing here\n\n"));
	}

	@Test(expected = DataFormatException.class)
	public void ruleWithoutArrowIsRejected() throws Exception {
		new CFGRuleSet(new StringReader("S\nS a b\n"));
	}

	@Test(expected = DataFormatException.class)
	public void emptyBodyMustBeSpelledOut() throws Exception {
		new CFGRuleSet(new StringReader("S\nS ->\n"));
	}

	@Test(expected = DataFormatException.class)
	public void epsilonMustStandAlone() throws Exception {
		new CFGRuleSet(new StringReader("S\nS -> a *e*\n"));
	}

	@Test
	public void builderKeepsDeclarations() {
		CFGRuleSet rs = new CFGRuleSet();
		rs.setStartSymbol("S");
		rs.addTerminal("x");
		rs.addRule("S", "x", "S");
		assertEquals("S\nS -> x S\n", rs.toString());
	}
}
