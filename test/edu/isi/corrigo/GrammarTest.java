package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.util.Set;

import org.junit.Test;

public class GrammarTest {

	private static Symbol t(String s) { return SymbolFactory.getTerminal(s); }
	private static Symbol nt(String s) { return SymbolFactory.getNonterminal(s); }

	@Test
	public void nullableAndFirst() throws Exception {
		Grammar g = Grammars.expressions();
		assertTrue(g.isNullable(nt("R")));
		assertFalse(g.isNullable(nt("E")));
		assertFalse(g.isNullable(t("x")));
		Set<Symbol> firstE = g.first(nt("E"));
		assertEquals(2, firstE.size());
		assertTrue(firstE.contains(t("x")));
		assertTrue(firstE.contains(t("(")));
		assertEquals(1, g.first(nt("R")).size());
		assertTrue(g.first(t("+")).contains(t("+")));
	}

	@Test
	public void firstOfSequenceSkipsNullables() throws Exception {
		Grammar g = Grammars.expressions();
		Symbol[] seq = { nt("R"), t(")") };
		Set<Symbol> f = g.first(seq, 0);
		assertTrue(f.contains(t("+")));
		assertTrue(f.contains(t(")")));
		assertFalse(g.isNullable(seq, 0));
		assertTrue(g.isNullable(seq, 2));
	}

	@Test
	public void queries() throws Exception {
		Grammar g = Grammars.palindrome();
		assertEquals(nt("S"), g.getStart());
		assertEquals(2, g.productionsFor(nt("S")).size());
		assertEquals(2, g.getTerminals().size());
		assertTrue(g.isTerminal(t("a")));
		assertFalse(g.isTerminal(t("zz")));
		assertEquals(2, g.getRules().size());
		assertEquals(0, g.getRules().get(0).getIndex());
	}

	@Test(expected = GrammarException.class)
	public void startMustHaveRules() throws Exception {
		CFGRuleSet rs = new CFGRuleSet();
		rs.setStartSymbol("Q");
		rs.addNonterminal("Q");
		rs.addTerminal("p");
		rs.addRule("P", "p");
		Grammar.compile(rs);
	}

	@Test(expected = GrammarException.class)
	public void undeclaredSymbolsAreRejected() throws Exception {
		CFGRuleSet rs = new CFGRuleSet();
		rs.setStartSymbol("S");
		rs.addRule("S", "x");
		Grammar.compile(rs);
	}

	@Test(expected = GrammarException.class)
	public void missingStartIsRejected() throws Exception {
		CFGRuleSet rs = new CFGRuleSet();
		rs.addTerminal("x");
		rs.addRule("S", "x");
		Grammar.compile(rs);
	}

	@Test
	public void reachableUnproductiveNonterminalIsRejected() throws Exception {
		try {
			Grammars.fromText("S\nS -> a\nS -> B\nB -> b B\n");
			fail("B derives no terminal string");
		}
		catch (GrammarException e) {
			assertTrue(e.getMessage().contains("B"));
		}
	}

	@Test
	public void unreachableUnproductiveNonterminalIsTolerated() throws Exception {
		Grammar g = Grammars.fromText("S\nS -> a\nB -> b B\n");
		assertEquals(2, g.getNumRules());
	}

	@Test
	public void unquotedRuleHeadMeansNonterminal() throws Exception {
		Grammar g = Grammars.fromText("S\nS -> \"S\" S\nS -> x\n");
		CFGRule r = g.productionsFor(nt("S")).get(0);
		assertTrue(r.getRHS(0).isTerminal());
		assertTrue(r.getRHS(1).isNonterminal());
	}
}
