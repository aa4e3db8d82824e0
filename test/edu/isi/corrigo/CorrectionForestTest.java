package edu.isi.corrigo;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

public class CorrectionForestTest {

	private Symbol s, a;
	private CFGRule r;

	@Before
	public void setUp() {
		s = SymbolFactory.getNonterminal("S");
		a = SymbolFactory.getTerminal("a");
		r = new CFGRule(s, new Symbol[] { a }, 0);
	}

	@Test
	public void labelsAreSharedAndAlternativesPacked() {
		CorrectionForest f = new CorrectionForest();
		int h = f.nodeFor(NodeLabel.symbol(s, 0, 1));
		assertEquals(h, f.nodeFor(NodeLabel.symbol(s, 0, 1)));
		assertEquals(PackedAlternative.NONE, f.lookup(NodeLabel.symbol(s, 0, 2)));
		assertEquals(1, f.getNumNodes());
		assertTrue(f.addAlternative(h, PackedAlternative.withLeaf(r, PackedAlternative.NONE, EditOperation.match(a, 0))));
		assertFalse(f.addAlternative(h, PackedAlternative.withLeaf(r, PackedAlternative.NONE, EditOperation.match(a, 0))));
		assertEquals(1, f.getAlternatives(h).size());
		assertEquals(1, f.getNumAlternatives());
	}

	@Test
	public void leavesAreInterned() {
		CorrectionForest f = new CorrectionForest();
		EditOperation one = f.leaf(EditOperation.insert(a, 3));
		assertSame(one, f.leaf(EditOperation.insert(a, 3)));
		assertNotSame(one, f.leaf(EditOperation.insert(a, 2)));
		assertEquals(2, f.getNumLeaves());
	}

	@Test(expected = IllegalArgumentException.class)
	public void danglingChildIsRejected() {
		CorrectionForest f = new CorrectionForest();
		int h = f.nodeFor(NodeLabel.symbol(s, 0, 1));
		f.addAlternative(h, PackedAlternative.withChild(r, PackedAlternative.NONE, 5));
	}

	@Test
	public void minimumCostThroughACycle() {
		CorrectionForest f = new CorrectionForest();
		int loop = f.nodeFor(NodeLabel.symbol(s, 0, 0));
		f.addAlternative(loop, PackedAlternative.withChild(r, PackedAlternative.NONE, loop));
		int above = f.nodeFor(NodeLabel.symbol(s, 0, 1),
				PackedAlternative.withLeaf(null, loop, EditOperation.delete(a, 0)));
		assertEquals(CorrectionForest.INFINITE, f.minimumCost(loop));
		assertEquals(CorrectionForest.INFINITE, f.minimumCost(above));

		f.addAlternative(loop, PackedAlternative.withLeaf(r, PackedAlternative.NONE, EditOperation.insert(a, 0)));
		assertEquals(1, f.minimumCost(loop));
		assertEquals(2, f.minimumCost(above));
		assertTrue(f.getNode(loop).isAmbiguous());
		assertFalse(f.getNode(above).isAmbiguous());

		f.addAlternative(above, PackedAlternative.withLeaf(r, PackedAlternative.NONE, EditOperation.match(a, 0)));
		assertEquals(0, f.minimumCost(above));
		int[] all = f.minimumCosts();
		assertEquals(2, all.length);
		assertEquals(1, all[loop]);
	}

	@Test
	public void minimumCostOfParsedWords() throws Exception {
		EarleyCorrectionParser p = new EarleyCorrectionParser(Grammars.palindrome());
		CorrectionParse parse = p.parse(Grammars.word("a b"));
		assertEquals(1, parse.getForest().minimumCost(parse.getRoot()));
		parse = p.parse(Grammars.word("a b a"));
		assertEquals(0, parse.getForest().minimumCost(parse.getRoot()));
		parse = p.parse(Grammars.word(""));
		assertEquals(1, parse.getForest().minimumCost(parse.getRoot()));
		parse = p.parse(Grammars.word("b b b"));
		assertEquals(2, parse.getForest().minimumCost(parse.getRoot()));
	}
}
