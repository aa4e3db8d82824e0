package edu.isi.corrigo;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import org.junit.Test;

// corrections checked against brute force over all short words
public class CorrectionCoverageTest {

	private static int distance(List<Symbol> a, List<Symbol> b) {
		int[][] d = new int[a.size()+1][b.size()+1];
		for (int i = 0; i <= a.size(); i++)
			d[i][0] = i;
		for (int j = 0; j <= b.size(); j++)
			d[0][j] = j;
		for (int i = 1; i <= a.size(); i++) {
			for (int j = 1; j <= b.size(); j++) {
				int sub = d[i-1][j-1] + (a.get(i-1) == b.get(j-1) ? 0 : 1);
				d[i][j] = Math.min(sub, Math.min(d[i-1][j], d[i][j-1]) + 1);
			}
		}
		return d[a.size()][b.size()];
	}

	// every word over the alphabet up to the given length
	private static List<List<Symbol>> words(String[] alphabet, int maxLen) {
		ArrayList<List<Symbol>> ret = new ArrayList<List<Symbol>>();
		ArrayList<List<Symbol>> layer = new ArrayList<List<Symbol>>();
		layer.add(new ArrayList<Symbol>());
		ret.addAll(layer);
		for (int len = 1; len <= maxLen; len++) {
			ArrayList<List<Symbol>> nextLayer = new ArrayList<List<Symbol>>();
			for (List<Symbol> w : layer) {
				for (String s : alphabet) {
					ArrayList<Symbol> x = new ArrayList<Symbol>(w);
					x.add(SymbolFactory.getTerminal(s));
					nextLayer.add(x);
				}
			}
			ret.addAll(nextLayer);
			layer = nextLayer;
		}
		return ret;
	}

	private static CorrectionParse parse(Grammar g, List<Symbol> w, boolean stat) throws Exception {
		return stat ? new StaticCorrectionParser(g).parse(w) : new EarleyCorrectionParser(g).parse(w);
	}

	private static void assertComplete(Grammar g, String text, String[] alphabet, int k) throws Exception {
		List<Symbol> w = Grammars.word(text);
		EarleyRecognizer rec = new EarleyRecognizer(g);
		for (boolean stat : new boolean[] { false, true }) {
			CorrectionParse p = parse(g, w, stat);
			CostOrderedEnumerator en = new CostOrderedEnumerator(p.getForest(), p.getRoots(), k,
					CostOrderedEnumerator.UNBOUNDED, EditLimits.NONE);
			HashMap<List<Symbol>, Integer> cheapest = new HashMap<List<Symbol>, Integer>();
			for (Correction c : Grammars.take(en, 100000)) {
				List<Symbol> u = c.getCorrected();
				assertTrue(c+" is not in the language", rec.recognize(u));
				assertTrue(c+" costs less than the distance", c.getCost() >= distance(w, u));
				if (!cheapest.containsKey(u))
					cheapest.put(u, c.getCost());
			}
			assertFalse(en.hasNext());
			int close = 0;
			for (List<Symbol> u : words(alphabet, w.size()+k)) {
				int d = distance(w, u);
				if (d > k || !rec.recognize(u))
					continue;
				close++;
				String what = "'"+Grammars.str(u)+"' from '"+text+"'"+(stat ? " (static)" : "");
				assertTrue(what+" is missing", cheapest.containsKey(u));
				assertEquals(what, d, cheapest.get(u).intValue());
			}
			assertTrue(close > 0);
			assertEquals(close, cheapest.size());
		}
	}

	@Test
	public void everyCloseWordIsFoundAtItsDistance() throws Exception {
		String[] ab = { "a", "b" };
		assertComplete(Grammars.palindrome(), "a b", ab, 2);
		assertComplete(Grammars.palindrome(), "b b", ab, 2);
		assertComplete(Grammars.palindrome(), "", ab, 2);
		assertComplete(Grammars.cyclic(), "b a", ab, 2);
		assertComplete(Grammars.fromText("S\nS -> S S\nS -> a\nS -> b\n"), "a b a", ab, 1);
		assertComplete(Grammars.expressions(), "x +", new String[] { "x", "+", "(", ")" }, 2);
	}

	private static void assertNeverMatched(Grammar g, String text, Symbol stranger) throws Exception {
		List<Symbol> w = Grammars.word(text);
		for (boolean stat : new boolean[] { false, true }) {
			CorrectionParse p = parse(g, w, stat);
			List<Correction> found = new ArrayList<Correction>();
			found.addAll(Grammars.take(new CostOrderedEnumerator(p.getForest(), p.getRoots(), 3,
					CostOrderedEnumerator.UNBOUNDED, EditLimits.NONE), 100000));
			found.addAll(Grammars.take(new DepthFirstEnumerator(p.getForest(), p.getRoots(), DepthFirstEnumerator.UNBOUNDED,
					DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT, new EditLimits(-1, -1, -1, 3)), 100000));
			assertFalse(found.isEmpty());
			for (Correction c : found) {
				int consumed = 0;
				for (EditOperation op : c.getOperations()) {
					if (op.getActual() != stranger)
						continue;
					consumed++;
					assertTrue(c.toString(), op.getKind() == EditOperation.Kind.DELETE
							|| op.getKind() == EditOperation.Kind.SUBSTITUTE);
				}
				assertEquals(c.toString(), 1, consumed);
				assertFalse(c.getCorrected().contains(stranger));
			}
		}
	}

	@Test
	public void symbolOutsideTheAlphabetIsNeverMatched() throws Exception {
		Symbol z = SymbolFactory.getTerminal("z");
		Grammar pal = Grammars.palindrome();
		assertFalse(pal.isTerminal(z));
		assertNeverMatched(pal, "z", z);
		assertNeverMatched(pal, "a z a", z);
		assertNeverMatched(Grammars.expressions(), "x + z", z);

		CorrectionParse p = new EarleyCorrectionParser(pal).parse(Grammars.word("z"));
		assertEquals(1, p.getForest().minimumCost(p.getRoot()));
		Correction best = new CostOrderedEnumerator(p).next();
		assertEquals("[Substitute(b,z)@0]", best.getOperations().toString());
	}
}
