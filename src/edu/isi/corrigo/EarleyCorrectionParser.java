package edu.isi.corrigo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Column-by-column all-corrections Earley parser. Each column is closed under prediction,
 * completion and insertion; the next column is seeded by reading the input symbol (a match or
 * a substitution) for every item expecting a terminal, and by deleting it, which carries every
 * item of the column over unchanged. Completions of items that start and end in the same
 * column are held, so items predicted after such a completion still see it.
 * <p>
 * Items are keyed by (rule, dot, origin), so every column holds O(n) items and the whole
 * chart costs O(n^3) for a fixed grammar.
 */
public class EarleyCorrectionParser extends AbstractCorrectionParser {

	// items of one column, with the items waiting on each nonterminal
	private static class Column {
		final LinkedHashSet<EarleyItem> items = new LinkedHashSet<EarleyItem>();
		final HashMap<Symbol, ArrayList<EarleyItem>> waiting = new HashMap<Symbol, ArrayList<EarleyItem>>();

		boolean add(EarleyItem item) {
			if (!items.add(item))
				return false;
			Symbol next = item.getNext();
			if (next != null && next.isNonterminal()) {
				ArrayList<EarleyItem> l = waiting.get(next);
				if (l == null) {
					l = new ArrayList<EarleyItem>();
					waiting.put(next, l);
				}
				l.add(item);
			}
			return true;
		}

		List<EarleyItem> waitingFor(Symbol s) {
			ArrayList<EarleyItem> l = waiting.get(s);
			if (l == null)
				return Collections.emptyList();
			return l;
		}
	}

	public EarleyCorrectionParser(Grammar g) {
		super(g);
	}

	public CorrectionParse parse(List<Symbol> word) throws NoDerivationException {
		boolean debug = false;
		Date startTime = new Date();
		int n = word.size();
		Builder b = new Builder(word);
		ArrayList<Column> chart = new ArrayList<Column>(n+1);
		Column first = new Column();
		for (CFGRule r : gram.productionsFor(gram.getStart()))
			first.add(new EarleyItem(r, 0, 0));
		chart.add(first);
		long items = 0;
		for (int i = 0; i <= n; i++) {
			closeColumn(b, chart, i);
			items += chart.get(i).items.size();
			if (debug) Debug.debug(debug, "Column "+i+": "+chart.get(i).items.size()+" items");
			if (i < n)
				chart.add(nextColumn(b, chart.get(i), i));
		}
		int[] roots = findRoots(b, chart.get(n).items);
		CorrectionParse ret = new CorrectionParse(word, b.forest, roots, items, b.moves);
		Debug.dbtime(1, startTime, "Earley correction parse: "+ret);
		return ret;
	}

	// predict, complete and insert until nothing new appears in column i
	private void closeColumn(Builder b, ArrayList<Column> chart, int i) {
		Column col = chart.get(i);
		ArrayDeque<EarleyItem> agenda = new ArrayDeque<EarleyItem>(col.items);
		HashMap<Symbol, Integer> held = new HashMap<Symbol, Integer>();
		while (!agenda.isEmpty()) {
			EarleyItem item = agenda.pop();
			Symbol next = item.getNext();
			if (next == null) {
				int node;
				if (item.getDot() == 0 && item.getOrigin() == i)
					node = b.epsilon(item, i);
				else
					node = b.nodeOf(item, i);
				Symbol lhs = item.getRule().getLHS();
				if (item.getOrigin() == i)
					held.put(lhs, node);
				List<EarleyItem> originators = chart.get(item.getOrigin()).waitingFor(lhs);
				// the list may grow while we walk it when the origin is this column
				int size = originators.size();
				for (int o = 0; o < size; o++) {
					EarleyItem originator = originators.get(o);
					b.complete(originator, item.getOrigin(), node, i);
					if (col.add(originator.advance()))
						agenda.push(originator.advance());
				}
			}
			else if (next.isNonterminal()) {
				for (CFGRule r : gram.productionsFor(next)) {
					EarleyItem p = new EarleyItem(r, 0, i);
					if (col.add(p))
						agenda.push(p);
				}
				Integer done = held.get(next);
				if (done != null) {
					b.complete(item, i, done, i);
					if (col.add(item.advance()))
						agenda.push(item.advance());
				}
			}
			else {
				b.insert(item, i);
				if (col.add(item.advance()))
					agenda.push(item.advance());
			}
		}
	}

	// read or delete word[i]
	private Column nextColumn(Builder b, Column col, int i) {
		Column next = new Column();
		for (EarleyItem item : col.items) {
			Symbol s = item.getNext();
			if (s != null && s.isTerminal()) {
				b.scan(item, i);
				next.add(item.advance());
			}
		}
		for (EarleyItem item : col.items) {
			b.delete(item, i);
			next.add(item);
		}
		return next;
	}
}
