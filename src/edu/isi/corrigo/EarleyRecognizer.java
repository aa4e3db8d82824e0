package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Plain Earley recognizer, no corrections. Nullable nonterminals are advanced over at
 * prediction time, so completions inside one column need no second pass.
 */
public class EarleyRecognizer {
	private final Grammar gram;

	public EarleyRecognizer(Grammar g) {
		gram = g;
	}

	public boolean recognize(List<Symbol> word) {
		boolean debug = false;
		int n = word.size();
		ArrayList<LinkedHashSet<EarleyItem>> chart = new ArrayList<LinkedHashSet<EarleyItem>>(n+1);
		for (int i = 0; i <= n; i++)
			chart.add(new LinkedHashSet<EarleyItem>());
		for (CFGRule r : gram.productionsFor(gram.getStart()))
			chart.get(0).add(new EarleyItem(r, 0, 0));
		for (int i = 0; i <= n; i++) {
			LinkedHashSet<EarleyItem> col = chart.get(i);
			ArrayList<EarleyItem> agenda = new ArrayList<EarleyItem>(col);
			for (int a = 0; a < agenda.size(); a++) {
				EarleyItem item = agenda.get(a);
				Symbol next = item.getNext();
				if (next == null) {
					// complete: advance everything in the origin column waiting for this head
					ArrayList<EarleyItem> origins = new ArrayList<EarleyItem>(chart.get(item.getOrigin()));
					for (EarleyItem o : origins) {
						if (o.getNext() == item.getRule().getLHS() && col.add(o.advance()))
							agenda.add(o.advance());
					}
				}
				else if (next.isNonterminal()) {
					for (CFGRule r : gram.productionsFor(next)) {
						EarleyItem p = new EarleyItem(r, 0, i);
						if (col.add(p))
							agenda.add(p);
					}
					if (gram.isNullable(next) && col.add(item.advance()))
						agenda.add(item.advance());
				}
				else if (i < n && next == word.get(i)) {
					chart.get(i+1).add(item.advance());
				}
			}
			if (debug) Debug.debug(debug, "Column "+i+": "+col.size()+" items");
		}
		for (EarleyItem item : chart.get(n)) {
			if (item.isComplete() && item.getOrigin() == 0 && item.getRule().getLHS() == gram.getStart())
				return true;
		}
		return false;
	}
}
