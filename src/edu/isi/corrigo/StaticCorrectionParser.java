package edu.isi.corrigo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Correcting parser that builds no chart. Since any terminal can be inserted and any input
 * symbol deleted, which dotted rules live in a column does not depend on the word: column i
 * holds every item of the first column's closure with origin 0, and every item of the closure
 * of the predicted rules with each origin 1..i. Both closures are computed once per grammar;
 * a parse then writes the forest edges for all spans directly.
 * <p>
 * The forest is the same, node for node, as the one {@link EarleyCorrectionParser} builds.
 */
public class StaticCorrectionParser extends AbstractCorrectionParser {

	// closure at origin 0 and closure of the items predicted at any later origin. stored with origin 0
	private final List<EarleyItem> first;
	private final List<EarleyItem> later;
	private final HashMap<Symbol, List<EarleyItem>> firstWaiting;
	private final HashMap<Symbol, List<EarleyItem>> laterWaiting;

	public StaticCorrectionParser(Grammar g) {
		super(g);
		boolean debug = false;
		ArrayList<EarleyItem> seeds = new ArrayList<EarleyItem>();
		for (CFGRule r : gram.productionsFor(gram.getStart()))
			seeds.add(new EarleyItem(r, 0, 0));
		first = Collections.unmodifiableList(new ArrayList<EarleyItem>(closure(seeds)));
		LinkedHashSet<Symbol> predicted = new LinkedHashSet<Symbol>();
		for (EarleyItem item : first) {
			Symbol next = item.getNext();
			if (next != null && next.isNonterminal())
				predicted.add(next);
		}
		seeds.clear();
		for (Symbol s : predicted)
			for (CFGRule r : gram.productionsFor(s))
				seeds.add(new EarleyItem(r, 0, 0));
		later = Collections.unmodifiableList(new ArrayList<EarleyItem>(closure(seeds)));
		firstWaiting = waitingIndex(first);
		laterWaiting = waitingIndex(later);
		if (debug) Debug.debug(debug, "First closure "+first+"; later closure "+later);
	}

	// items reachable from the seeds in one column by prediction, completion and insertion
	private LinkedHashSet<EarleyItem> closure(List<EarleyItem> seeds) {
		LinkedHashSet<EarleyItem> set = new LinkedHashSet<EarleyItem>(seeds);
		ArrayDeque<EarleyItem> agenda = new ArrayDeque<EarleyItem>(seeds);
		HashSet<Symbol> held = new HashSet<Symbol>();
		while (!agenda.isEmpty()) {
			EarleyItem item = agenda.pop();
			Symbol next = item.getNext();
			ArrayList<EarleyItem> found = new ArrayList<EarleyItem>();
			if (next == null) {
				Symbol lhs = item.getRule().getLHS();
				held.add(lhs);
				for (EarleyItem o : set) {
					if (o.getNext() == lhs)
						found.add(o.advance());
				}
			}
			else if (next.isNonterminal()) {
				for (CFGRule r : gram.productionsFor(next))
					found.add(new EarleyItem(r, 0, 0));
				if (held.contains(next))
					found.add(item.advance());
			}
			else
				found.add(item.advance());
			for (EarleyItem f : found) {
				if (set.add(f))
					agenda.push(f);
			}
		}
		return set;
	}

	private static HashMap<Symbol, List<EarleyItem>> waitingIndex(List<EarleyItem> items) {
		HashMap<Symbol, List<EarleyItem>> ret = new HashMap<Symbol, List<EarleyItem>>();
		for (EarleyItem item : items) {
			Symbol next = item.getNext();
			if (next == null || next.isTerminal())
				continue;
			if (!ret.containsKey(next))
				ret.put(next, new ArrayList<EarleyItem>());
			ret.get(next).add(item);
		}
		return ret;
	}

	private static List<EarleyItem> waiting(HashMap<Symbol, List<EarleyItem>> index, Symbol s) {
		List<EarleyItem> l = index.get(s);
		if (l == null)
			return Collections.emptyList();
		return l;
	}

	public List<EarleyItem> getFirstClosure() { return first; }
	public List<EarleyItem> getLaterClosure() { return later; }

	public CorrectionParse parse(List<Symbol> word) throws NoDerivationException {
		Date startTime = new Date();
		int n = word.size();
		Builder b = new Builder(word);
		for (int k = 0; k <= n; k++) {
			List<EarleyItem> base = k == 0 ? first : later;
			for (EarleyItem dotted : base) {
				EarleyItem item = dotted.withOrigin(k);
				for (int i = k; i <= n; i++)
					addEdges(b, item, i);
			}
		}
		long items = (long)first.size()*(n+1) + (long)later.size()*n*(n+1)/2;
		int[] roots = findRoots(b, first);
		CorrectionParse ret = new CorrectionParse(word, b.forest, roots, items, b.moves);
		Debug.dbtime(1, startTime, "Static correction parse: "+ret);
		return ret;
	}

	// every edge whose source is item in column i
	private void addEdges(Builder b, EarleyItem item, int i) {
		int n = b.word.size();
		int k = item.getOrigin();
		Symbol next = item.getNext();
		if (next == null) {
			if (item.getDot() == 0 && i == k)
				b.epsilon(item, i);
			int finished = b.forest.nodeFor(item.getLabel(i));
			Symbol lhs = item.getRule().getLHS();
			for (EarleyItem o : waiting(firstWaiting, lhs))
				b.complete(o, k, finished, i);
			for (int origin = 1; origin <= k; origin++) {
				for (EarleyItem o : waiting(laterWaiting, lhs))
					b.complete(o.withOrigin(origin), k, finished, i);
			}
		}
		else if (next.isTerminal()) {
			b.insert(item, i);
			if (i < n)
				b.scan(item, i);
		}
		if (i < n)
			b.delete(item, i);
	}
}
