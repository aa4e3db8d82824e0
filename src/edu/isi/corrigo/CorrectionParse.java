package edu.isi.corrigo;

import java.util.Collections;
import java.util.List;

// result of one correcting parse: the word, its forest, and the root nodes covering the
// whole word. counters record construction work
public class CorrectionParse {
	private final List<Symbol> word;
	private final CorrectionForest forest;
	private final int[] roots;
	private final long items;
	private final long moves;

	CorrectionParse(List<Symbol> w, CorrectionForest f, int[] r, long itemCount, long moveCount) {
		word = Collections.unmodifiableList(w);
		forest = f;
		roots = r.clone();
		items = itemCount;
		moves = moveCount;
	}

	public List<Symbol> getWord() { return word; }
	public CorrectionForest getForest() { return forest; }
	public int[] getRoots() { return roots.clone(); }
	// the first root; there is usually exactly one
	public int getRoot() { return roots[0]; }
	// chart items created. zero for a parser that builds no chart
	public long getItemCount() { return items; }
	// deductive steps tried while building the forest
	public long getMoveCount() { return moves; }

	public String toString() {
		return word.size()+" symbols, "+forest.getNumNodes()+" nodes, "+forest.getNumAlternatives()+
			" alternatives, "+roots.length+" root(s), "+items+" items, "+moves+" moves";
	}
}
