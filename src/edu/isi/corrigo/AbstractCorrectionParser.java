package edu.isi.corrigo;

import java.util.List;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

/**
 * Common ground of the correcting parsers: the compiled grammar and the deductive steps
 * that turn an item move into a packed forest edge. Every parser builds its forest through
 * {@link Builder}, so forests from different parsers of the same word are comparable with
 * {@link ForestEquality}.
 */
public abstract class AbstractCorrectionParser {
	protected final Grammar gram;

	protected AbstractCorrectionParser(Grammar g) {
		if (g == null)
			throw new IllegalArgumentException("Null grammar");
		gram = g;
	}

	public Grammar getGrammar() { return gram; }

	/**
	 * Builds the correction forest of a word.
	 * @throws NoDerivationException if no root covers the word. A compiled grammar always
	 * yields one, so this means something upstream is broken
	 */
	public abstract CorrectionParse parse(List<Symbol> word) throws NoDerivationException;

	// forest under construction plus the step counter
	protected static class Builder {
		final CorrectionForest forest = new CorrectionForest();
		final List<Symbol> word;
		long moves = 0;

		Builder(List<Symbol> w) {
			word = w;
		}

		// handle of the node for item over [origin, end], or NONE for an unstarted empty item
		int nodeOf(EarleyItem item, int end) {
			if (!item.hasNode(end))
				return PackedAlternative.NONE;
			return forest.nodeFor(item.getLabel(end));
		}

		// empty body finished in column i
		int epsilon(EarleyItem item, int i) {
			moves++;
			return forest.nodeFor(item.getLabel(i), PackedAlternative.epsilon(item.getRule()));
		}

		// supply the expected terminal in column i without reading
		int insert(EarleyItem item, int i) {
			moves++;
			EarleyItem adv = item.advance();
			EditOperation op = forest.leaf(EditOperation.insert(item.getNext(), i));
			return forest.nodeFor(adv.getLabel(i), PackedAlternative.withLeaf(item.getRule(), nodeOf(item, i), op));
		}

		// read word[i] against the expected terminal: match or substitute
		int scan(EarleyItem item, int i) {
			moves++;
			EarleyItem adv = item.advance();
			Symbol expected = item.getNext();
			Symbol actual = word.get(i);
			EditOperation op = forest.leaf(expected == actual ? EditOperation.match(actual, i)
					: EditOperation.substitute(expected, actual, i));
			return forest.nodeFor(adv.getLabel(i+1), PackedAlternative.withLeaf(item.getRule(), nodeOf(item, i), op));
		}

		// drop word[i] and keep the item as it was
		int delete(EarleyItem item, int i) {
			moves++;
			EditOperation op = forest.leaf(EditOperation.delete(word.get(i), i));
			CFGRule r = item.isComplete() ? null : item.getRule();
			return forest.nodeFor(item.getLabel(i+1), PackedAlternative.withLeaf(r, nodeOf(item, i), op));
		}

		// originator over [k, j] advanced over a finished node spanning [j, i]
		int complete(EarleyItem originator, int j, int finished, int i) {
			moves++;
			EarleyItem adv = originator.advance();
			return forest.nodeFor(adv.getLabel(i),
					PackedAlternative.withChild(adv.getRule(), nodeOf(originator, j), finished));
		}
	}

	// roots: finished start symbol nodes over the whole word
	protected int[] findRoots(Builder b, Iterable<EarleyItem> lastColumn) throws NoDerivationException {
		int n = b.word.size();
		TIntHashSet seen = new TIntHashSet();
		TIntArrayList roots = new TIntArrayList();
		for (EarleyItem item : lastColumn) {
			if (item.isComplete() && item.getOrigin() == 0 && item.getRule().getLHS() == gram.getStart()) {
				int h = b.forest.lookup(item.getLabel(n));
				if (h != PackedAlternative.NONE && seen.add(h))
					roots.add(h);
			}
		}
		if (roots.isEmpty())
			throw new NoDerivationException("No derivation of "+gram.getStart()+" over all "+n+" symbols");
		return roots.toArray();
	}
}
