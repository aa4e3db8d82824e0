package edu.isi.corrigo;

import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy walk over the corrections of a correction forest, producing {@link Correction}s on
 * demand. Subclasses decide the order and how the search is laid out. Identical operation
 * sequences are reported once.
 * <p>
 * Enumerators only read the forest. To restart, make a new one.
 */
public abstract class CorrectionEnumerator implements PIterator<Correction> {

	protected final CorrectionForest forest;
	protected final int[] roots;
	protected final EditLimits limits;
	protected final int[] minCost;
	// most edits any allowed correction can have, or UNLIMITED
	private final int editCap;

	private final HashSet<List<EditOperation>> reported = new HashSet<List<EditOperation>>();
	private Correction next = null;
	private boolean exhausted = false;
	private boolean truncated = false;
	private String limitName = null;
	private long expansions = 0;

	protected CorrectionEnumerator(CorrectionForest f, int[] r, EditLimits l) {
		if (f == null || r == null || r.length == 0)
			throw new IllegalArgumentException("Need a forest and at least one root");
		forest = f;
		roots = r.clone();
		for (int h : roots)
			forest.getNode(h);
		limits = l == null ? EditLimits.NONE : l;
		minCost = forest.minimumCosts();
		// every input symbol costs at most one edit, so capped insertions cap the total
		int n = 0;
		for (int h : roots)
			n = Math.max(n, forest.getLabel(h).getEnd());
		int cap = limits.getMaxEdits();
		if (limits.getMaxInsertions() != EditLimits.UNLIMITED) {
			int insCap = limits.getMaxInsertions()+n;
			cap = cap == EditLimits.UNLIMITED ? insCap : Math.min(cap, insCap);
		}
		editCap = cap;
	}

	// whether a search state whose completions cost at least this much can still meet the edit limits
	protected boolean withinEditCap(int bound) {
		return editCap == EditLimits.UNLIMITED || bound <= editCap;
	}

	protected void countExpansion() {
		expansions++;
	}

	// the correction made of the operations, or null if they were already reported
	protected Correction finish(List<EditOperation> ops) {
		if (!reported.add(ops))
			return null;
		return new Correction(ops);
	}

	protected void markTruncated(String limit) {
		truncated = true;
		if (limitName == null)
			limitName = limit;
	}

	// next correction in this enumerator's order, or null when there are no more
	protected abstract Correction findNext();

	private void fill() {
		if (next == null && !exhausted) {
			next = findNext();
			if (next == null)
				exhausted = true;
		}
	}

	public boolean hasNext() {
		fill();
		return next != null;
	}

	public Correction peek() throws NoSuchElementException {
		fill();
		if (next == null)
			throw noMore();
		return next;
	}

	/**
	 * @throws EnumerationLimitExceededException if corrections were left out because a cutoff
	 * was reached
	 * @throws NoSuchElementException if every correction has been returned
	 */
	public Correction next() throws NoSuchElementException {
		fill();
		if (next == null)
			throw noMore();
		Correction ret = next;
		next = null;
		return ret;
	}

	private NoSuchElementException noMore() {
		if (truncated)
			return new EnumerationLimitExceededException(limitName, "Enumeration stopped at the "+limitName+" cutoff after "+reported.size()+" corrections");
		return new NoSuchElementException("No more corrections after "+reported.size());
	}

	public void remove() throws UnsupportedOperationException {
		throw new UnsupportedOperationException("Corrections can't be removed from a forest");
	}

	// true once something was left out because of a cutoff
	public boolean isTruncated() { return truncated; }
	public String getLimit() { return limitName; }
	public long getExpansions() { return expansions; }
	public int getNumReported() { return reported.size(); }
}
