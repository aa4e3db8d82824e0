package edu.isi.corrigo;

import gnu.trove.impl.Constants;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

/**
 * Corrections in non-decreasing total cost. Best-first search over prefixes of operation
 * sequences. The forest is read as a grammar: its nodes are the nonterminals, its packed
 * alternatives the productions and its edit leaves the terminals. Every prefix carries the
 * Earley column of that grammar after reading it, so all the derivations that agree on a
 * prefix are one search state however many ways the forest packs them, and every operation
 * sequence is reached by exactly one path.
 * <p>
 * A prefix is ordered by its cost plus the least cost of finishing it, which the column gives
 * exactly. Prefixes no derivation continues have an empty column and are never made, so when
 * the correction set is finite the search runs out. It can be cut off by a maximum cost, by a
 * frontier size and by a number of expansions.
 */
public class CostOrderedEnumerator extends CorrectionEnumerator {

	public static final int UNBOUNDED = -1;
	// expansion budget of the convenience constructor
	public static final long DEFAULT_EXPANSIONS = 1000000;

	private static final int NONE = PackedAlternative.NONE;
	private static final int INFINITE = CorrectionForest.INFINITE;

	// alternative of a node with a dot: how many of its symbols are read, and where the node started
	static final class Item {
		final int node;
		final int alt;
		final int dot;
		final Prefix origin;
		Item(int n, int a, int d, Prefix o) {
			node = n;
			alt = a;
			dot = d;
			origin = o;
		}
		Item advance() {
			return new Item(node, alt, dot+1, origin);
		}
		public int hashCode() {
			int h = node*31 + alt;
			h = h*31 + dot;
			return h*31 + System.identityHashCode(origin);
		}
		public boolean equals(Object o) {
			if (!(o instanceof Item))
				return false;
			Item i = (Item)o;
			return node == i.node && alt == i.alt && dot == i.dot && origin == i.origin;
		}
	}

	// operation sequence read so far, with its chart column
	static final class Prefix {
		final Prefix parent;
		final EditOperation op;
		final int g;
		final int ins;
		final int del;
		final int sub;
		// released once the prefix is expanded
		ArrayList<Item> items = new ArrayList<Item>();
		HashSet<Item> seen = new HashSet<Item>();
		// items waiting here for a node, by the node's handle
		final TIntObjectHashMap<ArrayList<Item>> waiting = new TIntObjectHashMap<ArrayList<Item>>();
		// least cost of finishing after a node started here is complete
		TIntIntHashMap outside = null;
		boolean accepted = false;
		boolean reported = false;
		int bound = 0;

		Prefix(Prefix p, EditOperation o, int gval, int i, int d, int s) {
			parent = p;
			op = o;
			g = gval;
			ins = i;
			del = d;
			sub = s;
		}
		void add(Item it) {
			if (seen.add(it))
				items.add(it);
		}
		void release() {
			items = null;
			seen = null;
		}
	}

	private final int maxCost;
	private final int maxFrontier;
	private final long maxExpansions;
	private final TIntHashSet rootSet;
	private final Prefix start;
	private final FixedPrioritiesPriorityQueue<Prefix> frontier;

	/**
	 * @param maxCost corrections costing more are left out, or UNBOUNDED
	 * @param maxFrontier the search gives up once this many prefixes wait, or UNBOUNDED
	 * @param maxExpansions the search gives up after expanding this many prefixes, or UNBOUNDED
	 */
	public CostOrderedEnumerator(CorrectionForest forest, int[] roots, int maxCost, int maxFrontier,
			long maxExpansions, EditLimits limits) {
		super(forest, roots, limits);
		if (maxCost < UNBOUNDED)
			throw new IllegalArgumentException("Maximum cost must be non-negative or UNBOUNDED; got "+maxCost);
		if (maxFrontier < UNBOUNDED || maxFrontier == 0)
			throw new IllegalArgumentException("Frontier bound must be positive or UNBOUNDED; got "+maxFrontier);
		if (maxExpansions < UNBOUNDED || maxExpansions == 0)
			throw new IllegalArgumentException("Expansion budget must be positive or UNBOUNDED; got "+maxExpansions);
		this.maxCost = maxCost;
		this.maxFrontier = maxFrontier;
		this.maxExpansions = maxExpansions;
		frontier = new FixedPrioritiesPriorityQueue<Prefix>();
		rootSet = new TIntHashSet();
		start = new Prefix(null, null, 0, 0, 0, 0);
		int best = INFINITE;
		for (int h : this.roots) {
			if (minCost[h] == INFINITE || !rootSet.add(h))
				continue;
			best = Math.min(best, minCost[h]);
			start.waiting.put(h, new ArrayList<Item>());
			predict(start, h);
		}
		if (best == INFINITE)
			return;
		close(start);
		start.bound = best;
		push(start);
	}

	public CostOrderedEnumerator(CorrectionForest forest, int[] roots, int maxCost, int maxFrontier, EditLimits limits) {
		this(forest, roots, maxCost, maxFrontier, UNBOUNDED, limits);
	}

	public CostOrderedEnumerator(CorrectionParse parse) {
		this(parse.getForest(), parse.getRoots(), UNBOUNDED, UNBOUNDED, DEFAULT_EXPANSIONS, EditLimits.NONE);
	}

	private static int plus(int a, int b) {
		if (a == INFINITE || b == INFINITE)
			return INFINITE;
		return a+b;
	}

	// an alternative's body is an optional left node, then a right node or a leaf
	private static int length(PackedAlternative a) {
		return (a.hasLeft() ? 1 : 0) + (a.hasRight() || a.getLeaf() != null ? 1 : 0);
	}

	// node at the dot, or NONE if a leaf is there
	private static int nodeAt(PackedAlternative a, int dot) {
		if (a.hasLeft()) {
			if (dot == 0)
				return a.getLeft();
			dot--;
		}
		return dot == 0 ? a.getRight() : NONE;
	}

	private static EditOperation leafAt(PackedAlternative a, int dot) {
		if (a.hasLeft())
			dot--;
		return dot == 0 ? a.getLeaf() : null;
	}

	private PackedAlternative alternative(Item it) {
		return forest.getAlternatives(it.node).get(it.alt);
	}

	// least cost of the symbols from the dot on
	private int remaining(PackedAlternative a, int dot) {
		int c = 0;
		for (int d = dot; d < length(a); d++) {
			int h = nodeAt(a, d);
			c = plus(c, h != NONE ? minCost[h] : leafAt(a, d).getCost());
		}
		return c;
	}

	private void predict(Prefix p, int h) {
		List<PackedAlternative> alts = forest.getAlternatives(h);
		for (int i = 0; i < alts.size(); i++)
			if (remaining(alts.get(i), 0) != INFINITE)
				p.add(new Item(h, i, 0, p));
	}

	// completes and predicts until nothing new comes up
	private void close(Prefix p) {
		boolean debug = false;
		// nodes finished here without reading anything
		TIntHashSet held = new TIntHashSet();
		for (int i = 0; i < p.items.size(); i++) {
			Item it = p.items.get(i);
			PackedAlternative a = alternative(it);
			if (it.dot == length(a)) {
				if (it.origin == p)
					held.add(it.node);
				if (it.origin == start && rootSet.contains(it.node))
					p.accepted = true;
				ArrayList<Item> users = it.origin.waiting.get(it.node);
				if (users == null)
					continue;
				for (int u = 0; u < users.size(); u++)
					p.add(users.get(u).advance());
				continue;
			}
			int next = nodeAt(a, it.dot);
			if (next == NONE)
				continue;
			ArrayList<Item> w = p.waiting.get(next);
			if (w == null) {
				w = new ArrayList<Item>();
				p.waiting.put(next, w);
				predict(p, next);
			}
			w.add(it);
			if (held.contains(next))
				p.add(it.advance());
		}
		if (debug) Debug.debug(debug, "Column after "+p.op+" has "+p.items.size()+" items");
	}

	private static void relax(TIntIntHashMap out, FixedPrioritiesPriorityQueue<Integer> agenda, int h, int c) {
		if (c < out.get(h)) {
			out.put(h, c);
			agenda.add(h, -c);
		}
	}

	// least finishing cost for every node waited for here, cheapest first as nodes started
	// here can wait on each other
	private void computeOutside(Prefix p) {
		TIntIntHashMap out = new TIntIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, NONE, INFINITE);
		FixedPrioritiesPriorityQueue<Integer> agenda = new FixedPrioritiesPriorityQueue<Integer>();
		TIntObjectHashMap<ArrayList<Item>> local = new TIntObjectHashMap<ArrayList<Item>>();
		if (p == start)
			for (int h : rootSet.toArray())
				relax(out, agenda, h, 0);
		for (Item it : p.items) {
			PackedAlternative a = alternative(it);
			if (it.dot == length(a) || nodeAt(a, it.dot) == NONE)
				continue;
			if (it.origin == p) {
				ArrayList<Item> l = local.get(it.node);
				if (l == null) {
					l = new ArrayList<Item>();
					local.put(it.node, l);
				}
				l.add(it);
			}
			else
				relax(out, agenda, nodeAt(a, it.dot), plus(remaining(a, it.dot+1), it.origin.outside.get(it.node)));
		}
		TIntHashSet done = new TIntHashSet();
		while (!agenda.isEmpty()) {
			int c = (int)-agenda.getPriority();
			int h = agenda.removeFirst();
			if (c != out.get(h) || !done.add(h))
				continue;
			ArrayList<Item> users = local.get(h);
			if (users == null)
				continue;
			for (Item it : users) {
				PackedAlternative a = alternative(it);
				relax(out, agenda, nodeAt(a, it.dot), plus(c, remaining(a, it.dot+1)));
			}
		}
		p.outside = out;
	}

	// least cost of finishing a prefix. every continuation finishes an item started earlier
	private int rest(Prefix p) {
		int best = INFINITE;
		for (Item it : p.items) {
			if (it.origin == p)
				continue;
			best = Math.min(best, plus(remaining(alternative(it), it.dot), it.origin.outside.get(it.node)));
		}
		return best;
	}

	// max-heap, so cheaper is higher. among equal bounds, prefixes further along come first
	private static double priority(Prefix p) {
		return -p.bound + 1e-7*Math.min(p.g, 1000000);
	}

	private void push(Prefix p) {
		if (maxCost != UNBOUNDED && p.bound > maxCost) {
			markTruncated("cost");
			return;
		}
		if (p.outside == null)
			computeOutside(p);
		frontier.add(p, priority(p));
	}

	// one successor per leaf the column can read next
	private void expand(Prefix p) {
		boolean debug = false;
		countExpansion();
		LinkedHashMap<EditOperation, ArrayList<Item>> byLeaf = new LinkedHashMap<EditOperation, ArrayList<Item>>();
		for (Item it : p.items) {
			PackedAlternative a = alternative(it);
			if (it.dot == length(a))
				continue;
			EditOperation op = leafAt(a, it.dot);
			if (op == null)
				continue;
			ArrayList<Item> l = byLeaf.get(op);
			if (l == null) {
				l = new ArrayList<Item>();
				byLeaf.put(op, l);
			}
			l.add(it);
		}
		for (Map.Entry<EditOperation, ArrayList<Item>> e : byLeaf.entrySet()) {
			EditOperation op = e.getKey();
			int ins = p.ins, del = p.del, sub = p.sub;
			switch (op.getKind()) {
			case INSERT: ins++; break;
			case DELETE: del++; break;
			case SUBSTITUTE: sub++; break;
			case MATCH: break;
			}
			if (!limits.allows(ins, del, sub))
				continue;
			Prefix q = new Prefix(p, op, p.g+op.getCost(), ins, del, sub);
			for (Item it : e.getValue())
				q.add(it.advance());
			close(q);
			int r = rest(q);
			if (r == INFINITE)
				continue;
			q.bound = q.g+r;
			if (!withinEditCap(q.bound))
				continue;
			push(q);
		}
		if (debug) Debug.debug(debug, "Expanded "+p.op+" at "+p.g+" into "+byLeaf.size()+" leaves");
		p.release();
	}

	private Correction finish(Prefix p) {
		ArrayList<EditOperation> ops = new ArrayList<EditOperation>();
		for (Prefix x = p; x.op != null; x = x.parent)
			ops.add(x.op);
		Collections.reverse(ops);
		return finish(ops);
	}

	protected Correction findNext() {
		boolean debug = false;
		while (!frontier.isEmpty()) {
			if (maxFrontier != UNBOUNDED && frontier.size() > maxFrontier) {
				if (debug) Debug.debug(debug, "Frontier of "+frontier.size()+" exceeds "+maxFrontier);
				markTruncated("frontier");
				frontier.clear();
				return null;
			}
			Prefix p = frontier.removeFirst();
			if (p.accepted && !p.reported) {
				p.reported = true;
				// expanded later, at the same priority
				frontier.add(p, priority(p));
				Correction c = finish(p);
				if (c != null) {
					if (debug) Debug.debug(debug, "Found "+c+" after "+getExpansions()+" expansions");
					return c;
				}
				continue;
			}
			if (maxExpansions != UNBOUNDED && getExpansions() >= maxExpansions) {
				if (debug) Debug.debug(debug, "Stopping after "+getExpansions()+" expansions");
				markTruncated("expansions");
				frontier.clear();
				return null;
			}
			expand(p);
		}
		return null;
	}

	public int getFrontierSize() { return frontier.size(); }
}
