package edu.isi.corrigo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Corrections in forest order: the first alternative of every node is followed to the end
 * before the second is tried. The correction set of a forest is usually infinite, so the walk
 * must be bounded, by a maximum nesting depth of nodes, by refusing to re-enter a node that is
 * already open on the current path, or both.
 * <p>
 * A derivation is built left to right as a partial state: the cost so far, the operations
 * emitted, and a stack of what is still to be expanded. Partial states are persistent, so
 * sibling states share their common parts. Derivations that wrap a node inside itself with a
 * context that produces nothing are skipped: the derivation with the inner copy in place of
 * the outer one has the same operations.
 */
public class DepthFirstEnumerator extends CorrectionEnumerator {

	public enum CyclePolicy {
		// a node may appear inside itself; the depth bound keeps the walk finite
		ALLOW_REPEAT,
		// loop-free derivations only
		FORBID_REPEAT
	}

	public static final int UNBOUNDED = -1;

	// singly linked persistent list
	static final class Cons<T> {
		final T head;
		final Cons<T> tail;
		Cons(T h, Cons<T> t) {
			head = h;
			tail = t;
		}
	}

	// one expansion of a node on the current path
	static final class Occurrence {
		final int handle;
		final int entryG;
		final Occurrence parent;
		// nearest enclosing occurrence of the same node
		final Occurrence sameAbove;
		final int depth;
		// consecutive same-node nestings entered at equal cost, each owing a later edit
		final int chain;
		final int maxChain;

		Occurrence(int h, int g, Occurrence p) {
			handle = h;
			entryG = g;
			parent = p;
			depth = p == null ? 1 : p.depth+1;
			Occurrence same = null;
			for (Occurrence o = p; o != null; o = o.parent) {
				if (o.handle == h) {
					same = o;
					break;
				}
			}
			sameAbove = same;
			chain = same != null && same.entryG == g ? same.chain+1 : 0;
			maxChain = Math.max(p == null ? 0 : p.maxChain, chain);
		}
	}

	enum ElementKind { NODE, LEAF, END }

	// pending work: expand a node, emit a leaf, or close an occurrence
	static final class Element {
		final ElementKind kind;
		final int handle;
		final EditOperation op;
		final Occurrence occ;
		private Element(ElementKind k, int h, EditOperation o, Occurrence oc) {
			kind = k;
			handle = h;
			op = o;
			occ = oc;
		}
		static Element node(int h) { return new Element(ElementKind.NODE, h, null, null); }
		static Element leaf(EditOperation o) { return new Element(ElementKind.LEAF, PackedAlternative.NONE, o, null); }
		static Element end(Occurrence o) { return new Element(ElementKind.END, PackedAlternative.NONE, null, o); }
	}

	// an outer occurrence is redundant if it closes at this cost
	static final class Watch {
		final Occurrence target;
		final int g;
		Watch(Occurrence t, int gval) {
			target = t;
			g = gval;
		}
	}

	// partial derivation
	static final class Partial {
		final int g;
		final Cons<EditOperation> ops;
		final Cons<Element> pending;
		final Occurrence open;
		// sum of minimum costs of everything pending
		final int pendingCost;
		final int ins;
		final int del;
		final int sub;
		final Cons<Watch> watches;

		Partial(int g, Cons<EditOperation> ops, Cons<Element> pending, Occurrence open, int pendingCost,
				int ins, int del, int sub, Cons<Watch> watches) {
			this.g = g;
			this.ops = ops;
			this.pending = pending;
			this.open = open;
			this.pendingCost = pendingCost;
			this.ins = ins;
			this.del = del;
			this.sub = sub;
			this.watches = watches;
		}

		boolean isComplete() { return pending == null; }

		// lower bound on the cost of any completion
		int lowerBound() {
			int owed = open == null ? 0 : open.maxChain;
			return g + Math.max(pendingCost, owed);
		}
	}

	private final int maxDepth;
	private final CyclePolicy policy;
	private final ArrayDeque<Partial> stack;

	/**
	 * @param maxDepth largest number of nested node expansions, or UNBOUNDED. Required with ALLOW_REPEAT
	 */
	public DepthFirstEnumerator(CorrectionForest forest, int[] roots, int maxDepth, CyclePolicy policy, EditLimits limits) {
		super(forest, roots, limits);
		if (policy == null)
			throw new IllegalArgumentException("Null cycle policy");
		if (maxDepth < UNBOUNDED || maxDepth == 0)
			throw new IllegalArgumentException("Depth bound must be positive or UNBOUNDED; got "+maxDepth);
		if (maxDepth == UNBOUNDED && policy == CyclePolicy.ALLOW_REPEAT)
			throw new IllegalArgumentException("Repeating nodes without a depth bound never ends");
		this.maxDepth = maxDepth;
		this.policy = policy;
		stack = new ArrayDeque<Partial>();
		for (int i = this.roots.length-1; i >= 0; i--) {
			int h = this.roots[i];
			if (minCost[h] == CorrectionForest.INFINITE)
				continue;
			stack.push(new Partial(0, null, new Cons<Element>(Element.node(h), null), null, minCost[h], 0, 0, 0, null));
		}
	}

	public DepthFirstEnumerator(CorrectionParse parse, int maxDepth, CyclePolicy policy) {
		this(parse.getForest(), parse.getRoots(), maxDepth, policy, EditLimits.NONE);
	}

	// whether a node expansion may go ahead
	private boolean admit(Occurrence occ) {
		if (policy == CyclePolicy.FORBID_REPEAT && occ.sameAbove != null)
			return false;
		if (maxDepth != UNBOUNDED && occ.depth > maxDepth) {
			markTruncated("depth");
			return false;
		}
		return true;
	}

	// successors of a partial state, in forest order. those that must exceed the edit limits are dropped
	private List<Partial> successors(Partial p) {
		countExpansion();
		ArrayList<Partial> ret = new ArrayList<Partial>();
		Element top = p.pending.head;
		Cons<Element> rest = p.pending.tail;
		switch (top.kind) {
		case LEAF: {
			EditOperation op = top.op;
			int ins = p.ins, del = p.del, sub = p.sub;
			switch (op.getKind()) {
			case INSERT: ins++; break;
			case DELETE: del++; break;
			case SUBSTITUTE: sub++; break;
			case MATCH: break;
			}
			if (!limits.allows(ins, del, sub))
				break;
			ret.add(new Partial(p.g+op.getCost(), new Cons<EditOperation>(op, p.ops), rest, p.open,
					p.pendingCost-op.getCost(), ins, del, sub, p.watches));
			break;
		}
		case END: {
			Occurrence occ = top.occ;
			Cons<Watch> watches = null;
			boolean redundant = false;
			for (Cons<Watch> w = p.watches; w != null; w = w.tail) {
				if (w.head.target == occ)
					redundant |= w.head.g == p.g;
				else
					watches = new Cons<Watch>(w.head, watches);
			}
			if (redundant)
				break;
			if (occ.sameAbove != null && occ.sameAbove.entryG == occ.entryG)
				watches = new Cons<Watch>(new Watch(occ.sameAbove, p.g), watches);
			ret.add(new Partial(p.g, p.ops, rest, occ.parent, p.pendingCost, p.ins, p.del, p.sub, watches));
			break;
		}
		case NODE: {
			int h = top.handle;
			for (PackedAlternative alt : forest.getAlternatives(h)) {
				int lc = alt.hasLeft() ? minCost[alt.getLeft()] : 0;
				int rc = alt.hasRight() ? minCost[alt.getRight()] : alt.getLeaf() != null ? alt.getLeaf().getCost() : 0;
				if (lc == CorrectionForest.INFINITE || rc == CorrectionForest.INFINITE)
					continue;
				Occurrence occ = new Occurrence(h, p.g, p.open);
				if (!admit(occ))
					continue;
				Cons<Element> pend = new Cons<Element>(Element.end(occ), rest);
				if (alt.hasRight())
					pend = new Cons<Element>(Element.node(alt.getRight()), pend);
				else if (alt.getLeaf() != null)
					pend = new Cons<Element>(Element.leaf(alt.getLeaf()), pend);
				if (alt.hasLeft())
					pend = new Cons<Element>(Element.node(alt.getLeft()), pend);
				ret.add(new Partial(p.g, p.ops, pend, occ, p.pendingCost-minCost[h]+lc+rc,
						p.ins, p.del, p.sub, p.watches));
			}
			break;
		}
		}
		return ret;
	}

	private Correction finish(Partial p) {
		ArrayList<EditOperation> ops = new ArrayList<EditOperation>();
		for (Cons<EditOperation> c = p.ops; c != null; c = c.tail)
			ops.add(c.head);
		Collections.reverse(ops);
		return finish(ops);
	}

	protected Correction findNext() {
		boolean debug = false;
		while (!stack.isEmpty()) {
			Partial p = stack.pop();
			if (p.isComplete()) {
				Correction c = finish(p);
				if (c != null) {
					if (debug) Debug.debug(debug, "Found "+c);
					return c;
				}
				continue;
			}
			List<Partial> succ = successors(p);
			for (int i = succ.size()-1; i >= 0; i--)
				if (withinEditCap(succ.get(i).lowerBound()))
					stack.push(succ.get(i));
		}
		return null;
	}
}
