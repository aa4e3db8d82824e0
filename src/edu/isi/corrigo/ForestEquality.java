package edu.isi.corrigo;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Set;

// structural comparison of the parts of two forests reachable from given roots. nodes are
// matched by label, so handle numbering and alternative order don't matter
public class ForestEquality {

	// an alternative with its children replaced by their labels
	private static class Shape {
		final CFGRule rule;
		final NodeLabel left;
		final NodeLabel right;
		final EditOperation leaf;
		Shape(CorrectionForest f, PackedAlternative a) {
			rule = a.getRule();
			left = a.hasLeft() ? f.getLabel(a.getLeft()) : null;
			right = a.hasRight() ? f.getLabel(a.getRight()) : null;
			leaf = a.getLeaf();
		}
		public int hashCode() {
			int h = rule == null ? 0 : rule.getIndex()+1;
			h = h*31 + (left == null ? 0 : left.hashCode());
			h = h*31 + (right == null ? 0 : right.hashCode());
			return h*31 + (leaf == null ? 0 : leaf.hashCode());
		}
		public boolean equals(Object o) {
			if (!(o instanceof Shape))
				return false;
			Shape s = (Shape)o;
			return rule == s.rule && eq(left, s.left) && eq(right, s.right) && eq(leaf, s.leaf);
		}
		private static boolean eq(Object a, Object b) {
			return a == null ? b == null : a.equals(b);
		}
		public String toString() {
			return "<"+rule+" | "+left+", "+(right != null ? right : leaf)+">";
		}
	}

	private static HashMap<NodeLabel, Set<Shape>> reachable(CorrectionForest f, int root) {
		HashMap<NodeLabel, Set<Shape>> ret = new HashMap<NodeLabel, Set<Shape>>();
		TIntHashSet seen = new TIntHashSet();
		TIntArrayList todo = new TIntArrayList();
		todo.add(root);
		seen.add(root);
		for (int t = 0; t < todo.size(); t++) {
			int h = todo.get(t);
			HashSet<Shape> shapes = new HashSet<Shape>();
			for (PackedAlternative a : f.getAlternatives(h)) {
				shapes.add(new Shape(f, a));
				if (a.hasLeft() && seen.add(a.getLeft()))
					todo.add(a.getLeft());
				if (a.hasRight() && seen.add(a.getRight()))
					todo.add(a.getRight());
			}
			ret.put(f.getLabel(h), shapes);
		}
		return ret;
	}

	public static boolean equal(CorrectionForest a, int rootA, CorrectionForest b, int rootB) {
		boolean debug = false;
		if (!a.getLabel(rootA).equals(b.getLabel(rootB)))
			return false;
		HashMap<NodeLabel, Set<Shape>> ra = reachable(a, rootA);
		HashMap<NodeLabel, Set<Shape>> rb = reachable(b, rootB);
		if (ra.size() != rb.size()) {
			if (debug) Debug.debug(debug, "Reachable sizes differ: "+ra.size()+" vs "+rb.size());
			return false;
		}
		for (NodeLabel l : ra.keySet()) {
			if (!ra.get(l).equals(rb.get(l))) {
				if (debug) Debug.debug(debug, "Mismatch at "+l+": "+ra.get(l)+" vs "+rb.get(l));
				return false;
			}
		}
		return true;
	}
}
