package edu.isi.corrigo;

/**
 * One packed derivation step under a forest node. Binary: an optional left child node, then
 * either a right child node or an edit leaf. Both absent means the empty body. Children are
 * node handles of the owning {@link CorrectionForest}; {@link #NONE} marks an absent child.
 * <p>
 * The rule is the production the step belongs to. It is null only for a deletion continuing a
 * finished symbol node, since that step is the same for every production of the symbol.
 */
public final class PackedAlternative {
	public static final int NONE = -1;

	private final CFGRule rule;
	private final int left;
	private final int right;
	private final EditOperation leaf;

	private PackedAlternative(CFGRule r, int l, int rt, EditOperation lf) {
		if (rt != NONE && lf != null)
			throw new IllegalArgumentException("Alternative can't have both a right child and a leaf");
		rule = r;
		left = l;
		right = rt;
		leaf = lf;
	}

	public static PackedAlternative epsilon(CFGRule r) {
		return new PackedAlternative(r, NONE, NONE, null);
	}
	public static PackedAlternative withLeaf(CFGRule r, int left, EditOperation leaf) {
		if (leaf == null)
			throw new IllegalArgumentException("Null leaf");
		return new PackedAlternative(r, left, NONE, leaf);
	}
	public static PackedAlternative withChild(CFGRule r, int left, int right) {
		if (right == NONE)
			throw new IllegalArgumentException("Missing right child");
		return new PackedAlternative(r, left, right, null);
	}

	public CFGRule getRule() { return rule; }
	public int getLeft() { return left; }
	public int getRight() { return right; }
	public EditOperation getLeaf() { return leaf; }
	public boolean hasLeft() { return left != NONE; }
	public boolean hasRight() { return right != NONE; }
	public boolean isEpsilon() { return left == NONE && right == NONE && leaf == null; }

	public int hashCode() {
		int h = rule == null ? 0 : rule.getIndex()+1;
		h = h*31 + left;
		h = h*31 + right;
		return h*31 + (leaf == null ? 0 : leaf.hashCode());
	}
	public boolean equals(Object o) {
		if (!(o instanceof PackedAlternative))
			return false;
		PackedAlternative a = (PackedAlternative)o;
		return rule == a.rule && left == a.left && right == a.right
			&& (leaf == null ? a.leaf == null : leaf.equals(a.leaf));
	}
	public String toString() {
		StringBuilder sb = new StringBuilder("<");
		sb.append(rule == null ? "-" : rule.toString());
		sb.append(" | ").append(left == NONE ? "." : "#"+left);
		if (right != NONE)
			sb.append(", #").append(right);
		else if (leaf != null)
			sb.append(", ").append(leaf);
		else if (left == NONE)
			sb.append(", ").append(Symbol.EPSILON);
		return sb.append(">").toString();
	}
}
