package edu.isi.corrigo;

import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;

import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

/**
 * Arena of forest nodes addressed by dense int handles. A node is reserved the first time its
 * label is asked for, before any of its alternatives exist, so an alternative may point back at
 * a node still being built. That is how a finite forest holds the infinite families of
 * derivations made by repeated insertions.
 * <p>
 * Append-only: nodes and alternatives are never removed. Built by one parse, then read by any
 * number of enumerators.
 */
public class CorrectionForest {

	private final ArrayList<ForestNode> nodes;
	private final TObjectIntHashMap<NodeLabel> index;
	private final HashMap<EditOperation, EditOperation> leaves;
	private int numAlternatives = 0;

	// minimum costs, valid while the forest has the recorded number of alternatives
	private int[] minCost = null;
	private int minCostStamp = -1;

	public static final int INFINITE = Integer.MAX_VALUE;

	public CorrectionForest() {
		nodes = new ArrayList<ForestNode>();
		index = new TObjectIntHashMap<NodeLabel>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, PackedAlternative.NONE);
		leaves = new HashMap<EditOperation, EditOperation>();
	}

	// existing handle for the label, or a freshly reserved one
	public int nodeFor(NodeLabel label) {
		boolean debug = false;
		int h = index.get(label);
		if (h != PackedAlternative.NONE)
			return h;
		h = nodes.size();
		nodes.add(new ForestNode(h, label));
		index.put(label, h);
		if (debug) Debug.debug(debug, "Reserved #"+h+" for "+label);
		return h;
	}

	// handle for the label or NONE. never reserves
	public int lookup(NodeLabel label) {
		return index.get(label);
	}

	// the node for the label, with the alternative packed in
	public int nodeFor(NodeLabel label, PackedAlternative alt) {
		int h = nodeFor(label);
		addAlternative(h, alt);
		return h;
	}

	/**
	 * Packs an alternative under a node.
	 * @return false if the node already had a structurally equal alternative
	 */
	public boolean addAlternative(int handle, PackedAlternative alt) {
		boolean debug = false;
		ForestNode n = getNode(handle);
		if (alt.hasLeft())
			getNode(alt.getLeft());
		if (alt.hasRight())
			getNode(alt.getRight());
		if (!n.add(alt))
			return false;
		numAlternatives++;
		if (debug) Debug.debug(debug, "#"+handle+" += "+alt);
		return true;
	}

	// interned leaf: equal operations come back as one instance
	public EditOperation leaf(EditOperation op) {
		EditOperation ret = leaves.get(op);
		if (ret == null) {
			leaves.put(op, op);
			ret = op;
		}
		return ret;
	}

	public ForestNode getNode(int handle) {
		if (handle < 0 || handle >= nodes.size())
			throw new IllegalArgumentException("No node with handle "+handle);
		return nodes.get(handle);
	}
	public NodeLabel getLabel(int handle) {
		return getNode(handle).getLabel();
	}
	public List<PackedAlternative> getAlternatives(int handle) {
		return getNode(handle).getAlternatives();
	}
	public int getNumNodes() { return nodes.size(); }
	public int getNumAlternatives() { return numAlternatives; }
	public int getNumLeaves() { return leaves.size(); }

	/**
	 * Least total leaf cost of any finite derivation under the node, or {@link #INFINITE} if
	 * the node has none. Computed for the whole forest at once, smallest costs first, since
	 * the forest may be cyclic.
	 */
	public synchronized int minimumCost(int handle) {
		getNode(handle);
		if (minCost == null || minCostStamp != numAlternatives || minCost.length != nodes.size())
			computeMinimumCosts();
		return minCost[handle];
	}

	// minimum costs of all nodes, indexed by handle. a copy
	public synchronized int[] minimumCosts() {
		if (minCost == null || minCostStamp != numAlternatives || minCost.length != nodes.size())
			computeMinimumCosts();
		return minCost.clone();
	}

	// cost of the leaf or child that closes an alternative
	private int rightCost(PackedAlternative a, int[] cost) {
		if (a.hasRight())
			return cost[a.getRight()];
		if (a.getLeaf() != null)
			return a.getLeaf().getCost();
		return 0;
	}

	private static int plus(int a, int b) {
		if (a == INFINITE || b == INFINITE)
			return INFINITE;
		return a+b;
	}

	// an alternative's cost is known once all its child nodes are final. nodes are
	// finalized cheapest first, so the first final value of a node is its minimum
	private void computeMinimumCosts() {
		Date startTime = new Date();
		int n = nodes.size();
		int[] cost = new int[n];
		boolean[] done = new boolean[n];
		// parents of each node, as (node, alternative index) pairs flattened
		TIntArrayList[] users = new TIntArrayList[n];
		int[][] waiting = new int[n][];
		FixedPrioritiesPriorityQueue<Integer> agenda = new FixedPrioritiesPriorityQueue<Integer>();
		for (int h = 0; h < n; h++) {
			cost[h] = INFINITE;
			List<PackedAlternative> alts = nodes.get(h).getAlternatives();
			waiting[h] = new int[alts.size()];
		}
		for (int h = 0; h < n; h++) {
			List<PackedAlternative> alts = nodes.get(h).getAlternatives();
			for (int a = 0; a < alts.size(); a++) {
				PackedAlternative alt = alts.get(a);
				if (alt.hasLeft())
					addUser(users, alt.getLeft(), h, a, waiting);
				if (alt.hasRight())
					addUser(users, alt.getRight(), h, a, waiting);
				if (waiting[h][a] == 0) {
					int c = rightCost(alt, cost);
					if (c < cost[h]) {
						cost[h] = c;
						agenda.add(h, -c);
					}
				}
			}
		}
		while (!agenda.isEmpty()) {
			int c = (int)-agenda.getPriority();
			int h = agenda.removeFirst();
			if (done[h] || c != cost[h])
				continue;
			done[h] = true;
			if (users[h] == null)
				continue;
			for (int u = 0; u < users[h].size(); u += 2) {
				int p = users[h].get(u);
				int a = users[h].get(u+1);
				if (done[p] || --waiting[p][a] > 0)
					continue;
				PackedAlternative alt = nodes.get(p).getAlternatives().get(a);
				int ac = plus(alt.hasLeft() ? cost[alt.getLeft()] : 0, rightCost(alt, cost));
				if (ac < cost[p]) {
					cost[p] = ac;
					agenda.add(p, -ac);
				}
			}
		}
		minCost = cost;
		minCostStamp = numAlternatives;
		Debug.dbtime(3, startTime, "Minimum costs for "+n+" nodes");
	}

	private static void addUser(TIntArrayList[] users, int child, int parent, int alt, int[][] waiting) {
		if (users[child] == null)
			users[child] = new TIntArrayList();
		users[child].add(parent);
		users[child].add(alt);
		waiting[parent][alt]++;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (ForestNode n : nodes)
			sb.append(n).append('\n');
		return sb.toString();
	}
}
