package edu.isi.corrigo;

// key of a forest node. symbol nodes: (A, i, j). intermediate nodes: (rule, dot, i, j)
public final class NodeLabel {
	private final Symbol symbol;
	private final CFGRule rule;
	private final int dot;
	private final int start;
	private final int end;
	private final int hsh;

	private NodeLabel(Symbol s, CFGRule r, int d, int i, int j) {
		if (i < 0 || j < i)
			throw new IllegalArgumentException("Bad span ["+i+", "+j+"]");
		symbol = s;
		rule = r;
		dot = d;
		start = i;
		end = j;
		int h = s != null ? s.hashCode() : 7919*r.getIndex()+d+1;
		hsh = (h*31+i)*31+j;
	}

	public static NodeLabel symbol(Symbol s, int i, int j) {
		return new NodeLabel(s, null, -1, i, j);
	}
	public static NodeLabel intermediate(CFGRule r, int d, int i, int j) {
		return new NodeLabel(null, r, d, i, j);
	}

	public boolean isSymbolNode() { return symbol != null; }
	// null for intermediate nodes
	public Symbol getSymbol() { return symbol; }
	// null for symbol nodes
	public CFGRule getRule() { return rule; }
	public int getDot() { return dot; }
	public int getStart() { return start; }
	public int getEnd() { return end; }

	public int hashCode() { return hsh; }
	public boolean equals(Object o) {
		if (!(o instanceof NodeLabel))
			return false;
		NodeLabel l = (NodeLabel)o;
		return hsh == l.hsh && symbol == l.symbol && rule == l.rule && dot == l.dot
			&& start == l.start && end == l.end;
	}
	public String toString() {
		if (symbol != null)
			return "("+symbol+", "+start+", "+end+")";
		return "("+rule.toString(dot)+", "+start+", "+end+")";
	}
}
