package edu.isi.corrigo;

// dotted rule with origin column. the column an item lives in is implied by the chart
// that holds it, so it is not part of the key.
public class EarleyItem {
	private final CFGRule rule;
	private final int dot;
	private final int origin;
	private int hsh = -1;

	public EarleyItem(CFGRule r, int d, int o) {
		if (d < 0 || d > r.getRHSLength())
			throw new IllegalArgumentException("Dot "+d+" out of range for "+r);
		rule = r;
		dot = d;
		origin = o;
	}

	public CFGRule getRule() { return rule; }
	public int getDot() { return dot; }
	public int getOrigin() { return origin; }
	public boolean isComplete() { return dot == rule.getRHSLength(); }

	// symbol after the dot, or null if complete
	public Symbol getNext() {
		return isComplete() ? null : rule.getRHS(dot);
	}

	public EarleyItem advance() {
		if (isComplete())
			throw new IllegalStateException("Can't advance complete item "+this);
		return new EarleyItem(rule, dot+1, origin);
	}

	// same dotted rule, different origin
	public EarleyItem withOrigin(int o) {
		return o == origin ? this : new EarleyItem(rule, dot, o);
	}

	// the forest label of this item spanning [origin, end]. complete items are
	// labeled by their head symbol so all rules for a symbol share the node
	public NodeLabel getLabel(int end) {
		if (isComplete())
			return NodeLabel.symbol(rule.getLHS(), origin, end);
		return NodeLabel.intermediate(rule, dot, origin, end);
	}

	// an unstarted item over an empty span has no node
	public boolean hasNode(int end) {
		return dot > 0 || origin != end || isComplete();
	}

	public int hashCode() {
		if (hsh == -1)
			hsh = (rule.getIndex()*31+dot)*31+origin;
		return hsh;
	}
	public boolean equals(Object o) {
		if (!(o instanceof EarleyItem))
			return false;
		EarleyItem i = (EarleyItem)o;
		return rule == i.rule && dot == i.dot && origin == i.origin;
	}
	public String toString() {
		return "["+rule.toString(dot)+", "+origin+"]";
	}
}
