package edu.isi.corrigo;

// CFG Rule. Symbol lhs, array of Symbols rhs (empty for an epsilon rule).
// Rules are unique within their rule set; equality is identity.
public class CFGRule {

	private final Symbol lhs;
	private final Symbol[] rhs;
	private final int index;
	private String sval = null;

	CFGRule(Symbol inlhs, Symbol[] inrhs, int inindex) {
		lhs = inlhs;
		rhs = inrhs.clone();
		index = inindex;
	}

	public Symbol getLHS() { return lhs; }
	public int getRHSLength() { return rhs.length; }
	public Symbol getRHS(int i) { return rhs[i]; }
	public Symbol[] getRHS() { return rhs.clone(); }
	public boolean isEpsilon() { return rhs.length == 0; }
	public int getIndex() { return index; }

	public int hashCode() { return index; }

	// prefix of the rule up to the dot, as used in intermediate node labels
	public String toString(int dot) {
		StringBuilder sb = new StringBuilder(lhs.toString());
		sb.append(" ->");
		for (int i = 0; i < rhs.length; i++) {
			if (i == dot)
				sb.append(" .");
			sb.append(' ').append(rhs[i]);
		}
		if (dot == rhs.length)
			sb.append(" .");
		return sb.toString();
	}

	public String toString() {
		if (sval == null) {
			StringBuilder sb = new StringBuilder(lhs.toString());
			sb.append(" ->");
			if (rhs.length == 0)
				sb.append(' ').append(Symbol.EPSILON);
			for (Symbol s : rhs)
				sb.append(' ').append(s);
			sval = sb.toString();
		}
		return sval;
	}
}
