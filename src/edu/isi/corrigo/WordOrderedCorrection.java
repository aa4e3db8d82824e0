package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A correction in alternating form: the word inserted before the first input symbol, what
 * happens to the first input symbol (match, substitute or delete), the word inserted after
 * it, and so on, ending with the word inserted after the last input symbol. A correction of
 * an n-symbol word has n steps and n+1 insertion words, some possibly empty.
 * <p>
 * Two corrections of the same word are partially ordered step by step: an insertion word is
 * smaller than another if it is a scattered subsequence of it, and a match is smaller than a
 * deletion or substitution of the same symbol. A correction is smaller when it is smaller or
 * equal everywhere and smaller somewhere.
 */
public class WordOrderedCorrection {

	public enum Comparison { EQUAL, SMALLER, BIGGER, INCOMPARABLE }

	private final List<List<Symbol>> insertions;
	private final List<EditOperation> steps;

	public WordOrderedCorrection(List<List<Symbol>> ins, List<EditOperation> st) {
		if (ins.size() != st.size()+1)
			throw new IllegalArgumentException(st.size()+" steps need "+(st.size()+1)+" insertion words, not "+ins.size());
		ArrayList<List<Symbol>> i = new ArrayList<List<Symbol>>();
		for (List<Symbol> w : ins)
			i.add(Collections.unmodifiableList(new ArrayList<Symbol>(w)));
		for (EditOperation op : st)
			if (!op.consumesInput())
				throw new IllegalArgumentException("Step "+op+" must read, substitute or delete an input symbol");
		insertions = Collections.unmodifiableList(i);
		steps = Collections.unmodifiableList(new ArrayList<EditOperation>(st));
	}

	// the identity correction of the empty word
	public static WordOrderedCorrection empty() {
		List<List<Symbol>> ins = new ArrayList<List<Symbol>>();
		ins.add(new ArrayList<Symbol>());
		return new WordOrderedCorrection(ins, new ArrayList<EditOperation>());
	}

	// alternating form of an aligned correction. consecutive insertions join into one word
	public static WordOrderedCorrection of(Correction c) {
		ArrayList<List<Symbol>> ins = new ArrayList<List<Symbol>>();
		ArrayList<EditOperation> st = new ArrayList<EditOperation>();
		ArrayList<Symbol> current = new ArrayList<Symbol>();
		for (EditOperation op : c.getOperations()) {
			if (op.getKind() == EditOperation.Kind.INSERT)
				current.add(op.getExpected());
			else {
				ins.add(current);
				current = new ArrayList<Symbol>();
				st.add(op);
			}
		}
		ins.add(current);
		return new WordOrderedCorrection(ins, st);
	}

	public List<Symbol> getInsertion(int i) { return insertions.get(i); }
	public EditOperation getStep(int i) { return steps.get(i); }
	public int getNumSteps() { return steps.size(); }
	// number of elements in the alternating form
	public int length() { return insertions.size()+steps.size(); }

	public int getCost() {
		int c = 0;
		for (List<Symbol> w : insertions)
			c += w.size();
		for (EditOperation op : steps)
			c += op.getCost();
		return c;
	}

	// the corrected word
	public List<Symbol> apply() {
		ArrayList<Symbol> ret = new ArrayList<Symbol>(insertions.get(0));
		for (int i = 0; i < steps.size(); i++) {
			Symbol out = steps.get(i).getOutput();
			if (out != null)
				ret.add(out);
			ret.addAll(insertions.get(i+1));
		}
		return ret;
	}

	/**
	 * This correction followed by another; the insertion words at the seam are joined.
	 * @param simplify if true, return null when the result could be made cheaper at the seam
	 */
	public WordOrderedCorrection concatenate(WordOrderedCorrection other, boolean simplify) {
		if (simplify && canSimplify(other))
			return null;
		ArrayList<List<Symbol>> ins = new ArrayList<List<Symbol>>(insertions.subList(0, insertions.size()-1));
		ArrayList<Symbol> seam = new ArrayList<Symbol>(insertions.get(insertions.size()-1));
		seam.addAll(other.insertions.get(0));
		ins.add(seam);
		ins.addAll(other.insertions.subList(1, other.insertions.size()));
		ArrayList<EditOperation> st = new ArrayList<EditOperation>(steps);
		st.addAll(other.steps);
		return new WordOrderedCorrection(ins, st);
	}

	/**
	 * Whether joining this and another correction, both already simplified, leaves a wasteful
	 * pair at the seam: an insertion next to a deletion, an insertion ending in the symbol the
	 * next step substitutes away, a substitution followed by an insertion starting with the
	 * substituted symbol, or a substitution whose result is deleted right after.
	 */
	public boolean canSimplify(WordOrderedCorrection other) {
		List<Symbol> last = insertions.get(insertions.size()-1);
		List<Symbol> firstOther = other.insertions.get(0);
		if (!last.isEmpty() && !firstOther.isEmpty())
			return false;
		if (!last.isEmpty()) {
			if (other.steps.isEmpty())
				return false;
			EditOperation next = other.steps.get(0);
			switch (next.getKind()) {
			case DELETE:
				return true;
			case SUBSTITUTE:
				return last.get(last.size()-1) == next.getActual();
			default:
				return false;
			}
		}
		if (!firstOther.isEmpty()) {
			if (steps.isEmpty())
				return false;
			EditOperation prev = steps.get(steps.size()-1);
			switch (prev.getKind()) {
			case DELETE:
				return true;
			case SUBSTITUTE:
				return firstOther.get(0) == prev.getExpected();
			default:
				return false;
			}
		}
		if (steps.isEmpty() || other.steps.isEmpty())
			return false;
		EditOperation prev = steps.get(steps.size()-1);
		EditOperation next = other.steps.get(0);
		return prev.getKind() == EditOperation.Kind.SUBSTITUTE && next.getKind() == EditOperation.Kind.DELETE
			&& prev.getExpected() == next.getActual();
	}

	// is a a scattered subsequence of b
	private static boolean isSubsequence(List<Symbol> a, List<Symbol> b) {
		int i = 0;
		for (int j = 0; j < b.size() && i < a.size(); j++) {
			if (a.get(i) == b.get(j))
				i++;
		}
		return i == a.size();
	}

	static Comparison compareInsertions(List<Symbol> a, List<Symbol> b) {
		if (a.equals(b))
			return Comparison.EQUAL;
		if (a.size() < b.size() && isSubsequence(a, b))
			return Comparison.SMALLER;
		if (b.size() < a.size() && isSubsequence(b, a))
			return Comparison.BIGGER;
		return Comparison.INCOMPARABLE;
	}

	// positions are ignored; both steps are assumed to be at the same input symbol
	static Comparison compareSteps(EditOperation a, EditOperation b) {
		if (a.getActual() != b.getActual())
			return Comparison.INCOMPARABLE;
		if (a.getKind() == b.getKind()) {
			if (a.getKind() == EditOperation.Kind.SUBSTITUTE && a.getExpected() != b.getExpected())
				return Comparison.INCOMPARABLE;
			return Comparison.EQUAL;
		}
		if (a.getKind() == EditOperation.Kind.MATCH)
			return Comparison.SMALLER;
		if (b.getKind() == EditOperation.Kind.MATCH)
			return Comparison.BIGGER;
		return Comparison.INCOMPARABLE;
	}

	// fold one elementwise result into the running one
	private static Comparison combine(Comparison sofar, Comparison here) {
		if (here == Comparison.EQUAL || here == sofar)
			return sofar;
		if (here == Comparison.INCOMPARABLE || sofar != Comparison.EQUAL)
			return Comparison.INCOMPARABLE;
		return here;
	}

	/**
	 * Partial order between corrections of the same word.
	 * @throws IllegalArgumentException if the corrections have different numbers of steps
	 */
	public Comparison compare(WordOrderedCorrection other) {
		if (steps.size() != other.steps.size())
			throw new IllegalArgumentException("Only corrections of words of the same length compare: "+
					steps.size()+" vs "+other.steps.size());
		Comparison ret = compareInsertions(insertions.get(0), other.insertions.get(0));
		for (int i = 0; i < steps.size() && ret != Comparison.INCOMPARABLE; i++) {
			ret = combine(ret, compareSteps(steps.get(i), other.steps.get(i)));
			ret = combine(ret, compareInsertions(insertions.get(i+1), other.insertions.get(i+1)));
		}
		return ret;
	}

	public int hashCode() {
		return insertions.hashCode()*31 + steps.hashCode();
	}
	public boolean equals(Object o) {
		if (!(o instanceof WordOrderedCorrection))
			return false;
		WordOrderedCorrection w = (WordOrderedCorrection)o;
		return insertions.equals(w.insertions) && steps.equals(w.steps);
	}

	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < insertions.size(); i++) {
			if (i > 0)
				sb.append(", ").append(steps.get(i-1)).append(", ");
			sb.append("Insert'");
			for (Symbol s : insertions.get(i))
				sb.append(s);
			sb.append("'");
		}
		return sb.append("]").toString();
	}
}
