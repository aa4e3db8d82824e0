package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One correction read off the forest: the aligned operation sequence, left to right, with one
 * operation for every input symbol (match, substitute or delete) and the insertions between
 * them. The original word, the corrected word and the cost all follow from the operations.
 */
public class Correction {
	private final List<EditOperation> ops;
	private final List<Symbol> original;
	private final List<Symbol> corrected;
	private final int cost;
	private final int insertions;
	private final int deletions;
	private final int substitutions;

	public Correction(List<EditOperation> operations) {
		ops = Collections.unmodifiableList(new ArrayList<EditOperation>(operations));
		ArrayList<Symbol> orig = new ArrayList<Symbol>();
		ArrayList<Symbol> corr = new ArrayList<Symbol>();
		int c = 0, ins = 0, del = 0, sub = 0;
		for (EditOperation op : ops) {
			if (op.consumesInput())
				orig.add(op.getActual());
			if (op.getOutput() != null)
				corr.add(op.getOutput());
			c += op.getCost();
			switch (op.getKind()) {
			case INSERT: ins++; break;
			case DELETE: del++; break;
			case SUBSTITUTE: sub++; break;
			case MATCH: break;
			}
		}
		original = Collections.unmodifiableList(orig);
		corrected = Collections.unmodifiableList(corr);
		cost = c;
		insertions = ins;
		deletions = del;
		substitutions = sub;
	}

	// full alignment, matches included
	public List<EditOperation> getOperations() { return ops; }

	// the edit script proper: everything but matches. empty when the word was already fine
	public List<EditOperation> getEdits() {
		ArrayList<EditOperation> ret = new ArrayList<EditOperation>();
		for (EditOperation op : ops)
			if (op.isEdit())
				ret.add(op);
		return ret;
	}

	public List<Symbol> getOriginal() { return original; }
	public List<Symbol> getCorrected() { return corrected; }
	public int getCost() { return cost; }
	public int getInsertions() { return insertions; }
	public int getDeletions() { return deletions; }
	public int getSubstitutions() { return substitutions; }

	/**
	 * Runs the script over a word.
	 * @throws IllegalArgumentException if the word is not the one the script was made for
	 */
	public List<Symbol> apply(List<Symbol> word) {
		ArrayList<Symbol> ret = new ArrayList<Symbol>();
		int pos = 0;
		for (EditOperation op : ops) {
			if (op.consumesInput()) {
				if (pos >= word.size() || op.getPosition() != pos || word.get(pos) != op.getActual())
					throw new IllegalArgumentException(op+" does not fit position "+pos+" of "+word);
				pos++;
			}
			if (op.getOutput() != null)
				ret.add(op.getOutput());
		}
		if (pos != word.size())
			throw new IllegalArgumentException("Script consumes "+pos+" of "+word.size()+" symbols of "+word);
		return ret;
	}

	public int hashCode() { return ops.hashCode(); }
	public boolean equals(Object o) {
		return o instanceof Correction && ops.equals(((Correction)o).ops);
	}

	// cost, corrected word, edits
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(cost).append('\t');
		for (int i = 0; i < corrected.size(); i++) {
			if (i > 0)
				sb.append(' ');
			sb.append(corrected.get(i));
		}
		sb.append('\t').append(getEdits());
		return sb.toString();
	}
}
