package edu.isi.corrigo;

/**
 * Leaf label of the correction forest: what happened to one grammar terminal or one input
 * symbol. Immutable; instances are interned per forest by {@link CorrectionForest#leaf}.
 * <ul>
 * <li>MATCH: the input symbol at <code>position</code> is the expected terminal. cost 0</li>
 * <li>SUBSTITUTE: the input symbol at <code>position</code> is replaced by the expected terminal. cost 1</li>
 * <li>INSERT: the expected terminal is supplied in the gap <code>position</code>. cost 1</li>
 * <li>DELETE: the input symbol at <code>position</code> is dropped. cost 1</li>
 * </ul>
 */
public final class EditOperation {

	public enum Kind { MATCH, SUBSTITUTE, INSERT, DELETE }

	private final Kind kind;
	private final Symbol expected;
	private final Symbol actual;
	private final int position;

	private EditOperation(Kind k, Symbol e, Symbol a, int p) {
		kind = k;
		expected = e;
		actual = a;
		position = p;
	}

	public static EditOperation match(Symbol t, int pos) {
		return new EditOperation(Kind.MATCH, t, t, pos);
	}
	public static EditOperation substitute(Symbol expected, Symbol actual, int pos) {
		if (expected == actual)
			throw new IllegalArgumentException("Substituting "+actual+" by itself at "+pos);
		return new EditOperation(Kind.SUBSTITUTE, expected, actual, pos);
	}
	public static EditOperation insert(Symbol t, int gap) {
		return new EditOperation(Kind.INSERT, t, null, gap);
	}
	public static EditOperation delete(Symbol actual, int pos) {
		return new EditOperation(Kind.DELETE, null, actual, pos);
	}

	public Kind getKind() { return kind; }
	// grammar terminal produced; null for DELETE
	public Symbol getExpected() { return expected; }
	// input symbol consumed; null for INSERT
	public Symbol getActual() { return actual; }
	public int getPosition() { return position; }

	public int getCost() {
		switch (kind) {
		case MATCH:
			return 0;
		case SUBSTITUTE:
		case INSERT:
		case DELETE:
			return 1;
		default:
			throw new IllegalStateException("Unknown edit kind "+kind);
		}
	}
	public boolean isEdit() { return kind != Kind.MATCH; }
	public boolean consumesInput() { return kind != Kind.INSERT; }

	// symbol written to the corrected word, or null
	public Symbol getOutput() {
		return expected;
	}

	public int hashCode() {
		int h = kind.ordinal();
		h = h*31 + (expected == null ? 0 : expected.hashCode());
		h = h*31 + (actual == null ? 0 : actual.hashCode());
		return h*31 + position;
	}
	public boolean equals(Object o) {
		if (!(o instanceof EditOperation))
			return false;
		EditOperation e = (EditOperation)o;
		return kind == e.kind && expected == e.expected && actual == e.actual && position == e.position;
	}
	public String toString() {
		switch (kind) {
		case MATCH:
			return "Match("+actual+")@"+position;
		case SUBSTITUTE:
			return "Substitute("+expected+","+actual+")@"+position;
		case INSERT:
			return "Insert("+expected+")@"+position;
		case DELETE:
			return "Delete("+actual+")@"+position;
		default:
			throw new IllegalStateException("Unknown edit kind "+kind);
		}
	}
}
