package edu.isi.corrigo;

// grammar symbol. Interned by SymbolFactory, so identity is equality.
// The kind set is closed: every switch over Kind is exhaustive.
public final class Symbol {

	public enum Kind { TERMINAL, NONTERMINAL }

	// reserved spelling of the empty body in grammar text. never a real symbol
	public static final String EPSILON = "*e*";

	private final String name;
	private final Kind kind;
	private final int id;

	// only the factory makes these
	Symbol(String name, Kind kind, int id) {
		this.name = name;
		this.kind = kind;
		this.id = id;
	}

	public String getName() { return name; }
	public Kind getKind() { return kind; }
	public boolean isTerminal() { return kind == Kind.TERMINAL; }
	public boolean isNonterminal() { return kind == Kind.NONTERMINAL; }
	// dense per-factory number, handy for hashing
	public int getId() { return id; }

	public int hashCode() { return id; }
	public boolean equals(Object o) { return this == o; }
	public String toString() { return name; }
}
