package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;

/**
 * Compiled, immutable context-free grammar. Built once by {@link #compile(CFGRuleSet)} and
 * shared read-only by every parse, from any thread.
 * <p>
 * Compilation checks that the start symbol exists and has rules, that every body symbol is
 * declared, and that every nonterminal reachable from the start symbol can derive some
 * terminal string. Nullable and FIRST facts are computed here, once.
 */
public class Grammar {

	private final Symbol start;
	private final List<CFGRule> rules;
	private final Map<Symbol, List<CFGRule>> rulesByLHS;
	private final Set<Symbol> terminals;
	private final Set<Symbol> nonterminals;
	private final Set<Symbol> nullable;
	private final Map<Symbol, Set<Symbol>> first;

	private Grammar(Symbol s, List<CFGRule> r, Set<Symbol> t, Set<Symbol> nt) {
		start = s;
		rules = Collections.unmodifiableList(r);
		terminals = Collections.unmodifiableSet(t);
		nonterminals = Collections.unmodifiableSet(nt);
		HashMap<Symbol, List<CFGRule>> byLHS = new HashMap<Symbol, List<CFGRule>>();
		for (Symbol n : nonterminals)
			byLHS.put(n, new ArrayList<CFGRule>());
		for (CFGRule rule : rules)
			byLHS.get(rule.getLHS()).add(rule);
		for (Map.Entry<Symbol, List<CFGRule>> e : byLHS.entrySet())
			e.setValue(Collections.unmodifiableList(e.getValue()));
		rulesByLHS = byLHS;
		nullable = Collections.unmodifiableSet(computeNullable());
		first = computeFirst();
	}

	/**
	 * Validates and indexes a raw grammar.
	 * @throws GrammarException when the grammar is malformed or some reachable nonterminal is unproductive
	 */
	public static Grammar compile(CFGRuleSet raw) throws GrammarException {
		boolean debug = false;
		if (raw.getStartSymbol() == null)
			throw new GrammarException("No start symbol set");
		for (String t : raw.getTerminals()) {
			if (t.equals(Symbol.EPSILON))
				throw new GrammarException(Symbol.EPSILON+" is reserved for the empty body and can't be a terminal");
		}
		LinkedHashSet<Symbol> nt = new LinkedHashSet<Symbol>();
		for (String n : raw.getNonterminals())
			nt.add(SymbolFactory.getNonterminal(n));
		LinkedHashSet<Symbol> t = new LinkedHashSet<Symbol>();
		for (String s : raw.getTerminals())
			t.add(SymbolFactory.getTerminal(s));
		if (!raw.getNonterminals().contains(raw.getStartSymbol()))
			throw new GrammarException("Start symbol "+raw.getStartSymbol()+" is not a declared nonterminal");
		Symbol start = SymbolFactory.getNonterminal(raw.getStartSymbol());

		ArrayList<CFGRule> rules = new ArrayList<CFGRule>();
		for (CFGRuleSet.RawRule rr : raw.getRawRules()) {
			Symbol[] rhs = new Symbol[rr.rhs.length];
			for (int i = 0; i < rhs.length; i++) {
				String name = rr.rhs[i];
				boolean isNT = raw.getNonterminals().contains(name);
				boolean isT = raw.getTerminals().contains(name);
				// quoting forces a terminal. unquoted, a rule head name means the nonterminal
				if (rr.quoted[i])
					rhs[i] = SymbolFactory.getTerminal(name);
				else if (isNT)
					rhs[i] = SymbolFactory.getNonterminal(name);
				else if (isT)
					rhs[i] = SymbolFactory.getTerminal(name);
				else
					throw new GrammarException("Undeclared symbol "+name+" in "+rr);
				if (rhs[i].isTerminal())
					t.add(rhs[i]);
			}
			CFGRule rule = new CFGRule(SymbolFactory.getNonterminal(rr.lhs), rhs, rules.size());
			if (debug) Debug.debug(debug, "Compiled "+rule);
			rules.add(rule);
		}
		Grammar g = new Grammar(start, rules, t, nt);
		if (g.productionsFor(start).isEmpty())
			throw new GrammarException("Start symbol "+start+" has no rules");
		g.checkProductive();
		return g;
	}

	// bottom up: which nonterminals derive a terminal string. then top down from the start
	// symbol through rules whose symbols are all productive: any reachable unproductive
	// nonterminal is an error.
	private void checkProductive() throws GrammarException {
		boolean debug = false;
		HashSet<Symbol> bottomReachable = new HashSet<Symbol>();
		int brSize = 0;
		do {
			brSize = bottomReachable.size();
			for (CFGRule r : rules) {
				if (bottomReachable.contains(r.getLHS()))
					continue;
				boolean isOkay = true;
				for (int i = 0; i < r.getRHSLength(); i++) {
					Symbol leaf = r.getRHS(i);
					if (leaf.isNonterminal() && !bottomReachable.contains(leaf)) {
						isOkay = false;
						break;
					}
				}
				if (isOkay) {
					if (debug) Debug.debug(debug, "BU: "+r.getLHS()+" thanks to "+r);
					bottomReachable.add(r.getLHS());
				}
			}
		} while (brSize < bottomReachable.size());

		HashSet<Symbol> checked = new HashSet<Symbol>();
		Stack<Symbol> ready = new Stack<Symbol>();
		ready.push(start);
		checked.add(start);
		while (!ready.isEmpty()) {
			Symbol curr = ready.pop();
			if (!bottomReachable.contains(curr))
				throw new GrammarException("Nonterminal "+curr+" is reachable from "+start+" but derives no terminal string");
			for (CFGRule r : productionsFor(curr)) {
				for (int i = 0; i < r.getRHSLength(); i++) {
					Symbol s = r.getRHS(i);
					if (s.isNonterminal() && !checked.contains(s)) {
						checked.add(s);
						ready.push(s);
					}
				}
			}
		}
	}

	// least fixpoint: a nonterminal is nullable if some rule body is all nullable
	private Set<Symbol> computeNullable() {
		HashSet<Symbol> set = new HashSet<Symbol>();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (CFGRule r : rules) {
				if (set.contains(r.getLHS()))
					continue;
				boolean all = true;
				for (int i = 0; i < r.getRHSLength() && all; i++)
					all = set.contains(r.getRHS(i));
				if (all) {
					set.add(r.getLHS());
					changed = true;
				}
			}
		}
		return set;
	}

	// least fixpoint over FIRST sets of nonterminals
	private Map<Symbol, Set<Symbol>> computeFirst() {
		HashMap<Symbol, Set<Symbol>> f = new HashMap<Symbol, Set<Symbol>>();
		for (Symbol n : nonterminals)
			f.put(n, new LinkedHashSet<Symbol>());
		boolean changed = true;
		while (changed) {
			changed = false;
			for (CFGRule r : rules) {
				Set<Symbol> target = f.get(r.getLHS());
				for (int i = 0; i < r.getRHSLength(); i++) {
					Symbol s = r.getRHS(i);
					if (s.isTerminal()) {
						changed |= target.add(s);
						break;
					}
					changed |= target.addAll(f.get(s));
					if (!nullable.contains(s))
						break;
				}
			}
		}
		for (Map.Entry<Symbol, Set<Symbol>> e : f.entrySet())
			e.setValue(Collections.unmodifiableSet(e.getValue()));
		return Collections.unmodifiableMap(f);
	}

	public Symbol getStart() { return start; }
	public List<CFGRule> getRules() { return rules; }
	public Set<Symbol> getTerminals() { return terminals; }
	public Set<Symbol> getNonterminals() { return nonterminals; }
	public int getNumRules() { return rules.size(); }

	// is the symbol part of this grammar's terminal alphabet
	public boolean isTerminal(Symbol s) {
		return terminals.contains(s);
	}

	public List<CFGRule> productionsFor(Symbol nonterminal) {
		List<CFGRule> l = rulesByLHS.get(nonterminal);
		if (l == null)
			throw new IllegalArgumentException(nonterminal+" is not a nonterminal of this grammar");
		return l;
	}

	// terminals are never nullable
	public boolean isNullable(Symbol s) {
		return nullable.contains(s);
	}

	public Set<Symbol> first(Symbol s) {
		switch (s.getKind()) {
		case TERMINAL:
			return Collections.singleton(s);
		case NONTERMINAL:
			Set<Symbol> f = first.get(s);
			if (f == null)
				throw new IllegalArgumentException(s+" is not a nonterminal of this grammar");
			return f;
		default:
			throw new IllegalStateException("Unknown symbol kind "+s.getKind());
		}
	}

	// FIRST of seq[from..]. see isNullable(Symbol[], int) for whether the rest can vanish
	public Set<Symbol> first(Symbol[] seq, int from) {
		LinkedHashSet<Symbol> ret = new LinkedHashSet<Symbol>();
		for (int i = from; i < seq.length; i++) {
			ret.addAll(first(seq[i]));
			if (!isNullable(seq[i]))
				break;
		}
		return ret;
	}

	public boolean isNullable(Symbol[] seq, int from) {
		for (int i = from; i < seq.length; i++) {
			if (!isNullable(seq[i]))
				return false;
		}
		return true;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(start).append('\n');
		for (CFGRule r : rules)
			sb.append(r).append('\n');
		return sb.toString();
	}
}
