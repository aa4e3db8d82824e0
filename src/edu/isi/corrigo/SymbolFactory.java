package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

// manages the interned terminal and nonterminal symbols.
// a name may be used once as a terminal and once as a nonterminal; they are different symbols
public class SymbolFactory {
	static private HashMap<String, Symbol> terminals;
	static private HashMap<String, Symbol> nonterminals;
	static private int nextId = 0;
	static {
		terminals = new HashMap<String, Symbol>();
		nonterminals = new HashMap<String, Symbol>();
	}

	static public synchronized Symbol getTerminal(String str) {
		boolean debug = false;
		if (str == null || str.length() == 0)
			throw new IllegalArgumentException("Terminal name must be non-empty");
		Symbol sym = terminals.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new terminal from "+str);
			sym = new Symbol(str, Symbol.Kind.TERMINAL, nextId++);
			terminals.put(str, sym);
		}
		return sym;
	}

	static public synchronized Symbol getNonterminal(String str) {
		boolean debug = false;
		if (str == null || str.length() == 0)
			throw new IllegalArgumentException("Nonterminal name must be non-empty");
		Symbol sym = nonterminals.get(str);
		if (sym == null) {
			if (debug) Debug.debug(debug, "creating new nonterminal from "+str);
			sym = new Symbol(str, Symbol.Kind.NONTERMINAL, nextId++);
			nonterminals.put(str, sym);
		}
		return sym;
	}

	// a word as terminals, one per whitespace-separated token
	static public List<Symbol> getWord(String text) {
		List<Symbol> word = new ArrayList<Symbol>();
		String trimmed = text.trim();
		if (trimmed.length() == 0)
			return word;
		for (String tok : trimmed.split("\\s+"))
			word.add(getTerminal(tok));
		return word;
	}

	// a word as terminals, one per character
	static public List<Symbol> getCharWord(String text) {
		List<Symbol> word = new ArrayList<Symbol>();
		for (int i = 0; i < text.length(); i++)
			word.add(getTerminal(text.substring(i, i+1)));
		return word;
	}
}
