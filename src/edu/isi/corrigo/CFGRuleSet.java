package edu.isi.corrigo;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw, uncompiled description of a context-free grammar: a start symbol, declared
 * nonterminals and terminals, and rules over symbol names. Nothing is checked here;
 * {@link Grammar#compile(CFGRuleSet)} validates and indexes it.
 * <p>
 * Text format, one item per line:
 * <pre>
 * % comment
 * S
 * S -&gt; a S a
 * S -&gt; b
 * E -&gt; *e*
 * </pre>
 * The first content line is the start symbol. Every rule head is a nonterminal and every
 * other body symbol is a terminal; a body symbol in double quotes is always a terminal.
 */
public class CFGRuleSet {

	// one rule as read: head name and body tokens. quoted tokens are forced terminals
	static class RawRule {
		final String lhs;
		final String[] rhs;
		final boolean[] quoted;
		RawRule(String l, String[] r, boolean[] q) {
			lhs = l;
			rhs = r;
			quoted = q;
		}
		public String toString() {
			StringBuilder sb = new StringBuilder(lhs+" ->");
			if (rhs.length == 0)
				sb.append(" "+Symbol.EPSILON);
			for (int i = 0; i < rhs.length; i++)
				sb.append(quoted[i] ? " \""+rhs[i]+"\"" : " "+rhs[i]);
			return sb.toString();
		}
	}

	private String startSymbol = null;
	private LinkedHashSet<String> nonterminals = new LinkedHashSet<String>();
	private LinkedHashSet<String> terminals = new LinkedHashSet<String>();
	private ArrayList<RawRule> rules = new ArrayList<RawRule>();

	// to be filled by the caller
	public CFGRuleSet() {
	}

	public CFGRuleSet(String filename, String encoding) throws IOException, DataFormatException {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding)));
	}

	public CFGRuleSet(Reader r) throws IOException, DataFormatException {
		this(r instanceof BufferedReader ? (BufferedReader)r : new BufferedReader(r));
	}

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");

	// something that can be a start symbol -- no spaces
	// can be followed by whitespace and comment
	private static Pattern startStatePat = Pattern.compile("\\s*(\\S+)\\s*(%.*)?");

	// strip comments off
	private static Pattern commentStripPat = Pattern.compile("\\s*(.*?[^\\s%])(\\s*(?:%.*)?)?");

	// separate left from right
	private static Pattern sidesPat = Pattern.compile("(\\S+)\\s*->\\s*(.*?)\\s*$");

	// body tokens: quoted terminal or bare word
	private static Pattern tokenPat = Pattern.compile("\"([^\"]+)\"|(\\S+)");

	public CFGRuleSet(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		Date readTime = new Date();
		try {
			String line = br.readLine();
			int lineno = 1;
			// 1) ignore all comments fields and blank lines in the header
			while (line != null && commentPat.matcher(line).matches()) {
				if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
				line = br.readLine();
				lineno++;
			}
			if (line == null)
				throw new DataFormatException("No start symbol found; grammar text is empty");

			// 2) get start symbol
			Matcher startStateMatch = startStatePat.matcher(line);
			if (!startStateMatch.matches())
				throw new DataFormatException("Could not find start symbol in line "+lineno+": "+line);
			setStartSymbol(startStateMatch.group(1));

			// 3) get rules, skipping white space and comments
			while ((line = br.readLine()) != null) {
				lineno++;
				if (commentPat.matcher(line).matches())
					continue;
				Matcher commentStripMatch = commentStripPat.matcher(line);
				if (!commentStripMatch.matches())
					throw new DataFormatException("Couldn't strip comments off of line "+lineno+": "+line);
				String ruleText = commentStripMatch.group(1);
				if (debug) Debug.debug(debug, "Isolated "+ruleText+" for rule");
				try {
					addRuleText(ruleText);
				}
				catch (DataFormatException e) {
					throw new DataFormatException("line "+lineno+": "+e.getMessage(), e);
				}
			}
		}
		finally {
			br.close();
		}
		// every body symbol that never heads a rule is a terminal
		for (RawRule r : rules) {
			for (int i = 0; i < r.rhs.length; i++) {
				if (r.quoted[i] || !nonterminals.contains(r.rhs[i]))
					terminals.add(r.rhs[i]);
			}
		}
		Debug.dbtime(2, readTime, "Read "+rules.size()+" rules");
	}

	// rule from text representation: lhs -> tok tok ...
	private void addRuleText(String text) throws DataFormatException {
		Matcher sidesMatch = sidesPat.matcher(text);
		if (!sidesMatch.matches())
			throw new DataFormatException("Incorrect rule format: "+text);
		String lhs = sidesMatch.group(1);
		if (lhs.startsWith("\""))
			throw new DataFormatException("Quoted terminal "+lhs+" can't head a rule");
		String body = sidesMatch.group(2);
		ArrayList<String> toks = new ArrayList<String>();
		ArrayList<Boolean> quotes = new ArrayList<Boolean>();
		Matcher tokMatch = tokenPat.matcher(body);
		while (tokMatch.find()) {
			if (tokMatch.group(1) != null) {
				toks.add(tokMatch.group(1));
				quotes.add(true);
			}
			else {
				toks.add(tokMatch.group(2));
				quotes.add(false);
			}
		}
		if (toks.size() == 1 && !quotes.get(0) && toks.get(0).equals(Symbol.EPSILON)) {
			toks.clear();
			quotes.clear();
		}
		else if (toks.isEmpty())
			throw new DataFormatException("RHS appears to be empty in "+text+"; write "+Symbol.EPSILON+" for the empty body");
		boolean[] q = new boolean[quotes.size()];
		for (int i = 0; i < q.length; i++) {
			if (!quotes.get(i) && toks.get(i).equals(Symbol.EPSILON))
				throw new DataFormatException(Symbol.EPSILON+" must be the whole body in "+text);
			q[i] = quotes.get(i);
		}
		nonterminals.add(lhs);
		rules.add(new RawRule(lhs, toks.toArray(new String[toks.size()]), q));
	}

	public void setStartSymbol(String s) {
		startSymbol = s;
	}
	public void addNonterminal(String s) {
		nonterminals.add(s);
	}
	public void addTerminal(String s) {
		terminals.add(s);
	}
	// the head is declared a nonterminal; body names must be declared separately
	public void addRule(String lhs, String... rhs) {
		nonterminals.add(lhs);
		rules.add(new RawRule(lhs, rhs.clone(), new boolean[rhs.length]));
	}

	public String getStartSymbol() { return startSymbol; }
	public Set<String> getNonterminals() { return Collections.unmodifiableSet(nonterminals); }
	public Set<String> getTerminals() { return Collections.unmodifiableSet(terminals); }
	List<RawRule> getRawRules() { return Collections.unmodifiableList(rules); }
	public int getNumRules() { return rules.size(); }

	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(startSymbol).append('\n');
		for (RawRule r : rules)
			sb.append(r).append('\n');
		return sb.toString();
	}
}
