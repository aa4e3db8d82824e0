package edu.isi.corrigo;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.LongStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line front end: read a grammar, correct a word, print corrections
public class Corrigo {
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on them
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of the grammar file and of the output, if other than utf-8");
		jsap.registerParameter(encodingopt);

		FlaggedOption kopt = new FlaggedOption("kbest",
				IntegerStringParser.getParser(),
				"10",
				true,
				'k',
				"kbest",
				"print at most <kbest> corrections");
		jsap.registerParameter(kopt);

		FlaggedOption modeopt = new FlaggedOption("mode",
				EnumeratedStringParser.getParser("cost;depth"),
				"cost",
				true,
				JSAP.NO_SHORTFLAG,
				"mode",
				"order of corrections: cost (cheapest first) or depth (forest order, needs --maxdepth or --loopfree)");
		jsap.registerParameter(modeopt);

		FlaggedOption parseropt = new FlaggedOption("parser",
				EnumeratedStringParser.getParser("earley;static"),
				"earley",
				true,
				JSAP.NO_SHORTFLAG,
				"parser",
				"forest construction: earley (column by column) or static (precomputed closures)");
		jsap.registerParameter(parseropt);

		FlaggedOption depthopt = new FlaggedOption("maxdepth",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"maxdepth",
				"depth mode: largest nesting of forest nodes in a derivation");
		jsap.registerParameter(depthopt);

		FlaggedOption costopt = new FlaggedOption("maxcost",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"maxcost",
				"cost mode: leave out corrections with more than <maxcost> edits");
		jsap.registerParameter(costopt);

		FlaggedOption frontieropt = new FlaggedOption("frontier",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"frontier",
				"cost mode: give up once <frontier> prefixes are waiting");
		jsap.registerParameter(frontieropt);

		FlaggedOption expansionopt = new FlaggedOption("expansions",
				LongStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"expansions",
				"cost mode: give up after expanding <expansions> prefixes (default "+CostOrderedEnumerator.DEFAULT_EXPANSIONS+")");
		jsap.registerParameter(expansionopt);

		String[] kinds = {"insertions", "deletions", "substitutions", "edits"};
		for (String kind : kinds) {
			FlaggedOption limitopt = new FlaggedOption("max-"+kind,
					IntegerStringParser.getParser(),
					null,
					false,
					JSAP.NO_SHORTFLAG,
					"max-"+kind,
					"allow at most this many "+kind+" in a correction");
			jsap.registerParameter(limitopt);
		}

		Switch loopfreesw = new Switch("loopfree",
				JSAP.NO_SHORTFLAG,
				"loopfree",
				"depth mode: never expand a node inside itself");
		jsap.registerParameter(loopfreesw);

		Switch smallestsw = new Switch("smallest",
				JSAP.NO_SHORTFLAG,
				"smallest",
				"of the corrections found, print only those no other one is smaller than");
		jsap.registerParameter(smallestsw);

		Switch verifysw = new Switch("verify",
				JSAP.NO_SHORTFLAG,
				"verify",
				"check every corrected word with a plain recognizer and mark it ok or FAILED");
		jsap.registerParameter(verifysw);

		Switch charsw = new Switch("chars",
				JSAP.NO_SHORTFLAG,
				"chars",
				"split the word into single characters instead of whitespace-separated tokens");
		jsap.registerParameter(charsw);

		Switch checksw = new Switch("check",
				'c',
				"check",
				"print grammar and forest statistics before the corrections");
		jsap.registerParameter(checksw);

		FlaggedOption timeopt = new FlaggedOption("timedebug",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"print timing information to stderr at a level of verbosity 1 (least) to 3 (most)");
		jsap.registerParameter(timeopt);

		FlaggedOption outfileopt = new FlaggedOption("outfile",
				StringStringParser.getParser(),
				null,
				false,
				'o',
				"outputfile",
				"file to write corrections to. If absent, written to stdout");
		jsap.registerParameter(outfileopt);

		// grammar then the word, for a nice usage statement
		UnflaggedOption grammaropt = new UnflaggedOption("grammar",
				StringStringParser.getParser(),
				null,
				true,
				false,
				"grammar file: start symbol on the first line, then one rule per line");
		jsap.registerParameter(grammaropt);

		UnflaggedOption wordopt = new UnflaggedOption("word",
				StringStringParser.getParser(),
				null,
				false,
				true,
				"the word to correct. Omit for the empty word");
		jsap.registerParameter(wordopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help", false))
			return config;

		boolean depthMode = config.getString("mode").equals("depth");
		if (depthMode && !config.contains("maxdepth") && !config.getBoolean("loopfree"))
			throw new ConfigureException("Depth mode needs --maxdepth, --loopfree, or both");
		if (!depthMode && (config.contains("maxdepth") || config.getBoolean("loopfree")))
			throw new ConfigureException("--maxdepth and --loopfree only apply to --mode depth");
		if (depthMode && (config.contains("maxcost") || config.contains("frontier") || config.contains("expansions")))
			throw new ConfigureException("--maxcost, --frontier and --expansions only apply to --mode cost");
		if (config.getInt("kbest") < 0)
			throw new ConfigureException("-k must not be negative");
		if (config.contains("maxdepth") && config.getInt("maxdepth") < 1)
			throw new ConfigureException("--maxdepth must be at least 1");
		if (config.contains("maxcost") && config.getInt("maxcost") < 0)
			throw new ConfigureException("--maxcost must not be negative");
		if (config.contains("frontier") && config.getInt("frontier") < 1)
			throw new ConfigureException("--frontier must be at least 1");
		if (config.contains("expansions") && config.getLong("expansions") < 1)
			throw new ConfigureException("--expansions must be at least 1");
		for (String kind : kinds) {
			if (config.contains("max-"+kind) && config.getInt("max-"+kind) < 0)
				throw new ConfigureException("--max-"+kind+" must not be negative");
		}
		return config;
	}

	private static int intOr(JSAPResult config, String id, int dflt) {
		return config.contains(id) ? config.getInt(id) : dflt;
	}

	// the word from the remaining arguments
	static List<Symbol> readWord(JSAPResult config) {
		String[] parts = config.contains("word") ? config.getStringArray("word") : new String[0];
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < parts.length; i++) {
			if (i > 0 && !config.getBoolean("chars"))
				sb.append(' ');
			sb.append(parts[i]);
		}
		if (config.getBoolean("chars"))
			return SymbolFactory.getCharWord(sb.toString());
		return SymbolFactory.getWord(sb.toString());
	}

	static CorrectionEnumerator makeEnumerator(JSAPResult config, CorrectionParse parse) {
		EditLimits limits = new EditLimits(intOr(config, "max-insertions", EditLimits.UNLIMITED),
				intOr(config, "max-deletions", EditLimits.UNLIMITED),
				intOr(config, "max-substitutions", EditLimits.UNLIMITED),
				intOr(config, "max-edits", EditLimits.UNLIMITED));
		if (config.getString("mode").equals("depth")) {
			DepthFirstEnumerator.CyclePolicy policy = config.getBoolean("loopfree") ?
					DepthFirstEnumerator.CyclePolicy.FORBID_REPEAT : DepthFirstEnumerator.CyclePolicy.ALLOW_REPEAT;
			return new DepthFirstEnumerator(parse.getForest(), parse.getRoots(),
					intOr(config, "maxdepth", DepthFirstEnumerator.UNBOUNDED), policy, limits);
		}
		return new CostOrderedEnumerator(parse.getForest(), parse.getRoots(),
				intOr(config, "maxcost", CostOrderedEnumerator.UNBOUNDED),
				intOr(config, "frontier", CostOrderedEnumerator.UNBOUNDED),
				config.contains("expansions") ? config.getLong("expansions") : CostOrderedEnumerator.DEFAULT_EXPANSIONS,
				limits);
	}

	/**
	 * Does everything main does, writing to the given writer unless an output file is named.
	 * @return the exit status
	 */
	public static int run(String[] argv, Writer out) throws IOException {
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Corrigo options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Corrigo options improperly configured: "+e.getMessage());
			System.err.println("Try 'corrigo -h' for a detailed help message");
			return 1;
		}
		if (config.getBoolean("help", false)) {
			Debug.prettyDebug("Usage: corrigo ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}
		if (!config.success()) {
			for (java.util.Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: "+errs.next());
			Debug.prettyDebug("Usage: corrigo ");
			Debug.prettyDebug("             "+jsap.getUsage());
			return 1;
		}
		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		if (config.contains("timedebug"))
			Debug.setDbLevel(config.getInt("timedebug"));

		Grammar gram = null;
		try {
			Date readTime = new Date();
			CFGRuleSet raw = new CFGRuleSet(config.getString("grammar"), encoding);
			gram = Grammar.compile(raw);
			Debug.dbtime(1, readTime, "read and compiled grammar");
		}
		catch (FileNotFoundException e) {
			System.err.println("Grammar file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading grammar: "+e.getMessage());
			return 1;
		}
		catch (GrammarException e) {
			System.err.println("Bad grammar: "+e.getMessage());
			return 1;
		}

		List<Symbol> word = readWord(config);
		AbstractCorrectionParser parser = config.getString("parser").equals("static") ?
				new StaticCorrectionParser(gram) : new EarleyCorrectionParser(gram);
		CorrectionParse parse = null;
		try {
			parse = parser.parse(word);
		}
		catch (NoDerivationException e) {
			System.err.println("Internal error, no correction found: "+e.getMessage());
			return 1;
		}

		Writer w = out;
		if (config.contains("outfile"))
			w = new OutputStreamWriter(new FileOutputStream(config.getString("outfile")), encoding);
		try {
			if (config.getBoolean("check")) {
				w.write("% grammar: "+gram.getNonterminals().size()+" nonterminals, "+gram.getTerminals().size()+
						" terminals, "+gram.getNumRules()+" rules\n");
				w.write("% forest: "+parse+"\n");
				w.write("% minimum cost: "+parse.getForest().minimumCost(parse.getRoot())+"\n");
			}
			CorrectionEnumerator en = makeEnumerator(config, parse);
			ArrayList<Correction> found = new ArrayList<Correction>();
			int k = config.getInt("kbest");
			try {
				while (found.size() < k && en.hasNext())
					found.add(en.next());
				if (found.size() < k && en.isTruncated())
					Debug.prettyDebug("Stopped after "+found.size()+" corrections: "+en.getLimit()+" limit reached");
			}
			catch (EnumerationLimitExceededException e) {
				Debug.prettyDebug("Stopped after "+found.size()+" corrections: "+e.getMessage());
			}
			HashSet<WordOrderedCorrection> keep = null;
			if (config.getBoolean("smallest"))
				keep = new HashSet<WordOrderedCorrection>(CorrectionSets.smallestCorrections(found));
			EarleyRecognizer rec = config.getBoolean("verify") ? new EarleyRecognizer(gram) : null;
			for (Correction c : found) {
				if (keep != null && !keep.contains(WordOrderedCorrection.of(c)))
					continue;
				w.write(c.toString());
				if (rec != null)
					w.write(rec.recognize(c.getCorrected()) ? "\tok" : "\tFAILED");
				w.write("\n");
			}
		}
		finally {
			if (w != out)
				w.close();
			else
				w.flush();
		}
		Debug.dbtime(1, startTime, "total");
		return 0;
	}

	public static void main(String argv[]) throws Exception {
		Debug.prettyDebug("This is Corrigo, version "+VERSION);
		OutputStreamWriter out = new OutputStreamWriter(System.out, "utf-8");
		int status = run(argv, out);
		if (status != 0)
			System.exit(status);
	}
}
