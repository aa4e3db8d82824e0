package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

// operations on sets of corrections
public class CorrectionSets {

	/**
	 * Minimal elements under {@link WordOrderedCorrection#compare}: the corrections no other
	 * correction of the set is smaller than. Input order is kept; duplicates appear once.
	 * Corrections of words of different lengths never compare, so each length is treated apart.
	 */
	public static List<WordOrderedCorrection> smallest(Collection<WordOrderedCorrection> set) {
		boolean debug = false;
		ArrayList<WordOrderedCorrection> distinct = new ArrayList<WordOrderedCorrection>(new LinkedHashSet<WordOrderedCorrection>(set));
		ArrayList<WordOrderedCorrection> ret = new ArrayList<WordOrderedCorrection>();
		for (WordOrderedCorrection c : distinct) {
			boolean minimal = true;
			for (WordOrderedCorrection d : distinct) {
				if (d == c || d.getNumSteps() != c.getNumSteps())
					continue;
				if (d.compare(c) == WordOrderedCorrection.Comparison.SMALLER) {
					if (debug) Debug.debug(debug, d+" beats "+c);
					minimal = false;
					break;
				}
			}
			if (minimal)
				ret.add(c);
		}
		return ret;
	}

	// same, starting from aligned corrections
	public static List<WordOrderedCorrection> smallestCorrections(Collection<Correction> set) {
		ArrayList<WordOrderedCorrection> w = new ArrayList<WordOrderedCorrection>();
		for (Correction c : set)
			w.add(WordOrderedCorrection.of(c));
		return smallest(w);
	}
}
