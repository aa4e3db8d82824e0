package edu.isi.corrigo;

// caps on the edits a correction may use, per kind and in total. UNLIMITED for no cap
public final class EditLimits {
	public static final int UNLIMITED = -1;
	public static final EditLimits NONE = new EditLimits(UNLIMITED, UNLIMITED, UNLIMITED, UNLIMITED);

	private final int maxInsertions;
	private final int maxDeletions;
	private final int maxSubstitutions;
	private final int maxEdits;

	public EditLimits(int insertions, int deletions, int substitutions, int edits) {
		maxInsertions = check(insertions, "insertions");
		maxDeletions = check(deletions, "deletions");
		maxSubstitutions = check(substitutions, "substitutions");
		maxEdits = check(edits, "edits");
	}

	private static int check(int v, String what) {
		if (v < UNLIMITED)
			throw new IllegalArgumentException("Maximum "+what+" must be non-negative or UNLIMITED; got "+v);
		return v;
	}

	private static boolean within(int count, int max) {
		return max == UNLIMITED || count <= max;
	}

	public boolean allows(int insertions, int deletions, int substitutions) {
		return within(insertions, maxInsertions) && within(deletions, maxDeletions)
			&& within(substitutions, maxSubstitutions)
			&& within(insertions+deletions+substitutions, maxEdits);
	}

	public boolean isUnlimited() {
		return maxInsertions == UNLIMITED && maxDeletions == UNLIMITED
			&& maxSubstitutions == UNLIMITED && maxEdits == UNLIMITED;
	}

	public int getMaxInsertions() { return maxInsertions; }
	public int getMaxDeletions() { return maxDeletions; }
	public int getMaxSubstitutions() { return maxSubstitutions; }
	public int getMaxEdits() { return maxEdits; }

	public String toString() {
		return "ins<="+str(maxInsertions)+" del<="+str(maxDeletions)+" sub<="+str(maxSubstitutions)+" all<="+str(maxEdits);
	}
	private static String str(int v) {
		return v == UNLIMITED ? "*" : Integer.toString(v);
	}
}
