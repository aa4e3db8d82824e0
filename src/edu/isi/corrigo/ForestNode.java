package edu.isi.corrigo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

// one node of a correction forest. alternatives are packed in insertion order and never
// duplicated. only the owning forest adds to them
public class ForestNode {
	private final int handle;
	private final NodeLabel label;
	private final ArrayList<PackedAlternative> alts;
	private final HashSet<PackedAlternative> altSet;

	ForestNode(int h, NodeLabel l) {
		handle = h;
		label = l;
		alts = new ArrayList<PackedAlternative>(2);
		altSet = new HashSet<PackedAlternative>(4);
	}

	// false if already packed here
	boolean add(PackedAlternative a) {
		if (!altSet.add(a))
			return false;
		alts.add(a);
		return true;
	}

	public int getHandle() { return handle; }
	public NodeLabel getLabel() { return label; }
	public List<PackedAlternative> getAlternatives() { return Collections.unmodifiableList(alts); }
	public int getNumAlternatives() { return alts.size(); }
	public boolean isAmbiguous() { return alts.size() > 1; }

	public String toString() {
		return "#"+handle+" "+label+" "+alts;
	}
}
