package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits labelled examples into k folds with about the same share of every
 * class. The split is deterministic: examples of each class are dealt out to
 * the folds in turn, classes taken in name order, examples in input order.
 **/
public final class StratifiedFolds {

	private final int[] foldOf;
	private final int foldCount;

	private StratifiedFolds(int[] foldOf, int foldCount) {
		this.foldOf = foldOf;
		this.foldCount = foldCount;
	}

	public static StratifiedFolds of(List<String> labels, int foldCount) {
		if (foldCount < 2) {
			throw new IllegalArgumentException("Cross validation needs at least 2 folds, got " + foldCount);
		}
		if (foldCount > labels.size()) {
			throw new IllegalArgumentException("Cannot split " + labels.size() + " examples into " + foldCount
					+ " folds");
		}
		Map<String, List<Integer>> byClass = new TreeMap<String, List<Integer>>();
		for (int i = 0; i < labels.size(); i++) {
			List<Integer> members = byClass.get(labels.get(i));
			if (members == null) {
				members = new ArrayList<Integer>();
				byClass.put(labels.get(i), members);
			}
			members.add(i);
		}
		int[] foldOf = new int[labels.size()];
		int dealt = 0;
		for (List<Integer> members : byClass.values()) {
			for (int index : members) {
				foldOf[index] = dealt % foldCount;
				dealt++;
			}
		}
		return new StratifiedFolds(foldOf, foldCount);
	}

	public int foldCount() {
		return foldCount;
	}

	/*
	 * Positions of the examples held out in the fold
	 */
	public List<Integer> testIndices(int fold) {
		List<Integer> indices = new ArrayList<Integer>();
		for (int i = 0; i < foldOf.length; i++) {
			if (foldOf[i] == fold) {
				indices.add(i);
			}
		}
		return Collections.unmodifiableList(indices);
	}

	/*
	 * Positions of the examples trained on in the fold
	 */
	public List<Integer> trainIndices(int fold) {
		List<Integer> indices = new ArrayList<Integer>();
		for (int i = 0; i < foldOf.length; i++) {
			if (foldOf[i] != fold) {
				indices.add(i);
			}
		}
		return Collections.unmodifiableList(indices);
	}
}
