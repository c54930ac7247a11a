package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.arizona.cs.sdqc.features.FeatureBag;

/**
 * Feature bags with the class label of each, plus the full list of class
 * names of the problem (some of which may have no example).
 **/
public final class TrainingData {

	private final List<FeatureBag> bags;
	private final List<String> labels;
	private final List<String> classNames;

	public TrainingData(List<FeatureBag> bags, List<String> labels, List<String> classNames) {
		if (bags.size() != labels.size()) {
			throw new IllegalArgumentException(bags.size() + " messages but " + labels.size() + " labels");
		}
		for (String label : labels) {
			if (!classNames.contains(label)) {
				throw new IllegalArgumentException("Label '" + label + "' is not one of " + classNames);
			}
		}
		this.bags = Collections.unmodifiableList(new ArrayList<FeatureBag>(bags));
		this.labels = Collections.unmodifiableList(new ArrayList<String>(labels));
		this.classNames = Collections.unmodifiableList(new ArrayList<String>(classNames));
	}

	public List<FeatureBag> getBags() {
		return bags;
	}

	public List<String> getLabels() {
		return labels;
	}

	public List<String> getClassNames() {
		return classNames;
	}

	public int size() {
		return bags.size();
	}

	public boolean isEmpty() {
		return bags.isEmpty();
	}

	/*
	 * The examples at the given positions, in that order
	 */
	public TrainingData subset(List<Integer> indices) {
		List<FeatureBag> subBags = new ArrayList<FeatureBag>(indices.size());
		List<String> subLabels = new ArrayList<String>(indices.size());
		for (int index : indices) {
			subBags.add(bags.get(index));
			subLabels.add(labels.get(index));
		}
		return new TrainingData(subBags, subLabels, classNames);
	}
}
