package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.arizona.cs.sdqc.features.FeatureBag;
import edu.arizona.cs.sdqc.features.FeatureChannel;

/**
 * One dimensional data the linear classifiers can separate at x = 6.
 **/
final class ProfileFixtures {

	private ProfileFixtures() {
	}

	static ClassifierProfile linear() {
		return new ClassifierProfile("linear", KernelType.LINEAR, 1.0, null, ClassBalance.NONE,
				Arrays.asList(FeatureChannel.numeric("x", 1.0, "x"), FeatureChannel.numeric("noise", 0.0, "noise")));
	}

	static FeatureBag point(String id, double x) {
		return FeatureBag.builder(id).put("x", x).put("noise", 0).build();
	}

	static TrainingData separable() {
		List<FeatureBag> bags = new ArrayList<FeatureBag>();
		List<String> labels = new ArrayList<String>();
		double[] low = { 0, 1, 2 };
		double[] high = { 10, 11, 12 };
		for (double x : low) {
			bags.add(point("lo" + x, x));
			labels.add("lo");
		}
		for (double x : high) {
			bags.add(point("hi" + x, x));
			labels.add("hi");
		}
		return new TrainingData(bags, labels, Arrays.asList("hi", "lo"));
	}
}
