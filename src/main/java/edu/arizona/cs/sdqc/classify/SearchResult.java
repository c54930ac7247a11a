package edu.arizona.cs.sdqc.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a hyperparameter search.
 **/
public final class SearchResult {

	private final ClassifierProfile bestProfile;
	private final double bestScore;
	private final StanceModel model;
	private final Map<ClassifierProfile, Double> scores;

	public SearchResult(ClassifierProfile bestProfile, double bestScore, StanceModel model,
			Map<ClassifierProfile, Double> scores) {
		this.bestProfile = bestProfile;
		this.bestScore = bestScore;
		this.model = model;
		this.scores = Collections.unmodifiableMap(new LinkedHashMap<ClassifierProfile, Double>(scores));
	}

	public ClassifierProfile getBestProfile() {
		return bestProfile;
	}

	/*
	 * Mean held-out accuracy of the best profile
	 */
	public double getBestScore() {
		return bestScore;
	}

	public StanceModel getModel() {
		return model;
	}

	/*
	 * Mean held-out accuracy of every candidate, in search order
	 */
	public Map<ClassifierProfile, Double> getScores() {
		return scores;
	}
}
