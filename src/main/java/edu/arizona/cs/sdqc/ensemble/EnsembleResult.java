package edu.arizona.cs.sdqc.ensemble;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * The output of both combination strategies, their accuracies and the one
 * chosen.
 **/
public final class EnsembleResult {

	private final Map<CombinationStrategy, List<StanceLabel>> combined;
	private final Map<CombinationStrategy, Double> accuracies;
	private final CombinationStrategy chosen;
	private final Map<String, StanceLabel> finalLabels;

	EnsembleResult(Map<CombinationStrategy, List<StanceLabel>> combined, Map<CombinationStrategy, Double> accuracies,
			CombinationStrategy chosen, Map<String, StanceLabel> finalLabels) {
		this.combined = Collections.unmodifiableMap(new EnumMap<CombinationStrategy, List<StanceLabel>>(combined));
		this.accuracies = Collections.unmodifiableMap(new EnumMap<CombinationStrategy, Double>(accuracies));
		this.chosen = chosen;
		this.finalLabels = Collections.unmodifiableMap(new LinkedHashMap<String, StanceLabel>(finalLabels));
	}

	public List<StanceLabel> labels(CombinationStrategy strategy) {
		return combined.get(strategy);
	}

	public double accuracy(CombinationStrategy strategy) {
		return accuracies.get(strategy);
	}

	public CombinationStrategy getChosen() {
		return chosen;
	}

	/*
	 * Message id -> label of the chosen strategy, in evaluation order
	 */
	public Map<String, StanceLabel> getFinalLabels() {
		return finalLabels;
	}
}
