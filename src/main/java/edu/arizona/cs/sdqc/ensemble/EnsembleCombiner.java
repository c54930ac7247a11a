package edu.arizona.cs.sdqc.ensemble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.classify.BankPredictions;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Merges the three classifier outputs with both combination strategies and
 * keeps the one with the higher accuracy against the gold labels. On equal
 * accuracy {@link CombinationStrategy#WITHOUT_DENY} is kept.
 **/
public class EnsembleCombiner {

	private static final Logger LOGGER = LoggerFactory.getLogger(EnsembleCombiner.class);

	/**
	 * @param messageIds  ids of the evaluation messages, in prediction order
	 * @param predictions the outputs of the classifier bank
	 * @param gold        the gold labels of the messages, in the same order
	 **/
	public EnsembleResult combine(List<String> messageIds, BankPredictions predictions, List<StanceLabel> gold) {
		if (messageIds.size() != predictions.size() || gold.size() != predictions.size()) {
			throw new IllegalArgumentException("Expected " + predictions.size() + " message ids and gold labels, got "
					+ messageIds.size() + " and " + gold.size());
		}

		Map<CombinationStrategy, List<StanceLabel>> combined = new EnumMap<CombinationStrategy, List<StanceLabel>>(
				CombinationStrategy.class);
		Map<CombinationStrategy, Double> accuracies = new EnumMap<CombinationStrategy, Double>(
				CombinationStrategy.class);
		for (CombinationStrategy strategy : CombinationStrategy.values()) {
			List<StanceLabel> labels = apply(strategy, predictions);
			combined.put(strategy, Collections.unmodifiableList(labels));
			accuracies.put(strategy, accuracy(gold, labels));
		}

		CombinationStrategy chosen = choose(accuracies.get(CombinationStrategy.WITHOUT_DENY),
				accuracies.get(CombinationStrategy.WITH_DENY));
		LOGGER.info("Using {} ({} vs {})", chosen.description(),
				String.format("%.3f", accuracies.get(CombinationStrategy.WITHOUT_DENY)),
				String.format("%.3f", accuracies.get(CombinationStrategy.WITH_DENY)));

		Map<String, StanceLabel> finalLabels = new LinkedHashMap<String, StanceLabel>();
		List<StanceLabel> chosenLabels = combined.get(chosen);
		for (int i = 0; i < messageIds.size(); i++) {
			finalLabels.put(messageIds.get(i), chosenLabels.get(i));
		}
		return new EnsembleResult(combined, accuracies, chosen, finalLabels);
	}

	public static List<StanceLabel> apply(CombinationStrategy strategy, BankPredictions predictions) {
		List<StanceLabel> labels = new ArrayList<StanceLabel>(predictions.size());
		for (int i = 0; i < predictions.size(); i++) {
			labels.add(strategy.combine(predictions.getBase().get(i), predictions.getDeny().get(i),
					predictions.getQuery().get(i)));
		}
		return labels;
	}

	/*
	 * The deny variant has to be strictly better to be chosen
	 */
	static CombinationStrategy choose(double withoutDenyAccuracy, double withDenyAccuracy) {
		return withDenyAccuracy > withoutDenyAccuracy ? CombinationStrategy.WITH_DENY
				: CombinationStrategy.WITHOUT_DENY;
	}

	static double accuracy(List<StanceLabel> gold, List<StanceLabel> predicted) {
		if (gold.isEmpty()) {
			return 0.0;
		}
		int correct = 0;
		for (int i = 0; i < gold.size(); i++) {
			if (gold.get(i) == predicted.get(i)) {
				correct++;
			}
		}
		return (double) correct / gold.size();
	}
}
