package edu.arizona.cs.sdqc.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.classify.BankPredictions;
import edu.arizona.cs.sdqc.classify.BankRole;
import edu.arizona.cs.sdqc.ensemble.CombinationStrategy;
import edu.arizona.cs.sdqc.ensemble.EnsembleResult;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Logs how the classifiers and both combinations did on the evaluation set.
 * Nothing computed here flows back into classification.
 **/
public class EvaluationReporter {

	private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationReporter.class);

	private static final String SEPARATOR = "============================================================";

	/**
	 * Evaluates the five prediction sequences against the gold labels.
	 *
	 * @return the evaluations by title, in report order
	 **/
	public Map<String, StanceEvaluation> evaluate(BankPredictions predictions, EnsembleResult ensemble,
			List<StanceLabel> gold) throws Exception {
		Map<String, StanceEvaluation> evaluations = new LinkedHashMap<String, StanceEvaluation>();
		for (BankRole role : new BankRole[] { BankRole.DENY, BankRole.QUERY, BankRole.BASE }) {
			evaluations.put(role.roleName(), StanceEvaluation.of(role.roleName(), role.classNames(),
					role.labelsFor(gold), predictions.get(role)));
		}
		List<String> goldNames = BankRole.BASE.labelsFor(gold);
		for (CombinationStrategy strategy : CombinationStrategy.values()) {
			evaluations.put(strategy.description(), StanceEvaluation.of(strategy.description(),
					StanceLabel.labelNames(), goldNames, names(ensemble.labels(strategy))));
		}
		return evaluations;
	}

	/**
	 * Writes accuracies, classification reports and confusion matrices to the
	 * log.
	 **/
	public void report(Map<String, StanceEvaluation> evaluations) throws Exception {
		for (StanceEvaluation evaluation : evaluations.values()) {
			LOGGER.info("{} accuracy: {}", evaluation.getTitle(), String.format("%.3f", evaluation.accuracy()));
		}
		LOGGER.info("classification report:");
		for (StanceEvaluation evaluation : evaluations.values()) {
			LOGGER.info("{}\n{}", evaluation.getTitle(), ReportFormatter.classificationReport(evaluation));
			LOGGER.debug("{}", evaluation.toClassDetailsString());
		}
		for (StanceEvaluation evaluation : evaluations.values()) {
			LOGGER.info("confusion matrix ({}):\n{}", evaluation.getTitle(), ReportFormatter.confusionMatrix(evaluation));
		}
	}

	/**
	 * Writes the misclassified messages of a one-vs-rest classifier to the log.
	 **/
	public void reportMisclassified(StanceLabel target, List<Misclassification> misclassified) {
		LOGGER.info(SEPARATOR);
		LOGGER.info("Misclassified - {} ({} messages)", target.labelName(), misclassified.size());
		LOGGER.info(SEPARATOR);
		for (Misclassification wrong : misclassified) {
			LOGGER.info("{}", wrong);
		}
	}

	private static List<String> names(List<StanceLabel> labels) {
		List<String> names = new ArrayList<String>(labels.size());
		for (StanceLabel label : labels) {
			names.add(label.labelName());
		}
		return names;
	}
}
