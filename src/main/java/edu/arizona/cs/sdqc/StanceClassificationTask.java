package edu.arizona.cs.sdqc;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.classify.BankPredictions;
import edu.arizona.cs.sdqc.classify.BankRole;
import edu.arizona.cs.sdqc.classify.ClassifierBank;
import edu.arizona.cs.sdqc.classify.ClassifierProfile;
import edu.arizona.cs.sdqc.classify.GridSearchStrategy;
import edu.arizona.cs.sdqc.classify.SearchSpace;
import edu.arizona.cs.sdqc.config.ProfileCatalog;
import edu.arizona.cs.sdqc.config.SdqcConfig;
import edu.arizona.cs.sdqc.ensemble.EnsembleCombiner;
import edu.arizona.cs.sdqc.ensemble.EnsembleResult;
import edu.arizona.cs.sdqc.eval.EvaluationReporter;
import edu.arizona.cs.sdqc.eval.MisclassificationReport;
import edu.arizona.cs.sdqc.features.FeatureBag;
import edu.arizona.cs.sdqc.features.FeatureExtractor;
import edu.arizona.cs.sdqc.features.LexiconFeatureExtractor;
import edu.arizona.cs.sdqc.filter.TrainingFilter;
import edu.arizona.cs.sdqc.model.Annotations;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.MessageIndex;
import edu.arizona.cs.sdqc.model.ParentLookup;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * One train / evaluate run of the SDQC stance classifier: filter the training
 * replies, extract features, train the base, deny and query classifiers,
 * predict the evaluation messages, combine the three predictions and report
 * how well each of them did.
 **/
public class StanceClassificationTask {

	private static final Logger LOGGER = LoggerFactory.getLogger(StanceClassificationTask.class);

	private final FeatureExtractor extractor;
	private final TrainingFilter filter;
	private final ClassifierBank bank;
	private final EnsembleCombiner combiner;
	private final EvaluationReporter reporter;

	public StanceClassificationTask(FeatureExtractor extractor, TrainingFilter filter, ClassifierBank bank,
			EnsembleCombiner combiner, EvaluationReporter reporter) {
		this.extractor = extractor;
		this.filter = filter;
		this.bank = bank;
		this.combiner = combiner;
		this.reporter = reporter;
	}

	/**
	 * Wires a task from the run settings and the profile catalog they name.
	 **/
	public static StanceClassificationTask fromConfig(SdqcConfig config, ProfileCatalog catalog) {
		FeatureExtractor extractor = new LexiconFeatureExtractor(config.getExtractorOptions());
		TrainingFilter filter = new TrainingFilter(extractor, config.isFilterShort(), config.getSimilarityThreshold());

		Map<BankRole, ClassifierProfile> profiles = new EnumMap<BankRole, ClassifierProfile>(BankRole.class);
		Map<BankRole, SearchSpace> spaces = new EnumMap<BankRole, SearchSpace>(BankRole.class);
		for (BankRole role : BankRole.values()) {
			profiles.put(role, catalog.profile(config.getProfileName(role)));
			spaces.put(role, catalog.searchSpace(config.getSearchSpaceName(role)));
			LOGGER.info("{} classifier: profile {}, search space {}", role.roleName(), config.getProfileName(role),
					config.getSearchSpaceName(role));
		}
		ClassifierBank bank = new ClassifierBank(new GridSearchStrategy(config.getSearchParallelism()),
				config.getFoldCount(), profiles, spaces);
		return new StanceClassificationTask(extractor, filter, bank, new EnsembleCombiner(), new EvaluationReporter());
	}

	/**
	 * Trains on the training threads and labels the evaluation threads.
	 *
	 * @param train            the training messages and their threads
	 * @param eval             the evaluation messages; parents missing from
	 *                         it are looked up in the training threads
	 * @param trainAnnotations gold labels covering every training message
	 * @param evalAnnotations  gold labels covering every evaluation message,
	 *                         used to pick the combination strategy and for
	 *                         the reports
	 * @return the final stance of every evaluation message, in evaluation
	 *         order
	 **/
	public Map<String, StanceLabel> classify(MessageIndex train, MessageIndex eval, Annotations trainAnnotations,
			Annotations evalAnnotations) throws Exception {
		if (train.isEmpty()) {
			throw new IllegalArgumentException("No training messages");
		}
		trainAnnotations.requireCoverage(train);
		evalAnnotations.requireCoverage(eval);

		/*** Training ***/
		long start = System.currentTimeMillis();
		List<Message> kept = filter.filter(train.messages(), train);
		if (kept.isEmpty()) {
			throw new IllegalArgumentException("The training filter removed every training message");
		}
		List<FeatureBag> trainBags = extract(kept, train);
		List<StanceLabel> trainGold = trainAnnotations.labelsOf(kept);
		ClassifierBank.Fitted fitted = bank.fit(trainBags, trainGold);
		LOGGER.info("Training: {}s", seconds(start));

		/*** Evaluation ***/
		start = System.currentTimeMillis();
		List<Message> evalMessages = eval.messages();
		ParentLookup evalThreads = eval.withFallback(train);
		List<FeatureBag> evalBags = extract(evalMessages, evalThreads);
		BankPredictions predictions = fitted.predict(evalBags);
		LOGGER.info("Prediction: {}s", seconds(start));

		List<StanceLabel> evalGold = evalAnnotations.labelsOf(evalMessages);
		MisclassificationReport misclassified = new MisclassificationReport(extractor, evalThreads);
		reporter.reportMisclassified(StanceLabel.QUERY,
				misclassified.list(StanceLabel.QUERY, evalMessages, evalGold, predictions.get(BankRole.QUERY)));
		reporter.reportMisclassified(StanceLabel.DENY,
				misclassified.list(StanceLabel.DENY, evalMessages, evalGold, predictions.get(BankRole.DENY)));

		EnsembleResult ensemble = combiner.combine(ids(evalMessages), predictions, evalGold);
		if (!evalMessages.isEmpty()) {
			reporter.report(reporter.evaluate(predictions, ensemble, evalGold));
		}
		return ensemble.getFinalLabels();
	}

	private List<FeatureBag> extract(List<Message> messages, ParentLookup thread) {
		List<FeatureBag> bags = new ArrayList<FeatureBag>(messages.size());
		for (Message message : messages) {
			bags.add(extractor.extract(message, thread));
		}
		return bags;
	}

	private static List<String> ids(List<Message> messages) {
		List<String> ids = new ArrayList<String>(messages.size());
		for (Message message : messages) {
			ids.add(message.getId());
		}
		return ids;
	}

	private static String seconds(long start) {
		return String.format("%.3f", (System.currentTimeMillis() - start) / 1000.0);
	}

	public FeatureExtractor getExtractor() {
		return extractor;
	}

	public TrainingFilter getFilter() {
		return filter;
	}

	public ClassifierBank getBank() {
		return bank;
	}
}
