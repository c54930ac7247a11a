package edu.arizona.cs.sdqc.classify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.features.FeatureBag;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * The base, deny and query classifiers. Each one has its own profile and
 * search space and is tuned by the shared search strategy.
 **/
public class ClassifierBank {

	private static final Logger LOGGER = LoggerFactory.getLogger(ClassifierBank.class);

	public static final int DEFAULT_FOLDS = 3;

	private final SearchStrategy strategy;
	private final int foldCount;
	private final Map<BankRole, ClassifierProfile> profiles;
	private final Map<BankRole, SearchSpace> spaces;

	public ClassifierBank(SearchStrategy strategy, int foldCount, Map<BankRole, ClassifierProfile> profiles,
			Map<BankRole, SearchSpace> spaces) {
		this.strategy = strategy;
		this.foldCount = foldCount;
		this.profiles = new EnumMap<BankRole, ClassifierProfile>(BankRole.class);
		this.profiles.putAll(profiles);
		this.spaces = new EnumMap<BankRole, SearchSpace>(BankRole.class);
		for (BankRole role : BankRole.values()) {
			if (!this.profiles.containsKey(role)) {
				throw new IllegalArgumentException("No classifier profile for " + role.roleName());
			}
			SearchSpace space = spaces.get(role);
			this.spaces.put(role, space == null ? SearchSpace.empty() : space);
		}
	}

	/**
	 * Tunes and trains the three classifiers on the same messages.
	 *
	 * @param bags the feature bags of the training messages
	 * @param gold their four-class gold labels, in the same order
	 **/
	public Fitted fit(List<FeatureBag> bags, List<StanceLabel> gold) throws Exception {
		if (bags.isEmpty()) {
			throw new IllegalArgumentException("The classifier bank cannot be trained on no messages");
		}
		Map<BankRole, SearchResult> results = new EnumMap<BankRole, SearchResult>(BankRole.class);
		for (BankRole role : BankRole.values()) {
			LOGGER.info("Training the {} classifier", role.roleName());
			long start = System.currentTimeMillis();
			TrainingData data = new TrainingData(bags, role.labelsFor(gold), role.classNames());
			SearchResult result = strategy.search(profiles.get(role), spaces.get(role), data, foldCount);
			LOGGER.info("{} training: {}s", role.roleName(),
					String.format("%.3f", (System.currentTimeMillis() - start) / 1000.0));
			results.put(role, result);
		}
		return new Fitted(results);
	}

	public ClassifierProfile getProfile(BankRole role) {
		return profiles.get(role);
	}

	public SearchSpace getSearchSpace(BankRole role) {
		return spaces.get(role);
	}

	public int getFoldCount() {
		return foldCount;
	}

	/**
	 * The trained bank.
	 **/
	public static final class Fitted {

		private final Map<BankRole, SearchResult> results;

		private Fitted(Map<BankRole, SearchResult> results) {
			this.results = Collections.unmodifiableMap(results);
		}

		public SearchResult result(BankRole role) {
			return results.get(role);
		}

		public StanceModel model(BankRole role) {
			return results.get(role).getModel();
		}

		/**
		 * Runs the three classifiers over the same messages.
		 **/
		public BankPredictions predict(List<FeatureBag> bags) throws Exception {
			return new BankPredictions(model(BankRole.BASE).predict(bags), model(BankRole.DENY).predict(bags),
					model(BankRole.QUERY).predict(bags));
		}
	}
}
