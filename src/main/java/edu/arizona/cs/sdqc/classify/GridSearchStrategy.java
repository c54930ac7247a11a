package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exhaustive search over every candidate of the search space. Each candidate
 * is scored by its mean accuracy over stratified folds, with the feature
 * composer refitted on the training part of each fold. The best candidate
 * wins, the earlier one on equal scores, and is retrained on all of the data.
 *
 * Candidate/fold evaluations share no state and run on a fixed pool of worker
 * threads when the parallelism is above 1.
 **/
public class GridSearchStrategy implements SearchStrategy {

	private static final Logger LOGGER = LoggerFactory.getLogger(GridSearchStrategy.class);

	private final int parallelism;

	public GridSearchStrategy() {
		this(1);
	}

	public GridSearchStrategy(int parallelism) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
		}
		this.parallelism = parallelism;
	}

	@Override
	public SearchResult search(ClassifierProfile defaults, SearchSpace space, TrainingData data, int foldCount)
			throws Exception {
		if (data.isEmpty()) {
			throw new IllegalArgumentException("No training data for classifier " + defaults.getName());
		}
		List<ClassifierProfile> candidates = space.expand(defaults);
		StratifiedFolds folds = StratifiedFolds.of(data.getLabels(), foldCount);
		LOGGER.info("Searching {} candidate(s) for {} with {}-fold cross validation on {} messages",
				candidates.size(), defaults.getName(), foldCount, data.size());

		List<Callable<Double>> tasks = new ArrayList<Callable<Double>>();
		for (ClassifierProfile candidate : candidates) {
			for (int fold = 0; fold < foldCount; fold++) {
				tasks.add(foldTask(candidate, data, folds, fold));
			}
		}
		List<Double> accuracies = run(tasks);

		Map<ClassifierProfile, Double> scores = new LinkedHashMap<ClassifierProfile, Double>();
		ClassifierProfile best = null;
		double bestScore = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < candidates.size(); i++) {
			double sum = 0.0;
			for (int fold = 0; fold < foldCount; fold++) {
				sum += accuracies.get(i * foldCount + fold);
			}
			double mean = sum / foldCount;
			scores.put(candidates.get(i), mean);
			LOGGER.debug("{} -> mean accuracy {}", candidates.get(i).describe(), String.format("%.3f", mean));
			if (mean > bestScore) {
				bestScore = mean;
				best = candidates.get(i);
			}
		}

		LOGGER.info("Best {} score: {}", defaults.getName(), String.format("%.3f", bestScore));
		LOGGER.info("Best {} settings: {}", defaults.getName(), best.describe());
		StanceModel model = StanceModel.train(best, data);
		return new SearchResult(best, bestScore, model, scores);
	}

	/*
	 * Trains the candidate on the training part of the fold and scores it on
	 * the held out part
	 */
	private static Callable<Double> foldTask(final ClassifierProfile candidate, final TrainingData data,
			final StratifiedFolds folds, final int fold) {
		return new Callable<Double>() {
			@Override
			public Double call() throws Exception {
				TrainingData train = data.subset(folds.trainIndices(fold));
				TrainingData test = data.subset(folds.testIndices(fold));
				StanceModel model = StanceModel.train(candidate, train);
				return accuracy(test.getLabels(), model.predict(test.getBags()));
			}
		};
	}

	private List<Double> run(List<Callable<Double>> tasks) throws Exception {
		List<Double> results = new ArrayList<Double>(tasks.size());
		if (parallelism == 1 || tasks.size() == 1) {
			for (Callable<Double> task : tasks) {
				results.add(task.call());
			}
			return results;
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
		try {
			List<Future<Double>> futures = new ArrayList<Future<Double>>(tasks.size());
			for (Callable<Double> task : tasks) {
				futures.add(executor.submit(task));
			}
			for (Future<Double> future : futures) {
				try {
					results.add(future.get());
				} catch (ExecutionException e) {
					Throwable cause = e.getCause();
					if (cause instanceof Exception) {
						throw (Exception) cause;
					}
					throw e;
				}
			}
		} finally {
			executor.shutdownNow();
		}
		return results;
	}

	static double accuracy(List<String> gold, List<String> predicted) {
		if (gold.isEmpty()) {
			return 0.0;
		}
		int correct = 0;
		for (int i = 0; i < gold.size(); i++) {
			if (gold.get(i).equals(predicted.get(i))) {
				correct++;
			}
		}
		return (double) correct / gold.size();
	}

	public int getParallelism() {
		return parallelism;
	}
}
