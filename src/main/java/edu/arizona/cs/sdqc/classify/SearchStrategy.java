package edu.arizona.cs.sdqc.classify;

/**
 * Picks the settings of a classifier by cross validation and trains the final
 * model with them.
 **/
public interface SearchStrategy {

	/**
	 * @param defaults  the profile the search starts from
	 * @param space     the candidate settings; empty means the defaults only
	 * @param data      the training examples
	 * @param foldCount number of cross validation folds
	 * @return the best profile, its mean held-out accuracy, and the model
	 *         trained with it on all of the data
	 **/
	SearchResult search(ClassifierProfile defaults, SearchSpace space, TrainingData data, int foldCount)
			throws Exception;
}
