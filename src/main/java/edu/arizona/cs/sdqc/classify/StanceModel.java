package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.arizona.cs.sdqc.features.FeatureBag;
import edu.arizona.cs.sdqc.features.FeatureComposer;
import weka.classifiers.Classifier;
import weka.classifiers.functions.SMO;
import weka.classifiers.functions.supportVector.Kernel;
import weka.classifiers.functions.supportVector.PolyKernel;
import weka.classifiers.functions.supportVector.RBFKernel;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SelectedTag;

/**
 * A fitted classifier: the feature composer and the Weka support vector
 * machine trained through it. Never changes after {@link #train}.
 **/
public final class StanceModel {

	// Degree of the POLYNOMIAL kernel
	static final double POLYNOMIAL_EXPONENT = 3.0;

	private final ClassifierProfile profile;
	private final FeatureComposer.Fitted composer;
	private final Classifier classifier;

	private StanceModel(ClassifierProfile profile, FeatureComposer.Fitted composer, Classifier classifier) {
		this.profile = profile;
		this.composer = composer;
		this.classifier = classifier;
	}

	/**
	 * Fits the composer of the profile on the training data and trains the
	 * support vector machine on the composed instances.
	 **/
	public static StanceModel train(ClassifierProfile profile, TrainingData data) throws Exception {
		if (data.isEmpty()) {
			throw new IllegalArgumentException("No training data for classifier " + profile.getName());
		}
		FeatureComposer.Fitted composer = profile.composer().fit(data.getBags(), data.getClassNames());
		Instances training = composer.toInstances(data.getBags(), data.getLabels());
		if (profile.getClassBalance() == ClassBalance.BALANCED) {
			balanceWeights(training);
		}
		Classifier classifier = buildClassifier(profile);
		classifier.buildClassifier(training);
		return new StanceModel(profile, composer, classifier);
	}

	/**
	 * The untrained Weka classifier described by the profile. Attribute
	 * normalization is off: the channel weights decide the scale of each
	 * column.
	 **/
	static Classifier buildClassifier(ClassifierProfile profile) {
		SMO smo = new SMO();
		smo.setC(profile.getC());
		smo.setFilterType(new SelectedTag(SMO.FILTER_NONE, SMO.TAGS_FILTER));
		smo.setKernel(buildKernel(profile));
		return smo;
	}

	static Kernel buildKernel(ClassifierProfile profile) {
		switch (profile.getKernel()) {
		case LINEAR:
			PolyKernel linear = new PolyKernel();
			linear.setExponent(1.0);
			return linear;
		case POLYNOMIAL:
			PolyKernel polynomial = new PolyKernel();
			polynomial.setExponent(POLYNOMIAL_EXPONENT);
			return polynomial;
		case RBF:
			RBFKernel rbf = new RBFKernel();
			rbf.setGamma(profile.getGamma());
			return rbf;
		default:
			throw new IllegalStateException("Unhandled kernel " + profile.getKernel());
		}
	}

	/*
	 * Weights every instance by n / (k * n_c), k being the number of classes
	 * that have examples
	 */
	static void balanceWeights(Instances data) {
		Map<Integer, Integer> counts = new HashMap<Integer, Integer>();
		for (Instance instance : data) {
			int value = (int) instance.classValue();
			Integer count = counts.get(value);
			counts.put(value, count == null ? 1 : count + 1);
		}
		double total = data.numInstances();
		for (Instance instance : data) {
			int count = counts.get((int) instance.classValue());
			instance.setWeight(total / (counts.size() * count));
		}
	}

	/**
	 * Predicts the class name of every bag, in order. Weka classifiers keep
	 * filter state while classifying, so calls are serialized.
	 **/
	public synchronized List<String> predict(List<FeatureBag> bags) throws Exception {
		Instances data = composer.toInstances(bags, null);
		List<String> predictions = new ArrayList<String>(bags.size());
		for (Instance instance : data) {
			double value = classifier.classifyInstance(instance);
			predictions.add(data.classAttribute().value((int) value));
		}
		return predictions;
	}

	public ClassifierProfile getProfile() {
		return profile;
	}

	/*
	 * The trained Weka model, as Weka prints it
	 */
	public String describeClassifier() {
		return classifier.toString();
	}

	@Override
	public String toString() {
		return "StanceModel[" + profile.describe() + ", " + composer.numFeatures() + " features]";
	}
}
