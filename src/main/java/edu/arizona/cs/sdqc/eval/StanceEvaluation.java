package edu.arizona.cs.sdqc.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import weka.classifiers.Evaluation;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;

/**
 * Scores a sequence of predictions against gold labels with Weka's
 * {@link Evaluation}, which gives accuracy, per class precision, recall and
 * F1, and the confusion matrix.
 **/
public final class StanceEvaluation {

	private final String title;
	private final List<String> classNames;
	private final Evaluation evaluation;
	private final int[] support;

	private StanceEvaluation(String title, List<String> classNames, Evaluation evaluation, int[] support) {
		this.title = title;
		this.classNames = classNames;
		this.evaluation = evaluation;
		this.support = support;
	}

	/**
	 * @param title      name of the evaluated classifier, for the reports
	 * @param classNames the classes, in report order
	 * @param gold       gold labels
	 * @param predicted  predicted labels, aligned with the gold ones
	 **/
	public static StanceEvaluation of(String title, List<String> classNames, List<String> gold,
			List<String> predicted) throws Exception {
		if (gold.size() != predicted.size()) {
			throw new IllegalArgumentException(gold.size() + " gold labels but " + predicted.size() + " predictions");
		}
		ArrayList<Attribute> attributes = new ArrayList<Attribute>();
		Attribute classAttribute = new Attribute("the_class", new ArrayList<String>(classNames));
		attributes.add(classAttribute);
		Instances header = new Instances(title, attributes, gold.size());
		header.setClassIndex(0);

		Evaluation evaluation = new Evaluation(header);
		int[] support = new int[classNames.size()];
		for (int i = 0; i < gold.size(); i++) {
			int actual = indexOf(classAttribute, gold.get(i));
			int guess = indexOf(classAttribute, predicted.get(i));
			Instance instance = new DenseInstance(1);
			instance.setDataset(header);
			instance.setClassValue(actual);
			double[] distribution = new double[classNames.size()];
			distribution[guess] = 1.0;
			evaluation.evaluateModelOnce(distribution, instance);
			support[actual]++;
		}
		return new StanceEvaluation(title, Collections.unmodifiableList(new ArrayList<String>(classNames)),
				evaluation, support);
	}

	private static int indexOf(Attribute classAttribute, String label) {
		int index = classAttribute.indexOfValue(label);
		if (index < 0) {
			throw new IllegalArgumentException("Label '" + label + "' is not one of the evaluated classes");
		}
		return index;
	}

	public String getTitle() {
		return title;
	}

	public List<String> getClassNames() {
		return classNames;
	}

	public int numPredictions() {
		return (int) evaluation.numInstances();
	}

	/*
	 * Fraction of correct predictions, 0 when nothing was evaluated
	 */
	public double accuracy() {
		if (evaluation.numInstances() == 0) {
			return 0.0;
		}
		return evaluation.pctCorrect() / 100.0;
	}

	public double precision(String className) {
		return zeroIfNaN(evaluation.precision(classNames.indexOf(className)));
	}

	public double recall(String className) {
		return zeroIfNaN(evaluation.recall(classNames.indexOf(className)));
	}

	public double f1(String className) {
		return zeroIfNaN(evaluation.fMeasure(classNames.indexOf(className)));
	}

	public int support(String className) {
		return support[classNames.indexOf(className)];
	}

	/*
	 * Rows are gold classes, columns predicted classes
	 */
	public int[][] confusionMatrix() {
		double[][] matrix = evaluation.confusionMatrix();
		int[][] counts = new int[matrix.length][];
		for (int i = 0; i < matrix.length; i++) {
			counts[i] = new int[matrix[i].length];
			for (int j = 0; j < matrix[i].length; j++) {
				counts[i][j] = (int) Math.round(matrix[i][j]);
			}
		}
		return counts;
	}

	/*
	 * Weka's own per class breakdown
	 */
	public String toClassDetailsString() throws Exception {
		return evaluation.toClassDetailsString(title);
	}

	private static double zeroIfNaN(double value) {
		return Double.isNaN(value) ? 0.0 : value;
	}
}
