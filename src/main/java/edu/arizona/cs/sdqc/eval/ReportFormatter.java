package edu.arizona.cs.sdqc.eval;

import java.util.List;

/**
 * Plain text tables for the evaluation logs.
 **/
public final class ReportFormatter {

	private ReportFormatter() {
	}

	/**
	 * Precision, recall, F1 and support per class, followed by the weighted
	 * averages.
	 **/
	public static String classificationReport(StanceEvaluation evaluation) {
		List<String> classes = evaluation.getClassNames();
		int width = 12;
		for (String name : classes) {
			width = Math.max(width, name.length() + 2);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(String.format("%" + width + "s %9s %9s %9s %9s%n", "", "precision", "recall", "f1-score", "support"));
		double precision = 0.0, recall = 0.0, f1 = 0.0;
		int total = 0;
		for (String name : classes) {
			int support = evaluation.support(name);
			sb.append(String.format("%" + width + "s %9.2f %9.2f %9.2f %9d%n", name, evaluation.precision(name),
					evaluation.recall(name), evaluation.f1(name), support));
			precision += evaluation.precision(name) * support;
			recall += evaluation.recall(name) * support;
			f1 += evaluation.f1(name) * support;
			total += support;
		}
		if (total > 0) {
			sb.append(String.format("%n%" + width + "s %9.2f %9.2f %9.2f %9d%n", "avg / total", precision / total,
					recall / total, f1 / total, total));
		}
		return sb.toString();
	}

	/**
	 * The confusion matrix with one row per gold class.
	 **/
	public static String confusionMatrix(StanceEvaluation evaluation) {
		List<String> classes = evaluation.getClassNames();
		int[][] matrix = evaluation.confusionMatrix();
		int width = 10;
		for (String name : classes) {
			width = Math.max(width, name.length() + 1);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(String.format("%-" + width + "s", ""));
		for (String name : classes) {
			sb.append(" | ").append(String.format("%-" + width + "s", name));
		}
		sb.append(String.format("%n"));
		for (int i = 0; i < classes.size(); i++) {
			sb.append(String.format("%-" + width + "s", classes.get(i)));
			for (int j = 0; j < classes.size(); j++) {
				sb.append(" | ").append(String.format("%-" + width + "s", String.format("%06d", matrix[i][j])));
			}
			sb.append(String.format("%n"));
		}
		return sb.toString();
	}
}
