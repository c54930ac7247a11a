package edu.arizona.cs.sdqc.text;

import java.util.Arrays;
import java.util.Map;

/**
 * Cosine similarity of sparse term weight vectors.
 **/
public final class CosineSimilarity {

	private CosineSimilarity() {
	}

	/**
	 * @return the cosine of the angle between the two vectors; 0.0 when either
	 *         of them is empty or all zero, exactly 1.0 when they are equal
	 **/
	public static double between(Map<Integer, Double> a, Map<Integer, Double> b) {
		if (a.isEmpty() || b.isEmpty()) {
			return 0.0;
		}
		if (a.equals(b)) {
			return 1.0;
		}
		double dot = 0.0;
		double normA = 0.0;
		double normB = 0.0;
		for (Map.Entry<Integer, Double> entry : a.entrySet()) {
			Double other = b.get(entry.getKey());
			if (other != null) {
				dot += entry.getValue() * other;
			}
			normA += entry.getValue() * entry.getValue();
		}
		for (Double value : b.values()) {
			normB += value * value;
		}
		if (normA == 0.0 || normB == 0.0) {
			return 0.0;
		}
		return dot / (Math.sqrt(normA) * Math.sqrt(normB));
	}

	/**
	 * Similarity of two texts under a vocabulary built from those two texts
	 * alone. Equal texts are fully similar even when they have no terms.
	 **/
	public static double ofPair(String first, String second) {
		if (first.equals(second)) {
			return 1.0;
		}
		TfidfVectorizer vectorizer = TfidfVectorizer.fit(Arrays.asList(first, second));
		return between(vectorizer.transform(first), vectorizer.transform(second));
	}
}
