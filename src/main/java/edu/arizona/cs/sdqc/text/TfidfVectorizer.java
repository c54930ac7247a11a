package edu.arizona.cs.sdqc.text;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.search.similarities.ClassicSimilarity;

/**
 * Term frequency / inverse document frequency weighting over a vocabulary
 * learned from a set of documents. Term frequencies are raw counts, the idf is
 * Lucene's classic smoothed idf, ln((n + 1) / (df + 1)) + 1, and each
 * document vector is scaled to unit length.
 *
 * A fitted vectorizer is immutable and can be shared between threads.
 **/
public final class TfidfVectorizer {

	private static final ClassicSimilarity SIMILARITY = new ClassicSimilarity();

	private final Analyzer analyzer;
	// term -> column, terms in sorted order
	private final Map<String, Integer> vocabulary;
	private final double[] idf;

	private TfidfVectorizer(Analyzer analyzer, Map<String, Integer> vocabulary, double[] idf) {
		this.analyzer = analyzer;
		this.vocabulary = vocabulary;
		this.idf = idf;
	}

	public static TfidfVectorizer fit(List<String> documents) {
		return fit(TermAnalyzer.shared(), documents);
	}

	/**
	 * Learns the vocabulary and document frequencies of the documents. An empty
	 * vocabulary is allowed; every document then maps to an empty vector.
	 **/
	public static TfidfVectorizer fit(Analyzer analyzer, List<String> documents) {
		Map<String, Integer> documentFrequency = new TreeMap<String, Integer>();
		for (String document : documents) {
			Set<String> seen = new HashSet<String>(TermAnalyzer.terms(analyzer, document));
			for (String term : seen) {
				Integer count = documentFrequency.get(term);
				documentFrequency.put(term, count == null ? 1 : count + 1);
			}
		}

		Map<String, Integer> vocabulary = new LinkedHashMap<String, Integer>();
		double[] idf = new double[documentFrequency.size()];
		int column = 0;
		for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
			vocabulary.put(entry.getKey(), column);
			idf[column] = SIMILARITY.idf(entry.getValue(), documents.size());
			column++;
		}
		return new TfidfVectorizer(analyzer, Collections.unmodifiableMap(vocabulary), idf);
	}

	Analyzer getAnalyzer() {
		return analyzer;
	}

	public int size() {
		return idf.length;
	}

	/*
	 * The learned terms, in column order
	 */
	public Set<String> terms() {
		return new TreeSet<String>(vocabulary.keySet());
	}

	/**
	 * @return the unit length weight vector of the document as column -> weight,
	 *         ordered by column. Terms outside the vocabulary are ignored.
	 **/
	public Map<Integer, Double> transform(String document) {
		Map<Integer, Double> counts = new TreeMap<Integer, Double>();
		for (String term : TermAnalyzer.terms(analyzer, document)) {
			Integer column = vocabulary.get(term);
			if (column != null) {
				Double count = counts.get(column);
				counts.put(column, count == null ? 1.0 : count + 1.0);
			}
		}

		double norm = 0.0;
		for (Map.Entry<Integer, Double> entry : counts.entrySet()) {
			double weight = entry.getValue() * idf[entry.getKey()];
			entry.setValue(weight);
			norm += weight * weight;
		}
		if (norm > 0.0) {
			norm = Math.sqrt(norm);
			for (Map.Entry<Integer, Double> entry : counts.entrySet()) {
				entry.setValue(entry.getValue() / norm);
			}
		}
		return counts;
	}
}
