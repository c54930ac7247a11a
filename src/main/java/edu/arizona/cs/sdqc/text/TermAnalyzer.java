package edu.arizona.cs.sdqc.text;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Lucene analyzer used for term weighting: standard tokenization, lower case,
 * and only terms of two characters or more.
 **/
public final class TermAnalyzer extends Analyzer {

	public static final String FIELD = "text";

	private static final int MIN_TERM_LENGTH = 2;

	// Components are reused per thread
	private static final TermAnalyzer SHARED = new TermAnalyzer();

	public static TermAnalyzer shared() {
		return SHARED;
	}

	@Override
	protected TokenStreamComponents createComponents(String fieldName) {
		StandardTokenizer source = new StandardTokenizer();
		TokenStream result = new LowerCaseFilter(source);
		result = new LengthFilter(result, MIN_TERM_LENGTH, Integer.MAX_VALUE);
		return new TokenStreamComponents(source, result);
	}

	/**
	 * Runs any analyzer over a piece of text and collects its terms in order.
	 **/
	public static List<String> terms(Analyzer analyzer, String text) {
		List<String> terms = new ArrayList<String>();
		try (TokenStream stream = analyzer.tokenStream(FIELD, text == null ? "" : text)) {
			CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
			stream.reset();
			while (stream.incrementToken()) {
				terms.add(term.toString());
			}
			stream.end();
		} catch (IOException e) {
			throw new UncheckedIOException("Could not analyze text", e);
		}
		return terms;
	}
}
