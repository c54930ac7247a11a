package edu.arizona.cs.sdqc.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;

import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.ParentLookup;
import edu.arizona.cs.sdqc.model.ThreadRoots;
import edu.arizona.cs.sdqc.text.TermAnalyzer;

/**
 * Feature extractor based on word lists and punctuation counts. It fills every
 * key read by the default classifier profiles.
 **/
public class LexiconFeatureExtractor implements FeatureExtractor {

	/** Keys of the produced feature bags **/
	public static final String TEXT_STEMMED_STOPPED = "text_stemmed_stopped";
	public static final String TEXT_MINUS_ROOT = "text_minus_root";
	public static final String VERIFIED = "verified";
	public static final String IS_NEWS = "is_news";
	public static final String IS_ROOT = "is_root";
	public static final String PERIOD_COUNT = "period_count";
	public static final String QUESTION_MARK_COUNT = "question_mark_count";
	public static final String EXCLAMATION_COUNT = "exclamation_count";
	public static final String ELLIPSIS_COUNT = "ellipsis_count";
	public static final String CHAR_COUNT = "char_count";
	public static final String DEPTH = "depth";
	public static final String HASHTAGS = "hashtags";
	public static final String USER_MENTIONS = "user_mentions";
	public static final String RETWEET_COUNT = "retweet_count";
	public static final String POSITIVE_WORDS = "positive_words";
	public static final String NEGATIVE_WORDS = "negative_words";
	public static final String DENYING_WORDS = "denying_words";
	public static final String QUERYING_WORDS = "querying_words";
	public static final String SWEAR_WORDS = "swear_words";
	public static final String PERSONAL_WORDS = "personal_words";

	// List of words with a generally positive connotation
	static final Set<String> positiveWords = new HashSet<String>(Arrays.asList("good", "great", "yes", "right",
			"agree", "love", "confirmed", "confirms", "correct", "thanks", "hope", "safe", "glad", "happy"));
	// List of words with a generally negative connotation
	static final Set<String> negativeWords = new HashSet<String>(Arrays.asList("bad", "sad", "terrible", "hate",
			"awful", "horrible", "killed", "dead", "attack", "shot", "fear", "scary", "tragic", "sick"));
	// List of words that tend to show a denial of the claim
	static final Set<String> denyingWords = new HashSet<String>(Arrays.asList("no", "not", "fake", "false", "hoax",
			"lie", "lies", "lying", "untrue", "wrong", "debunked", "nope", "isn't", "didn't", "doesn't", "wasn't",
			"never", "rumor", "rumour"));
	// List of words that tend to ask about the claim
	static final Set<String> queryingWords = new HashSet<String>(Arrays.asList("what", "why", "how", "who", "where",
			"when", "really", "source", "sources", "sure", "unconfirmed", "verify", "proof", "evidence"));
	// List of swear words
	static final Set<String> swearWords = new HashSet<String>(Arrays.asList("damn", "hell", "shit", "fuck",
			"fucking", "crap", "wtf", "bullshit", "ass", "bloody"));
	// List of words aimed at a person
	static final Set<String> personalWords = new HashSet<String>(Arrays.asList("you", "your", "you're", "idiot",
			"stupid", "moron", "liar", "dumb", "fool", "loser", "shame"));

	private static final Pattern URL = Pattern.compile("https?://\\S+");
	private static final Pattern HASHTAG = Pattern.compile("#\\w+");
	private static final Pattern MENTION = Pattern.compile("@\\w+");
	private static final Pattern ELLIPSIS = Pattern.compile("\\.\\.\\.|…");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final ExtractorOptions options;
	private final Analyzer stemmingAnalyzer = new EnglishAnalyzer();
	private final Analyzer termAnalyzer = TermAnalyzer.shared();

	public LexiconFeatureExtractor(ExtractorOptions options) {
		this.options = options;
	}

	public ExtractorOptions getOptions() {
		return options;
	}

	@Override
	public FeatureBag extract(Message message, ParentLookup thread) {
		String raw = message.getText();
		String normalized = normalizeText(message);
		Message root = ThreadRoots.resolve(message, thread);
		boolean isRoot = root.equals(message);

		List<String> terms = TermAnalyzer.terms(termAnalyzer, normalized);
		List<String> textMinusRoot;
		if (isRoot) {
			textMinusRoot = terms;
		} else {
			Set<String> rootTerms = new HashSet<String>(TermAnalyzer.terms(termAnalyzer, normalizeText(root)));
			textMinusRoot = new ArrayList<String>();
			for (String term : terms) {
				if (!rootTerms.contains(term)) {
					textMinusRoot.add(term);
				}
			}
		}

		int ellipses = count(ELLIPSIS, raw);
		return FeatureBag.builder(message.getId())
				.put(TEXT_STEMMED_STOPPED, TermAnalyzer.terms(stemmingAnalyzer, normalized))
				.put(TEXT_MINUS_ROOT, textMinusRoot)
				.put(VERIFIED, message.isVerified())
				.put(IS_NEWS, message.isNews())
				.put(IS_ROOT, isRoot)
				.put(PERIOD_COUNT, countChar(raw, '.') - 3 * countOf(raw, "..."))
				.put(QUESTION_MARK_COUNT, countChar(raw, '?'))
				.put(EXCLAMATION_COUNT, countChar(raw, '!'))
				.put(ELLIPSIS_COUNT, ellipses)
				.put(CHAR_COUNT, raw.length())
				.put(DEPTH, ThreadRoots.depth(message, thread))
				.put(HASHTAGS, hashtags(message))
				.put(USER_MENTIONS, mentions(message))
				.put(RETWEET_COUNT, message.getRetweetCount())
				.put(POSITIVE_WORDS, countIn(terms, positiveWords))
				.put(NEGATIVE_WORDS, countIn(terms, negativeWords))
				.put(DENYING_WORDS, countIn(terms, denyingWords))
				.put(QUERYING_WORDS, countIn(terms, queryingWords))
				.put(SWEAR_WORDS, countIn(terms, swearWords))
				.put(PERSONAL_WORDS, countIn(terms, personalWords))
				.build();
	}

	/**
	 * Lower case text without links, optionally without hashtags and mentions,
	 * with runs of whitespace collapsed to one space.
	 **/
	@Override
	public String normalizeText(Message message) {
		String text = message.getText().toLowerCase();
		text = URL.matcher(text).replaceAll(" ");
		if (options.isStripHashtags()) {
			text = HASHTAG.matcher(text).replaceAll(" ");
		}
		if (options.isStripMentions()) {
			text = MENTION.matcher(text).replaceAll(" ");
		}
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}

	/*
	 * Hashtags from the metadata, or from the text when the metadata has none
	 */
	private static List<String> hashtags(Message message) {
		if (!message.getHashtags().isEmpty()) {
			return message.getHashtags();
		}
		return matches(HASHTAG, message.getText());
	}

	private static List<String> mentions(Message message) {
		if (!message.getMentions().isEmpty()) {
			return message.getMentions();
		}
		return matches(MENTION, message.getText());
	}

	private static List<String> matches(Pattern pattern, String text) {
		List<String> found = new ArrayList<String>();
		Matcher matcher = pattern.matcher(text);
		while (matcher.find()) {
			found.add(matcher.group().substring(1));
		}
		return found;
	}

	private static int count(Pattern pattern, String text) {
		int count = 0;
		Matcher matcher = pattern.matcher(text);
		while (matcher.find()) {
			count++;
		}
		return count;
	}

	private static int countOf(String text, String part) {
		int count = 0;
		int from = text.indexOf(part);
		while (from >= 0) {
			count++;
			from = text.indexOf(part, from + part.length());
		}
		return count;
	}

	private static int countChar(String text, char c) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == c) {
				count++;
			}
		}
		return count;
	}

	private static int countIn(List<String> terms, Set<String> lexicon) {
		int count = 0;
		for (String term : terms) {
			if (lexicon.contains(term)) {
				count++;
			}
		}
		return count;
	}
}
