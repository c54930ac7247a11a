package edu.arizona.cs.sdqc.filter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.features.FeatureExtractor;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.ParentLookup;
import edu.arizona.cs.sdqc.model.ThreadRoots;
import edu.arizona.cs.sdqc.text.CosineSimilarity;

/**
 * Removes training replies that are expected to confuse the classifiers:
 * replies that restate their thread root and, optionally, replies too short to
 * carry a stance. Thread roots are always kept and the order of the kept
 * messages is preserved.
 **/
public class TrainingFilter {

	private static final Logger LOGGER = LoggerFactory.getLogger(TrainingFilter.class);

	public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.9;
	// Replies with fewer space separated tokens count as too short
	static final int MIN_TOKENS = 3;

	private final FeatureExtractor extractor;
	private final boolean filterShort;
	private final double similarityThreshold;

	public TrainingFilter(FeatureExtractor extractor) {
		this(extractor, false, DEFAULT_SIMILARITY_THRESHOLD);
	}

	public TrainingFilter(FeatureExtractor extractor, boolean filterShort, double similarityThreshold) {
		this.extractor = extractor;
		this.filterShort = filterShort;
		this.similarityThreshold = similarityThreshold;
	}

	/**
	 * @param messages the training messages, in order
	 * @param thread   parent links covering the messages and their ancestors
	 * @return the kept messages, in their original order
	 **/
	public List<Message> filter(List<Message> messages, ParentLookup thread) {
		// Normalized root texts, only for the duration of this call
		Map<String, String> rootCache = new HashMap<String, String>();

		List<Message> kept = new ArrayList<Message>(messages.size());
		int tooShort = 0, tooSimilar = 0;
		for (Message message : messages) {
			Message root = ThreadRoots.resolve(message, thread);
			if (root.equals(message)) {
				kept.add(message);
				continue;
			}

			String rootText = rootCache.get(root.getId());
			if (rootText == null) {
				rootText = extractor.normalizeText(root);
				rootCache.put(root.getId(), rootText);
			}
			String text = extractor.normalizeText(message);

			if (filterShort && isShort(text)) {
				tooShort++;
				LOGGER.debug("Dropping short message {}: {}", message.getId(), text);
				continue;
			}

			double similarity = CosineSimilarity.ofPair(rootText, text);
			if (similarity >= similarityThreshold) {
				tooSimilar++;
				LOGGER.debug("Dropping message {} with similarity {} to its root", message.getId(), similarity);
				continue;
			}
			kept.add(message);
		}
		LOGGER.info("Training filter kept {} of {} messages ({} too short, {} too similar to their root)",
				kept.size(), messages.size(), tooShort, tooSimilar);
		return kept;
	}

	/*
	 * Splits on single spaces, so an empty text still counts as one token
	 */
	static boolean isShort(String text) {
		return text.split(" ", -1).length < MIN_TOKENS;
	}

	public boolean isFilterShort() {
		return filterShort;
	}

	public double getSimilarityThreshold() {
		return similarityThreshold;
	}
}
