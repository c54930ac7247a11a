package edu.arizona.cs.sdqc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gold stance labels by message id.
 **/
public final class Annotations {

	private final Map<String, StanceLabel> labels;

	public Annotations(Map<String, StanceLabel> labels) {
		this.labels = Collections.unmodifiableMap(new LinkedHashMap<String, StanceLabel>(labels));
	}

	/**
	 * Builds annotations from raw label names, validating each of them against
	 * {@link StanceLabel}.
	 **/
	public static Annotations fromNames(Map<String, String> rawLabels) {
		Map<String, StanceLabel> labels = new LinkedHashMap<String, StanceLabel>();
		for (Map.Entry<String, String> entry : rawLabels.entrySet()) {
			labels.put(entry.getKey(), StanceLabel.fromName(entry.getValue()));
		}
		return new Annotations(labels);
	}

	public StanceLabel get(String messageId) {
		StanceLabel label = labels.get(messageId);
		if (label == null) {
			throw new IllegalArgumentException("No annotation for message " + messageId);
		}
		return label;
	}

	public boolean contains(String messageId) {
		return labels.containsKey(messageId);
	}

	public Map<String, StanceLabel> asMap() {
		return labels;
	}

	public int size() {
		return labels.size();
	}

	/**
	 * Fails on the first message without a gold label.
	 **/
	public void requireCoverage(Iterable<Message> messages) {
		for (Message message : messages) {
			if (!labels.containsKey(message.getId())) {
				throw new IllegalArgumentException("No annotation for message " + message.getId());
			}
		}
	}

	/**
	 * @return the gold labels of the messages, in message order
	 **/
	public List<StanceLabel> labelsOf(List<Message> messages) {
		List<StanceLabel> result = new ArrayList<StanceLabel>(messages.size());
		for (Message message : messages) {
			result.add(get(message.getId()));
		}
		return result;
	}
}
