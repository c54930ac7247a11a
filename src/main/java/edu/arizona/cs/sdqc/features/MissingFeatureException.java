package edu.arizona.cs.sdqc.features;

/**
 * Thrown when a feature channel reads a key the extractor did not produce.
 * The extractor is expected to fill every key, so this always ends the run.
 **/
public class MissingFeatureException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String messageId;
	private final String key;

	public MissingFeatureException(String messageId, String key) {
		super("Feature '" + key + "' missing for message " + messageId);
		this.messageId = messageId;
		this.key = key;
	}

	public String getMessageId() {
		return messageId;
	}

	public String getKey() {
		return key;
	}
}
