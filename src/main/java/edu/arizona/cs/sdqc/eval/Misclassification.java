package edu.arizona.cs.sdqc.eval;

/**
 * An evaluation message a one-vs-rest classifier got wrong, with the text of
 * its thread root for context.
 **/
public final class Misclassification {

	private final String messageId;
	private final String gold;
	private final String predicted;
	private final String text;
	private final String rootText;

	public Misclassification(String messageId, String gold, String predicted, String text, String rootText) {
		this.messageId = messageId;
		this.gold = gold;
		this.predicted = predicted;
		this.text = text;
		this.rootText = rootText;
	}

	public String getMessageId() {
		return messageId;
	}

	public String getGold() {
		return gold;
	}

	public String getPredicted() {
		return predicted;
	}

	public String getText() {
		return text;
	}

	public String getRootText() {
		return rootText;
	}

	@Override
	public String toString() {
		return gold + "\t" + predicted + "\t" + text + "\n\t\t" + rootText;
	}
}
