package edu.arizona.cs.sdqc;

import java.util.LinkedHashMap;
import java.util.Map;

import edu.arizona.cs.sdqc.model.Annotations;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.MessageIndex;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * A rumour thread with one reply of each interesting kind.
 **/
public final class ThreadFixtures {

	public static final Message ROOT = Message.builder("R").text("Breaking news: X happened").build();
	public static final Message QUERY_REPLY = Message.builder("A").parent("R").text("Is that true?").build();
	public static final Message DENY_REPLY = Message.builder("B").parent("R").text("No it's not true").build();
	public static final Message SHORT_REPLY = Message.builder("C").parent("R").text("lol same").build();

	private ThreadFixtures() {
	}

	public static MessageIndex trainingThread() {
		return new MessageIndex().add(ROOT).add(QUERY_REPLY).add(DENY_REPLY).add(SHORT_REPLY);
	}

	public static Annotations trainingAnnotations() {
		Map<String, StanceLabel> labels = new LinkedHashMap<String, StanceLabel>();
		labels.put("R", StanceLabel.SUPPORT);
		labels.put("A", StanceLabel.QUERY);
		labels.put("B", StanceLabel.DENY);
		labels.put("C", StanceLabel.COMMENT);
		return new Annotations(labels);
	}
}
