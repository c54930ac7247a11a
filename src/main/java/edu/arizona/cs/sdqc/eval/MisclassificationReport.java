package edu.arizona.cs.sdqc.eval;

import java.util.ArrayList;
import java.util.List;

import edu.arizona.cs.sdqc.features.FeatureExtractor;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.ParentLookup;
import edu.arizona.cs.sdqc.model.StanceLabel;
import edu.arizona.cs.sdqc.model.ThreadRoots;

/**
 * Lists the messages on which a one-vs-rest classifier disagrees with the
 * gold stance: the target predicted for another stance, or the target missed.
 **/
public final class MisclassificationReport {

	private final FeatureExtractor extractor;
	private final ParentLookup thread;

	public MisclassificationReport(FeatureExtractor extractor, ParentLookup thread) {
		this.extractor = extractor;
		this.thread = thread;
	}

	/**
	 * @param target      the target of the one-vs-rest classifier
	 * @param messages    the evaluation messages
	 * @param gold        their gold stance labels
	 * @param predictions the classifier's target / not_target predictions
	 **/
	public List<Misclassification> list(StanceLabel target, List<Message> messages, List<StanceLabel> gold,
			List<String> predictions) {
		List<Misclassification> wrong = new ArrayList<Misclassification>();
		for (int i = 0; i < messages.size(); i++) {
			boolean predictedTarget = target.labelName().equals(predictions.get(i));
			boolean goldTarget = gold.get(i) == target;
			if (predictedTarget != goldTarget) {
				Message message = messages.get(i);
				Message root = ThreadRoots.resolve(message, thread);
				wrong.add(new Misclassification(message.getId(), gold.get(i).labelName(), predictions.get(i),
						extractor.normalizeText(message), extractor.normalizeText(root)));
			}
		}
		return wrong;
	}
}
