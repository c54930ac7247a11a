package edu.arizona.cs.sdqc.features;

import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.ParentLookup;

/**
 * Produces the feature values of a message. Implementations must fill every
 * key the configured feature channels read.
 **/
public interface FeatureExtractor {

	/**
	 * @param message the message to describe
	 * @param thread  parent links of the thread the message belongs to
	 **/
	FeatureBag extract(Message message, ParentLookup thread);

	/**
	 * The text of the message in the form used to compare it with other
	 * messages.
	 **/
	String normalizeText(Message message);
}
