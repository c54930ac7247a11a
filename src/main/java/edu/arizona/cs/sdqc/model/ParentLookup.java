package edu.arizona.cs.sdqc.model;

/**
 * Resolves the message a message replies to.
 **/
public interface ParentLookup {

	/**
	 * @return the parent of the message, or null when the message is a thread
	 *         root or its parent is not known to this lookup
	 **/
	Message parentOf(Message message);
}
