package edu.arizona.cs.sdqc.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Walks parent links up to the root of a conversation thread. The walk is
 * iterative so deep threads cannot overflow the stack, and a repeated message
 * on the way up is reported as a broken thread instead of looping forever.
 **/
public final class ThreadRoots {

	private ThreadRoots() {
	}

	/**
	 * @return the ancestor of the message that has no parent, the message
	 *         itself when it is a root
	 **/
	public static Message resolve(Message message, ParentLookup lookup) {
		return walk(message, lookup).root;
	}

	/**
	 * @return the number of parent links between the message and its root, 0
	 *         for the root
	 **/
	public static int depth(Message message, ParentLookup lookup) {
		return walk(message, lookup).depth;
	}

	private static Walk walk(Message message, ParentLookup lookup) {
		Message root = message;
		int depth = 0;
		Set<String> seen = new HashSet<String>();
		seen.add(root.getId());
		Message parent = lookup.parentOf(root);
		while (parent != null) {
			if (!seen.add(parent.getId())) {
				throw new IllegalStateException("Cycle in thread of message " + message.getId()
						+ " at " + parent.getId());
			}
			root = parent;
			depth++;
			parent = lookup.parentOf(root);
		}
		return new Walk(root, depth);
	}

	private static final class Walk {
		final Message root;
		final int depth;

		Walk(Message root, int depth) {
			this.root = root;
			this.depth = depth;
		}
	}

	public static boolean isRoot(Message message, ParentLookup lookup) {
		return lookup.parentOf(message) == null;
	}
}
