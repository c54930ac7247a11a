package edu.arizona.cs.sdqc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The messages of a set of conversation threads, in the order they were
 * added. The index owns the messages; parent links between them are plain ids
 * looked up here.
 **/
public final class MessageIndex implements ParentLookup, Iterable<Message> {

	// LinkedHashMap keeps the insertion order for iteration
	private final Map<String, Message> messages = new LinkedHashMap<String, Message>();

	public MessageIndex() {
	}

	public MessageIndex(Iterable<Message> messages) {
		for (Message message : messages) {
			add(message);
		}
	}

	/**
	 * Adds a message. A second message with the same id is rejected.
	 **/
	public MessageIndex add(Message message) {
		if (messages.containsKey(message.getId())) {
			throw new IllegalArgumentException("Duplicate message id " + message.getId());
		}
		messages.put(message.getId(), message);
		return this;
	}

	public Message get(String id) {
		return messages.get(id);
	}

	public boolean contains(String id) {
		return messages.containsKey(id);
	}

	public int size() {
		return messages.size();
	}

	public boolean isEmpty() {
		return messages.isEmpty();
	}

	public List<Message> messages() {
		return Collections.unmodifiableList(new ArrayList<Message>(messages.values()));
	}

	@Override
	public Message parentOf(Message message) {
		if (!message.hasParent()) {
			return null;
		}
		return messages.get(message.getParentId());
	}

	/**
	 * A parent lookup that searches this index first and the other one for
	 * parents missing here, e.g. evaluation replies to a root that only the
	 * training threads carry.
	 **/
	public ParentLookup withFallback(final ParentLookup fallback) {
		final MessageIndex primary = this;
		return new ParentLookup() {
			@Override
			public Message parentOf(Message message) {
				Message parent = primary.parentOf(message);
				if (parent == null && message.hasParent()) {
					parent = fallback.parentOf(message);
				}
				return parent;
			}
		};
	}

	@Override
	public Iterator<Message> iterator() {
		return messages().iterator();
	}
}
