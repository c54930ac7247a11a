package edu.arizona.cs.sdqc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single post of a conversation thread. The parent is kept as an id only;
 * the {@link MessageIndex} the message belongs to resolves it.
 **/
public final class Message {

	// Identifier of the message, unique within its index
	private final String id;
	// Identifier of the message replied to, null for a thread root
	private final String parentId;
	// The raw text as posted
	private final String text;

	// Metadata of the author and the post
	private final boolean verified;
	private final boolean news;
	private final int retweetCount;
	private final List<String> hashtags;
	private final List<String> mentions;

	private Message(Builder builder) {
		this.id = Objects.requireNonNull(builder.id, "id");
		this.parentId = builder.parentId == null || builder.parentId.isEmpty() ? null : builder.parentId;
		this.text = builder.text == null ? "" : builder.text;
		this.verified = builder.verified;
		this.news = builder.news;
		this.retweetCount = builder.retweetCount;
		this.hashtags = Collections.unmodifiableList(new ArrayList<String>(builder.hashtags));
		this.mentions = Collections.unmodifiableList(new ArrayList<String>(builder.mentions));
		if (this.id.equals(this.parentId)) {
			throw new IllegalArgumentException("Message " + id + " cannot be its own parent");
		}
	}

	public static Builder builder(String id) {
		return new Builder(id);
	}

	public String getId() {
		return id;
	}

	public String getParentId() {
		return parentId;
	}

	public boolean hasParent() {
		return parentId != null;
	}

	public String getText() {
		return text;
	}

	public boolean isVerified() {
		return verified;
	}

	public boolean isNews() {
		return news;
	}

	public int getRetweetCount() {
		return retweetCount;
	}

	public List<String> getHashtags() {
		return hashtags;
	}

	public List<String> getMentions() {
		return mentions;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Message)) {
			return false;
		}
		return id.equals(((Message) o).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return "Message[" + id + (parentId == null ? "" : " -> " + parentId) + "] " + text;
	}

	public static final class Builder {
		private final String id;
		private String parentId;
		private String text = "";
		private boolean verified;
		private boolean news;
		private int retweetCount;
		private List<String> hashtags = new ArrayList<String>();
		private List<String> mentions = new ArrayList<String>();

		private Builder(String id) {
			this.id = id;
		}

		public Builder parent(String parentId) {
			this.parentId = parentId;
			return this;
		}

		public Builder text(String text) {
			this.text = text;
			return this;
		}

		public Builder verified(boolean verified) {
			this.verified = verified;
			return this;
		}

		public Builder news(boolean news) {
			this.news = news;
			return this;
		}

		public Builder retweetCount(int retweetCount) {
			this.retweetCount = retweetCount;
			return this;
		}

		public Builder hashtags(List<String> hashtags) {
			this.hashtags = new ArrayList<String>(hashtags);
			return this;
		}

		public Builder mentions(List<String> mentions) {
			this.mentions = new ArrayList<String>(mentions);
			return this;
		}

		public Message build() {
			return new Message(this);
		}
	}
}
