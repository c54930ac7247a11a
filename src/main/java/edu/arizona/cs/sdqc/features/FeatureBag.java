package edu.arizona.cs.sdqc.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The named feature values extracted from one message. Values are numbers,
 * booleans, strings or lists of strings. A bag never changes once built.
 **/
public final class FeatureBag {

	private final String messageId;
	private final Map<String, Object> values;

	private FeatureBag(String messageId, Map<String, Object> values) {
		this.messageId = messageId;
		this.values = Collections.unmodifiableMap(values);
	}

	public static Builder builder(String messageId) {
		return new Builder(messageId);
	}

	public String getMessageId() {
		return messageId;
	}

	public boolean contains(String key) {
		return values.containsKey(key);
	}

	public Set<String> keys() {
		return values.keySet();
	}

	/**
	 * @throws MissingFeatureException when the bag has no value for the key
	 **/
	public Object get(String key) {
		Object value = values.get(key);
		if (value == null) {
			throw new MissingFeatureException(messageId, key);
		}
		return value;
	}

	@Override
	public String toString() {
		return "FeatureBag[" + messageId + "] " + values;
	}

	public static final class Builder {
		private final String messageId;
		private final Map<String, Object> values = new LinkedHashMap<String, Object>();

		private Builder(String messageId) {
			this.messageId = messageId;
		}

		public Builder put(String key, Number value) {
			values.put(key, value);
			return this;
		}

		public Builder put(String key, boolean value) {
			values.put(key, value);
			return this;
		}

		public Builder put(String key, String value) {
			values.put(key, value);
			return this;
		}

		public Builder put(String key, List<String> value) {
			values.put(key, Collections.unmodifiableList(new ArrayList<String>(value)));
			return this;
		}

		public FeatureBag build() {
			return new FeatureBag(messageId, new LinkedHashMap<String, Object>(values));
		}
	}
}
