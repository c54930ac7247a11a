package edu.arizona.cs.sdqc.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named slice of the feature vector: the bag keys it reads, how they are
 * encoded, and the factor the encoded columns are multiplied by.
 **/
public final class FeatureChannel {

	private final String name;
	private final List<String> keys;
	private final ChannelEncoding encoding;
	private final double weight;

	@JsonCreator
	public FeatureChannel(@JsonProperty("name") String name,
			@JsonProperty("keys") List<String> keys,
			@JsonProperty("encoding") ChannelEncoding encoding,
			@JsonProperty("weight") double weight) {
		this.name = Objects.requireNonNull(name, "channel name");
		if (keys == null || keys.isEmpty()) {
			throw new IllegalArgumentException("Channel " + name + " reads no keys");
		}
		this.keys = Collections.unmodifiableList(new ArrayList<String>(keys));
		this.encoding = Objects.requireNonNull(encoding, "encoding of channel " + name);
		if (!Double.isFinite(weight)) {
			throw new IllegalArgumentException("Channel " + name + " has non-finite weight " + weight);
		}
		if (weight < 0.0) {
			throw new IllegalArgumentException("Channel " + name + " has negative weight " + weight);
		}
		this.weight = weight;
		if (encoding == ChannelEncoding.TEXT && keys.size() != 1) {
			throw new IllegalArgumentException("Text channel " + name + " must read exactly one key");
		}
	}

	public static FeatureChannel numeric(String name, double weight, String... keys) {
		return new FeatureChannel(name, Arrays.asList(keys), ChannelEncoding.NUMERIC, weight);
	}

	public static FeatureChannel categorical(String name, double weight, String... keys) {
		return new FeatureChannel(name, Arrays.asList(keys), ChannelEncoding.CATEGORICAL, weight);
	}

	public static FeatureChannel text(String name, double weight, String key) {
		return new FeatureChannel(name, Collections.singletonList(key), ChannelEncoding.TEXT, weight);
	}

	@JsonProperty("name")
	public String getName() {
		return name;
	}

	@JsonProperty("keys")
	public List<String> getKeys() {
		return keys;
	}

	@JsonProperty("encoding")
	public ChannelEncoding getEncoding() {
		return encoding;
	}

	@JsonProperty("weight")
	public double getWeight() {
		return weight;
	}

	public FeatureChannel withWeight(double newWeight) {
		return new FeatureChannel(name, keys, encoding, newWeight);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FeatureChannel)) {
			return false;
		}
		FeatureChannel other = (FeatureChannel) o;
		return name.equals(other.name) && keys.equals(other.keys) && encoding == other.encoding
				&& Double.compare(weight, other.weight) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, keys, encoding, weight);
	}

	@Override
	public String toString() {
		return name + keys + " " + encoding + " x" + weight;
	}
}
