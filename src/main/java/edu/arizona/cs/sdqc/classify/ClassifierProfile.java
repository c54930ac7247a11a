package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.arizona.cs.sdqc.features.FeatureChannel;
import edu.arizona.cs.sdqc.features.FeatureComposer;

/**
 * Everything needed to build one classifier of the bank: its feature channels
 * and the support vector machine settings. Profiles are immutable; the
 * {@code with...} methods return modified copies, which is how the search
 * strategies derive candidates.
 **/
public final class ClassifierProfile {

	private final String name;
	private final KernelType kernel;
	private final double c;
	private final double gamma;
	private final ClassBalance classBalance;
	private final List<FeatureChannel> channels;

	@JsonCreator
	public ClassifierProfile(@JsonProperty("name") String name,
			@JsonProperty("kernel") KernelType kernel,
			@JsonProperty("c") double c,
			@JsonProperty("gamma") Double gamma,
			@JsonProperty("classBalance") ClassBalance classBalance,
			@JsonProperty("channels") List<FeatureChannel> channels) {
		this.name = name;
		this.kernel = Objects.requireNonNull(kernel, "kernel of profile " + name);
		if (c <= 0.0) {
			throw new IllegalArgumentException("Profile " + name + " needs a positive C, got " + c);
		}
		this.c = c;
		this.gamma = gamma == null ? 0.0 : gamma;
		if (kernel == KernelType.RBF && this.gamma <= 0.0) {
			throw new IllegalArgumentException("Profile " + name + " uses an RBF kernel without a positive gamma");
		}
		this.classBalance = classBalance == null ? ClassBalance.NONE : classBalance;
		if (channels == null || channels.isEmpty()) {
			throw new IllegalArgumentException("Profile " + name + " has no feature channels");
		}
		Set<String> names = new HashSet<String>();
		for (FeatureChannel channel : channels) {
			if (!names.add(channel.getName())) {
				throw new IllegalArgumentException("Profile " + name + " repeats channel " + channel.getName());
			}
		}
		this.channels = Collections.unmodifiableList(new ArrayList<FeatureChannel>(channels));
	}

	@JsonProperty("name")
	public String getName() {
		return name;
	}

	@JsonProperty("kernel")
	public KernelType getKernel() {
		return kernel;
	}

	@JsonProperty("c")
	public double getC() {
		return c;
	}

	@JsonProperty("gamma")
	public double getGamma() {
		return gamma;
	}

	@JsonProperty("classBalance")
	public ClassBalance getClassBalance() {
		return classBalance;
	}

	@JsonProperty("channels")
	public List<FeatureChannel> getChannels() {
		return channels;
	}

	@JsonIgnore
	public FeatureComposer composer() {
		return new FeatureComposer(name, channels);
	}

	public FeatureChannel channel(String channelName) {
		for (FeatureChannel channel : channels) {
			if (channel.getName().equals(channelName)) {
				return channel;
			}
		}
		throw new IllegalArgumentException("Profile " + name + " has no channel " + channelName);
	}

	public ClassifierProfile withName(String newName) {
		return new ClassifierProfile(newName, kernel, c, gamma, classBalance, channels);
	}

	public ClassifierProfile withKernel(KernelType newKernel) {
		return new ClassifierProfile(name, newKernel, c, gamma, classBalance, channels);
	}

	public ClassifierProfile withC(double newC) {
		return new ClassifierProfile(name, kernel, newC, gamma, classBalance, channels);
	}

	public ClassifierProfile withGamma(double newGamma) {
		return new ClassifierProfile(name, kernel, c, newGamma, classBalance, channels);
	}

	public ClassifierProfile withClassBalance(ClassBalance newBalance) {
		return new ClassifierProfile(name, kernel, c, gamma, newBalance, channels);
	}

	public ClassifierProfile withChannelWeight(String channelName, double weight) {
		List<FeatureChannel> changed = new ArrayList<FeatureChannel>(channels.size());
		boolean found = false;
		for (FeatureChannel channel : channels) {
			if (channel.getName().equals(channelName)) {
				changed.add(channel.withWeight(weight));
				found = true;
			} else {
				changed.add(channel);
			}
		}
		if (!found) {
			throw new IllegalArgumentException("Profile " + name + " has no channel " + channelName);
		}
		return new ClassifierProfile(name, kernel, c, gamma, classBalance, changed);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ClassifierProfile)) {
			return false;
		}
		ClassifierProfile other = (ClassifierProfile) o;
		return Objects.equals(name, other.name) && kernel == other.kernel && Double.compare(c, other.c) == 0
				&& Double.compare(gamma, other.gamma) == 0 && classBalance == other.classBalance
				&& channels.equals(other.channels);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, kernel, c, gamma, classBalance, channels);
	}

	/*
	 * One line summary for the logs
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		sb.append(name).append(": kernel=").append(kernel).append(" C=").append(c);
		if (kernel == KernelType.RBF) {
			sb.append(" gamma=").append(gamma);
		}
		sb.append(" classBalance=").append(classBalance).append(" weights={");
		for (int i = 0; i < channels.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(channels.get(i).getName()).append('=').append(channels.get(i).getWeight());
		}
		return sb.append('}').toString();
	}

	@Override
	public String toString() {
		return describe();
	}
}
