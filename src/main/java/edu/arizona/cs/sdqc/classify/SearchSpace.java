package edu.arizona.cs.sdqc.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Candidate values for the settings of a classifier profile. A setting without
 * candidates keeps the value of the profile being searched around, so an empty
 * space describes exactly one candidate: the profile itself.
 **/
public final class SearchSpace {

	private static final SearchSpace EMPTY = new SearchSpace(null, null, null, null, null);

	private final List<Double> c;
	private final List<Double> gamma;
	private final List<KernelType> kernel;
	private final List<ClassBalance> classBalance;
	// channel name -> candidate weights, in declaration order
	private final Map<String, List<Double>> channelWeights;

	@JsonCreator
	public SearchSpace(@JsonProperty("c") List<Double> c,
			@JsonProperty("gamma") List<Double> gamma,
			@JsonProperty("kernel") List<KernelType> kernel,
			@JsonProperty("classBalance") List<ClassBalance> classBalance,
			@JsonProperty("channelWeights") Map<String, List<Double>> channelWeights) {
		this.c = copy(c);
		this.gamma = copy(gamma);
		this.kernel = copy(kernel);
		this.classBalance = copy(classBalance);
		Map<String, List<Double>> weights = new LinkedHashMap<String, List<Double>>();
		if (channelWeights != null) {
			for (Map.Entry<String, List<Double>> entry : channelWeights.entrySet()) {
				if (entry.getValue() == null) {
					continue;
				}
				for (Double weight : entry.getValue()) {
					if (weight == null || weight < 0.0) {
						throw new IllegalArgumentException("Negative candidate weight for channel " + entry.getKey());
					}
				}
				weights.put(entry.getKey(), copy(entry.getValue()));
			}
		}
		this.channelWeights = Collections.unmodifiableMap(weights);
	}

	public static SearchSpace empty() {
		return EMPTY;
	}

	private static <T> List<T> copy(List<T> values) {
		if (values == null) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(new ArrayList<T>(values));
	}

	@JsonProperty("c")
	public List<Double> getC() {
		return c;
	}

	@JsonProperty("gamma")
	public List<Double> getGamma() {
		return gamma;
	}

	@JsonProperty("kernel")
	public List<KernelType> getKernel() {
		return kernel;
	}

	@JsonProperty("classBalance")
	public List<ClassBalance> getClassBalance() {
		return classBalance;
	}

	@JsonProperty("channelWeights")
	public Map<String, List<Double>> getChannelWeights() {
		return channelWeights;
	}

	@JsonIgnore
	public boolean isEmpty() {
		return c.isEmpty() && gamma.isEmpty() && kernel.isEmpty() && classBalance.isEmpty()
				&& channelWeights.isEmpty();
	}

	/**
	 * Every combination of the candidate values applied to the profile, in a
	 * fixed order: C, gamma, kernel, class balance, then the channel weights in
	 * declaration order, the last one varying fastest. Gamma is applied before
	 * the kernel so a linear profile can be searched towards an RBF one.
	 **/
	public List<ClassifierProfile> expand(ClassifierProfile base) {
		List<ClassifierProfile> candidates = new ArrayList<ClassifierProfile>();
		candidates.add(base);

		List<ClassifierProfile> next;
		if (!c.isEmpty()) {
			next = new ArrayList<ClassifierProfile>();
			for (ClassifierProfile candidate : candidates) {
				for (double value : c) {
					next.add(candidate.withC(value));
				}
			}
			candidates = next;
		}
		if (!gamma.isEmpty()) {
			next = new ArrayList<ClassifierProfile>();
			for (ClassifierProfile candidate : candidates) {
				for (double value : gamma) {
					next.add(candidate.withGamma(value));
				}
			}
			candidates = next;
		}
		if (!kernel.isEmpty()) {
			next = new ArrayList<ClassifierProfile>();
			for (ClassifierProfile candidate : candidates) {
				for (KernelType value : kernel) {
					next.add(candidate.withKernel(value));
				}
			}
			candidates = next;
		}
		if (!classBalance.isEmpty()) {
			next = new ArrayList<ClassifierProfile>();
			for (ClassifierProfile candidate : candidates) {
				for (ClassBalance value : classBalance) {
					next.add(candidate.withClassBalance(value));
				}
			}
			candidates = next;
		}
		for (Map.Entry<String, List<Double>> entry : channelWeights.entrySet()) {
			if (entry.getValue().isEmpty()) {
				continue;
			}
			next = new ArrayList<ClassifierProfile>();
			for (ClassifierProfile candidate : candidates) {
				for (double value : entry.getValue()) {
					next.add(candidate.withChannelWeight(entry.getKey(), value));
				}
			}
			candidates = next;
		}
		return candidates;
	}

	/*
	 * Number of candidates expand() produces
	 */
	public int size() {
		int size = Math.max(1, c.size()) * Math.max(1, gamma.size()) * Math.max(1, kernel.size())
				* Math.max(1, classBalance.size());
		for (List<Double> weights : channelWeights.values()) {
			size *= Math.max(1, weights.size());
		}
		return size;
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "{}";
		}
		return "{c=" + c + ", gamma=" + gamma + ", kernel=" + kernel + ", classBalance=" + classBalance
				+ ", channelWeights=" + channelWeights + "}";
	}
}
