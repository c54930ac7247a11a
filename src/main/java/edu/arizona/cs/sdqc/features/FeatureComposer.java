package edu.arizona.cs.sdqc.features;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import edu.arizona.cs.sdqc.text.TfidfVectorizer;
import weka.core.Attribute;
import weka.core.Instances;
import weka.core.SparseInstance;
import weka.core.Utils;

/**
 * Turns feature bags into Weka instances. Each channel is encoded into its own
 * block of columns, the block is multiplied by the channel weight, and the
 * blocks are laid out one after the other in channel order, followed by the
 * nominal class attribute.
 *
 * Fitting learns what depends on the training data (text vocabularies and
 * categorical values) and returns an immutable {@link Fitted} composer.
 **/
public final class FeatureComposer {

	static final String CLASS_ATTRIBUTE = "the_class";

	private final String name;
	private final List<FeatureChannel> channels;

	public FeatureComposer(String name, List<FeatureChannel> channels) {
		this.name = name;
		this.channels = Collections.unmodifiableList(new ArrayList<FeatureChannel>(channels));
		if (this.channels.isEmpty()) {
			throw new IllegalArgumentException("Composer " + name + " has no channels");
		}
	}

	public String getName() {
		return name;
	}

	public List<FeatureChannel> getChannels() {
		return channels;
	}

	/**
	 * Learns the channel encodings from the training bags.
	 *
	 * @param bags        the training feature bags
	 * @param classLabels the class values of the classifier, in order
	 **/
	public Fitted fit(List<FeatureBag> bags, List<String> classLabels) {
		if (bags.isEmpty()) {
			throw new IllegalArgumentException("Cannot fit composer " + name + " on no messages");
		}
		List<ChannelEncoder> encoders = new ArrayList<ChannelEncoder>();
		ArrayList<Attribute> attributes = new ArrayList<Attribute>();
		for (FeatureChannel channel : channels) {
			ChannelEncoder encoder;
			switch (channel.getEncoding()) {
			case NUMERIC:
				encoder = new NumericEncoder(channel);
				break;
			case CATEGORICAL:
				encoder = CategoricalEncoder.fit(channel, bags);
				break;
			case TEXT:
				encoder = TextEncoder.fit(channel, bags);
				break;
			default:
				throw new IllegalStateException("Unhandled encoding " + channel.getEncoding());
			}
			encoder.offset = attributes.size();
			for (String column : encoder.columnNames()) {
				attributes.add(new Attribute(channel.getName() + ":" + column));
			}
			encoders.add(encoder);
		}
		attributes.add(new Attribute(CLASS_ATTRIBUTE, new ArrayList<String>(classLabels)));

		Instances header = new Instances(name, attributes, 0);
		header.setClassIndex(attributes.size() - 1);
		return new Fitted(name, header, encoders);
	}

	/**
	 * A composer whose encodings have been learned. Safe to share between
	 * threads.
	 **/
	public static final class Fitted {

		private final String name;
		private final Instances header;
		private final List<ChannelEncoder> encoders;

		private Fitted(String name, Instances header, List<ChannelEncoder> encoders) {
			this.name = name;
			this.header = header;
			this.encoders = encoders;
		}

		/*
		 * Number of feature columns, class excluded
		 */
		public int numFeatures() {
			return header.numAttributes() - 1;
		}

		/*
		 * An empty copy of the dataset structure
		 */
		public Instances header() {
			return new Instances(header, 0);
		}

		/**
		 * Encodes the bags into a dataset. With labels, each instance gets its
		 * class value; with {@code null} labels the class is left missing.
		 **/
		public Instances toInstances(List<FeatureBag> bags, List<String> labels) {
			if (labels != null && labels.size() != bags.size()) {
				throw new IllegalArgumentException(bags.size() + " messages but " + labels.size() + " labels");
			}
			Instances data = new Instances(header, bags.size());
			Attribute classAttribute = data.classAttribute();
			for (int i = 0; i < bags.size(); i++) {
				double[] row = new double[data.numAttributes()];
				for (ChannelEncoder encoder : encoders) {
					encoder.encode(bags.get(i), row);
				}
				if (labels == null) {
					row[data.classIndex()] = Utils.missingValue();
				} else {
					int classValue = classAttribute.indexOfValue(labels.get(i));
					if (classValue < 0) {
						throw new IllegalArgumentException("Label '" + labels.get(i) + "' is not a class of " + name);
					}
					row[data.classIndex()] = classValue;
				}
				data.add(new SparseInstance(1.0, row));
			}
			return data;
		}
	}

	/**************************************************************************
	 * Encoders of a single channel
	 **************************************************************************/
	abstract static class ChannelEncoder {

		final FeatureChannel channel;
		// First column of this channel in the row
		int offset;

		ChannelEncoder(FeatureChannel channel) {
			this.channel = channel;
		}

		abstract List<String> columnNames();

		abstract void encode(FeatureBag bag, double[] row);
	}

	static final class NumericEncoder extends ChannelEncoder {

		NumericEncoder(FeatureChannel channel) {
			super(channel);
		}

		@Override
		List<String> columnNames() {
			return channel.getKeys();
		}

		@Override
		void encode(FeatureBag bag, double[] row) {
			List<String> keys = channel.getKeys();
			for (int i = 0; i < keys.size(); i++) {
				row[offset + i] = channel.getWeight() * numericValue(bag, keys.get(i));
			}
		}

		static double numericValue(FeatureBag bag, String key) {
			Object value = bag.get(key);
			if (value instanceof Number) {
				return ((Number) value).doubleValue();
			}
			if (value instanceof Boolean) {
				return ((Boolean) value) ? 1.0 : 0.0;
			}
			if (value instanceof Collection) {
				return ((Collection<?>) value).size();
			}
			throw new IllegalArgumentException("Feature '" + key + "' of message " + bag.getMessageId()
					+ " is not numeric: " + value);
		}
	}

	static final class CategoricalEncoder extends ChannelEncoder {

		// key=value -> column within the channel
		private final List<String> columns;

		private CategoricalEncoder(FeatureChannel channel, List<String> columns) {
			super(channel);
			this.columns = columns;
		}

		static CategoricalEncoder fit(FeatureChannel channel, List<FeatureBag> bags) {
			TreeSet<String> seen = new TreeSet<String>();
			for (FeatureBag bag : bags) {
				for (String key : channel.getKeys()) {
					seen.add(indicator(key, bag.get(key)));
				}
			}
			return new CategoricalEncoder(channel, new ArrayList<String>(seen));
		}

		@Override
		List<String> columnNames() {
			return columns;
		}

		@Override
		void encode(FeatureBag bag, double[] row) {
			for (String key : channel.getKeys()) {
				int column = Collections.binarySearch(columns, indicator(key, bag.get(key)));
				// values never seen while fitting have no column
				if (column >= 0) {
					row[offset + column] = channel.getWeight();
				}
			}
		}

		static String indicator(String key, Object value) {
			if (value instanceof Collection) {
				return key + "=" + String.join(" ", asStrings((Collection<?>) value));
			}
			return key + "=" + value;
		}
	}

	static final class TextEncoder extends ChannelEncoder {

		private final TfidfVectorizer vectorizer;

		private TextEncoder(FeatureChannel channel, TfidfVectorizer vectorizer) {
			super(channel);
			this.vectorizer = vectorizer;
		}

		static TextEncoder fit(FeatureChannel channel, List<FeatureBag> bags) {
			List<String> documents = new ArrayList<String>(bags.size());
			for (FeatureBag bag : bags) {
				documents.add(document(bag, channel.getKeys().get(0)));
			}
			return new TextEncoder(channel, TfidfVectorizer.fit(documents));
		}

		@Override
		List<String> columnNames() {
			return new ArrayList<String>(vectorizer.terms());
		}

		@Override
		void encode(FeatureBag bag, double[] row) {
			Map<Integer, Double> weights = vectorizer.transform(document(bag, channel.getKeys().get(0)));
			for (Map.Entry<Integer, Double> entry : weights.entrySet()) {
				row[offset + entry.getKey()] = channel.getWeight() * entry.getValue();
			}
		}

		static String document(FeatureBag bag, String key) {
			Object value = bag.get(key);
			if (value instanceof Collection) {
				return String.join(" ", asStrings((Collection<?>) value));
			}
			return String.valueOf(value);
		}
	}

	static List<String> asStrings(Collection<?> values) {
		List<String> strings = new ArrayList<String>(values.size());
		for (Object value : values) {
			strings.add(String.valueOf(value));
		}
		return strings;
	}
}
