package edu.arizona.cs.sdqc.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.classify.BankRole;
import edu.arizona.cs.sdqc.features.ExtractorOptions;

/**
 * Run settings. Defaults come from {@code sdqc.properties} on the classpath,
 * then the file named by the {@code sdqc.config} system property, if any, and
 * finally {@code sdqc.*} system properties, each layer overriding the one
 * before.
 **/
public final class SdqcConfig {

	private static final Logger LOGGER = LoggerFactory.getLogger(SdqcConfig.class);

	public static final String DEFAULTS_RESOURCE = "sdqc.properties";
	public static final String CONFIG_FILE_PROPERTY = "sdqc.config";

	static final String FILTER_SHORT = "sdqc.filter.short";
	static final String SIMILARITY_THRESHOLD = "sdqc.filter.similarityThreshold";
	static final String SEARCH_FOLDS = "sdqc.search.folds";
	static final String SEARCH_PARALLELISM = "sdqc.search.parallelism";
	static final String PROFILES_RESOURCE = "sdqc.profiles.resource";
	static final String PROFILE_PREFIX = "sdqc.profile.";
	static final String SEARCH_PREFIX = "sdqc.search.";
	static final String EXTRACTOR_TASK = "sdqc.extractor.task";
	static final String STRIP_HASHTAGS = "sdqc.extractor.stripHashtags";
	static final String STRIP_MENTIONS = "sdqc.extractor.stripMentions";

	private final Properties properties;

	public SdqcConfig(Properties properties) {
		this.properties = properties;
	}

	/**
	 * Loads the layered configuration.
	 **/
	public static SdqcConfig load() throws IOException {
		Properties properties = new Properties();
		try (InputStream in = SdqcConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				throw new IOException("Missing " + DEFAULTS_RESOURCE + " on the classpath");
			}
			properties.load(in);
		}

		String external = System.getProperty(CONFIG_FILE_PROPERTY);
		if (external != null && !external.trim().isEmpty()) {
			Path path = Paths.get(external.trim());
			try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
				properties.load(reader);
			}
			LOGGER.info("Loaded configuration overrides from {}", path);
		}

		for (String key : System.getProperties().stringPropertyNames()) {
			if (key.startsWith("sdqc.") && !key.equals(CONFIG_FILE_PROPERTY)) {
				properties.setProperty(key, System.getProperty(key));
			}
		}
		return new SdqcConfig(properties);
	}

	public boolean isFilterShort() {
		return Boolean.parseBoolean(get(FILTER_SHORT, "false"));
	}

	public double getSimilarityThreshold() {
		return Double.parseDouble(get(SIMILARITY_THRESHOLD, "0.9"));
	}

	public int getFoldCount() {
		return Integer.parseInt(get(SEARCH_FOLDS, "3"));
	}

	public int getSearchParallelism() {
		return Integer.parseInt(get(SEARCH_PARALLELISM, "1"));
	}

	public String getProfilesResource() {
		return get(PROFILES_RESOURCE, ProfileCatalog.DEFAULT_RESOURCE);
	}

	/*
	 * Name of the classifier profile used for the role
	 */
	public String getProfileName(BankRole role) {
		return get(PROFILE_PREFIX + role.roleName(), role.roleName());
	}

	/*
	 * Name of the search space used for the role
	 */
	public String getSearchSpaceName(BankRole role) {
		return get(SEARCH_PREFIX + role.roleName(), ProfileCatalog.NO_SEARCH);
	}

	public ExtractorOptions getExtractorOptions() {
		return new ExtractorOptions(get(EXTRACTOR_TASK, ExtractorOptions.STANCE_TASK),
				Boolean.parseBoolean(get(STRIP_HASHTAGS, "false")),
				Boolean.parseBoolean(get(STRIP_MENTIONS, "false")));
	}

	private String get(String key, String fallback) {
		String value = properties.getProperty(key);
		if (value == null || value.trim().isEmpty()) {
			return fallback;
		}
		return value.trim();
	}

	@Override
	public String toString() {
		return "filterShort=" + isFilterShort() + ", similarityThreshold=" + getSimilarityThreshold() + ", folds="
				+ getFoldCount() + ", parallelism=" + getSearchParallelism() + ", profiles=" + getProfilesResource();
	}
}
