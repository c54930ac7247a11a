package edu.arizona.cs.sdqc.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import edu.arizona.cs.sdqc.classify.ClassifierProfile;
import edu.arizona.cs.sdqc.classify.SearchSpace;

/**
 * Named classifier profiles and search spaces read from a YAML document.
 * Profile and space names are the keys of the {@code profiles} and
 * {@code searchSpaces} maps.
 **/
public final class ProfileCatalog {

	public static final String DEFAULT_RESOURCE = "sdqc-profiles.yaml";
	public static final String NO_SEARCH = "none";

	private final Map<String, ClassifierProfile> profiles;
	private final Map<String, SearchSpace> searchSpaces;

	@JsonCreator
	ProfileCatalog(@JsonProperty("profiles") Map<String, ClassifierProfile> profiles,
			@JsonProperty("searchSpaces") Map<String, SearchSpace> searchSpaces) {
		Map<String, ClassifierProfile> named = new LinkedHashMap<String, ClassifierProfile>();
		if (profiles != null) {
			for (Map.Entry<String, ClassifierProfile> entry : profiles.entrySet()) {
				named.put(entry.getKey(), entry.getValue().withName(entry.getKey()));
			}
		}
		this.profiles = Collections.unmodifiableMap(named);
		Map<String, SearchSpace> spaces = new LinkedHashMap<String, SearchSpace>();
		spaces.put(NO_SEARCH, SearchSpace.empty());
		if (searchSpaces != null) {
			for (Map.Entry<String, SearchSpace> entry : searchSpaces.entrySet()) {
				spaces.put(entry.getKey(), entry.getValue() == null ? SearchSpace.empty() : entry.getValue());
			}
		}
		this.searchSpaces = Collections.unmodifiableMap(spaces);
	}

	static ObjectMapper mapper() {
		return new ObjectMapper(new YAMLFactory());
	}

	/**
	 * Reads a catalog from the classpath, or from the file system when no
	 * classpath resource has that name.
	 **/
	public static ProfileCatalog load(String resource) throws IOException {
		try (InputStream in = ProfileCatalog.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null) {
				return mapper().readValue(in, ProfileCatalog.class);
			}
		}
		Path path = Paths.get(resource);
		if (!Files.exists(path)) {
			throw new IOException("No profile catalog at " + resource);
		}
		try (InputStream in = Files.newInputStream(path)) {
			return mapper().readValue(in, ProfileCatalog.class);
		}
	}

	public static ProfileCatalog loadDefault() throws IOException {
		return load(DEFAULT_RESOURCE);
	}

	public ClassifierProfile profile(String name) {
		ClassifierProfile profile = profiles.get(name);
		if (profile == null) {
			throw new IllegalArgumentException("Unknown classifier profile '" + name + "', known: " + profiles.keySet());
		}
		return profile;
	}

	public SearchSpace searchSpace(String name) {
		SearchSpace space = searchSpaces.get(name);
		if (space == null) {
			throw new IllegalArgumentException("Unknown search space '" + name + "', known: " + searchSpaces.keySet());
		}
		return space;
	}

	public Map<String, ClassifierProfile> getProfiles() {
		return profiles;
	}

	public Map<String, SearchSpace> getSearchSpaces() {
		return searchSpaces;
	}
}
