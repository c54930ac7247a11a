package edu.arizona.cs.sdqc.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AnnotationsTest {

	@Test
	void validatesLabelsAtIngestion() {
		Map<String, String> raw = new LinkedHashMap<String, String>();
		raw.put("a", "query");
		raw.put("b", "unrelated");

		assertThrows(IllegalArgumentException.class, () -> Annotations.fromNames(raw));
	}

	@Test
	void gapInCoverageNamesTheMessage() {
		Map<String, String> raw = new LinkedHashMap<String, String>();
		raw.put("a", "query");
		Annotations annotations = Annotations.fromNames(raw);
		MessageIndex index = new MessageIndex().add(Message.builder("a").build()).add(Message.builder("b").build());

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> annotations.requireCoverage(index));
		assertTrue(e.getMessage().contains("b"));
	}

	@Test
	void labelsFollowMessageOrder() {
		Map<String, String> raw = new LinkedHashMap<String, String>();
		raw.put("a", "query");
		raw.put("b", "deny");
		Annotations annotations = Annotations.fromNames(raw);

		assertEquals(Arrays.asList(StanceLabel.DENY, StanceLabel.QUERY), annotations.labelsOf(
				Arrays.asList(Message.builder("b").build(), Message.builder("a").build())));
	}
}
