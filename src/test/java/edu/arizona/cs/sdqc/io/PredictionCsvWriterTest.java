package edu.arizona.cs.sdqc.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import edu.arizona.cs.sdqc.model.StanceLabel;

class PredictionCsvWriterTest {

	@TempDir
	Path tempDir;

	private static Map<String, StanceLabel> predictions() {
		Map<String, StanceLabel> predictions = new LinkedHashMap<String, StanceLabel>();
		predictions.put("B", StanceLabel.DENY);
		predictions.put("A", StanceLabel.QUERY);
		return predictions;
	}

	@Test
	void writesOneRowPerMessageInOrder() throws IOException {
		StringWriter out = new StringWriter();
		new PredictionCsvWriter().write(out, predictions());

		assertEquals("id,label\nB,deny\nA,query\n", out.toString());
	}

	@Test
	void writtenFileReadsBackAsAnnotations() throws IOException {
		Path file = tempDir.resolve("predictions.csv");
		new PredictionCsvWriter().write(file, predictions());

		assertTrue(Files.readString(file, StandardCharsets.UTF_8).startsWith("id,label"));
		assertEquals(predictions(), new AnnotationCsvReader().read(file).asMap());
	}
}
