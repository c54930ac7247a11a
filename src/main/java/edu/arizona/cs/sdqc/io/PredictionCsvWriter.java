package edu.arizona.cs.sdqc.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVWriter;

import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Writes the final stance of each evaluation message as {@code id,label}
 * rows, in the order of the map.
 **/
public class PredictionCsvWriter {

	private static final Logger LOGGER = LoggerFactory.getLogger(PredictionCsvWriter.class);

	static final String[] HEADER = { "id", "label" };

	public void write(Path path, Map<String, StanceLabel> predictions) throws IOException {
		try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(out, predictions);
		}
		LOGGER.info("Wrote {} predictions to {}", predictions.size(), path);
	}

	public void write(Writer out, Map<String, StanceLabel> predictions) throws IOException {
		CSVWriter writer = new CSVWriter(out);
		writer.writeNext(HEADER, false);
		for (Map.Entry<String, StanceLabel> entry : predictions.entrySet()) {
			String[] entries = new String[2];
			entries[0] = entry.getKey();
			entries[1] = entry.getValue().labelName();
			writer.writeNext(entries, false);
		}
		writer.flush();
	}
}
