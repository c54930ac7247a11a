package edu.arizona.cs.sdqc.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import edu.arizona.cs.sdqc.model.Annotations;

/**
 * Reads gold stance labels from a CSV file with the header {@code id,label}.
 **/
public class AnnotationCsvReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationCsvReader.class);

	public Annotations read(Path path) throws IOException {
		LOGGER.info("Preprocessing the {} file", path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	public Annotations read(Reader source) throws IOException {
		Map<String, String> labels = new LinkedHashMap<String, String>();
		try (CSVReader reader = new CSVReaderBuilder(source).withSkipLines(1).build()) {
			String[] nextLine;
			while ((nextLine = reader.readNext()) != null) {
				if (ThreadCsvReader.isBlank(nextLine)) {
					continue;
				}
				if (nextLine.length < 2) {
					throw new IllegalArgumentException("Line " + reader.getLinesRead() + " has no label");
				}
				String id = nextLine[0].trim();
				if (labels.put(id, nextLine[1].trim()) != null) {
					throw new IllegalArgumentException("Message " + id + " is annotated twice");
				}
			}
		} catch (CsvValidationException e) {
			throw new IOException("Malformed annotation file: " + e.getMessage(), e);
		}
		return Annotations.fromNames(labels);
	}
}
