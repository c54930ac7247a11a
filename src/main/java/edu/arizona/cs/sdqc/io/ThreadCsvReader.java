package edu.arizona.cs.sdqc.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.MessageIndex;

/**
 * Reads conversation threads from a CSV file with the header
 * {@code id,parent_id,text,verified,is_news,retweet_count,hashtags,mentions}.
 * The parent id is empty for thread roots; hashtags and mentions are space
 * separated. Only the first three columns are required.
 **/
public class ThreadCsvReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(ThreadCsvReader.class);

	static final int ID = 0, PARENT_ID = 1, TEXT = 2, VERIFIED = 3, IS_NEWS = 4, RETWEET_COUNT = 5, HASHTAGS = 6,
			MENTIONS = 7;

	public MessageIndex read(Path path) throws IOException {
		LOGGER.info("Preprocessing the {} file", path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			MessageIndex index = read(reader);
			LOGGER.info("Read {} messages from {}", index.size(), path);
			return index;
		}
	}

	public MessageIndex read(Reader source) throws IOException {
		MessageIndex index = new MessageIndex();
		// The first line holds the column names
		try (CSVReader reader = new CSVReaderBuilder(source).withSkipLines(1).build()) {
			String[] nextLine;
			while ((nextLine = reader.readNext()) != null) {
				if (isBlank(nextLine)) {
					continue;
				}
				index.add(toMessage(nextLine, reader.getLinesRead()));
			}
		} catch (CsvValidationException e) {
			throw new IOException("Malformed thread file: " + e.getMessage(), e);
		}
		return index;
	}

	static Message toMessage(String[] line, long lineNumber) {
		if (line.length < 3) {
			throw new IllegalArgumentException("Line " + lineNumber + " has " + line.length
					+ " columns, expected at least id, parent_id and text");
		}
		return Message.builder(line[ID].trim())
				.parent(line[PARENT_ID].trim())
				.text(line[TEXT])
				.verified(flag(column(line, VERIFIED)))
				.news(flag(column(line, IS_NEWS)))
				.retweetCount(count(column(line, RETWEET_COUNT), lineNumber))
				.hashtags(words(column(line, HASHTAGS)))
				.mentions(words(column(line, MENTIONS)))
				.build();
	}

	private static String column(String[] line, int column) {
		return column < line.length ? line[column].trim() : "";
	}

	private static boolean flag(String value) {
		return value.equalsIgnoreCase("true") || value.equals("1");
	}

	private static int count(String value, long lineNumber) {
		if (value.isEmpty()) {
			return 0;
		}
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Line " + lineNumber + " has a bad retweet count: " + value, e);
		}
	}

	private static List<String> words(String value) {
		List<String> words = new ArrayList<String>();
		for (String word : value.split(" ")) {
			if (!word.isEmpty()) {
				words.add(word);
			}
		}
		return words;
	}

	static boolean isBlank(String[] line) {
		return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
	}
}
