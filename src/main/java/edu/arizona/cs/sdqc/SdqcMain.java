package edu.arizona.cs.sdqc;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.arizona.cs.sdqc.config.ProfileCatalog;
import edu.arizona.cs.sdqc.config.SdqcConfig;
import edu.arizona.cs.sdqc.io.AnnotationCsvReader;
import edu.arizona.cs.sdqc.io.PredictionCsvWriter;
import edu.arizona.cs.sdqc.io.ThreadCsvReader;
import edu.arizona.cs.sdqc.model.Annotations;
import edu.arizona.cs.sdqc.model.MessageIndex;
import edu.arizona.cs.sdqc.model.StanceLabel;

/**
 * Command line entry point.
 *
 * <pre>
 * SdqcMain &lt;train-threads.csv&gt; &lt;train-annotations.csv&gt; &lt;eval-threads.csv&gt; &lt;eval-annotations.csv&gt; &lt;predictions-out.csv&gt;
 * </pre>
 *
 * Run settings come from {@code sdqc.properties}, see {@link SdqcConfig}.
 **/
public class SdqcMain {

	private static final Logger LOGGER = LoggerFactory.getLogger(SdqcMain.class);

	static final String USAGE = "usage: SdqcMain <train-threads.csv> <train-annotations.csv> <eval-threads.csv> "
			+ "<eval-annotations.csv> <predictions-out.csv>";

	public static void main(String[] args) throws Exception {
		if (args.length != 5) {
			System.err.println(USAGE);
			System.exit(2);
		}
		run(Paths.get(args[0]), Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3]), Paths.get(args[4]));
	}

	/**
	 * Reads the four input files, classifies the evaluation threads and writes
	 * the final labels.
	 **/
	public static Map<String, StanceLabel> run(Path trainThreads, Path trainAnnotations, Path evalThreads,
			Path evalAnnotations, Path output) throws Exception {
		SdqcConfig config = SdqcConfig.load();
		LOGGER.info("Configuration: {}", config);
		ProfileCatalog catalog = ProfileCatalog.load(config.getProfilesResource());

		/*** Use the opencsv readers for the thread and annotation files ***/
		ThreadCsvReader threadReader = new ThreadCsvReader();
		AnnotationCsvReader annotationReader = new AnnotationCsvReader();
		MessageIndex train = threadReader.read(trainThreads);
		Annotations trainGold = annotationReader.read(trainAnnotations);
		MessageIndex eval = threadReader.read(evalThreads);
		Annotations evalGold = annotationReader.read(evalAnnotations);

		StanceClassificationTask task = StanceClassificationTask.fromConfig(config, catalog);
		Map<String, StanceLabel> labels = task.classify(train, eval, trainGold, evalGold);

		LOGGER.info("Generating the output file {}", output);
		new PredictionCsvWriter().write(output, labels);
		return labels;
	}
}
