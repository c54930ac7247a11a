package edu.arizona.cs.sdqc.eval;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class StanceEvaluationTest {

	private static final List<String> CLASSES = Arrays.asList("deny", "not_deny");

	private static StanceEvaluation evaluation() throws Exception {
		return StanceEvaluation.of("deny", CLASSES, Arrays.asList("deny", "deny", "not_deny", "not_deny"),
				Arrays.asList("deny", "not_deny", "not_deny", "not_deny"));
	}

	@Test
	void perClassScores() throws Exception {
		StanceEvaluation evaluation = evaluation();

		assertEquals(4, evaluation.numPredictions());
		assertEquals(0.75, evaluation.accuracy(), 1e-9);
		assertEquals(1.0, evaluation.precision("deny"), 1e-9);
		assertEquals(0.5, evaluation.recall("deny"), 1e-9);
		assertEquals(2.0 / 3.0, evaluation.precision("not_deny"), 1e-9);
		assertEquals(2.0 / 3.0, evaluation.f1("deny"), 1e-9);
		assertEquals(2, evaluation.support("not_deny"));
	}

	@Test
	void confusionMatrixRowsAreGoldClasses() throws Exception {
		int[][] matrix = evaluation().confusionMatrix();

		assertArrayEquals(new int[] { 1, 1 }, matrix[0]);
		assertArrayEquals(new int[] { 0, 2 }, matrix[1]);
	}

	@Test
	void classNeverPredictedScoresZero() throws Exception {
		StanceEvaluation evaluation = StanceEvaluation.of("query", Arrays.asList("not_query", "query"),
				Arrays.asList("query", "not_query"), Arrays.asList("not_query", "not_query"));

		assertEquals(0.0, evaluation.precision("query"), 0.0);
		assertEquals(0.0, evaluation.f1("query"), 0.0);
	}

	@Test
	void unknownLabelIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> StanceEvaluation.of("deny", CLASSES,
				Arrays.asList("deny"), Arrays.asList("query")));
		assertThrows(IllegalArgumentException.class, () -> StanceEvaluation.of("deny", CLASSES,
				Arrays.asList("deny"), Arrays.asList("deny", "deny")));
	}

	@Test
	void reportsListEveryClass() throws Exception {
		StanceEvaluation evaluation = evaluation();

		String report = ReportFormatter.classificationReport(evaluation);
		assertTrue(report.contains("precision"));
		assertTrue(report.contains("not_deny"));
		assertTrue(report.contains("avg / total"));

		String matrix = ReportFormatter.confusionMatrix(evaluation);
		assertTrue(matrix.contains("000002"));
		assertEquals(3, matrix.split("\\R").length);
	}
}
