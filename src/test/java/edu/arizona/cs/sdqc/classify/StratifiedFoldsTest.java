package edu.arizona.cs.sdqc.classify;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class StratifiedFoldsTest {

	private static final List<String> LABELS = Arrays.asList("a", "b", "a", "b", "a", "b");

	@Test
	void foldsPartitionTheExamples() {
		StratifiedFolds folds = StratifiedFolds.of(LABELS, 3);

		Set<Integer> seen = new HashSet<Integer>();
		for (int fold = 0; fold < folds.foldCount(); fold++) {
			for (int index : folds.testIndices(fold)) {
				assertTrue(seen.add(index), "index " + index + " held out twice");
				assertFalse(folds.trainIndices(fold).contains(index));
			}
			assertEquals(LABELS.size(), folds.testIndices(fold).size() + folds.trainIndices(fold).size());
		}
		assertEquals(LABELS.size(), seen.size());
	}

	@Test
	void everyFoldHoldsOutEachClass() {
		StratifiedFolds folds = StratifiedFolds.of(LABELS, 3);

		for (int fold = 0; fold < 3; fold++) {
			Set<String> classes = new HashSet<String>();
			for (int index : folds.testIndices(fold)) {
				classes.add(LABELS.get(index));
			}
			assertEquals(new HashSet<String>(Arrays.asList("a", "b")), classes);
		}
	}

	@Test
	void splitIsDeterministic() {
		assertEquals(StratifiedFolds.of(LABELS, 2).testIndices(1), StratifiedFolds.of(LABELS, 2).testIndices(1));
	}

	@Test
	void badFoldCountsAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> StratifiedFolds.of(LABELS, 1));
		assertThrows(IllegalArgumentException.class, () -> StratifiedFolds.of(LABELS, 7));
	}
}
