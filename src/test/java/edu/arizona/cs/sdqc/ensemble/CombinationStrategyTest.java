package edu.arizona.cs.sdqc.ensemble;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import edu.arizona.cs.sdqc.model.StanceLabel;

class CombinationStrategyTest {

	@Test
	void withoutDenyKeepsBaseComments() {
		assertEquals(StanceLabel.COMMENT, CombinationStrategy.WITHOUT_DENY.combine("comment", "deny", "query"));
	}

	@Test
	void withoutDenyLetsQueryOverrideOtherBaseLabels() {
		assertEquals(StanceLabel.QUERY, CombinationStrategy.WITHOUT_DENY.combine("support", "not_deny", "query"));
		assertEquals(StanceLabel.QUERY, CombinationStrategy.WITHOUT_DENY.combine("deny", "deny", "query"));
	}

	@Test
	void withoutDenyIgnoresTheDenyClassifier() {
		assertEquals(StanceLabel.SUPPORT, CombinationStrategy.WITHOUT_DENY.combine("support", "deny", "not_query"));
	}

	@Test
	void withDenyPriorityIsQueryThenDenyThenBase() {
		assertEquals(StanceLabel.QUERY, CombinationStrategy.WITH_DENY.combine("comment", "deny", "query"));
		assertEquals(StanceLabel.DENY, CombinationStrategy.WITH_DENY.combine("comment", "deny", "not_query"));
		assertEquals(StanceLabel.SUPPORT, CombinationStrategy.WITH_DENY.combine("support", "not_deny", "not_query"));
	}

	@Test
	void unknownBaseLabelIsRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> CombinationStrategy.WITH_DENY.combine("agree", "not_deny", "not_query"));
	}
}
