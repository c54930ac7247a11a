package edu.arizona.cs.sdqc.classify;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import edu.arizona.cs.sdqc.model.Annotations;
import edu.arizona.cs.sdqc.model.StanceLabel;

class LabelRelabelerTest {

	private static Annotations annotations() {
		Map<String, StanceLabel> labels = new LinkedHashMap<String, StanceLabel>();
		labels.put("A", StanceLabel.QUERY);
		labels.put("B", StanceLabel.DENY);
		return new Annotations(labels);
	}

	@Test
	void denyAgainstTheRest() {
		Map<String, String> expected = new LinkedHashMap<String, String>();
		expected.put("A", "not_deny");
		expected.put("B", "deny");
		assertEquals(expected, LabelRelabeler.relabel(annotations(), StanceLabel.DENY));
	}

	@Test
	void queryAgainstTheRest() {
		Map<String, String> expected = new LinkedHashMap<String, String>();
		expected.put("A", "query");
		expected.put("B", "not_query");
		assertEquals(expected, LabelRelabeler.relabel(annotations(), StanceLabel.QUERY));
	}

	@Test
	void classNamesAreSorted() {
		assertEquals(Arrays.asList("deny", "not_deny"), LabelRelabeler.classNames(StanceLabel.DENY));
		assertEquals(Arrays.asList("not_support", "support"), LabelRelabeler.classNames(StanceLabel.SUPPORT));
	}

	@Test
	void baseRoleKeepsAllFourLabels() {
		assertEquals(Arrays.asList("support", "comment"),
				BankRole.BASE.labelsFor(Arrays.asList(StanceLabel.SUPPORT, StanceLabel.COMMENT)));
		assertEquals(Arrays.asList("not_query", "query"),
				BankRole.QUERY.labelsFor(Arrays.asList(StanceLabel.SUPPORT, StanceLabel.QUERY)));
	}
}
