package edu.arizona.cs.sdqc.eval;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import edu.arizona.cs.sdqc.ThreadFixtures;
import edu.arizona.cs.sdqc.features.ExtractorOptions;
import edu.arizona.cs.sdqc.features.LexiconFeatureExtractor;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.StanceLabel;

class MisclassificationReportTest {

	@Test
	void listsMissesAndFalseAlarmsWithTheirRoot() {
		MisclassificationReport report = new MisclassificationReport(
				new LexiconFeatureExtractor(ExtractorOptions.stanceDefaults()), ThreadFixtures.trainingThread());
		List<Message> messages = Arrays.asList(ThreadFixtures.QUERY_REPLY, ThreadFixtures.DENY_REPLY,
				ThreadFixtures.SHORT_REPLY);
		List<StanceLabel> gold = Arrays.asList(StanceLabel.QUERY, StanceLabel.DENY, StanceLabel.COMMENT);

		List<Misclassification> wrong = report.list(StanceLabel.QUERY, messages, gold,
				Arrays.asList("not_query", "query", "not_query"));

		assertEquals(2, wrong.size());
		assertEquals("A", wrong.get(0).getMessageId());
		assertEquals("query", wrong.get(0).getGold());
		assertEquals("not_query", wrong.get(0).getPredicted());
		assertEquals("is that true?", wrong.get(0).getText());
		assertEquals("breaking news: x happened", wrong.get(0).getRootText());
		assertEquals("B", wrong.get(1).getMessageId());
	}
}
