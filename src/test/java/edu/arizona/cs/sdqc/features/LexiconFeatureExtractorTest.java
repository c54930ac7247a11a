package edu.arizona.cs.sdqc.features;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import edu.arizona.cs.sdqc.ThreadFixtures;
import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.MessageIndex;

class LexiconFeatureExtractorTest {

	private final LexiconFeatureExtractor extractor = new LexiconFeatureExtractor(ExtractorOptions.stanceDefaults());
	private final MessageIndex thread = ThreadFixtures.trainingThread();

	@Test
	void queryReplyFeatures() {
		FeatureBag bag = extractor.extract(ThreadFixtures.QUERY_REPLY, thread);

		assertEquals("A", bag.getMessageId());
		assertEquals(Boolean.FALSE, bag.get(LexiconFeatureExtractor.IS_ROOT));
		assertEquals(1, bag.get(LexiconFeatureExtractor.DEPTH));
		assertEquals(1, bag.get(LexiconFeatureExtractor.QUESTION_MARK_COUNT));
		assertEquals(0, bag.get(LexiconFeatureExtractor.DENYING_WORDS));
		assertEquals(13, bag.get(LexiconFeatureExtractor.CHAR_COUNT));
		// "is" and "that" are stop words
		assertEquals(Collections.singletonList("true"), bag.get(LexiconFeatureExtractor.TEXT_STEMMED_STOPPED));
		assertEquals(Arrays.asList("is", "that", "true"), bag.get(LexiconFeatureExtractor.TEXT_MINUS_ROOT));
	}

	@Test
	void denyReplyCountsDenyingWords() {
		FeatureBag bag = extractor.extract(ThreadFixtures.DENY_REPLY, thread);

		assertEquals(2, bag.get(LexiconFeatureExtractor.DENYING_WORDS));
		assertEquals(0, bag.get(LexiconFeatureExtractor.QUESTION_MARK_COUNT));
	}

	@Test
	void rootKeepsItsWholeText() {
		FeatureBag bag = extractor.extract(ThreadFixtures.ROOT, thread);

		assertEquals(Boolean.TRUE, bag.get(LexiconFeatureExtractor.IS_ROOT));
		assertEquals(0, bag.get(LexiconFeatureExtractor.DEPTH));
		assertEquals(Arrays.asList("breaking", "news", "happened"), bag.get(LexiconFeatureExtractor.TEXT_MINUS_ROOT));
	}

	@Test
	void replyWordsSharedWithTheRootAreDropped() {
		Message root = Message.builder("r").text("Plane landed in the river").build();
		Message reply = Message.builder("a").parent("r").text("the plane did not land in any river").build();
		MessageIndex index = new MessageIndex().add(root).add(reply);

		assertEquals(Arrays.asList("did", "not", "land", "any"),
				extractor.extract(reply, index).get(LexiconFeatureExtractor.TEXT_MINUS_ROOT));
	}

	@Test
	void punctuationCounts() {
		Message message = Message.builder("m").text("Wait... what. Really?! No way!").build();
		FeatureBag bag = extractor.extract(message, new MessageIndex().add(message));

		assertEquals(1, bag.get(LexiconFeatureExtractor.ELLIPSIS_COUNT));
		assertEquals(1, bag.get(LexiconFeatureExtractor.PERIOD_COUNT));
		assertEquals(1, bag.get(LexiconFeatureExtractor.QUESTION_MARK_COUNT));
		assertEquals(2, bag.get(LexiconFeatureExtractor.EXCLAMATION_COUNT));
		assertEquals(2, bag.get(LexiconFeatureExtractor.QUERYING_WORDS));
	}

	@Test
	void hashtagsAndMentionsFallBackToTheText() {
		Message tagged = Message.builder("m").text("@bbc is this real? #hoax #breaking").build();
		FeatureBag bag = extractor.extract(tagged, new MessageIndex().add(tagged));
		assertEquals(Arrays.asList("hoax", "breaking"), bag.get(LexiconFeatureExtractor.HASHTAGS));
		assertEquals(Collections.singletonList("bbc"), bag.get(LexiconFeatureExtractor.USER_MENTIONS));

		Message withMetadata = Message.builder("n").text("#hoax").hashtags(Arrays.asList("other")).build();
		assertEquals(Collections.singletonList("other"), extractor
				.extract(withMetadata, new MessageIndex().add(withMetadata)).get(LexiconFeatureExtractor.HASHTAGS));
	}

	@Test
	void normalizedTextDropsLinksAndWhitespace() {
		Message message = Message.builder("m").text("  Look   HERE http://t.co/xyz  #News @bbc ").build();

		assertEquals("look here #news @bbc", extractor.normalizeText(message));
		LexiconFeatureExtractor stripping = new LexiconFeatureExtractor(new ExtractorOptions("A", true, true));
		assertEquals("look here", stripping.normalizeText(message));
	}
}
