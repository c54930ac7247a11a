package edu.arizona.cs.sdqc.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonMappingException;

import edu.arizona.cs.sdqc.classify.ClassBalance;
import edu.arizona.cs.sdqc.classify.ClassifierProfile;
import edu.arizona.cs.sdqc.classify.KernelType;
import edu.arizona.cs.sdqc.features.ChannelEncoding;
import edu.arizona.cs.sdqc.features.FeatureChannel;
import edu.arizona.cs.sdqc.features.LexiconFeatureExtractor;

class ProfileCatalogTest {

	@Test
	void defaultProfilesMatchTheTunedSettings() throws IOException {
		ProfileCatalog catalog = ProfileCatalog.loadDefault();

		ClassifierProfile base = catalog.profile("base");
		assertEquals("base", base.getName());
		assertEquals(KernelType.RBF, base.getKernel());
		assertEquals(100.0, base.getC(), 0.0);
		assertEquals(0.001, base.getGamma(), 0.0);
		assertEquals(ClassBalance.NONE, base.getClassBalance());
		assertEquals(17, base.getChannels().size());
		assertEquals(20.0, base.channel("is_root").getWeight(), 0.0);
		assertEquals(5.0, base.channel("offensiveness").getWeight(), 0.0);

		FeatureChannel text = base.channel("tweet_text");
		assertEquals(ChannelEncoding.TEXT, text.getEncoding());
		assertEquals(LexiconFeatureExtractor.TEXT_STEMMED_STOPPED, text.getKeys().get(0));

		ClassifierProfile deny = catalog.profile("deny");
		assertEquals(KernelType.LINEAR, deny.getKernel());
		assertEquals(10.0, deny.getC(), 0.0);
		assertEquals(ClassBalance.BALANCED, deny.getClassBalance());
		assertEquals(LexiconFeatureExtractor.TEXT_MINUS_ROOT, deny.channel("tweet_text").getKeys().get(0));
		assertEquals(5.0, deny.channel("denying_words").getWeight(), 0.0);

		ClassifierProfile query = catalog.profile("query");
		assertEquals(1.0, query.getC(), 0.0);
		assertEquals(6, query.getChannels().size());
		assertEquals(5.0, query.channel("count_question_marks").getWeight(), 0.0);
		assertThrows(IllegalArgumentException.class, () -> query.channel("tweet_text"));
	}

	@Test
	void historicalProfilesAndGridsAreAvailable() throws IOException {
		ProfileCatalog catalog = ProfileCatalog.loadDefault();

		for (String name : new String[] { "base-heavy-lexicon", "deny-heavy-lexicon", "query-heavy-lexicon" }) {
			assertEquals(name, catalog.profile(name).getName());
		}
		assertTrue(catalog.searchSpace(ProfileCatalog.NO_SEARCH).isEmpty());
		assertEquals(3 * 2 * 2 * 4 * 4 * 4 * 4 * 4, catalog.searchSpace("base-grid").size());
		// every grid only touches channels its profile has
		assertEquals(catalog.searchSpace("deny-grid").size(),
				catalog.searchSpace("deny-grid").expand(catalog.profile("deny")).size());
		assertEquals(catalog.searchSpace("query-grid").size(),
				catalog.searchSpace("query-grid").expand(catalog.profile("query")).size());
	}

	@Test
	void unknownNamesAreRejected() throws IOException {
		ProfileCatalog catalog = ProfileCatalog.loadDefault();

		assertThrows(IllegalArgumentException.class, () -> catalog.profile("nope"));
		assertThrows(IllegalArgumentException.class, () -> catalog.searchSpace("nope"));
	}

	@Test
	void negativeChannelWeightIsRejected() {
		JsonMappingException e = assertThrows(JsonMappingException.class,
				() -> ProfileCatalog.load("profiles-negative-weight.yaml"));
		assertTrue(e.getMessage().contains("negative weight"), e.getMessage());
	}

	@Test
	void missingCatalogIsAnIOException() {
		assertThrows(IOException.class, () -> ProfileCatalog.load("no-such-profiles.yaml"));
	}
}
