package edu.arizona.cs.sdqc.io;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import edu.arizona.cs.sdqc.model.Message;
import edu.arizona.cs.sdqc.model.MessageIndex;

class ThreadCsvReaderTest {

	private final ThreadCsvReader reader = new ThreadCsvReader();

	@Test
	void readsMessagesAndMetadata() throws IOException {
		String csv = "id,parent_id,text,verified,is_news,retweet_count,hashtags,mentions\n"
				+ "R,,\"Breaking news: X happened, say police\",true,true,12,breaking news,bbc\n"
				+ "A,R,Is that true?,false,false,0,,\n";

		MessageIndex index = reader.read(new StringReader(csv));

		assertEquals(2, index.size());
		Message root = index.get("R");
		assertFalse(root.hasParent());
		assertEquals("Breaking news: X happened, say police", root.getText());
		assertTrue(root.isVerified());
		assertTrue(root.isNews());
		assertEquals(12, root.getRetweetCount());
		assertEquals(Arrays.asList("breaking", "news"), root.getHashtags());
		assertEquals(Collections.singletonList("bbc"), root.getMentions());

		Message reply = index.get("A");
		assertEquals("R", reply.getParentId());
		assertSame(root, index.parentOf(reply));
		assertTrue(reply.getHashtags().isEmpty());
	}

	@Test
	void metadataColumnsAreOptional() throws IOException {
		MessageIndex index = reader.read(new StringReader("id,parent_id,text\nR,,claim\n\nA,R,reply\n"));

		assertEquals(2, index.size());
		assertEquals(0, index.get("A").getRetweetCount());
		assertFalse(index.get("A").isVerified());
	}

	@Test
	void malformedRowsAreRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> reader.read(new StringReader("id,parent_id,text\nR,\n")));
		assertThrows(IllegalArgumentException.class,
				() -> reader.read(new StringReader("id,parent_id,text,verified,is_news,retweet_count\nR,,x,1,0,many\n")));
		assertThrows(IllegalArgumentException.class,
				() -> reader.read(new StringReader("id,parent_id,text\nR,,x\nR,,y\n")));
	}
}
