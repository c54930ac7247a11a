package edu.arizona.cs.sdqc.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ThreadRootsTest {

	@Test
	void rootResolvesToItself() {
		Message root = Message.builder("r").text("claim").build();
		MessageIndex index = new MessageIndex().add(root);

		assertSame(root, ThreadRoots.resolve(root, index));
		assertEquals(0, ThreadRoots.depth(root, index));
		assertTrue(ThreadRoots.isRoot(root, index));
	}

	@Test
	void nestedReplyResolvesToTheTopOfItsChain() {
		Message root = Message.builder("r").text("claim").build();
		Message first = Message.builder("a").parent("r").build();
		Message second = Message.builder("b").parent("a").build();
		MessageIndex index = new MessageIndex().add(root).add(first).add(second);

		assertSame(root, ThreadRoots.resolve(second, index));
		assertEquals(2, ThreadRoots.depth(second, index));
		assertFalse(ThreadRoots.isRoot(second, index));
	}

	@Test
	void deepThreadsDoNotOverflowTheStack() {
		MessageIndex index = new MessageIndex().add(Message.builder("m0").build());
		for (int i = 1; i <= 50000; i++) {
			index.add(Message.builder("m" + i).parent("m" + (i - 1)).build());
		}
		Message leaf = index.get("m50000");

		assertEquals("m0", ThreadRoots.resolve(leaf, index).getId());
		assertEquals(50000, ThreadRoots.depth(leaf, index));
	}

	@Test
	void cycleIsReported() {
		MessageIndex index = new MessageIndex()
				.add(Message.builder("a").parent("b").build())
				.add(Message.builder("b").parent("c").build())
				.add(Message.builder("c").parent("a").build());

		assertThrows(IllegalStateException.class, () -> ThreadRoots.resolve(index.get("a"), index));
		assertThrows(IllegalStateException.class, () -> ThreadRoots.depth(index.get("b"), index));
	}

	@Test
	void rootAndDepthReportTheSameCycle() {
		MessageIndex index = new MessageIndex()
				.add(Message.builder("a").parent("b").build())
				.add(Message.builder("b").parent("a").build());

		IllegalStateException fromResolve = assertThrows(IllegalStateException.class,
				() -> ThreadRoots.resolve(index.get("a"), index));
		IllegalStateException fromDepth = assertThrows(IllegalStateException.class,
				() -> ThreadRoots.depth(index.get("a"), index));
		assertEquals(fromResolve.getMessage(), fromDepth.getMessage());
	}

	@Test
	void messageCannotBeItsOwnParent() {
		assertThrows(IllegalArgumentException.class, () -> Message.builder("a").parent("a").build());
	}
}
