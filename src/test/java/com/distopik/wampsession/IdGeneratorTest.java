package com.distopik.wampsession;

import static org.junit.Assert.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.distopik.wampsession.message.MessageLayout;

public class IdGeneratorTest {
	private final Map<Long, Object> outstanding = new HashMap<>();

	@Test
	public void startsAtOne() {
		IdGenerator ids = new IdGenerator();
		assertEquals(1, ids.next(outstanding));
		assertEquals(2, ids.next(outstanding));
	}

	@Test
	public void wrapsAfterTheLargestIdentifier() {
		IdGenerator ids = new IdGenerator(MessageLayout.MAX_ID - 1);
		assertEquals(MessageLayout.MAX_ID, ids.next(outstanding));
		assertEquals(1, ids.next(outstanding));
	}

	@Test
	public void skipsIdsStillOutstanding() {
		outstanding.put(1L, "call");
		outstanding.put(2L, "subscribe");
		IdGenerator ids = new IdGenerator(MessageLayout.MAX_ID);
		assertEquals(3, ids.next(outstanding));
	}
}
