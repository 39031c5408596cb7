package com.distopik.wampsession;

import static org.junit.Assert.*;

import org.junit.Test;

public class SubscriptionRegistryTest {
	private final SubscriptionRegistry registry = new SubscriptionRegistry();

	private static Subscription subscription(String topic, long id) {
		return new Subscription(topic, id, event -> {});
	}

	@Test
	public void missIsEmpty() {
		assertTrue(registry.get(42).isEmpty());
		assertEquals(0, registry.count(42));
	}

	@Test
	public void keepsEverySubscriptionUnderASharedId() {
		Subscription a = subscription("com.myapp.topic1", 5);
		Subscription b = subscription("com.myapp.topic1", 5);
		registry.insert(a);
		registry.insert(b);

		assertEquals(2, registry.count(5));
		assertEquals(2, registry.size());
		assertEquals(a, registry.get(5).get(0));

		assertTrue(registry.remove(a));
		assertFalse(registry.contains(a));
		assertTrue(registry.contains(b));
		assertEquals(1, registry.size());
	}

	@Test
	public void removingTwiceIsHarmless() {
		Subscription a = subscription("com.myapp.topic1", 5);
		registry.insert(a);

		assertTrue(registry.remove(a));
		assertFalse(registry.remove(a));
		assertEquals(0, registry.size());
		assertTrue(registry.get(5).isEmpty());
	}

	@Test
	public void lookupReturnsACopy() {
		registry.insert(subscription("com.myapp.topic1", 5));
		registry.get(5).clear();
		assertEquals(1, registry.count(5));
	}

	@Test
	public void clearForgetsEverything() {
		registry.insert(subscription("com.myapp.topic1", 5));
		registry.insert(subscription("com.myapp.topic2", 6));
		registry.clear();
		assertEquals(0, registry.size());
		assertTrue(registry.get(6).isEmpty());
	}
}
