package com.distopik.wampsession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local subscriptions keyed by router-assigned subscription id. A miss is an ordinary
 * outcome: events may still be in flight for a subscription that was just removed.
 * Not thread safe, the owning session serializes access.
 */
public class SubscriptionRegistry {
	private final Map<Long, List<Subscription>> byId = new HashMap<>();
	private int size;

	public void insert(Subscription subscription) {
		byId.computeIfAbsent(subscription.getId(), id -> new ArrayList<>(1)).add(subscription);
		size++;
	}

	/** Removes exactly this subscription; false if it was not present. */
	public boolean remove(Subscription subscription) {
		List<Subscription> entries = byId.get(subscription.getId());
		if (entries == null || !entries.remove(subscription))
			return false;
		if (entries.isEmpty())
			byId.remove(subscription.getId());
		size--;
		return true;
	}

	/** Every subscription under this id, empty on a miss. */
	public List<Subscription> get(long subscriptionId) {
		List<Subscription> entries = byId.get(subscriptionId);
		return entries == null ? Collections.<Subscription>emptyList() : new ArrayList<>(entries);
	}

	public boolean contains(Subscription subscription) {
		List<Subscription> entries = byId.get(subscription.getId());
		return entries != null && entries.contains(subscription);
	}

	public int count(long subscriptionId) {
		List<Subscription> entries = byId.get(subscriptionId);
		return entries == null ? 0 : entries.size();
	}

	public int size() {
		return size;
	}

	public void clear() {
		byId.clear();
		size = 0;
	}
}
