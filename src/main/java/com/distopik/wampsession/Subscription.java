package com.distopik.wampsession;

/**
 * A local handler attached to a topic under the subscription id the router assigned.
 * Several subscriptions may share one id when the router folds them together.
 */
public final class Subscription {
	private final String       topic;
	private final long         id;
	private final EventHandler handler;

	Subscription(String topic, long id, EventHandler handler) {
		this.topic   = topic;
		this.id      = id;
		this.handler = handler;
	}

	public String getTopic() {
		return topic;
	}

	public long getId() {
		return id;
	}

	public EventHandler getHandler() {
		return handler;
	}

	@Override
	public String toString() {
		return "Subscription[" + topic + " #" + id + "]";
	}
}
