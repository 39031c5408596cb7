package com.distopik.wampsession;

/**
 * Receives the events published to a subscribed topic, one at a time and in the order
 * the router delivered them.
 */
public interface EventHandler {
	void onEvent(Arguments event) throws Exception;
}
