package com.distopik.wampsession.transport;

import reactor.fn.Consumer;

/**
 * An established, ordered and reliable message channel to a router. Handlers are
 * installed before the first message is sent; a transport delivers each inbound
 * payload exactly once and reports its own end through {@link #onClose(Consumer)}.
 */
public interface Transport {
	/** Negotiated serialization, e.g. {@code wamp.2.json}. */
	String subprotocol();

	void send(byte[] payload) throws TransportException;

	void onMessage(Consumer<byte[]> handler);

	/** Invoked once with a human readable reason when the channel goes away. */
	void onClose(Consumer<String> handler);

	boolean isOpen();

	void close();
}
