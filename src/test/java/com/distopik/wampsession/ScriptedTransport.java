package com.distopik.wampsession;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.transport.Transport;
import com.distopik.wampsession.transport.TransportException;
import com.distopik.wampsession.transport.TransportFactory;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.fn.Consumer;

/** JSON transport whose router side is played by the test. */
class ScriptedTransport implements Transport, TransportFactory {
	private final List<JsonNode> sent = new ArrayList<>();

	private Consumer<byte[]> messageHandler;
	private Consumer<String> closeHandler;
	private boolean          open = true;
	private boolean          refusing;
	private boolean          failingSends;
	private int              connects;

	@Override
	public Transport connect() throws TransportException {
		if (refusing)
			throw new TransportException("connection refused");
		connects++;
		open = true;
		return this;
	}

	@Override
	public String subprotocol() {
		return Codecs.WAMP_JSON_V2;
	}

	@Override
	public void send(byte[] payload) throws TransportException {
		if (!open || failingSends)
			throw new TransportException("broken pipe");
		try {
			sent.add(Codecs.mapper().readTree(payload));
		} catch (IOException e) {
			throw new AssertionError("session sent invalid JSON", e);
		}
	}

	@Override
	public void onMessage(Consumer<byte[]> handler) {
		this.messageHandler = handler;
	}

	@Override
	public void onClose(Consumer<String> handler) {
		this.closeHandler = handler;
	}

	@Override
	public boolean isOpen() {
		return open;
	}

	@Override
	public void close() {
		if (open) {
			open = false;
			closeHandler.accept("closed locally");
		}
	}

	/** Plays a message from the router. */
	void receive(String json) {
		messageHandler.accept(json.getBytes(StandardCharsets.UTF_8));
	}

	/** Breaks the connection from the far side. */
	void drop() {
		open = false;
		closeHandler.accept("connection reset");
	}

	void setRefusing(boolean refusing) {
		this.refusing = refusing;
	}

	void setFailingSends(boolean failingSends) {
		this.failingSends = failingSends;
	}

	int connects() {
		return connects;
	}

	int sentCount() {
		return sent.size();
	}

	JsonNode sent(int index) {
		return sent.get(index);
	}

	JsonNode last() {
		return sent.get(sent.size() - 1);
	}

	/** Compact JSON of the last message sent. */
	String lastJson() {
		return last().toString();
	}
}
