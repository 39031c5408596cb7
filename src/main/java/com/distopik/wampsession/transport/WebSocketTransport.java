package com.distopik.wampsession.transport;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.message.Codecs;

import reactor.fn.Consumer;

/**
 * Jetty WebSocket endpoint carrying WAMP messages. JSON goes out as text frames,
 * msgpack as binary frames, matching the subprotocol the router accepted.
 */
public class WebSocketTransport extends WebSocketAdapter implements Transport {
	private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

	private final AtomicBoolean closed = new AtomicBoolean();

	private volatile String           subprotocol;
	private volatile Consumer<byte[]> messageHandler;
	private volatile Consumer<String> closeHandler;

	@Override
	public void onWebSocketConnect(Session session) {
		super.onWebSocketConnect(session);
		subprotocol = session.getUpgradeResponse().getAcceptedSubProtocol();
		log.info("CONNECTED {} using {}", session.getRemoteAddress(), subprotocol);
	}

	void setSubprotocol(String subprotocol) {
		this.subprotocol = subprotocol;
	}

	@Override
	public String subprotocol() {
		return subprotocol;
	}

	@Override
	public void send(byte[] payload) throws TransportException {
		if (!isConnected() || closed.get()) {
			throw new TransportException("websocket is not connected");
		}
		synchronized (this) {
			if (Codecs.WAMP_JSON_V2.equals(subprotocol)) {
				getRemote().sendStringByFuture(new String(payload, StandardCharsets.UTF_8));
			} else {
				getRemote().sendBytesByFuture(ByteBuffer.wrap(payload));
			}
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
		return isConnected() && !closed.get();
	}

	@Override
	public void close() {
		Session session = getSession();
		if (session != null && session.isOpen()) {
			session.close();
		}
		fireClose("closed locally");
	}

	@Override
	public void onWebSocketText(String message) {
		super.onWebSocketText(message);
		deliver(message.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public void onWebSocketBinary(byte[] payload, int offset, int len) {
		super.onWebSocketBinary(payload, offset, len);
		if (offset == 0 && len == payload.length) {
			deliver(payload);
		} else {
			byte[] xbytes = new byte[len];
			System.arraycopy(payload, offset, xbytes, 0, len);
			deliver(xbytes);
		}
	}

	@Override
	public void onWebSocketClose(int statusCode, String reason) {
		super.onWebSocketClose(statusCode, reason);
		log.info("CLOSED {} because '{}'", statusCode, reason);
		fireClose(statusCode + " " + reason);
	}

	@Override
	public void onWebSocketError(Throwable cause) {
		super.onWebSocketError(cause);
		log.warn("websocket failed", cause);
		fireClose(String.valueOf(cause));
	}

	private void deliver(byte[] payload) {
		Consumer<byte[]> handler = messageHandler;
		if (handler == null || closed.get()) {
			log.debug("dropping {} bytes, nobody is listening", payload.length);
			return;
		}
		handler.accept(payload);
	}

	private void fireClose(String reason) {
		if (closed.compareAndSet(false, true)) {
			Consumer<String> handler = closeHandler;
			if (handler != null) {
				handler.accept(reason);
			}
		}
	}
}
