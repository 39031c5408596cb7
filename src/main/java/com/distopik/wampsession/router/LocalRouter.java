package com.distopik.wampsession.router;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.message.DecodeException;
import com.distopik.wampsession.message.Message;
import com.distopik.wampsession.message.MessageCodec;
import com.distopik.wampsession.transport.Transport;
import com.distopik.wampsession.transport.TransportException;
import com.distopik.wampsession.transport.TransportFactory;

import reactor.fn.Consumer;

/**
 * In-process router. Every {@link #connect()} yields a transport wired directly to a new
 * {@link RouterSession}; frames are JSON encoded both ways and handed over on the
 * sending thread.
 */
public class LocalRouter implements TransportFactory {
	private static final Logger log = LoggerFactory.getLogger(LocalRouter.class);

	private final Engine               engine;
	private final MessageCodec         codec       = Codecs.JSON;
	private final List<LocalTransport> connections = new ArrayList<>();
	private volatile boolean           refusing;

	public LocalRouter() {
		this(new ReactorEngine());
	}

	public LocalRouter(Engine engine) {
		this.engine = engine;
	}

	public Engine getEngine() {
		return engine;
	}

	@Override
	public Transport connect() throws TransportException {
		if (refusing)
			throw new TransportException("local router refuses connections");

		LocalTransport transport = new LocalTransport();
		synchronized (connections) {
			connections.add(transport);
		}
		return transport;
	}

	/** While set, {@link #connect()} fails as if the router were unreachable. */
	public void setRefusing(boolean refusing) {
		this.refusing = refusing;
	}

	public int connectionCount() {
		synchronized (connections) {
			return connections.size();
		}
	}

	/** Drops every connection without a GOODBYE, as a network failure would. */
	public void disconnectAll() {
		for (LocalTransport transport : snapshot()) {
			transport.close();
		}
	}

	/** Asks every joined client to leave with {@code reason}. */
	public void goodbyeAll(String reason) {
		for (LocalTransport transport : snapshot()) {
			transport.router.goodbye(reason);
		}
	}

	private List<LocalTransport> snapshot() {
		synchronized (connections) {
			return new ArrayList<>(connections);
		}
	}

	private class LocalTransport implements Transport, RouterSession.Peer {
		private final AtomicBoolean     closed = new AtomicBoolean();
		private final RouterSession     router = new RouterSession(engine, this);
		private volatile Consumer<byte[]> messageHandler = bytes -> {};
		private volatile Consumer<String> closeHandler   = reason -> {};

		@Override
		public String subprotocol() {
			return codec.subprotocol();
		}

		@Override
		public void send(byte[] payload) throws TransportException {
			if (closed.get())
				throw new TransportException("transport closed");

			Message msg;
			try {
				msg = codec.decode(payload);
			} catch (DecodeException e) {
				log.warn("router dropping undecodable message: {}", e.getReason());
				return;
			}
			router.onMessage(msg);
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
			return !closed.get();
		}

		@Override
		public void close() {
			if (!closed.compareAndSet(false, true))
				return;
			synchronized (connections) {
				connections.remove(this);
			}
			router.onClose();
			closeHandler.accept("connection closed");
		}

		@Override
		public boolean isConnected() {
			return !closed.get();
		}

		@Override
		public void deliver(Message msg) {
			if (!closed.get())
				messageHandler.accept(codec.encode(msg));
		}

		@Override
		public void disconnect() {
			close();
		}
	}
}
