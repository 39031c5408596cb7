package com.distopik.wampsession.transport;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.client.ClientUpgradeRequest;
import org.eclipse.jetty.websocket.client.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.message.Codecs;

/**
 * Opens {@link WebSocketTransport}s to one router URL. The underlying Jetty client is
 * started on first use and shared by every transport this factory hands out.
 */
public class WebSocketTransportFactory implements TransportFactory, AutoCloseable {
	private static final Logger log = LoggerFactory.getLogger(WebSocketTransportFactory.class);

	private final URI             uri;
	private final List<String>    subprotocols;
	private final long            connectTimeoutMillis;
	private final WebSocketClient client = new WebSocketClient();

	public WebSocketTransportFactory(URI uri) {
		this(uri, Arrays.asList(Codecs.WAMP_JSON_V2, Codecs.WAMP_MSGPACK_V2), 10_000);
	}

	public WebSocketTransportFactory(URI uri, List<String> subprotocols, long connectTimeoutMillis) {
		if (subprotocols.isEmpty())
			throw new IllegalArgumentException("subprotocols");
		for (String subprotocol : subprotocols)
			Codecs.forSubprotocol(subprotocol);

		this.uri                  = uri;
		this.subprotocols         = new ArrayList<>(subprotocols);
		this.connectTimeoutMillis = connectTimeoutMillis;
	}

	public URI getUri() {
		return uri;
	}

	@Override
	public Transport connect() throws TransportException {
		ensureStarted();

		WebSocketTransport   socket  = new WebSocketTransport();
		ClientUpgradeRequest request = new ClientUpgradeRequest();
		request.setSubProtocols(subprotocols);

		Session session;
		try {
			Future<Session> future = client.connect(socket, uri, request);
			session = future.get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("interrupted while connecting to " + uri, e);
		} catch (ExecutionException e) {
			throw new TransportException("cannot connect to " + uri, e.getCause());
		} catch (TimeoutException | java.io.IOException e) {
			throw new TransportException("cannot connect to " + uri, e);
		}

		String accepted = session.getUpgradeResponse().getAcceptedSubProtocol();
		if (accepted == null || !subprotocols.contains(accepted)) {
			session.close();
			throw new TransportException("router at " + uri + " accepted no WAMP subprotocol (" + accepted + ")");
		}
		socket.setSubprotocol(accepted);
		return socket;
	}

	private synchronized void ensureStarted() throws TransportException {
		if (client.isStarted())
			return;
		try {
			client.start();
			log.debug("websocket client started for {}", uri);
		} catch (Exception e) {
			throw new TransportException("cannot start websocket client", e);
		}
	}

	@Override
	public synchronized void close() throws Exception {
		if (client.isStarted())
			client.stop();
	}
}
