package com.distopik.wampsession.router;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketAdapter;
import org.eclipse.jetty.websocket.servlet.WebSocketServlet;
import org.eclipse.jetty.websocket.servlet.WebSocketServletFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.message.DecodeException;
import com.distopik.wampsession.message.Message;
import com.distopik.wampsession.message.MessageCodec;

import reactor.Environment;
import reactor.rx.broadcast.Broadcaster;

/**
 * Serves the embedded router over WebSocket, speaking {@code wamp.2.json} or
 * {@code wamp.2.msgpack}, whichever the client offers first.
 */
public class RouterWebSocketServlet extends WebSocketServlet {
	private static final long   serialVersionUID = 1L;
	private static final Logger log              = LoggerFactory.getLogger(RouterWebSocketServlet.class);

	private final transient Engine engine;

	public RouterWebSocketServlet(Engine engine) {
		this.engine = engine;
	}

	@Override
	public void configure(WebSocketServletFactory factory) {
		factory.setCreator((req, resp) -> {
			for (String offered : req.getSubProtocols()) {
				if (Codecs.WAMP_JSON_V2.equals(offered) || Codecs.WAMP_MSGPACK_V2.equals(offered)) {
					resp.setAcceptedSubProtocol(offered);
					return new RouterSocket(engine, Codecs.forSubprotocol(offered));
				}
			}
			log.info("rejecting websocket offering {}", req.getSubProtocols());
			resp.setSuccess(false);
			return null;
		});
	}

	/** Starts a Jetty server routing on {@code port}; 0 picks a free port. */
	public static Server serve(Engine engine, int port) throws Exception {
		Environment.initializeIfEmpty();

		ServletContextHandler handler = new ServletContextHandler();
		handler.setContextPath("/");
		handler.addServlet(new ServletHolder(new RouterWebSocketServlet(engine)), "/");

		HttpConfiguration httpConfig = new HttpConfiguration();
		httpConfig.setOutputBufferSize(32 * 1024);
		httpConfig.setRequestHeaderSize(8 * 1024);
		httpConfig.setResponseHeaderSize(8 * 1024);
		httpConfig.setSendDateHeader(true);

		HttpConnectionFactory connFac = new HttpConnectionFactory(httpConfig);

		final Server server = new Server();

		ServerConnector connector = new ServerConnector(server, 1, 2, connFac);
		connector.setPort(port);
		connector.setAcceptQueueSize(1000);
		connector.setReuseAddress(true);
		server.addConnector(connector);

		server.setHandler(handler);
		server.start();
		return server;
	}

	/** Local port of a server started by {@link #serve}. */
	public static int portOf(Server server) {
		return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
	}

	static class RouterSocket extends WebSocketAdapter implements RouterSession.Peer {
		private final MessageCodec        codec;
		private final RouterSession       session;
		private final Broadcaster<byte[]> frames = Broadcaster.<byte[]>create(Environment.cachedDispatcher());

		RouterSocket(Engine engine, MessageCodec codec) {
			this.codec   = codec;
			this.session = new RouterSession(engine, this);

			frames.filter (unused -> isConnected())  /* skip frames once the socket is gone */
			      .consume(this::receive);           /* decode and dispatch, in arrival order */
		}

		private void receive(byte[] payload) {
			Message msg;
			try {
				msg = codec.decode(payload);
			} catch (DecodeException e) {
				log.warn("router dropping undecodable message: {}", e.getReason());
				return;
			}
			session.onMessage(msg);
		}

		@Override
		public void onWebSocketConnect(Session sess) {
			super.onWebSocketConnect(sess);
			log.info("CONNECTED {}", sess.getUpgradeRequest().getSubProtocols());
		}

		@Override
		public void onWebSocketText(String message) {
			super.onWebSocketText(message);
			frames.onNext(message.getBytes(StandardCharsets.UTF_8));
		}

		@Override
		public void onWebSocketBinary(byte[] payload, int offset, int len) {
			super.onWebSocketBinary(payload, offset, len);
			byte[] xbytes = new byte[len];
			System.arraycopy(payload, offset, xbytes, 0, len);
			frames.onNext(xbytes);
		}

		@Override
		public void onWebSocketClose(int statusCode, String reason) {
			super.onWebSocketClose(statusCode, reason);
			log.info("CLOSED {} because '{}'", statusCode, reason);
			session.onClose();
		}

		@Override
		public void onWebSocketError(Throwable cause) {
			super.onWebSocketError(cause);
			log.warn("router websocket failed", cause);
			session.onClose();
		}

		@Override
		public synchronized void deliver(Message msg) {
			if (!isConnected())
				return;
			byte[] payload = codec.encode(msg);
			if (codec.isText()) {
				getRemote().sendStringByFuture(new String(payload, StandardCharsets.UTF_8));
			} else {
				getRemote().sendBytesByFuture(ByteBuffer.wrap(payload));
			}
		}

		@Override
		public void disconnect() {
			Session sess = getSession();
			if (sess != null)
				sess.close();
		}
	}
}
