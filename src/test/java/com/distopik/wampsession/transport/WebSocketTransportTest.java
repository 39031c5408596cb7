package com.distopik.wampsession.transport;

import static org.junit.Assert.*;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.eclipse.jetty.server.Server;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.distopik.wampsession.Arguments;
import com.distopik.wampsession.Await;
import com.distopik.wampsession.ErrorUris;
import com.distopik.wampsession.PublishOptions;
import com.distopik.wampsession.Reply;
import com.distopik.wampsession.SessionConfig;
import com.distopik.wampsession.WampSession;
import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.router.ReactorEngine;
import com.distopik.wampsession.router.RouterWebSocketServlet;

public class WebSocketTransportTest {
	private Server                    server;
	private WebSocketTransportFactory json;
	private WebSocketTransportFactory msgpack;

	@Before
	public void startRouter() throws Exception {
		server = RouterWebSocketServlet.serve(new ReactorEngine(), 0);
		URI uri = new URI("ws://127.0.0.1:" + RouterWebSocketServlet.portOf(server) + "/");
		json    = new WebSocketTransportFactory(uri, Collections.singletonList(Codecs.WAMP_JSON_V2), 5000);
		msgpack = new WebSocketTransportFactory(uri, Collections.singletonList(Codecs.WAMP_MSGPACK_V2), 5000);
	}

	@After
	public void stopRouter() throws Exception {
		json.close();
		msgpack.close();
		server.stop();
	}

	private static WampSession join(TransportFactory factory) throws InterruptedException {
		return Await.value(WampSession.open(SessionConfig.builder()
			.withRealm           ("realm1")
			.withTransportFactory(factory)
			.build()));
	}

	@Test
	public void routerAcceptsTheOfferedSerialization() throws Exception {
		Transport text = json.connect();
		Transport binary = msgpack.connect();
		try {
			assertEquals(Codecs.WAMP_JSON_V2, text.subprotocol());
			assertEquals(Codecs.WAMP_MSGPACK_V2, binary.subprotocol());
		} finally {
			text.close();
			binary.close();
		}
	}

	@Test
	public void callsCrossSerializations() throws InterruptedException {
		WampSession callee = join(msgpack);
		WampSession caller = join(json);

		Await.value(callee.register("com.math.square", args -> Reply.value(args.getLong(0) * args.getLong(0))));
		assertEquals(81L, Await.value(caller.call("com.math.square", Arguments.of(9))).getLong(0));

		assertEquals(ErrorUris.CLOSE_NORMAL, Await.value(caller.close()));
		assertEquals(ErrorUris.CLOSE_NORMAL, Await.value(callee.close()));
	}

	@Test
	public void eventsCrossSerializations() throws InterruptedException {
		final List<String> received = new CopyOnWriteArrayList<>();
		WampSession subscriber = join(json);
		WampSession publisher  = join(msgpack);

		Await.value(subscriber.subscribe("com.myapp.hello", event -> received.add(event.getString(0))));
		for (String word : Arrays.asList("Hello", "world")) {
			Await.value(publisher.publish("com.myapp.hello", Arguments.of(word),
					PublishOptions.builder().withAcknowledge(true).build()));
		}

		Await.until(() -> received.size() == 2);
		assertEquals(Arrays.asList("Hello", "world"), received);

		Await.value(subscriber.close());
		Await.value(publisher.close());
	}

	@Test
	public void stoppedRouterLosesTheTransport() throws Exception {
		WampSession session = join(json);

		server.stop();

		assertEquals(ErrorUris.TRANSPORT_LOST, Await.value(session.closed()));
	}

	@Test(expected = TransportException.class)
	public void unreachableRouterFailsToConnect() throws Exception {
		int port = RouterWebSocketServlet.portOf(server);
		server.stop();
		try (WebSocketTransportFactory gone = new WebSocketTransportFactory(new URI("ws://127.0.0.1:" + port + "/"))) {
			gone.connect();
		}
	}
}
