package com.distopik.wampsession;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.distopik.wampsession.transport.TransportException;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.dispatch.SynchronousDispatcher;
import reactor.rx.Promise;
import reactor.rx.Promises;

public class WampSessionTest {
	private static final String WELCOME = "[2,9129137332,{\"roles\":{\"broker\":{},\"dealer\":{}}}]";

	private ScriptedTransport transport;
	private WampSession       session;

	private SessionConfig.Builder config() {
		return SessionConfig.builder()
			.withRealm           ("realm1")
			.withTransportFactory(transport)
			.withDispatcher      (SynchronousDispatcher.INSTANCE);
	}

	@Before
	public void join() {
		transport = new ScriptedTransport();
		Promise<WampSession> opening = WampSession.open(config().build());
		transport.receive(WELCOME);

		assertTrue(opening.isSuccess());
		session = opening.get();
	}

	private Registration registered(String procedure, Procedure implementation, long registrationId) {
		Promise<Registration> registering = session.register(procedure, implementation);
		long requestId = transport.last().get(1).asLong();
		transport.receive("[65," + requestId + "," + registrationId + "]");
		assertTrue(registering.isSuccess());
		return registering.get();
	}

	private Subscription subscribed(String topic, EventHandler handler, long subscriptionId) {
		Promise<Subscription> subscribing = session.subscribe(topic, handler);
		long requestId = transport.last().get(1).asLong();
		transport.receive("[33," + requestId + "," + subscriptionId + "]");
		assertTrue(subscribing.isSuccess());
		return subscribing.get();
	}

	@Test
	public void helloAnnouncesRealmAndClientRoles() {
		JsonNode hello = transport.sent(0);
		assertEquals(1, hello.get(0).asInt());
		assertEquals("realm1", hello.get(1).asText());
		assertEquals(SessionConfig.DEFAULT_AGENT, hello.get(2).get("agent").asText());
		for (String role : Arrays.asList("publisher", "subscriber", "caller", "callee")) {
			assertTrue(role, hello.get(2).get("roles").has(role));
		}
	}

	@Test
	public void welcomeEstablishesTheSession() {
		assertEquals(SessionState.ESTABLISHED, session.getState());
		assertEquals(9129137332L, session.getSessionId());
		assertTrue(session.getWelcomeDetails().get("roles").has("dealer"));
		assertEquals("realm1", session.getRealm());
	}

	@Test
	public void squareYieldsSixteenExactlyOnce() {
		Registration square = registered("com.math.square", args -> Reply.value(args.getLong(0) * args.getLong(0)), 100);
		assertEquals("[64,1,{},\"com.math.square\"]", transport.sent(1).toString());
		assertEquals(100, square.getId());

		int before = transport.sentCount();
		transport.receive("[68,7,100,{},[4]]");

		assertEquals(before + 1, transport.sentCount());
		assertEquals("[70,7,{},[16]]", transport.lastJson());
		assertEquals(0, session.pendingInvocations());
	}

	@Test
	public void sixEventsArriveInOrderAndNoneAfterClose() {
		final List<Long> received = new ArrayList<>();
		subscribed("com.myapp.topic1", event -> received.add(event.getLong(0)), 5);
		assertEquals("[32,1,{},\"com.myapp.topic1\"]", transport.sent(1).toString());

		for (int i = 1; i <= 6; i++) {
			transport.receive("[36,5," + (100 + i) + ",{},[" + i + "]]");
		}
		assertEquals(Arrays.asList(1L, 2L, 3L, 4L, 5L, 6L), received);

		Promise<String> closed = session.close();
		assertEquals("[6,{},\"wamp.close.normal\"]", transport.lastJson());
		assertEquals(SessionState.CLOSING, session.getState());

		transport.receive("[36,5,107,{},[7]]");
		assertEquals(6, received.size());

		transport.receive("[6,{},\"wamp.close.goodbye_and_out\"]");
		assertEquals(SessionState.CLOSED, session.getState());
		assertEquals(ErrorUris.CLOSE_NORMAL, closed.get());
		assertFalse(transport.isOpen());
	}

	@Test
	public void secondRegistrationOfAProcedureFailsWithoutSending() {
		Promise<Registration> first = session.register("com.math.square", args -> Reply.value(0));
		int sent = transport.sentCount();

		Promise<Registration> second = session.register("com.math.square", args -> Reply.value(1));
		assertTrue(second.isError());
		assertTrue(second.reason() instanceof DuplicateRegistrationException);
		assertEquals(sent, transport.sentCount());

		transport.receive("[65,1,100]");
		assertTrue(first.isSuccess());

		Promise<Registration> third = session.register("com.math.square", args -> Reply.value(2));
		assertTrue(third.reason() instanceof DuplicateRegistrationException);
		assertEquals(sent, transport.sentCount());
	}

	@Test
	public void failedRegistrationFreesTheName() {
		Promise<Registration> first = session.register("com.math.square", args -> Reply.value(0));
		transport.receive("[8,64,1,{},\"wamp.error.procedure_already_exists\"]");
		assertEquals(ErrorUris.PROCEDURE_ALREADY_EXISTS, ((ApplicationException) first.reason()).getUri());

		Promise<Registration> retry = session.register("com.math.square", args -> Reply.value(0));
		assertTrue(retry.isPending());
		assertEquals("[64,2,{},\"com.math.square\"]", transport.lastJson());
	}

	@Test
	public void closeRejectsEveryOutstandingCall() {
		List<Promise<Arguments>> calls = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			calls.add(session.call("com.math.square", Arguments.of(i)));
		}
		assertEquals(3, session.pendingRequests());

		session.close();
		for (Promise<Arguments> call : calls) {
			assertTrue(call.isError());
			assertTrue(call.reason() instanceof SessionClosedException);
		}
		assertEquals(0, session.pendingRequests());

		transport.receive("[50,1,{},[0]]");
		transport.receive("[50,2,{},[1]]");
		assertEquals(0, session.pendingRequests());
		assertEquals(SessionState.CLOSING, session.getState());
	}

	@Test
	public void resultsAreMatchedByRequestIdInAnyOrder() {
		Promise<Arguments> one   = session.call("com.math.square", Arguments.of(1));
		Promise<Arguments> two   = session.call("com.math.square", Arguments.of(2));
		Promise<Arguments> three = session.call("com.math.square", Arguments.of(3));
		assertEquals("[48,3,{},\"com.math.square\",[3]]", transport.lastJson());

		transport.receive("[50,3,{},[9]]");
		transport.receive("[50,1,{},[1]]");
		assertTrue(two.isPending());
		transport.receive("[50,2,{},[4],{\"exact\":true}]");

		assertEquals(1L, one.get().getLong(0));
		assertEquals(4L, two.get().getLong(0));
		assertTrue(two.get().keyword("exact").asBoolean());
		assertEquals(9L, three.get().getLong(0));
	}

	@Test
	public void deferredRepliesYieldOnceEachInCompletionOrder() {
		final List<Promise<Arguments>> deferred = new ArrayList<>();
		registered("com.math.slowsquare", args -> {
			Promise<Arguments> reply = Promises.prepare();
			deferred.add(reply);
			return Reply.deferred(reply);
		}, 101);

		int before = transport.sentCount();
		transport.receive("[68,7,101,{},[3]]");
		transport.receive("[68,8,101,{},[4]]");
		assertEquals(before, transport.sentCount());
		assertEquals(2, session.pendingInvocations());

		deferred.get(1).onNext(Arguments.of(16));
		assertEquals("[70,8,{},[16]]", transport.lastJson());
		deferred.get(0).onNext(Arguments.of(9));
		assertEquals("[70,7,{},[9]]", transport.lastJson());

		assertEquals(before + 2, transport.sentCount());
		assertEquals(0, session.pendingInvocations());
	}

	@Test
	public void deferredRejectionBecomesError() {
		final Promise<Arguments> reply = Promises.prepare();
		registered("com.math.slowsquare", args -> Reply.deferred(reply), 101);

		transport.receive("[68,7,101,{},[3]]");
		reply.onError(new ApplicationException("com.math.error.negative", Arguments.of("bad input")));

		assertEquals("[8,68,7,{},\"com.math.error.negative\",[\"bad input\"]]", transport.lastJson());
	}

	@Test
	public void deferredCompletionWithoutValueYieldsNoArguments() {
		final Promise<Arguments> reply = Promises.prepare();
		registered("com.myapp.slow", args -> Reply.deferred(reply), 101);

		int before = transport.sentCount();
		transport.receive("[68,3,101,{}]");
		assertEquals(1, session.pendingInvocations());

		reply.onComplete();

		assertEquals(before + 1, transport.sentCount());
		assertEquals("[70,3,{}]", transport.lastJson());
		assertEquals(0, session.pendingInvocations());
	}

	@Test
	public void nullReplyYieldsNoArgumentsEvenAfterCallersTamperWithEmpty() {
		Arguments.empty().positional().add(42);
		registered("com.myapp.nothing", args -> null, 100);

		transport.receive("[68,3,100,{}]");
		assertEquals("[70,3,{}]", transport.lastJson());
	}

	@Test
	public void failingProcedureReportsRuntimeError() {
		registered("com.math.square", args -> {
			throw new IllegalStateException("boom");
		}, 100);

		transport.receive("[68,7,100,{},[4]]");
		assertEquals("[8,68,7,{},\"wamp.error.runtime_error\",[\"boom\"]]", transport.lastJson());
		assertEquals(SessionState.ESTABLISHED, session.getState());
	}

	@Test
	public void invocationOfUnknownRegistrationIsRefused() {
		transport.receive("[68,9,555,{},[4]]");
		assertEquals("[8,68,9,{},\"wamp.error.no_such_registration\"]", transport.lastJson());
	}

	@Test
	public void interruptCancelsAndSuppressesTheLateReply() {
		final Promise<Arguments> reply = Promises.prepare();
		registered("com.math.slowsquare", args -> Reply.deferred(reply), 101);

		transport.receive("[68,7,101,{},[3]]");
		transport.receive("[69,7,{}]");
		assertEquals("[8,68,7,{},\"wamp.error.canceled\"]", transport.lastJson());

		int sent = transport.sentCount();
		reply.onNext(Arguments.of(9));
		assertEquals(sent, transport.sentCount());
	}

	@Test
	public void errorResponseRejectsTheCall() {
		Promise<Arguments> call = session.call("com.myapp.fail", Arguments.empty());
		assertEquals("[48,1,{},\"com.myapp.fail\"]", transport.lastJson());

		transport.receive("[8,48,1,{},\"com.myapp.error\",[1],{\"a\":2}]");

		ApplicationException error = (ApplicationException) call.reason();
		assertEquals("com.myapp.error", error.getUri());
		assertEquals(1L, error.getArguments().getLong(0));
		assertEquals(2, error.getArguments().keyword("a").asInt());
	}

	@Test
	public void eventForUnknownSubscriptionIsDropped() {
		transport.receive("[36,999,1,{},[1]]");
		assertEquals(SessionState.ESTABLISHED, session.getState());
	}

	@Test
	public void unsubscribeIsIdempotent() {
		final List<Arguments> received = new ArrayList<>();
		Subscription subscription = subscribed("com.myapp.topic1", received::add, 5);

		Promise<Subscription> first = session.unsubscribe(subscription);
		assertEquals("[34,2,5]", transport.lastJson());
		transport.receive("[35,2]");
		assertTrue(first.isSuccess());

		transport.receive("[35,2]");
		transport.receive("[36,5,1,{},[1]]");
		assertTrue(received.isEmpty());

		int sent = transport.sentCount();
		Promise<Subscription> again = session.unsubscribe(subscription);
		assertTrue(again.isSuccess());
		assertEquals(sent, transport.sentCount());
		assertEquals(SessionState.ESTABLISHED, session.getState());
	}

	@Test
	public void repeatedUnsubscribeWhileInFlightSendsOnce() {
		Subscription subscription = subscribed("com.myapp.topic1", event -> {}, 5);

		Promise<Subscription> first = session.unsubscribe(subscription);
		int sent = transport.sentCount();
		Promise<Subscription> second = session.unsubscribe(subscription);
		assertEquals(sent, transport.sentCount());
		assertTrue(second.isPending());

		transport.receive("[35," + transport.last().get(1).asLong() + "]");
		assertTrue(first.isSuccess());
		assertTrue(second.isSuccess());
		assertSame(subscription, second.get());
	}

	@Test
	public void subscriptionsSharingAnIdAreUnsubscribedOnceAtTheRouter() {
		final List<String> calls = new ArrayList<>();
		Subscription a = subscribed("com.myapp.topic1", event -> calls.add("a"), 5);
		Subscription b = subscribed("com.myapp.topic1", event -> calls.add("b"), 5);

		transport.receive("[36,5,1,{},[1]]");
		assertEquals(Arrays.asList("a", "b"), calls);

		int sent = transport.sentCount();
		assertTrue(session.unsubscribe(a).isSuccess());
		assertEquals(sent, transport.sentCount());

		session.unsubscribe(b);
		assertEquals(34, transport.last().get(0).asInt());
	}

	@Test
	public void failingEventHandlerDoesNotStopDelivery() {
		final List<Long> received = new ArrayList<>();
		subscribed("com.myapp.topic1", event -> {
			if (event.getLong(0) == 1)
				throw new IllegalArgumentException("cannot handle 1");
			received.add(event.getLong(0));
		}, 5);

		transport.receive("[36,5,1,{},[1]]");
		transport.receive("[36,5,2,{},[2]]");
		assertEquals(Arrays.asList(2L), received);
	}

	@Test
	public void unexpectedMessageAbortsTheSession() {
		Promise<Arguments> call = session.call("com.math.square", Arguments.of(2));

		transport.receive("[1,\"realm1\",{}]");

		assertEquals(3, transport.last().get(0).asInt());
		assertEquals(ErrorUris.PROTOCOL_VIOLATION, transport.last().get(2).asText());
		assertEquals(SessionState.CLOSED, session.getState());
		assertTrue(call.reason() instanceof SessionClosedException);
		assertTrue(call.reason().getCause() instanceof ProtocolException);
	}

	@Test
	public void responseOfTheWrongTypeIsAProtocolViolation() {
		session.call("com.math.square", Arguments.of(2));
		transport.receive("[33,1,5]");
		assertEquals(SessionState.CLOSED, session.getState());
	}

	@Test
	public void undecodableMessagesAreDropped() {
		transport.receive("not json at all");
		transport.receive("[999,1]");
		transport.receive("[50,\"one\",{}]");
		assertEquals(SessionState.ESTABLISHED, session.getState());
	}

	@Test
	public void routerGoodbyeIsAnsweredAndClosesTheSession() {
		Promise<Arguments> call = session.call("com.math.square", Arguments.of(2));
		transport.receive("[6,{\"message\":\"maintenance\"},\"wamp.close.system_shutdown\"]");

		assertEquals("[6,{},\"wamp.close.goodbye_and_out\"]", transport.lastJson());
		assertEquals(SessionState.CLOSED, session.getState());
		assertEquals(ErrorUris.SYSTEM_SHUTDOWN, session.closed().get());
		assertEquals(ErrorUris.SYSTEM_SHUTDOWN, ((SessionClosedException) call.reason()).getReason());
		assertFalse(transport.isOpen());
	}

	@Test
	public void transportLossRejectsPendingRequests() {
		Promise<Subscription> subscribing = session.subscribe("com.myapp.topic1", event -> {});
		transport.drop();

		assertEquals(ErrorUris.TRANSPORT_LOST, ((SessionClosedException) subscribing.reason()).getReason());
		assertEquals(ErrorUris.TRANSPORT_LOST, session.closed().get());
		assertTrue(session.call("com.math.square", Arguments.of(1)).reason() instanceof SessionClosedException);
	}

	@Test
	public void failedSendClosesTheSession() {
		transport.setFailingSends(true);
		Promise<Long> published = session.publish("com.myapp.topic1", Arguments.of(1));

		assertTrue(published.reason() instanceof SessionClosedException);
		assertEquals(SessionState.CLOSED, session.getState());
		assertEquals(ErrorUris.TRANSPORT_LOST, session.closed().get());
	}

	@Test
	public void unacknowledgedPublishResolvesOnSend() {
		Promise<Long> published = session.publish("com.myapp.topic1", Arguments.of("Hello, world!"));
		assertEquals("[16,1,{},\"com.myapp.topic1\",[\"Hello, world!\"]]", transport.lastJson());
		assertEquals(Long.valueOf(0), published.get());
		assertEquals(0, session.pendingRequests());
	}

	@Test
	public void acknowledgedPublishResolvesWithPublicationId() {
		PublishOptions options = PublishOptions.builder().withAcknowledge(true).withExcludeMe(false).build();
		Promise<Long> published = session.publish("com.myapp.topic1", Arguments.empty().with("n", 1), options);
		assertEquals("[16,1,{\"acknowledge\":true,\"exclude_me\":false},\"com.myapp.topic1\",[],{\"n\":1}]", transport.lastJson());

		transport.receive("[17,1,4429313566]");
		assertEquals(Long.valueOf(4429313566L), published.get());
	}

	@Test
	public void callOptionsAreForwarded() {
		CallOptions options = CallOptions.builder().withTimeoutMillis(1000).withDiscloseMe(true).build();
		session.call("com.math.square", Arguments.of(3), options);
		assertEquals("[48,1,{\"timeout\":1000,\"disclose_me\":true},\"com.math.square\",[3]]", transport.lastJson());
	}

	@Test
	public void unregisterRemovesTheProcedure() {
		Registration square = registered("com.math.square", args -> Reply.value(1), 100);

		Promise<Registration> unregistering = session.unregister(square);
		assertEquals("[66,2,100]", transport.lastJson());
		transport.receive("[67,2]");
		assertTrue(unregistering.isSuccess());

		transport.receive("[68,7,100,{},[4]]");
		assertEquals("[8,68,7,{},\"wamp.error.no_such_registration\"]", transport.lastJson());
		assertTrue(session.unregister(square).isSuccess());
	}

	@Test
	public void emptyNamesAreRejected() {
		try {
			session.call("", Arguments.empty());
			fail("empty procedure accepted");
		} catch (IllegalArgumentException expected) {
			assertEquals("procedure", expected.getMessage());
		}
	}

	@Test
	public void operationsAfterCloseFail() {
		session.close();
		transport.receive("[6,{},\"wamp.close.goodbye_and_out\"]");

		Throwable error = session.subscribe("com.myapp.topic1", event -> {}).reason();
		assertTrue(error instanceof SessionClosedException);
		assertEquals(ErrorUris.CLOSE_NORMAL, ((SessionClosedException) error).getReason());
	}

	@Test
	public void abortDuringHandshakeRejectsOpening() {
		transport = new ScriptedTransport();
		Promise<WampSession> opening = WampSession.open(config().withRealm("nosuchrealm").build());
		transport.receive("[3,{\"message\":\"no such realm\"},\"wamp.error.no_such_realm\"]");

		assertEquals(ErrorUris.NO_SUCH_REALM, ((ApplicationException) opening.reason()).getUri());
		assertFalse(transport.isOpen());
	}

	@Test
	public void unreachableRouterRejectsOpening() {
		transport = new ScriptedTransport();
		transport.setRefusing(true);
		Promise<WampSession> opening = WampSession.open(config().build());

		assertTrue(opening.reason() instanceof TransportException);
	}

	@Test
	public void callBeforeWelcomeIsAStateError() {
		transport = new ScriptedTransport();
		WampSession joining = new WampSession(config().build());
		joining.connect();
		assertEquals(SessionState.CONNECTING, joining.getState());

		assertTrue(joining.call("com.math.square", Arguments.of(1)).reason() instanceof SessionStateException);

		transport.receive(WELCOME);
		assertEquals(SessionState.ESTABLISHED, joining.getState());
	}

	@Test
	public void challengeIsAnsweredByTheResponder() {
		transport = new ScriptedTransport();
		Promise<WampSession> opening = WampSession.open(config()
			.withAuthId            ("joe")
			.withAuthMethods       ("ticket")
			.withChallengeResponder((method, extra) -> "secret-" + method)
			.build());

		JsonNode hello = transport.sent(0);
		assertEquals("joe", hello.get(2).get("authid").asText());
		assertEquals("ticket", hello.get(2).get("authmethods").get(0).asText());

		transport.receive("[4,\"ticket\",{}]");
		assertEquals("[5,\"secret-ticket\",{}]", transport.lastJson());
		assertTrue(opening.isPending());

		transport.receive(WELCOME);
		assertTrue(opening.isSuccess());
	}

	@Test
	public void challengeWithoutResponderAborts() {
		transport = new ScriptedTransport();
		Promise<WampSession> opening = WampSession.open(config().build());

		transport.receive("[4,\"wampcra\",{}]");
		assertEquals(3, transport.last().get(0).asInt());
		assertEquals(ErrorUris.CANNOT_AUTHENTICATE, transport.last().get(2).asText());
		assertEquals(ErrorUris.CANNOT_AUTHENTICATE, ((ApplicationException) opening.reason()).getUri());
	}
}
