package com.distopik.wampsession;

import static com.distopik.wampsession.message.Message.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.message.DecodeException;
import com.distopik.wampsession.message.Message;
import com.distopik.wampsession.message.MessageCodec;
import com.distopik.wampsession.transport.Transport;
import com.distopik.wampsession.transport.TransportException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.rx.Promise;
import reactor.rx.Promises;
import reactor.rx.broadcast.Broadcaster;

/**
 * Client side of one WAMP session: joins a realm over a {@link Transport}, then lets the
 * application subscribe, publish, register and call.
 * <p>
 * Inbound messages are pushed through a {@link Broadcaster} bound to the configured
 * dispatcher and consumed one at a time, in transport order. Requests issued from
 * application threads only touch the pending tables and registries under the session
 * lock; promises are completed and user code runs outside of it. Event handlers and
 * procedures therefore run on the dispatcher and must not block waiting for another
 * inbound message of the same session.
 */
public class WampSession {
	private static final Logger log = LoggerFactory.getLogger(WampSession.class);

	private static final ObjectNode CLIENT_ROLES = objectNode();
	static {
		CLIENT_ROLES.set("publisher",  objectNode());
		CLIENT_ROLES.set("subscriber", objectNode());
		CLIENT_ROLES.set("caller",     objectNode());
		CLIENT_ROLES.set("callee",     objectNode());
	}

	private final SessionConfig config;
	private final Object        lock = new Object();

	private final IdGenerator                  requestIds    = new IdGenerator();
	private final Map<Long, PendingRequest<?>> requests      = new HashMap<>();
	private final SubscriptionRegistry         subscriptions = new SubscriptionRegistry();
	private final RegistrationRegistry         registrations = new RegistrationRegistry();
	private final Set<String>                  registering   = new HashSet<>();
	private final Map<Subscription, Promise<Subscription>> unsubscribing = new HashMap<>();

	private final Promise<WampSession> welcome = Promises.prepare();
	private final Promise<String>      closed  = Promises.prepare();
	private final Broadcaster<byte[]>  inbound;

	private volatile SessionState state = SessionState.CLOSED;
	private volatile Transport    transport;
	private volatile MessageCodec codec;
	private volatile long         sessionId;
	private volatile ObjectNode   welcomeDetails;
	private volatile String       closeReason;

	WampSession(SessionConfig config) {
		this.config  = config;
		this.inbound = Broadcaster.<byte[]>create(config.getDispatcher());
		this.inbound.consume(this::receive);
	}

	/**
	 * Connects and joins the configured realm. The promise resolves with the session
	 * once the router welcomed it, and rejects if the transport cannot be opened, the
	 * router aborts, or the handshake goes wrong.
	 */
	public static Promise<WampSession> open(SessionConfig config) {
		WampSession session = new WampSession(config);
		session.connect();
		return session.welcome;
	}

	private static ObjectNode objectNode() {
		return JsonNodeFactory.instance.objectNode();
	}

	void connect() {
		synchronized (lock) {
			if (state != SessionState.CLOSED || closeReason != null)
				throw new IllegalStateException("session can only be opened once");
			state = SessionState.CONNECTING;
		}

		Transport opened;
		try {
			opened = config.getTransportFactory().connect();
		} catch (TransportException e) {
			log.warn("cannot reach router: {}", e.getMessage());
			teardown(ErrorUris.UNREACHABLE, e);
			return;
		}

		try {
			codec = Codecs.forSubprotocol(opened.subprotocol());
		} catch (IllegalArgumentException e) {
			opened.close();
			teardown(ErrorUris.UNREACHABLE, new TransportException("unsupported serialization " + opened.subprotocol(), e));
			return;
		}

		transport = opened;
		opened.onMessage(bytes -> {
			if (state != SessionState.CLOSED)
				inbound.onNext(bytes);
		});
		opened.onClose(this::onTransportClosed);

		send(Message.hello(config.getRealm(), helloDetails()));
	}

	private ObjectNode helloDetails() {
		ObjectNode details = objectNode();
		details.put("agent", config.getAgent());
		details.set("roles", CLIENT_ROLES.deepCopy());
		if (config.getAuthId() != null)
			details.put("authid", config.getAuthId());
		if (!config.getAuthMethods().isEmpty()) {
			ArrayNode methods = details.putArray("authmethods");
			for (String method : config.getAuthMethods())
				methods.add(method);
		}
		return details;
	}

	public SessionState getState() {
		return state;
	}

	public long getSessionId() {
		return sessionId;
	}

	public String getRealm() {
		return config.getRealm();
	}

	public ObjectNode getWelcomeDetails() {
		return welcomeDetails;
	}

	/** Resolves with the close reason URI once the session reached {@link SessionState#CLOSED}. */
	public Promise<String> closed() {
		return closed;
	}

	public Promise<Subscription> subscribe(final String topic, final EventHandler handler) {
		requireName(topic, "topic");
		if (handler == null)
			throw new IllegalArgumentException("handler");

		final Promise<Subscription> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);

			long requestId = nextRequestId();
			requests.put(requestId, new PendingRequest<>(SUBSCRIBE, SUBSCRIBED, promise, response -> {
				Subscription subscription = new Subscription(topic, response.getSubscriptionId(), handler);
				subscriptions.insert(subscription);
				return subscription;
			}));
			msg = Message.subscribe(requestId, objectNode(), topic);
		}
		send(msg);
		return promise;
	}

	/**
	 * Removes a subscription. A subscription that is already gone resolves at once; one
	 * that shares its id with other local subscriptions is dropped locally and only the
	 * last one is unsubscribed at the router. Repeating the call while the router has not
	 * answered yet returns the pending promise.
	 */
	public Promise<Subscription> unsubscribe(final Subscription subscription) {
		final Promise<Subscription> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);

			if (!subscriptions.contains(subscription)) {
				log.debug("{} is not active, nothing to unsubscribe", subscription);
				return resolved(promise, subscription);
			}
			Promise<Subscription> inFlight = unsubscribing.get(subscription);
			if (inFlight != null)
				return inFlight;
			if (subscriptions.count(subscription.getId()) > 1) {
				subscriptions.remove(subscription);
				return resolved(promise, subscription);
			}

			unsubscribing.put(subscription, promise);
			long requestId = nextRequestId();
			requests.put(requestId, new PendingRequest<>(UNSUBSCRIBE, UNSUBSCRIBED, promise, response -> {
				unsubscribing.remove(subscription);
				subscriptions.remove(subscription);
				return subscription;
			}, () -> unsubscribing.remove(subscription)));
			msg = Message.unsubscribe(requestId, subscription.getId());
		}
		send(msg);
		return promise;
	}

	public Promise<Long> publish(String topic, Arguments args) {
		return publish(topic, args, PublishOptions.DEFAULTS);
	}

	/**
	 * Publishes to a topic. Unacknowledged publications resolve with {@code 0} as soon as
	 * they are handed to the transport; acknowledged ones with the publication id.
	 */
	public Promise<Long> publish(String topic, Arguments args, PublishOptions options) {
		requireName(topic, "topic");
		if (args == null)
			args = Arguments.empty();

		final Promise<Long> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);

			long requestId = nextRequestId();
			if (options.isAcknowledge()) {
				requests.put(requestId, new PendingRequest<>(PUBLISH, PUBLISHED, promise, Message::getPublicationId));
			}
			msg = Message.publish(requestId, options.toOptions(), topic, args.wirePositional(), args.wireKeywords());
		}

		boolean sent = send(msg);
		if (!options.isAcknowledge()) {
			if (sent)
				promise.onNext(0L);
			else
				promise.onError(new SessionClosedException(closeReason));
		}
		return promise;
	}

	/**
	 * Registers a procedure. Fails with {@link DuplicateRegistrationException}, without
	 * talking to the router, when the name is registered or being registered already.
	 */
	public Promise<Registration> register(final String procedure, final Procedure implementation) {
		requireName(procedure, "procedure");
		if (implementation == null)
			throw new IllegalArgumentException("implementation");

		final Promise<Registration> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);
			if (registrations.contains(procedure) || registering.contains(procedure))
				return rejected(promise, new DuplicateRegistrationException(procedure));

			registering.add(procedure);
			long requestId = nextRequestId();
			requests.put(requestId, new PendingRequest<>(REGISTER, REGISTERED, promise, response -> {
				registering.remove(procedure);
				Registration registration = new Registration(procedure, response.getRegistrationId(), implementation);
				registrations.insert(registration);
				return registration;
			}, () -> registering.remove(procedure)));
			msg = Message.register(requestId, objectNode(), procedure);
		}
		send(msg);
		return promise;
	}

	public Promise<Registration> unregister(final Registration registration) {
		final Promise<Registration> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);

			if (registrations.get(registration.getId()) != registration) {
				log.debug("{} is not active, nothing to unregister", registration);
				return resolved(promise, registration);
			}

			long requestId = nextRequestId();
			requests.put(requestId, new PendingRequest<>(UNREGISTER, UNREGISTERED, promise, response -> {
				registrations.remove(registration.getId());
				return registration;
			}));
			msg = Message.unregister(requestId, registration.getId());
		}
		send(msg);
		return promise;
	}

	public Promise<Arguments> call(String procedure, Arguments args) {
		return call(procedure, args, CallOptions.DEFAULTS);
	}

	/** Calls a procedure; results are matched by request id, whatever order they arrive in. */
	public Promise<Arguments> call(String procedure, Arguments args, CallOptions options) {
		requireName(procedure, "procedure");
		if (args == null)
			args = Arguments.empty();

		final Promise<Arguments> promise = Promises.prepare();
		final Message msg;
		synchronized (lock) {
			WampException notReady = checkEstablished();
			if (notReady != null)
				return rejected(promise, notReady);

			long requestId = nextRequestId();
			requests.put(requestId, new PendingRequest<>(CALL, RESULT, promise, Arguments::from));
			msg = Message.call(requestId, options.toOptions(), procedure, args.wirePositional(), args.wireKeywords());
		}
		send(msg);
		return promise;
	}

	/**
	 * Leaves the realm. Outstanding requests fail with {@link SessionClosedException} right
	 * away and nothing else is dispatched; the returned promise resolves once the router
	 * answered the GOODBYE or the transport went away.
	 */
	public Promise<String> close() {
		List<PendingRequest<?>> orphans;
		synchronized (lock) {
			if (state == SessionState.CLOSED || state == SessionState.CLOSING)
				return closed;
			if (state != SessionState.ESTABLISHED) {
				orphans = null;
			} else {
				state       = SessionState.CLOSING;
				closeReason = ErrorUris.CLOSE_NORMAL;
				orphans     = drain();
			}
		}

		if (orphans == null) {
			teardown(ErrorUris.CLOSE_NORMAL, null);
			return closed;
		}

		log.info("closing session {}", sessionId);
		reject(orphans, new SessionClosedException(ErrorUris.CLOSE_NORMAL));
		send(Message.goodbye(ErrorUris.CLOSE_NORMAL, null));
		return closed;
	}

	int pendingRequests() {
		synchronized (lock) {
			return requests.size();
		}
	}

	int pendingInvocations() {
		synchronized (lock) {
			return registrations.pendingInvocations();
		}
	}

	private void receive(byte[] payload) {
		if (state == SessionState.CLOSED)
			return;

		Message msg;
		try {
			msg = codec.decode(payload);
		} catch (DecodeException e) {
			log.warn("dropping undecodable message: {}", e.getReason());
			return;
		}

		try {
			dispatch(msg);
		} catch (RuntimeException e) {
			log.error("failed to handle {}", msg, e);
		}
	}

	private void dispatch(Message msg) {
		switch (state) {
		case CLOSED:
			break;
		case CLOSING:
			if (msg.getType() == GOODBYE) {
				teardown(closeReason, null);
			} else {
				log.debug("closing, ignoring {}", Message.typeName(msg.getType()));
			}
			break;
		case CONNECTING:
		case AUTHENTICATING:
			dispatchHandshake(msg);
			break;
		case ESTABLISHED:
			dispatchEstablished(msg);
			break;
		}
	}

	private void dispatchHandshake(Message msg) {
		switch (msg.getType()) {
		case WELCOME:
			onWelcome(msg);
			break;
		case CHALLENGE:
			onChallenge(msg);
			break;
		case ABORT:
			onAbort(msg);
			break;
		default:
			protocolViolation(Message.typeName(msg.getType()) + " before WELCOME");
		}
	}

	private void dispatchEstablished(Message msg) {
		switch (msg.getType()) {
		case SUBSCRIBED:
		case UNSUBSCRIBED:
		case PUBLISHED:
		case REGISTERED:
		case UNREGISTERED:
		case RESULT:
			onResponse(msg);
			break;
		case ERROR:
			onError(msg);
			break;
		case EVENT:
			onEvent(msg);
			break;
		case INVOCATION:
			onInvocation(msg);
			break;
		case INTERRUPT:
			onInterrupt(msg);
			break;
		case GOODBYE:
			onGoodbye(msg);
			break;
		case ABORT:
			onAbort(msg);
			break;
		default:
			protocolViolation("unexpected " + Message.typeName(msg.getType()) + " in established session");
		}
	}

	private void onWelcome(Message msg) {
		synchronized (lock) {
			sessionId      = msg.getSessionId();
			welcomeDetails = msg.getDetails();
			state          = SessionState.ESTABLISHED;
		}
		log.info("session {} established on realm '{}'", sessionId, config.getRealm());
		welcome.onNext(this);
	}

	private void onChallenge(Message msg) {
		synchronized (lock) {
			state = SessionState.AUTHENTICATING;
		}

		ChallengeResponder responder = config.getChallengeResponder();
		if (responder == null) {
			abort(ErrorUris.CANNOT_AUTHENTICATE, "no responder for authentication method " + msg.getText(),
					new ApplicationException(ErrorUris.CANNOT_AUTHENTICATE));
			return;
		}

		String signature;
		try {
			signature = responder.respond(msg.getText(), msg.getDetails());
		} catch (Exception e) {
			log.warn("challenge '{}' failed", msg.getText(), e);
			abort(ErrorUris.CANNOT_AUTHENTICATE, String.valueOf(e.getMessage()),
					new ApplicationException(ErrorUris.CANNOT_AUTHENTICATE));
			return;
		}
		send(Message.authenticate(signature, objectNode()));
	}

	private void onAbort(Message msg) {
		log.warn("router aborted session: {} {}", msg.getUri(), msg.getDetails());
		teardown(msg.getUri(), new ApplicationException(msg.getUri(), new Arguments(null, null, msg.getDetails())));
	}

	private void onGoodbye(Message msg) {
		log.info("router closed session {}: {}", sessionId, msg.getUri());
		send(Message.goodbye(ErrorUris.GOODBYE_AND_OUT, null));
		teardown(msg.getUri(), null);
	}

	private void onResponse(Message msg) {
		Runnable completion = null;
		String   violation  = null;
		synchronized (lock) {
			PendingRequest<?> pending = requests.get(msg.getRequestId());
			if (pending == null) {
				log.debug("ignoring {} for unknown request {}", Message.typeName(msg.getType()), msg.getRequestId());
				return;
			}
			if (pending.getResponseType() != msg.getType()) {
				violation = Message.typeName(msg.getType()) + " answering a " + Message.typeName(pending.getRequestType());
			} else {
				requests.remove(msg.getRequestId());
				completion = pending.accept(msg);
			}
		}

		if (violation != null) {
			protocolViolation(violation);
		} else {
			completion.run();
		}
	}

	private void onError(Message msg) {
		Runnable completion = null;
		String   violation  = null;
		synchronized (lock) {
			PendingRequest<?> pending = requests.get(msg.getRequestId());
			if (pending == null) {
				log.debug("ignoring ERROR {} for unknown request {}", msg.getUri(), msg.getRequestId());
				return;
			}
			if (pending.getRequestType() != msg.getRequestType()) {
				violation = "ERROR for " + Message.typeName(msg.getRequestType()) + " answering a " + Message.typeName(pending.getRequestType());
			} else {
				requests.remove(msg.getRequestId());
				completion = pending.fail(new ApplicationException(msg.getUri(), Arguments.from(msg)));
			}
		}

		if (violation != null) {
			protocolViolation(violation);
		} else {
			completion.run();
		}
	}

	private void onEvent(Message msg) {
		List<Subscription> targets;
		synchronized (lock) {
			targets = subscriptions.get(msg.getSubscriptionId());
		}
		if (targets.isEmpty()) {
			log.debug("dropping event for inactive subscription {}", msg.getSubscriptionId());
			return;
		}

		Arguments event = Arguments.from(msg);
		for (Subscription subscription : targets) {
			if (state != SessionState.ESTABLISHED)
				break;
			try {
				subscription.getHandler().onEvent(event);
			} catch (Exception e) {
				log.error("event handler for '{}' failed", subscription.getTopic(), e);
			}
		}
	}

	private void onInvocation(Message msg) {
		final long invocationId = msg.getRequestId();
		Registration registration;
		boolean      duplicate = false;
		synchronized (lock) {
			registration = registrations.get(msg.getRegistrationId());
			if (registration != null)
				duplicate = !registrations.beginInvocation(invocationId, registration);
		}

		if (registration == null) {
			log.debug("invocation {} for inactive registration {}", invocationId, msg.getRegistrationId());
			send(Message.error(INVOCATION, invocationId, ErrorUris.NO_SUCH_REGISTRATION, null, null));
			return;
		}
		if (duplicate) {
			protocolViolation("invocation " + invocationId + " is already outstanding");
			return;
		}

		Reply reply;
		try {
			reply = registration.getImplementation().invoke(Arguments.from(msg));
		} catch (Exception e) {
			if (!(e instanceof ApplicationException))
				log.warn("procedure '{}' failed", registration.getProcedure(), e);
			settleInvocation(invocationId, null, e);
			return;
		}

		if (reply == null || !reply.isDeferred()) {
			settleInvocation(invocationId, reply == null ? Arguments.empty() : reply.getValue(), null);
		} else {
			/* any terminal signal settles, a completion without a value yields no arguments */
			reply.getDeferred().onComplete(done -> settleInvocation(invocationId,
					done.isError() ? null : done.get(), done.reason()));
		}
	}

	private void onInterrupt(Message msg) {
		boolean outstanding;
		synchronized (lock) {
			outstanding = registrations.endInvocation(msg.getRequestId());
		}
		if (outstanding) {
			log.debug("invocation {} interrupted", msg.getRequestId());
			send(Message.error(INVOCATION, msg.getRequestId(), ErrorUris.CANCELED, null, null));
		}
	}

	private void settleInvocation(long invocationId, Arguments value, Throwable error) {
		synchronized (lock) {
			if (!registrations.endInvocation(invocationId)) {
				log.debug("dropping late reply to invocation {}", invocationId);
				return;
			}
		}

		if (error == null) {
			Arguments result = value == null ? Arguments.empty() : value;
			send(Message.yield(invocationId, objectNode(), result.wirePositional(), result.wireKeywords()));
		} else if (error instanceof ApplicationException) {
			ApplicationException failure = (ApplicationException) error;
			send(Message.error(INVOCATION, invocationId, failure.getUri(),
					failure.getArguments().wirePositional(), failure.getArguments().wireKeywords()));
		} else {
			send(Message.error(INVOCATION, invocationId, ErrorUris.RUNTIME_ERROR,
					Arguments.of(String.valueOf(error.getMessage())).wirePositional(), null));
		}
	}

	private void onTransportClosed(String reason) {
		if (state == SessionState.CLOSED)
			return;
		if (state == SessionState.CLOSING) {
			teardown(closeReason, null);
		} else {
			log.warn("transport of session {} lost: {}", sessionId, reason);
			teardown(ErrorUris.TRANSPORT_LOST, new TransportException(reason));
		}
	}

	private void protocolViolation(String what) {
		log.warn("protocol violation in session {}: {}", sessionId, what);
		abort(ErrorUris.PROTOCOL_VIOLATION, what, new ProtocolException(what));
	}

	private void abort(String reason, String message, Throwable cause) {
		send(Message.abort(reason, message));
		teardown(reason, cause);
	}

	/**
	 * Moves to CLOSED from any state: rejects everything outstanding, forgets every
	 * subscription and registration without asking the router, and closes the transport.
	 */
	private void teardown(String reason, Throwable cause) {
		List<PendingRequest<?>> orphans;
		Transport               channel;
		synchronized (lock) {
			if (state == SessionState.CLOSED && closeReason != null)
				return;
			state       = SessionState.CLOSED;
			closeReason = reason;
			orphans     = drain();
			channel     = transport;
		}

		SessionClosedException closedError = new SessionClosedException(reason, cause);
		reject(orphans, closedError);
		if (welcome.isPending())
			welcome.onError(cause != null ? cause : closedError);
		if (channel != null && channel.isOpen())
			channel.close();

		log.info("session {} closed: {}", sessionId, reason);
		if (closed.isPending())
			closed.onNext(reason);
	}

	private List<PendingRequest<?>> drain() {
		List<PendingRequest<?>> orphans = new ArrayList<>(requests.values());
		requests.clear();
		subscriptions.clear();
		registrations.clear();
		registering.clear();
		unsubscribing.clear();
		return orphans;
	}

	private static void reject(List<PendingRequest<?>> orphans, Throwable error) {
		for (PendingRequest<?> orphan : orphans) {
			orphan.fail(error).run();
		}
	}

	private boolean send(Message msg) {
		Transport channel = transport;
		if (channel == null)
			return false;
		try {
			channel.send(codec.encode(msg));
			return true;
		} catch (TransportException e) {
			log.warn("cannot send {}: {}", Message.typeName(msg.getType()), e.getMessage());
			teardown(ErrorUris.TRANSPORT_LOST, e);
			return false;
		}
	}

	private WampException checkEstablished() {
		switch (state) {
		case ESTABLISHED:
			return null;
		case CLOSING:
		case CLOSED:
			return new SessionClosedException(closeReason == null ? ErrorUris.CLOSE_NORMAL : closeReason);
		default:
			return new SessionStateException(state);
		}
	}

	private long nextRequestId() {
		return requestIds.next(requests);
	}

	private static void requireName(String name, String what) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException(what);
	}

	private static <T> Promise<T> rejected(Promise<T> promise, Throwable error) {
		promise.onError(error);
		return promise;
	}

	private static <T> Promise<T> resolved(Promise<T> promise, T value) {
		promise.onNext(value);
		return promise;
	}
}
