package com.distopik.wampsession.router;

import static com.distopik.wampsession.message.Message.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.ApplicationException;
import com.distopik.wampsession.ErrorUris;
import com.distopik.wampsession.message.Message;
import com.distopik.wampsession.message.MessageLayout;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.fn.Consumer;

/**
 * Router side of one client connection: joins the client to a realm of the
 * {@link Engine} and relays its subscriptions, publications, registrations and calls.
 * Whatever carries the bytes implements {@link Peer}.
 */
public class RouterSession {
	private static final Logger log = LoggerFactory.getLogger(RouterSession.class);

	private static final ObjectNode WAMP_ROUTER_CAPABILITIES = objectNode();
	static {
		WAMP_ROUTER_CAPABILITIES.put("agent", "reactor-wamp-session-router");
		ObjectNode roles = objectNode();
		roles.set("broker", objectNode());
		roles.set("dealer", objectNode());
		WAMP_ROUTER_CAPABILITIES.set("roles", roles);
	}

	/** The connection a router session talks through. */
	public interface Peer {
		boolean isConnected();
		void    deliver(Message msg);
		void    disconnect();
	}

	private static ObjectNode objectNode() {
		return JsonNodeFactory.instance.objectNode();
	}

	private final Engine engine;
	private final Peer   peer;

	private volatile long    sessionId = -1;
	private volatile boolean goodbyeSent;

	private final AtomicLong                invocationId      = new AtomicLong();
	private final Map<Long, Notification>   futureInvocations = new HashMap<>();

	public RouterSession(Engine engine, Peer peer) {
		this.engine = engine;
		this.peer   = peer;
	}

	public long getSessionId() {
		return sessionId;
	}

	public void onMessage(final Message msg) {
		guardErrors(msg, unused -> {
			if (sessionId < 0 && msg.getType() != HELLO) {
				throw new IllegalStateException("first message must be HELLO, got " + Message.typeName(msg.getType()));
			}

			switch (msg.getType()) {
			case HELLO:       onHello(msg);       break;
			case SUBSCRIBE:   onSubscribe(msg);   break;
			case UNSUBSCRIBE: onUnsubscribe(msg); break;
			case PUBLISH:     onPublish(msg);     break;
			case REGISTER:    onRegister(msg);    break;
			case UNREGISTER:  onUnregister(msg);  break;
			case CALL:        onCall(msg);        break;
			case YIELD:       onYield(msg);       break;
			case ERROR:       onError(msg);       break;
			case GOODBYE:     onGoodbye(msg);     break;
			case ABORT:       onAbort(msg);       break;
			default:
				throw new IllegalStateException("unexpected " + Message.typeName(msg.getType()));
			}
		});
	}

	/**
	 * Runs a handler; WAMP errors are answered with an ERROR for the request, anything
	 * else aborts the session.
	 */
	private void guardErrors(Message msg, Consumer<Message> func) {
		try {
			func.accept(msg);
		} catch (ApplicationException e) {
			if (MessageLayout.canFail(msg.getType())) {
				peer.deliver(Message.error(msg.getType(), msg.getRequestId(), e.getUri(), null, null));
			} else {
				abort(e.getUri(), e.getMessage());
			}
		} catch (RuntimeException e) {
			log.warn("aborting session {}: {}", sessionId, e.getMessage());
			abort(ErrorUris.PROTOCOL_VIOLATION, e.getMessage());
		}
	}

	private void onHello(Message msg) {
		if (sessionId > 0) {
			throw new IllegalStateException("already welcome");
		}
		sessionId   = engine.createSession(msg.getUri());
		goodbyeSent = false;
		log.info("session {} joined realm '{}'", sessionId, msg.getUri());
		peer.deliver(Message.welcome(sessionId, WAMP_ROUTER_CAPABILITIES.deepCopy()));
	}

	private void onSubscribe(Message msg) {
		long subId = engine.subscribe(sessionId, msg.getUri(), event -> {
			if (peer.isConnected()) {
				peer.deliver(event);
				return true;
			}
			return false;
		});
		peer.deliver(Message.subscribed(msg.getRequestId(), subId));
	}

	private void onUnsubscribe(Message msg) {
		engine.unsubscribe(sessionId, msg.getSubscriptionId());
		peer.deliver(Message.unsubscribed(msg.getRequestId()));
	}

	private void onPublish(Message msg) {
		boolean excludeMe   = msg.getDetails().path("exclude_me").asBoolean(true);
		boolean acknowledge = msg.getDetails().path("acknowledge").asBoolean(false);

		long pubId = engine.publish(sessionId, msg.getUri(), msg, excludeMe);
		if (acknowledge) {
			peer.deliver(Message.published(msg.getRequestId(), pubId));
		}
	}

	private void onRegister(Message msg) {
		long regId = engine.register(sessionId, msg.getUri(), (call, reply) -> {
			if (!peer.isConnected())
				return false;

			long invId = invocationId.incrementAndGet();
			synchronized (futureInvocations) {
				futureInvocations.put(invId, reply);
			}
			peer.deliver(Message.invocation(invId, call.getRegistrationId(), objectNode(),
					call.getArguments(), call.getArgumentsKeywords()));
			return true;
		});
		peer.deliver(Message.registered(msg.getRequestId(), regId));
	}

	private void onUnregister(Message msg) {
		engine.unregister(sessionId, msg.getRegistrationId());
		peer.deliver(Message.unregistered(msg.getRequestId()));
	}

	private void onCall(final Message msg) {
		final long requestId = msg.getRequestId();
		engine.call(sessionId, msg.getUri(), msg, reply -> {
			if (!peer.isConnected())
				return false;

			if (reply.getType() == YIELD) {
				peer.deliver(Message.result(requestId, objectNode(), reply.getArguments(), reply.getArgumentsKeywords()));
			} else {
				peer.deliver(Message.error(CALL, requestId, reply.getUri(), reply.getArguments(), reply.getArgumentsKeywords()));
			}
			return true;
		});
	}

	private void onYield(Message msg) {
		Notification target;
		synchronized (futureInvocations) {
			target = futureInvocations.remove(msg.getRequestId());
		}
		if (target == null) {
			log.debug("session {} yielded unknown invocation {}", sessionId, msg.getRequestId());
			return;
		}
		target.notify(msg);
	}

	private void onError(Message msg) {
		if (msg.getRequestType() != INVOCATION) {
			throw new IllegalStateException("ERROR from a client must answer an INVOCATION");
		}
		onYield(msg);
	}

	private void onGoodbye(Message msg) {
		log.info("session {} left: {}", sessionId, msg.getUri());
		boolean answer = !goodbyeSent;
		leave();
		if (answer) {
			peer.deliver(Message.goodbye(ErrorUris.GOODBYE_AND_OUT, null));
		}
	}

	private void onAbort(Message msg) {
		log.info("session {} aborted: {}", sessionId, msg.getUri());
		leave();
		peer.disconnect();
	}

	/** Asks the client to leave the realm; the session ends when it answers. */
	public void goodbye(String reason) {
		if (sessionId < 0 || goodbyeSent)
			return;
		goodbyeSent = true;
		peer.deliver(Message.goodbye(reason, null));
	}

	private void abort(String reason, String message) {
		if (peer.isConnected())
			peer.deliver(Message.abort(reason, message));
		leave();
		peer.disconnect();
	}

	/** The connection is gone: leave the realm and cancel what callers are still waiting for. */
	public void onClose() {
		leave();
	}

	private void leave() {
		long left = sessionId;
		sessionId = -1;
		if (left > 0) {
			engine.closeSession(left);
		}

		List<Notification> orphans;
		synchronized (futureInvocations) {
			orphans = new ArrayList<>(futureInvocations.values());
			futureInvocations.clear();
		}
		for (Notification caller : orphans) {
			caller.notify(Message.error(INVOCATION, 0, ErrorUris.CANCELED, null, null));
		}
	}
}
