package com.distopik.wampsession;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distopik.wampsession.transport.TransportException;

import reactor.fn.Consumer;
import reactor.rx.Promise;
import reactor.rx.Promises;

/**
 * Keeps a {@link WampSession} open: joins the realm, and when the router cannot be
 * reached or the transport of an established session is lost, opens a fresh session
 * after the delay the {@link RetryPolicy} asks for. Subscriptions and registrations do
 * not survive a reconnect; {@link #onOpen} handlers are expected to set them up again.
 * <p>
 * Reconnecting stops for good on {@link #close()}, on a GOODBYE or ABORT from the
 * router, and when the policy runs out of retries.
 */
public class WampConnection {
	private static final Logger log = LoggerFactory.getLogger(WampConnection.class);

	private final SessionConfig            config;
	private final RetryPolicy              policy;
	private final ScheduledExecutorService scheduler;
	private final boolean                  ownScheduler;
	private final Object                   lock   = new Object();
	private final Promise<String>          closed = Promises.prepare();

	private volatile Consumer<WampSession> openHandler  = session -> {};
	private volatile Consumer<String>      closeHandler = reason -> {};

	private WampSession        current;
	private ScheduledFuture<?> nextAttempt;
	private int                attempt;
	private boolean            started;
	private boolean            closing;
	private boolean            finished;

	public WampConnection(SessionConfig config, RetryPolicy policy) {
		this(config, policy, Executors.newSingleThreadScheduledExecutor(), true);
	}

	public WampConnection(SessionConfig config, RetryPolicy policy, ScheduledExecutorService scheduler) {
		this(config, policy, scheduler, false);
	}

	private WampConnection(SessionConfig config, RetryPolicy policy, ScheduledExecutorService scheduler, boolean ownScheduler) {
		this.config       = config;
		this.policy       = policy;
		this.scheduler    = scheduler;
		this.ownScheduler = ownScheduler;
	}

	/** Called with every newly established session, the first one and each reconnect. */
	public WampConnection onOpen(Consumer<WampSession> handler) {
		this.openHandler = handler;
		return this;
	}

	/** Called once, with the reason, when the connection gives up or is closed. */
	public WampConnection onClose(Consumer<String> handler) {
		this.closeHandler = handler;
		return this;
	}

	public void open() {
		synchronized (lock) {
			if (started)
				throw new IllegalStateException("connection already opened");
			started = true;
		}
		scheduler.execute(this::connect);
	}

	/** The established session, or {@code null} while (re)connecting or after close. */
	public WampSession session() {
		synchronized (lock) {
			return current;
		}
	}

	public boolean isOpen() {
		WampSession session = session();
		return session != null && session.getState() == SessionState.ESTABLISHED;
	}

	/** Resolves with the reason once the connection stopped for good. */
	public Promise<String> closed() {
		return closed;
	}

	public Promise<String> close() {
		WampSession session;
		synchronized (lock) {
			if (closing || finished)
				return closed;
			closing = true;
			if (nextAttempt != null)
				nextAttempt.cancel(false);
			session = current;
		}

		if (session != null) {
			session.close();
		} else {
			finish(ErrorUris.CLOSE_NORMAL);
		}
		return closed;
	}

	private void connect() {
		synchronized (lock) {
			if (closing || finished)
				return;
		}
		log.debug("joining realm '{}' (attempt {})", config.getRealm(), attempt + 1);

		Promise<WampSession> opening = WampSession.open(config);
		opening.onSuccess(this::onEstablished);
		opening.onError(this::onFailed);
	}

	private void onEstablished(final WampSession session) {
		boolean abandon;
		synchronized (lock) {
			abandon = closing || finished;
			if (!abandon) {
				current = session;
				attempt = 0;
			}
		}
		if (abandon) {
			session.close();
			return;
		}

		session.closed().onSuccess(reason -> onSessionClosed(session, reason));
		try {
			openHandler.accept(session);
		} catch (RuntimeException e) {
			log.error("open handler failed", e);
		}
	}

	private void onFailed(Throwable error) {
		synchronized (lock) {
			if (closing || finished)
				return;
		}
		if (error instanceof TransportException) {
			log.info("cannot join realm '{}': {}", config.getRealm(), error.getMessage());
			retry();
		} else if (error instanceof ApplicationException) {
			finish(((ApplicationException) error).getUri());
		} else if (error instanceof SessionClosedException) {
			finish(((SessionClosedException) error).getReason());
		} else {
			log.warn("cannot join realm '{}'", config.getRealm(), error);
			finish(ErrorUris.PROTOCOL_VIOLATION);
		}
	}

	private void onSessionClosed(WampSession session, String reason) {
		boolean stop;
		synchronized (lock) {
			if (current == session)
				current = null;
			stop = closing || finished;
		}
		if (!stop && ErrorUris.TRANSPORT_LOST.equals(reason)) {
			retry();
		} else {
			finish(reason);
		}
	}

	private void retry() {
		synchronized (lock) {
			if (closing || finished)
				return;
			attempt++;
			if (policy.canRetry(attempt)) {
				long delay = policy.delayFor(attempt);
				log.info("reconnecting to realm '{}' in {} ms (retry {})", config.getRealm(), delay, attempt);
				nextAttempt = scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
				return;
			}
		}
		log.warn("giving up on realm '{}' after {} retries", config.getRealm(), attempt - 1);
		finish(ErrorUris.UNREACHABLE);
	}

	private void finish(String reason) {
		synchronized (lock) {
			if (finished)
				return;
			finished = true;
			current  = null;
		}

		log.info("connection to realm '{}' closed: {}", config.getRealm(), reason);
		try {
			closeHandler.accept(reason);
		} catch (RuntimeException e) {
			log.error("close handler failed", e);
		}
		closed.onNext(reason);
		if (ownScheduler)
			scheduler.shutdown();
	}
}
