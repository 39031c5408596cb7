package com.distopik.wampsession.router;

import static reactor.bus.selector.Selectors.$;

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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import reactor.bus.Event;
import reactor.bus.EventBus;
import reactor.fn.Function;

/**
 * {@link Engine} keeping one Reactor {@link EventBus} per realm for publications, keyed
 * by exact topic. Procedures are unique per realm.
 */
public class ReactorEngine implements Engine {
	private static final Logger log = LoggerFactory.getLogger(ReactorEngine.class);

	static class RPCReg {
		RPCReg(long registrationId, String uri, Invocation handler) {
			this.registrationId = registrationId;
			this.uri            = uri;
			this.handler        = handler;
		}

		final long       registrationId;
		final String     uri;
		final Invocation handler;
	}

	static class Publication {
		Publication(long publisherId, long publicationId, boolean excludeMe, Message published) {
			this.publisherId   = publisherId;
			this.publicationId = publicationId;
			this.excludeMe     = excludeMe;
			this.published     = published;
		}

		final long    publisherId;
		final long    publicationId;
		final boolean excludeMe;
		final Message published;
	}

	static class Realm {
		Realm(String name) {
			this.name     = name;
			this.eventBus = EventBus.create();
		}

		final String              name;
		final EventBus            eventBus;
		final Map<String, RPCReg> registrations = new HashMap<>();
	}

	static class SubscriptionReg {
		SubscriptionReg(String topic, Runnable cancel) {
			this.topic  = topic;
			this.cancel = cancel;
		}

		final String   topic;
		final Runnable cancel;
	}

	static class Session {
		Session(long id, Realm realm) {
			this.id    = id;
			this.realm = realm;
		}

		final long  id;
		final Realm realm;

		final Map<Long, SubscriptionReg> subscriptions = new HashMap<>();
		final Map<String, Long>          topics        = new HashMap<>();
		final Map<Long, RPCReg>          registrations = new HashMap<>();

		void cleanup() {
			synchronized (subscriptions) {
				for (SubscriptionReg sub : subscriptions.values()) {
					sub.cancel.run();
				}
				subscriptions.clear();
				topics.clear();
			}
			synchronized (registrations) {
				synchronized (realm.registrations) {
					for (RPCReg reg : registrations.values()) {
						realm.registrations.remove(reg.uri);
					}
				}
				registrations.clear();
			}
		}
	}

	private final Map<String, Realm> realms          = new HashMap<>();
	private final Map<Long, Session> sessions        = new HashMap<>();
	private final AtomicLong         sessionIds      = new AtomicLong();
	private final AtomicLong         subscriptionIds = new AtomicLong();
	private final AtomicLong         publicationIds  = new AtomicLong();
	private final AtomicLong         registrationIds = new AtomicLong();

	private <T> T checkSession(long sessionId, Function<Session, T> func) {
		Session s;
		synchronized (sessions) {
			s = sessions.get(sessionId);
		}
		if (s == null)
			throw new IllegalArgumentException("sessionId");
		return func.apply(s);
	}

	@Override
	public long createSession(String realm) {
		synchronized (sessions) {
			Realm r = realms.get(realm);
			if (r == null)
				realms.put(realm, r = new Realm(realm));

			long sId = sessionIds.incrementAndGet();
			sessions.put(sId, new Session(sId, r));
			log.debug("session {} joined realm '{}'", sId, realm);
			return sId;
		}
	}

	@Override
	public void closeSession(long sessionId) {
		Session s;
		synchronized (sessions) {
			s = sessions.remove(sessionId);
		}
		if (s != null) {
			s.cleanup();
			log.debug("session {} left realm '{}'", sessionId, s.realm.name);
		}
	}

	/** A session subscribing twice to one topic gets the same subscription id back. */
	@Override
	public long subscribe(long sessionId, String topic, Notification callme) {
		return checkSession(sessionId, s -> {
			synchronized (s.subscriptions) {
				Long existing = s.topics.get(topic);
				if (existing != null)
					return existing;

				final long subId = subscriptionIds.incrementAndGet();
				Runnable cancel = s.realm.eventBus.on($(topic), (Event<Publication> event) -> {
					Publication p = event.getData();
					if (p.excludeMe && p.publisherId == s.id)
						return;

					Message delivered = Message.event(subId, p.publicationId, JsonNodeFactory.instance.objectNode(),
							p.published.getArguments(), p.published.getArgumentsKeywords());
					if (!callme.notify(delivered)) {
						dropSubscription(s, subId);
					}
				})::cancel;
				s.subscriptions.put(subId, new SubscriptionReg(topic, cancel));
				s.topics.put(topic, subId);
				return subId;
			}
		});
	}

	private static boolean dropSubscription(Session s, long subscriptionId) {
		synchronized (s.subscriptions) {
			SubscriptionReg sub = s.subscriptions.remove(subscriptionId);
			if (sub == null)
				return false;
			sub.cancel.run();
			s.topics.remove(sub.topic);
			return true;
		}
	}

	@Override
	public void unsubscribe(long sessionId, long subscriptionId) {
		checkSession(sessionId, s -> {
			if (!dropSubscription(s, subscriptionId))
				throw new ApplicationException(ErrorUris.NO_SUCH_SUBSCRIPTION);
			return null;
		});
	}

	@Override
	public long publish(long sessionId, String topic, Message publication, boolean excludeMe) {
		return checkSession(sessionId, s -> {
			long pubId = publicationIds.incrementAndGet();
			s.realm.eventBus.notify(topic, Event.wrap(new Publication(s.id, pubId, excludeMe, publication)));
			return pubId;
		});
	}

	@Override
	public long register(long sessionId, String procedure, Invocation callme) {
		return checkSession(sessionId, s -> {
			synchronized (s.registrations) {
				synchronized (s.realm.registrations) {
					if (s.realm.registrations.containsKey(procedure)) {
						throw new ApplicationException(ErrorUris.PROCEDURE_ALREADY_EXISTS);
					}

					long   regId  = registrationIds.incrementAndGet();
					RPCReg rpcReg = new RPCReg(regId, procedure, callme);
					s.realm.registrations.put(procedure, rpcReg);
					s.registrations.put(regId, rpcReg);
					return regId;
				}
			}
		});
	}

	@Override
	public void unregister(long sessionId, long registrationId) {
		checkSession(sessionId, s -> {
			synchronized (s.registrations) {
				RPCReg reg = s.registrations.remove(registrationId);
				if (reg == null)
					throw new ApplicationException(ErrorUris.NO_SUCH_REGISTRATION);
				synchronized (s.realm.registrations) {
					s.realm.registrations.remove(reg.uri);
				}
			}
			return null;
		});
	}

	@Override
	public void call(long sessionId, String procedure, Message call, Notification callme) {
		RPCReg reg = checkSession(sessionId, s -> {
			synchronized (s.realm.registrations) {
				return s.realm.registrations.get(procedure);
			}
		});
		if (reg == null)
			throw new ApplicationException(ErrorUris.NO_SUCH_PROCEDURE);

		Message routed = new Message(call);
		routed.setRegistrationId(reg.registrationId);
		if (!reg.handler.invoke(routed, callme))
			throw new ApplicationException(ErrorUris.NO_SUCH_PROCEDURE);
	}

	/** Number of sessions currently joined to any realm. */
	public int sessionCount() {
		synchronized (sessions) {
			return sessions.size();
		}
	}

	/** Procedures registered in a realm, for diagnostics. */
	public List<String> procedures(String realm) {
		synchronized (sessions) {
			Realm r = realms.get(realm);
			if (r == null)
				return new ArrayList<>();
			synchronized (r.registrations) {
				return new ArrayList<>(r.registrations.keySet());
			}
		}
	}
}
