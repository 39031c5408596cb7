package com.distopik.wampsession;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.distopik.wampsession.transport.TransportFactory;

import reactor.Environment;
import reactor.core.Dispatcher;

/**
 * Everything a {@link WampSession} needs to join a realm. The dispatcher drives the
 * session's inbound message loop; when none is given a cached single-threaded
 * dispatcher of the shared Reactor {@link Environment} is used.
 */
public final class SessionConfig {
	public static final String DEFAULT_AGENT = "reactor-wamp-session";

	private final String             realm;
	private final TransportFactory   transportFactory;
	private final Dispatcher         dispatcher;
	private final String             agent;
	private final String             authId;
	private final List<String>       authMethods;
	private final ChallengeResponder challengeResponder;

	private SessionConfig(Builder builder) {
		this.realm              = builder.realm;
		this.transportFactory   = builder.transportFactory;
		this.dispatcher         = builder.dispatcher;
		this.agent              = builder.agent;
		this.authId             = builder.authId;
		this.authMethods        = Collections.unmodifiableList(new ArrayList<>(builder.authMethods));
		this.challengeResponder = builder.challengeResponder;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getRealm() {
		return realm;
	}

	public TransportFactory getTransportFactory() {
		return transportFactory;
	}

	public Dispatcher getDispatcher() {
		return dispatcher;
	}

	public String getAgent() {
		return agent;
	}

	public String getAuthId() {
		return authId;
	}

	public List<String> getAuthMethods() {
		return authMethods;
	}

	public ChallengeResponder getChallengeResponder() {
		return challengeResponder;
	}

	public Builder toBuilder() {
		Builder builder            = new Builder();
		builder.realm              = realm;
		builder.transportFactory   = transportFactory;
		builder.dispatcher         = dispatcher;
		builder.agent              = agent;
		builder.authId             = authId;
		builder.authMethods        = new ArrayList<>(authMethods);
		builder.challengeResponder = challengeResponder;
		return builder;
	}

	public static final class Builder {
		private String             realm;
		private TransportFactory   transportFactory;
		private Dispatcher         dispatcher;
		private String             agent       = DEFAULT_AGENT;
		private String             authId;
		private List<String>       authMethods = new ArrayList<>();
		private ChallengeResponder challengeResponder;

		public Builder withRealm(String realm) {
			this.realm = realm;
			return this;
		}

		public Builder withTransportFactory(TransportFactory transportFactory) {
			this.transportFactory = transportFactory;
			return this;
		}

		public Builder withDispatcher(Dispatcher dispatcher) {
			this.dispatcher = dispatcher;
			return this;
		}

		public Builder withAgent(String agent) {
			this.agent = agent;
			return this;
		}

		public Builder withAuthId(String authId) {
			this.authId = authId;
			return this;
		}

		public Builder withAuthMethods(String... authMethods) {
			this.authMethods = new ArrayList<>(Arrays.asList(authMethods));
			return this;
		}

		public Builder withChallengeResponder(ChallengeResponder challengeResponder) {
			this.challengeResponder = challengeResponder;
			return this;
		}

		public SessionConfig build() {
			if (realm == null || realm.isEmpty())
				throw new IllegalArgumentException("realm");
			if (transportFactory == null)
				throw new IllegalArgumentException("transportFactory");
			if (dispatcher == null) {
				Environment.initializeIfEmpty();
				dispatcher = Environment.cachedDispatcher();
			}
			return new SessionConfig(this);
		}
	}
}
