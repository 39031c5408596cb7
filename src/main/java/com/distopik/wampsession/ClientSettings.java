package com.distopik.wampsession;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.transport.WebSocketTransportFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Connection settings as read from a JSON document:
 *
 * <pre>
 * {
 *   "url": "ws://127.0.0.1:8080/ws",
 *   "realm": "realm1",
 *   "serializations": ["wamp.2.json", "wamp.2.msgpack"],
 *   "agent": "my-app",
 *   "retry": { "maxRetries": 15, "initialDelay": 1500, "maxDelay": 300000, "growth": 1.5, "jitter": 0.1 }
 * }
 * </pre>
 *
 * Delays are in milliseconds. Everything but {@code url} and {@code realm} may be left out.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSettings {
	private static final ObjectMapper mapper = new ObjectMapper();

	private String       url;
	private String       realm;
	private List<String> serializations = new ArrayList<>(Arrays.asList(Codecs.WAMP_JSON_V2, Codecs.WAMP_MSGPACK_V2));
	private String       agent          = SessionConfig.DEFAULT_AGENT;
	private long         connectTimeout = 10_000;
	private Retry        retry          = new Retry();

	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Retry {
		private int    maxRetries   = RetryPolicy.DEFAULTS.getMaxRetries();
		private long   initialDelay = RetryPolicy.DEFAULTS.getInitialDelayMillis();
		private long   maxDelay     = RetryPolicy.DEFAULTS.getMaxDelayMillis();
		private double growth       = RetryPolicy.DEFAULTS.getGrowth();
		private double jitter       = RetryPolicy.DEFAULTS.getJitter();

		public int getMaxRetries() {
			return maxRetries;
		}

		public void setMaxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
		}

		public long getInitialDelay() {
			return initialDelay;
		}

		public void setInitialDelay(long initialDelay) {
			this.initialDelay = initialDelay;
		}

		public long getMaxDelay() {
			return maxDelay;
		}

		public void setMaxDelay(long maxDelay) {
			this.maxDelay = maxDelay;
		}

		public double getGrowth() {
			return growth;
		}

		public void setGrowth(double growth) {
			this.growth = growth;
		}

		public double getJitter() {
			return jitter;
		}

		public void setJitter(double jitter) {
			this.jitter = jitter;
		}
	}

	public static ClientSettings load(Path file) throws IOException {
		try (InputStream in = Files.newInputStream(file)) {
			return mapper.readValue(in, ClientSettings.class);
		}
	}

	public static ClientSettings fromResource(String name) throws IOException {
		InputStream in = ClientSettings.class.getClassLoader().getResourceAsStream(name);
		if (in == null)
			throw new IOException("no such resource: " + name);
		try {
			return mapper.readValue(in, ClientSettings.class);
		} finally {
			in.close();
		}
	}

	public SessionConfig toSessionConfig() {
		if (url == null || url.isEmpty())
			throw new IllegalArgumentException("url");

		URI endpoint;
		try {
			endpoint = new URI(url);
		} catch (URISyntaxException e) {
			throw new IllegalArgumentException("url: " + e.getMessage(), e);
		}

		return SessionConfig.builder()
			.withRealm           (realm)
			.withAgent           (agent)
			.withTransportFactory(new WebSocketTransportFactory(endpoint, serializations, connectTimeout))
			.build();
	}

	public RetryPolicy toRetryPolicy() {
		return RetryPolicy.builder()
			.withMaxRetries  (retry.maxRetries)
			.withInitialDelay(retry.initialDelay, TimeUnit.MILLISECONDS)
			.withMaxDelay    (retry.maxDelay,     TimeUnit.MILLISECONDS)
			.withGrowth      (retry.growth)
			.withJitter      (retry.jitter)
			.build();
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getRealm() {
		return realm;
	}

	public void setRealm(String realm) {
		this.realm = realm;
	}

	public List<String> getSerializations() {
		return serializations;
	}

	public void setSerializations(List<String> serializations) {
		this.serializations = serializations;
	}

	public String getAgent() {
		return agent;
	}

	public void setAgent(String agent) {
		this.agent = agent;
	}

	public long getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(long connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Retry getRetry() {
		return retry;
	}

	public void setRetry(Retry retry) {
		this.retry = retry;
	}
}
