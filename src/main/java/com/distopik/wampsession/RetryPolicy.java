package com.distopik.wampsession;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * How often and how fast {@link WampConnection} tries to reach the router again.
 * Delays grow geometrically from {@code initialDelay} up to {@code maxDelay}, each one
 * spread by a random factor of {@code jitter}.
 */
public final class RetryPolicy {
	public static final int UNLIMITED = -1;

	public static final RetryPolicy DEFAULTS = builder().build();
	public static final RetryPolicy NEVER    = builder().withMaxRetries(0).build();

	private final int    maxRetries;
	private final long   initialDelayMillis;
	private final long   maxDelayMillis;
	private final double growth;
	private final double jitter;

	private RetryPolicy(Builder builder) {
		this.maxRetries         = builder.maxRetries;
		this.initialDelayMillis = builder.initialDelayMillis;
		this.maxDelayMillis     = builder.maxDelayMillis;
		this.growth             = builder.growth;
		this.jitter             = builder.jitter;
	}

	public static Builder builder() {
		return new Builder();
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public long getInitialDelayMillis() {
		return initialDelayMillis;
	}

	public long getMaxDelayMillis() {
		return maxDelayMillis;
	}

	public double getGrowth() {
		return growth;
	}

	public double getJitter() {
		return jitter;
	}

	/** Whether retry number {@code attempt} (counting from 1) is still allowed. */
	public boolean canRetry(int attempt) {
		return maxRetries == UNLIMITED || attempt <= maxRetries;
	}

	/** Milliseconds to wait before retry number {@code attempt}, counting from 1. */
	public long delayFor(int attempt) {
		double delay = initialDelayMillis * Math.pow(growth, Math.max(0, attempt - 1));
		delay = Math.min(delay, maxDelayMillis);
		if (jitter > 0) {
			delay += delay * jitter * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
		}
		return Math.max(0L, Math.min(Math.round(delay), maxDelayMillis));
	}

	@Override
	public String toString() {
		return "RetryPolicy{maxRetries=" + maxRetries + ", initialDelay=" + initialDelayMillis
				+ "ms, maxDelay=" + maxDelayMillis + "ms, growth=" + growth + ", jitter=" + jitter + "}";
	}

	public static final class Builder {
		private int    maxRetries         = 15;
		private long   initialDelayMillis = 1500;
		private long   maxDelayMillis     = TimeUnit.SECONDS.toMillis(300);
		private double growth             = 1.5;
		private double jitter             = 0.1;

		private Builder() {}

		public Builder withMaxRetries(int maxRetries) {
			if (maxRetries < UNLIMITED)
				throw new IllegalArgumentException("maxRetries");
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder withInitialDelay(long delay, TimeUnit unit) {
			if (delay < 0)
				throw new IllegalArgumentException("initialDelay");
			this.initialDelayMillis = unit.toMillis(delay);
			return this;
		}

		public Builder withMaxDelay(long delay, TimeUnit unit) {
			if (delay < 0)
				throw new IllegalArgumentException("maxDelay");
			this.maxDelayMillis = unit.toMillis(delay);
			return this;
		}

		public Builder withGrowth(double growth) {
			if (growth < 1.0)
				throw new IllegalArgumentException("growth");
			this.growth = growth;
			return this;
		}

		public Builder withJitter(double jitter) {
			if (jitter < 0 || jitter >= 1.0)
				throw new IllegalArgumentException("jitter");
			this.jitter = jitter;
			return this;
		}

		public RetryPolicy build() {
			if (maxDelayMillis < initialDelayMillis)
				throw new IllegalArgumentException("maxDelay is shorter than initialDelay");
			return new RetryPolicy(this);
		}
	}
}
