package com.distopik.wampsession;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class CallOptions {
	public static final CallOptions DEFAULTS = builder().build();

	private final long    timeoutMillis;
	private final boolean discloseMe;

	private CallOptions(long timeoutMillis, boolean discloseMe) {
		this.timeoutMillis = timeoutMillis;
		this.discloseMe    = discloseMe;
	}

	public static Builder builder() {
		return new Builder();
	}

	public long getTimeoutMillis() {
		return timeoutMillis;
	}

	public boolean isDiscloseMe() {
		return discloseMe;
	}

	ObjectNode toOptions() {
		ObjectNode options = JsonNodeFactory.instance.objectNode();
		if (timeoutMillis > 0)
			options.put("timeout", timeoutMillis);
		if (discloseMe)
			options.put("disclose_me", true);
		return options;
	}

	public static final class Builder {
		private long    timeoutMillis;
		private boolean discloseMe;

		/** Forwarded to the router, which may cancel the call after this many milliseconds. */
		public Builder withTimeoutMillis(long timeoutMillis) {
			if (timeoutMillis < 0)
				throw new IllegalArgumentException("timeoutMillis");
			this.timeoutMillis = timeoutMillis;
			return this;
		}

		public Builder withDiscloseMe(boolean discloseMe) {
			this.discloseMe = discloseMe;
			return this;
		}

		public CallOptions build() {
			return new CallOptions(timeoutMillis, discloseMe);
		}
	}
}
