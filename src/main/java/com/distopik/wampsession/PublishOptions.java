package com.distopik.wampsession;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class PublishOptions {
	public static final PublishOptions DEFAULTS = builder().build();

	private final boolean acknowledge;
	private final boolean excludeMe;

	private PublishOptions(boolean acknowledge, boolean excludeMe) {
		this.acknowledge = acknowledge;
		this.excludeMe   = excludeMe;
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isAcknowledge() {
		return acknowledge;
	}

	public boolean isExcludeMe() {
		return excludeMe;
	}

	ObjectNode toOptions() {
		ObjectNode options = JsonNodeFactory.instance.objectNode();
		if (acknowledge)
			options.put("acknowledge", true);
		if (!excludeMe)
			options.put("exclude_me", false);
		return options;
	}

	public static final class Builder {
		private boolean acknowledge;
		private boolean excludeMe = true;

		/** Ask the router for a PUBLISHED (or ERROR) answer. */
		public Builder withAcknowledge(boolean acknowledge) {
			this.acknowledge = acknowledge;
			return this;
		}

		/** Whether the publisher's own subscriptions are skipped; WAMP defaults to true. */
		public Builder withExcludeMe(boolean excludeMe) {
			this.excludeMe = excludeMe;
			return this;
		}

		public PublishOptions build() {
			return new PublishOptions(acknowledge, excludeMe);
		}
	}
}
