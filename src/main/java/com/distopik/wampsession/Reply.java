package com.distopik.wampsession;

import reactor.rx.Promise;

/** What a {@link Procedure} hands back: a value now, or a promise of one. */
public final class Reply {
	private final Arguments          value;
	private final Promise<Arguments> deferred;

	private Reply(Arguments value, Promise<Arguments> deferred) {
		this.value    = value;
		this.deferred = deferred;
	}

	public static Reply value(Arguments value) {
		return new Reply(value == null ? Arguments.empty() : value, null);
	}

	public static Reply value(Object... values) {
		return value(Arguments.of(values));
	}

	public static Reply deferred(Promise<Arguments> deferred) {
		if (deferred == null)
			throw new IllegalArgumentException("deferred");
		return new Reply(null, deferred);
	}

	public boolean isDeferred() {
		return deferred != null;
	}

	public Arguments getValue() {
		return value;
	}

	public Promise<Arguments> getDeferred() {
		return deferred;
	}
}
