package com.distopik.wampsession;

/** An operation was issued before the session was established. */
public class SessionStateException extends WampException {
	private static final long serialVersionUID = 1L;

	private final SessionState state;

	public SessionStateException(SessionState state) {
		super("session is " + state + ", not ESTABLISHED");
		this.state = state;
	}

	public SessionState getState() {
		return state;
	}
}
