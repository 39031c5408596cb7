package com.distopik.wampsession;

/**
 * The session went away while the operation was outstanding, or before it was issued.
 * {@link #getReason()} is the close reason URI.
 */
public class SessionClosedException extends WampException {
	private static final long serialVersionUID = 1L;

	private final String reason;

	public SessionClosedException(String reason) {
		this(reason, null);
	}

	public SessionClosedException(String reason, Throwable cause) {
		super("session closed: " + reason, cause);
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}
}
