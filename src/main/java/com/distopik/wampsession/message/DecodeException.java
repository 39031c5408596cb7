package com.distopik.wampsession.message;

/**
 * Raised when bytes received from a transport cannot be turned into a {@link Message}.
 * Decoding never touches session state, so the receiver decides whether the offending
 * message is dropped or the session is aborted.
 */
public class DecodeException extends Exception {
	private static final long serialVersionUID = 1L;

	public DecodeException(String reason) {
		super(reason);
	}

	public DecodeException(String reason, Throwable cause) {
		super(reason, cause);
	}

	public String getReason() {
		return getMessage();
	}
}
