package com.distopik.wampsession;

/** Base of every error a session reports through its promises. */
public class WampException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public WampException(String message) {
		super(message);
	}

	public WampException(String message, Throwable cause) {
		super(message, cause);
	}
}
