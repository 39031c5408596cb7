package com.distopik.wampsession;

/** The router sent something the session cannot make sense of in its current state. */
public class ProtocolException extends WampException {
	private static final long serialVersionUID = 1L;

	public ProtocolException(String message) {
		super(message);
	}
}
