package com.distopik.wampsession.transport;

import java.io.IOException;

/**
 * The channel to the router is broken or could not be established. Fatal to the
 * session that owns the channel.
 */
public class TransportException extends IOException {
	private static final long serialVersionUID = 1L;

	public TransportException(String message) {
		super(message);
	}

	public TransportException(String message, Throwable cause) {
		super(message, cause);
	}
}
