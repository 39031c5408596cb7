package com.distopik.wampsession.message;

/**
 * Turns messages into the payload a transport carries and back. Implementations are
 * pure and may be shared between sessions.
 */
public interface MessageCodec {
	/** The WebSocket subprotocol this serialization is negotiated under. */
	String subprotocol();

	/** True when the payload is text and travels as text frames. */
	boolean isText();

	byte[] encode(Message message);

	Message decode(byte[] payload) throws DecodeException;
}
