package com.distopik.wampsession.message;

import org.msgpack.jackson.dataformat.MessagePackFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class Codecs {
	private Codecs() {}

	public static final String WAMP_JSON_V2    = "wamp.2.json";
	public static final String WAMP_MSGPACK_V2 = "wamp.2.msgpack";

	private static final ObjectMapper textMapper    = new ObjectMapper();
	private static final ObjectMapper msgpackMapper = new ObjectMapper(new MessagePackFactory());

	public static final MessageCodec JSON    = new JacksonCodec(textMapper, WAMP_JSON_V2, true);
	public static final MessageCodec MSGPACK = new JacksonCodec(msgpackMapper, WAMP_MSGPACK_V2, false);

	/** The mapper used for building argument trees out of plain Java values. */
	public static ObjectMapper mapper() {
		return textMapper;
	}

	public static MessageCodec forSubprotocol(String subprotocol) {
		if (WAMP_JSON_V2.equals(subprotocol)) {
			return JSON;
		} else if (WAMP_MSGPACK_V2.equals(subprotocol)) {
			return MSGPACK;
		}
		throw new IllegalArgumentException("unsupported subprotocol: " + subprotocol);
	}

	private static final class JacksonCodec implements MessageCodec {
		private final ObjectMapper mapper;
		private final String       subprotocol;
		private final boolean      text;

		JacksonCodec(ObjectMapper mapper, String subprotocol, boolean text) {
			this.mapper      = mapper;
			this.subprotocol = subprotocol;
			this.text        = text;
		}

		@Override
		public String subprotocol() {
			return subprotocol;
		}

		@Override
		public boolean isText() {
			return text;
		}

		@Override
		public byte[] encode(Message message) {
			try {
				return mapper.writeValueAsBytes(message.toJson());
			} catch (JsonProcessingException e) { throw new IllegalArgumentException("message", e); }
		}

		@Override
		public Message decode(byte[] payload) throws DecodeException {
			JsonNode node;
			try {
				node = mapper.readTree(payload);
			} catch (Exception e) { throw new DecodeException("unreadable " + subprotocol + " payload", e); }
			return MessageLayout.read(node);
		}

		@Override
		public String toString() {
			return subprotocol;
		}
	}
}
