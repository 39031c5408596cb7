package com.distopik.wampsession.message;

import static com.distopik.wampsession.message.Field.*;
import static com.distopik.wampsession.message.Message.*;
import static com.fasterxml.jackson.databind.node.JsonNodeType.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.JsonNodeType;

/**
 * Fixed-position layout of every message type: which {@link Field} sits at which
 * index of the wire array, and from which index on the trailing fields may be left out.
 */
public class MessageLayout {
	/** Largest value an identifier may take (2^53), so it survives a JavaScript number. */
	public static final long MAX_ID = 9007199254740992L;

	private final Field[] items;
	private final int     required;

	private static final JsonNodeType[] expectedNodeTypes = new JsonNodeType[Field.values().length];
	static {
		expectedNodeTypes[MessageTypeId.ordinal()]     = NUMBER;
		expectedNodeTypes[URI.ordinal()]               = STRING;
		expectedNodeTypes[Text.ordinal()]              = STRING;
		expectedNodeTypes[SessionId.ordinal()]         = NUMBER;
		expectedNodeTypes[Details.ordinal()]           = OBJECT;
		expectedNodeTypes[RequestType.ordinal()]       = NUMBER;
		expectedNodeTypes[RequestId.ordinal()]         = NUMBER;
		expectedNodeTypes[Arguments.ordinal()]         = ARRAY;
		expectedNodeTypes[ArgumentsKeywords.ordinal()] = OBJECT;
		expectedNodeTypes[PublicationId.ordinal()]     = NUMBER;
		expectedNodeTypes[SubscriptionId.ordinal()]    = NUMBER;
		expectedNodeTypes[RegistrationId.ordinal()]    = NUMBER;
	}

	private static final MessageLayout[] LAYOUTS = new MessageLayout[LARGEST_MESSAGE_ID + 1];
	static {
		LAYOUTS[HELLO]        = new MessageLayout(MessageTypeId, URI, Details);
		LAYOUTS[WELCOME]      = new MessageLayout(MessageTypeId, SessionId, Details);
		LAYOUTS[ABORT]        = new MessageLayout(MessageTypeId, Details, URI);
		LAYOUTS[CHALLENGE]    = new MessageLayout(MessageTypeId, Text, Details);
		LAYOUTS[AUTHENTICATE] = new MessageLayout(MessageTypeId, Text, Details);
		LAYOUTS[GOODBYE]      = new MessageLayout(MessageTypeId, Details, URI);
		LAYOUTS[ERROR]        = new MessageLayout(MessageTypeId, RequestType, RequestId, Details, URI, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[PUBLISH]      = new MessageLayout(MessageTypeId, RequestId, Details, URI, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[PUBLISHED]    = new MessageLayout(MessageTypeId, RequestId, PublicationId);
		LAYOUTS[SUBSCRIBE]    = new MessageLayout(MessageTypeId, RequestId, Details, URI);
		LAYOUTS[SUBSCRIBED]   = new MessageLayout(MessageTypeId, RequestId, SubscriptionId);
		LAYOUTS[UNSUBSCRIBE]  = new MessageLayout(MessageTypeId, RequestId, SubscriptionId);
		LAYOUTS[UNSUBSCRIBED] = new MessageLayout(MessageTypeId, RequestId);
		LAYOUTS[EVENT]        = new MessageLayout(MessageTypeId, SubscriptionId, PublicationId, Details, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[CALL]         = new MessageLayout(MessageTypeId, RequestId, Details, URI, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[CANCEL]       = new MessageLayout(MessageTypeId, RequestId, Details);
		LAYOUTS[RESULT]       = new MessageLayout(MessageTypeId, RequestId, Details, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[REGISTER]     = new MessageLayout(MessageTypeId, RequestId, Details, URI);
		LAYOUTS[REGISTERED]   = new MessageLayout(MessageTypeId, RequestId, RegistrationId);
		LAYOUTS[UNREGISTER]   = new MessageLayout(MessageTypeId, RequestId, RegistrationId);
		LAYOUTS[UNREGISTERED] = new MessageLayout(MessageTypeId, RequestId);
		LAYOUTS[INVOCATION]   = new MessageLayout(MessageTypeId, RequestId, RegistrationId, Details, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
		LAYOUTS[INTERRUPT]    = new MessageLayout(MessageTypeId, RequestId, Details);
		LAYOUTS[YIELD]        = new MessageLayout(MessageTypeId, RequestId, Details, Arguments, ArgumentsKeywords).optionalFrom(Arguments);
	}

	private MessageLayout(Field... items) {
		this.items    = items;
		this.required = items.length;
	}

	private MessageLayout(Field[] items, int required) {
		this.items    = items;
		this.required = required;
	}

	private MessageLayout optionalFrom(Field what) {
		for (int idx = 1; idx < items.length; idx++) {
			if (items[idx] == what)
				return new MessageLayout(items, idx);
		}
		return this;
	}

	public static boolean isKnown(int type) {
		return type > 0 && type < LAYOUTS.length && LAYOUTS[type] != null;
	}

	/** True for the request types an ERROR message may answer. */
	public static boolean canFail(int requestType) {
		switch (requestType) {
		case SUBSCRIBE:
		case UNSUBSCRIBE:
		case PUBLISH:
		case REGISTER:
		case UNREGISTER:
		case CALL:
		case INVOCATION:
			return true;
		default:
			return false;
		}
	}

	public static Message read(JsonNode source) throws DecodeException {
		if (source == null || !source.isArray() || source.size() == 0) {
			throw new DecodeException("message must be a non-empty array");
		}
		JsonNode typeNode = source.get(0);
		if (!typeNode.isIntegralNumber()) {
			throw new DecodeException("message type must be an integer, got " + typeNode.getNodeType());
		}
		if (!typeNode.canConvertToInt()) {
			throw new DecodeException("unknown message type " + typeNode.asText());
		}
		int type = typeNode.asInt();
		if (!isKnown(type)) {
			throw new DecodeException("unknown message type " + type);
		}

		Message destination = new Message();
		LAYOUTS[type].internalRead(source, destination);

		if (type == ERROR && !canFail(destination.getRequestType())) {
			throw new DecodeException("ERROR for request type " + destination.getRequestType() + " which cannot fail");
		}
		return destination;
	}

	private void internalRead(JsonNode source, Message destination) throws DecodeException {
		String name = Message.typeName(source.get(0).asInt());
		if (source.size() < required || source.size() > items.length) {
			throw new DecodeException("invalid length " + source.size() + " for " + name);
		}

		for (int index = 0; index < source.size(); index++) {
			JsonNode value = source.get(index);
			Field    item  = items[index];
			if (value.getNodeType() != expectedNodeTypes[item.ordinal()]) {
				throw new DecodeException("invalid type " + value.getNodeType() + " for " + item + " in " + name);
			}
			if (isIdentifier(item)) {
				if (!value.isIntegralNumber() || !value.canConvertToLong()
						|| value.asLong() < 0 || value.asLong() > MAX_ID) {
					throw new DecodeException("invalid value " + value + " for " + item + " in " + name);
				}
			} else if (item == URI && value.asText().isEmpty()) {
				throw new DecodeException("empty URI in " + name);
			}

			destination.set(item, value);
		}
	}

	private static boolean isIdentifier(Field item) {
		switch (item) {
		case SessionId:
		case RequestId:
		case PublicationId:
		case SubscriptionId:
		case RegistrationId:
			return true;
		default:
			return false;
		}
	}

	public static JsonNode write(Message message) {
		if (!isKnown(message.getType())) {
			throw new IllegalArgumentException("unknown message type " + message.getType());
		}
		final MessageLayout layout = LAYOUTS[message.getType()];
		final ArrayNode     rv     = JsonNodeFactory.instance.arrayNode();

		int last = layout.items.length;
		while (last > layout.required && message.get(layout.items[last - 1]) == null) {
			last--;
		}

		for (int i = 0; i < last; i++) {
			Field    item = layout.items[i];
			JsonNode node = message.get(item);
			if (node == null) {
				node = emptyNode(item);
			}
			rv.add(node);
		}
		return rv;
	}

	private static JsonNode emptyNode(Field item) {
		switch (expectedNodeTypes[item.ordinal()]) {
		case ARRAY:
			return JsonNodeFactory.instance.arrayNode();
		case OBJECT:
			return JsonNodeFactory.instance.objectNode();
		default:
			return JsonNodeFactory.instance.textNode("");
		}
	}

	public static String debug(Message msg) {
		if (!isKnown(msg.getType())) {
			return "{" + Message.typeName(msg.getType()) + "}";
		}
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		for (Field item : LAYOUTS[msg.getType()].items) {
			sb.append(" ").append(item.name()).append(": ").append(msg.get(item));
		}
		sb.append(" }");
		return sb.toString();
	}
}
