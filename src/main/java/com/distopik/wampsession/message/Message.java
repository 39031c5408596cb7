package com.distopik.wampsession.message;

import java.io.Serializable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single WAMP v2 message. The {@link #getType() type code} selects which of the
 * fields are meaningful; {@link MessageLayout} knows the position of each of them
 * on the wire.
 */
public class Message implements Serializable {
	private static final long serialVersionUID = 1L;
	public static final int HELLO        = 1;
	public static final int WELCOME      = 2;
	public static final int ABORT        = 3;
	public static final int CHALLENGE    = 4;
	public static final int AUTHENTICATE = 5;
	public static final int GOODBYE      = 6;

	public static final int ERROR        = 8;

	public static final int PUBLISH      = 16;
	public static final int PUBLISHED    = 17;

	public static final int SUBSCRIBE    = 32;
	public static final int SUBSCRIBED   = 33;
	public static final int UNSUBSCRIBE  = 34;
	public static final int UNSUBSCRIBED = 35;
	public static final int EVENT        = 36;

	public static final int CALL         = 48;
	public static final int CANCEL       = 49;
	public static final int RESULT       = 50;

	public static final int REGISTER     = 64;
	public static final int REGISTERED   = 65;
	public static final int UNREGISTER   = 66;
	public static final int UNREGISTERED = 67;
	public static final int INVOCATION   = 68;
	public static final int INTERRUPT    = 69;
	public static final int YIELD        = 70;

	public static final int LARGEST_MESSAGE_ID = YIELD;

	private int        type;
	private String     uri;
	private String     text;
	private long       sessionId;
	private ObjectNode details;
	private int        requestType;
	private long       requestId;
	private ArrayNode  arguments;
	private ObjectNode argumentsKeywords;
	private long       publicationId;
	private long       subscriptionId;
	private long       registrationId;

	public Message() {
	}

	public Message(int type) {
		this.type = type;
	}

	public Message(int type, Message msg) {
		this(msg);
		this.type = type;
	}

	public Message(Message msg) {
		this.type              = msg.type;
		this.uri               = msg.uri;
		this.text              = msg.text;
		this.sessionId         = msg.sessionId;
		this.details           = msg.details == null ? null : msg.details.deepCopy();
		this.requestType       = msg.requestType;
		this.requestId         = msg.requestId;
		this.arguments         = msg.arguments == null ? null : msg.arguments.deepCopy();
		this.argumentsKeywords = msg.argumentsKeywords == null ? null : msg.argumentsKeywords.deepCopy();
		this.publicationId     = msg.publicationId;
		this.subscriptionId    = msg.subscriptionId;
		this.registrationId    = msg.registrationId;
	}

	public static Message hello(String realm, ObjectNode details) {
		Message msg = new Message(HELLO);
		msg.uri     = realm;
		msg.details = details;
		return msg;
	}

	public static Message welcome(long sessionId, ObjectNode details) {
		Message msg   = new Message(WELCOME);
		msg.sessionId = sessionId;
		msg.details   = details;
		return msg;
	}

	public static Message abort(String reason, String message) {
		Message msg = new Message(ABORT);
		msg.uri     = reason;
		msg.details = messageDetails(message);
		return msg;
	}

	public static Message goodbye(String reason, String message) {
		Message msg = new Message(GOODBYE);
		msg.uri     = reason;
		msg.details = messageDetails(message);
		return msg;
	}

	public static Message challenge(String authMethod, ObjectNode extra) {
		Message msg = new Message(CHALLENGE);
		msg.text    = authMethod;
		msg.details = extra;
		return msg;
	}

	public static Message authenticate(String signature, ObjectNode extra) {
		Message msg = new Message(AUTHENTICATE);
		msg.text    = signature;
		msg.details = extra;
		return msg;
	}

	public static Message error(int requestType, long requestId, String error, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(ERROR);
		msg.requestType       = requestType;
		msg.requestId         = requestId;
		msg.uri               = error;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message publish(long requestId, ObjectNode options, String topic, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(PUBLISH);
		msg.requestId         = requestId;
		msg.details           = options;
		msg.uri               = topic;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message published(long requestId, long publicationId) {
		Message msg       = new Message(PUBLISHED);
		msg.requestId     = requestId;
		msg.publicationId = publicationId;
		return msg;
	}

	public static Message subscribe(long requestId, ObjectNode options, String topic) {
		Message msg   = new Message(SUBSCRIBE);
		msg.requestId = requestId;
		msg.details   = options;
		msg.uri       = topic;
		return msg;
	}

	public static Message subscribed(long requestId, long subscriptionId) {
		Message msg        = new Message(SUBSCRIBED);
		msg.requestId      = requestId;
		msg.subscriptionId = subscriptionId;
		return msg;
	}

	public static Message unsubscribe(long requestId, long subscriptionId) {
		Message msg        = new Message(UNSUBSCRIBE);
		msg.requestId      = requestId;
		msg.subscriptionId = subscriptionId;
		return msg;
	}

	public static Message unsubscribed(long requestId) {
		Message msg   = new Message(UNSUBSCRIBED);
		msg.requestId = requestId;
		return msg;
	}

	public static Message event(long subscriptionId, long publicationId, ObjectNode details, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(EVENT);
		msg.subscriptionId    = subscriptionId;
		msg.publicationId     = publicationId;
		msg.details           = details;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message call(long requestId, ObjectNode options, String procedure, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(CALL);
		msg.requestId         = requestId;
		msg.details           = options;
		msg.uri               = procedure;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message cancel(long requestId, ObjectNode options) {
		Message msg   = new Message(CANCEL);
		msg.requestId = requestId;
		msg.details   = options;
		return msg;
	}

	public static Message result(long requestId, ObjectNode details, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(RESULT);
		msg.requestId         = requestId;
		msg.details           = details;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message register(long requestId, ObjectNode options, String procedure) {
		Message msg   = new Message(REGISTER);
		msg.requestId = requestId;
		msg.details   = options;
		msg.uri       = procedure;
		return msg;
	}

	public static Message registered(long requestId, long registrationId) {
		Message msg        = new Message(REGISTERED);
		msg.requestId      = requestId;
		msg.registrationId = registrationId;
		return msg;
	}

	public static Message unregister(long requestId, long registrationId) {
		Message msg        = new Message(UNREGISTER);
		msg.requestId      = requestId;
		msg.registrationId = registrationId;
		return msg;
	}

	public static Message unregistered(long requestId) {
		Message msg   = new Message(UNREGISTERED);
		msg.requestId = requestId;
		return msg;
	}

	public static Message invocation(long requestId, long registrationId, ObjectNode details, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(INVOCATION);
		msg.requestId         = requestId;
		msg.registrationId    = registrationId;
		msg.details           = details;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	public static Message interrupt(long requestId, ObjectNode options) {
		Message msg   = new Message(INTERRUPT);
		msg.requestId = requestId;
		msg.details   = options;
		return msg;
	}

	public static Message yield(long requestId, ObjectNode options, ArrayNode args, ObjectNode kwargs) {
		Message msg           = new Message(YIELD);
		msg.requestId         = requestId;
		msg.details           = options;
		msg.arguments         = args;
		msg.argumentsKeywords = kwargs;
		return msg;
	}

	private static ObjectNode messageDetails(String message) {
		ObjectNode details = JsonNodeFactory.instance.objectNode();
		if (message != null)
			details.put("message", message);
		return details;
	}

	public static String typeName(int type) {
		switch (type) {
		case HELLO:        return "HELLO";
		case WELCOME:      return "WELCOME";
		case ABORT:        return "ABORT";
		case CHALLENGE:    return "CHALLENGE";
		case AUTHENTICATE: return "AUTHENTICATE";
		case GOODBYE:      return "GOODBYE";
		case ERROR:        return "ERROR";
		case PUBLISH:      return "PUBLISH";
		case PUBLISHED:    return "PUBLISHED";
		case SUBSCRIBE:    return "SUBSCRIBE";
		case SUBSCRIBED:   return "SUBSCRIBED";
		case UNSUBSCRIBE:  return "UNSUBSCRIBE";
		case UNSUBSCRIBED: return "UNSUBSCRIBED";
		case EVENT:        return "EVENT";
		case CALL:         return "CALL";
		case CANCEL:       return "CANCEL";
		case RESULT:       return "RESULT";
		case REGISTER:     return "REGISTER";
		case REGISTERED:   return "REGISTERED";
		case UNREGISTER:   return "UNREGISTER";
		case UNREGISTERED: return "UNREGISTERED";
		case INVOCATION:   return "INVOCATION";
		case INTERRUPT:    return "INTERRUPT";
		case YIELD:        return "YIELD";
		default:           return "UNKNOWN(" + type + ")";
		}
	}

	public JsonNode toJson() {
		return MessageLayout.write(this);
	}

	void set(Field field, JsonNode node) {
		switch (field) {
		case MessageTypeId:
			setType(node.asInt());
			break;
		case URI:
			setUri(node.asText());
			break;
		case Text:
			setText(node.asText());
			break;
		case SessionId:
			setSessionId(node.asLong());
			break;
		case Details:
			setDetails((ObjectNode) node);
			break;
		case RequestType:
			setRequestType(node.asInt());
			break;
		case RequestId:
			setRequestId(node.asLong());
			break;
		case Arguments:
			setArguments((ArrayNode) node);
			break;
		case ArgumentsKeywords:
			setArgumentsKeywords((ObjectNode) node);
			break;
		case PublicationId:
			setPublicationId(node.asLong());
			break;
		case SubscriptionId:
			setSubscriptionId(node.asLong());
			break;
		case RegistrationId:
			setRegistrationId(node.asLong());
			break;
		}
	}

	JsonNode get(Field field) {
		switch (field) {
		case MessageTypeId:
			return JsonNodeFactory.instance.numberNode(getType());
		case URI:
			return getUri() == null ? null : JsonNodeFactory.instance.textNode(getUri());
		case Text:
			return getText() == null ? null : JsonNodeFactory.instance.textNode(getText());
		case SessionId:
			return JsonNodeFactory.instance.numberNode(getSessionId());
		case Details:
			return getDetails();
		case RequestType:
			return JsonNodeFactory.instance.numberNode(getRequestType());
		case RequestId:
			return JsonNodeFactory.instance.numberNode(getRequestId());
		case Arguments:
			return getArguments();
		case ArgumentsKeywords:
			return getArgumentsKeywords();
		case PublicationId:
			return JsonNodeFactory.instance.numberNode(getPublicationId());
		case SubscriptionId:
			return JsonNodeFactory.instance.numberNode(getSubscriptionId());
		case RegistrationId:
			return JsonNodeFactory.instance.numberNode(getRegistrationId());
		default:
			return null;
		}
	}

	public int getType() {
		return type;
	}

	public void setType(int type) {
		this.type = type;
	}

	public String getUri() {
		return uri;
	}

	public void setUri(String uri) {
		this.uri = uri;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}

	public long getSessionId() {
		return sessionId;
	}

	public void setSessionId(long sessionId) {
		this.sessionId = sessionId;
	}

	public ObjectNode getDetails() {
		return details;
	}

	public void setDetails(ObjectNode details) {
		this.details = details;
	}

	public int getRequestType() {
		return requestType;
	}

	public void setRequestType(int requestType) {
		this.requestType = requestType;
	}

	public long getRequestId() {
		return requestId;
	}

	public void setRequestId(long requestId) {
		this.requestId = requestId;
	}

	public ArrayNode getArguments() {
		return arguments;
	}

	public void setArguments(ArrayNode arguments) {
		this.arguments = arguments;
	}

	public ObjectNode getArgumentsKeywords() {
		return argumentsKeywords;
	}

	public void setArgumentsKeywords(ObjectNode argumentsKeywords) {
		this.argumentsKeywords = argumentsKeywords;
	}

	public long getPublicationId() {
		return publicationId;
	}

	public void setPublicationId(long publicationId) {
		this.publicationId = publicationId;
	}

	public long getSubscriptionId() {
		return subscriptionId;
	}

	public void setSubscriptionId(long subscriptionId) {
		this.subscriptionId = subscriptionId;
	}

	public long getRegistrationId() {
		return registrationId;
	}

	public void setRegistrationId(long registrationId) {
		this.registrationId = registrationId;
	}

	public Message deepCopy() {
		return new Message(getType(), this);
	}

	@Override
	public String toString() {
		return MessageLayout.isKnown(type) ? typeName(type) + toJson() : typeName(type);
	}
}
