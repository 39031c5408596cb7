package com.distopik.wampsession;

import java.util.List;

import com.distopik.wampsession.message.Codecs;
import com.distopik.wampsession.message.Message;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Application payload of an event, a call or a result: positional arguments, keyword
 * arguments and the details the router attached. Instances are never mutated once
 * they have been handed to a session.
 */
public final class Arguments {
	private final ArrayNode  positional;
	private final ObjectNode keywords;
	private final ObjectNode details;

	public Arguments(ArrayNode positional, ObjectNode keywords) {
		this(positional, keywords, null);
	}

	public Arguments(ArrayNode positional, ObjectNode keywords, ObjectNode details) {
		this.positional = positional == null ? JsonNodeFactory.instance.arrayNode()  : positional;
		this.keywords   = keywords   == null ? JsonNodeFactory.instance.objectNode() : keywords;
		this.details    = details    == null ? JsonNodeFactory.instance.objectNode() : details;
	}

	public static Arguments empty() {
		return new Arguments(null, null, null);
	}

	/** Positional arguments converted from plain Java values with Jackson. */
	public static Arguments of(Object... values) {
		ArrayNode array = JsonNodeFactory.instance.arrayNode();
		for (Object value : values) {
			array.add(toTree(value));
		}
		return new Arguments(array, null);
	}

	private static JsonNode toTree(Object value) {
		if (value == null)
			return JsonNodeFactory.instance.nullNode();
		return Codecs.mapper().valueToTree(value);
	}

	public static Arguments from(Message msg) {
		return new Arguments(msg.getArguments(), msg.getArgumentsKeywords(), msg.getDetails());
	}

	/** A copy carrying one more keyword argument. */
	public Arguments with(String keyword, Object value) {
		ObjectNode copy = keywords.deepCopy();
		copy.set(keyword, toTree(value));
		return new Arguments(positional, copy, details);
	}

	/** A copy of the positional arguments. */
	public ArrayNode positional() {
		return positional.deepCopy();
	}

	public ObjectNode keywords() {
		return keywords.deepCopy();
	}

	public ObjectNode details() {
		return details.deepCopy();
	}

	public int size() {
		return positional.size();
	}

	public boolean isEmpty() {
		return positional.size() == 0 && keywords.size() == 0;
	}

	public JsonNode get(int index) {
		if (index < 0 || index >= positional.size())
			throw new IndexOutOfBoundsException("argument " + index + " of " + positional.size());
		return positional.get(index).deepCopy();
	}

	public long getLong(int index) {
		return get(index).asLong();
	}

	public String getString(int index) {
		return get(index).asText();
	}

	public JsonNode keyword(String name) {
		JsonNode value = keywords.get(name);
		return value == null ? null : value.deepCopy();
	}

	public List<Object> toList() {
		return Codecs.mapper().convertValue(positional, new TypeReference<List<Object>>() {});
	}

	ArrayNode wirePositional() {
		return isEmpty() ? null : positional;
	}

	ObjectNode wireKeywords() {
		return keywords.size() == 0 ? null : keywords;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Arguments))
			return false;
		Arguments other = (Arguments) obj;
		return positional.equals(other.positional) && keywords.equals(other.keywords);
	}

	@Override
	public int hashCode() {
		return 31 * positional.hashCode() + keywords.hashCode();
	}

	@Override
	public String toString() {
		return keywords.size() == 0 ? positional.toString() : positional + " " + keywords;
	}
}
