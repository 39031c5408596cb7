package com.distopik.wampsession;

/**
 * The router or a callee rejected a single operation with an error URI. Only the
 * operation fails; the session stays established. Procedures throw it to answer an
 * invocation with a specific error.
 */
public class ApplicationException extends WampException {
	private static final long serialVersionUID = 1L;

	private final String             uri;
	private final transient Arguments arguments;

	public ApplicationException(String uri) {
		this(uri, Arguments.empty());
	}

	public ApplicationException(String uri, Arguments arguments) {
		super(arguments.isEmpty() ? uri : uri + " " + arguments);
		this.uri       = uri;
		this.arguments = arguments;
	}

	public String getUri() {
		return uri;
	}

	public Arguments getArguments() {
		return arguments;
	}
}
