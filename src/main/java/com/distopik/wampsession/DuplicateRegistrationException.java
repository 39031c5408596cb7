package com.distopik.wampsession;

/** The procedure is already registered, or being registered, on this session. */
public class DuplicateRegistrationException extends WampException {
	private static final long serialVersionUID = 1L;

	private final String procedure;

	public DuplicateRegistrationException(String procedure) {
		super("procedure already registered: " + procedure);
		this.procedure = procedure;
	}

	public String getProcedure() {
		return procedure;
	}
}
