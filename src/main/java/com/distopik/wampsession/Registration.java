package com.distopik.wampsession;

/** A procedure implementation registered under a router-assigned id. */
public final class Registration {
	private final String    procedure;
	private final long      id;
	private final Procedure implementation;

	Registration(String procedure, long id, Procedure implementation) {
		this.procedure      = procedure;
		this.id             = id;
		this.implementation = implementation;
	}

	public String getProcedure() {
		return procedure;
	}

	public long getId() {
		return id;
	}

	public Procedure getImplementation() {
		return implementation;
	}

	@Override
	public String toString() {
		return "Registration[" + procedure + " #" + id + "]";
	}
}
