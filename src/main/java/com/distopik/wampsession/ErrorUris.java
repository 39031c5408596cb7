package com.distopik.wampsession;

/** Error and close reason URIs predefined by WAMP, plus the ones this library reports. */
public final class ErrorUris {
	private ErrorUris() {}

	public static final String INVALID_URI              = "wamp.error.invalid_uri";
	public static final String NO_SUCH_PROCEDURE        = "wamp.error.no_such_procedure";
	public static final String PROCEDURE_ALREADY_EXISTS = "wamp.error.procedure_already_exists";
	public static final String NO_SUCH_REGISTRATION     = "wamp.error.no_such_registration";
	public static final String NO_SUCH_SUBSCRIPTION     = "wamp.error.no_such_subscription";
	public static final String NO_SUCH_REALM            = "wamp.error.no_such_realm";
	public static final String INVALID_ARGUMENT         = "wamp.error.invalid_argument";
	public static final String RUNTIME_ERROR            = "wamp.error.runtime_error";
	public static final String CANCELED                 = "wamp.error.canceled";
	public static final String PROTOCOL_VIOLATION       = "wamp.error.protocol_violation";
	public static final String CANNOT_AUTHENTICATE      = "wamp.error.cannot_authenticate";

	public static final String CLOSE_NORMAL             = "wamp.close.normal";
	public static final String GOODBYE_AND_OUT          = "wamp.close.goodbye_and_out";
	public static final String SYSTEM_SHUTDOWN          = "wamp.close.system_shutdown";
	public static final String TRANSPORT_LOST           = "wamp.close.transport_lost";
	public static final String UNREACHABLE              = "wamp.close.unreachable";
}
