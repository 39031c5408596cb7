package com.distopik.wampsession;

/**
 * Implementation of a registered procedure. Returning {@link Reply#value(Arguments)}
 * answers the invocation at once; {@link Reply#deferred(reactor.rx.Promise)} answers it
 * whenever the promise settles. A thrown {@link ApplicationException} is sent back with
 * its own error URI, anything else as {@code wamp.error.runtime_error}.
 */
public interface Procedure {
	Reply invoke(Arguments args) throws Exception;
}
