package com.distopik.wampsession.router;

import com.distopik.wampsession.message.Message;

/**
 * Realm-scoped broker and dealer bookkeeping shared by all router sessions. Failures
 * that a client should see are thrown as {@link com.distopik.wampsession.ApplicationException}
 * carrying the WAMP error URI.
 */
public interface Engine {
	long createSession(String realm);
	void closeSession (long   sessionId);
	long subscribe    (long   sessionId, String topic, Notification callme);
	void unsubscribe  (long   sessionId, long subscriptionId);
	long publish      (long   sessionId, String topic, Message publication, boolean excludeMe);
	long register     (long   sessionId, String procedure, Invocation callme);
	void unregister   (long   sessionId, long registrationId);
	void call         (long   sessionId, String procedure, Message call, Notification callme);
}
