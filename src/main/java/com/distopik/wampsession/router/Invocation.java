package com.distopik.wampsession.router;

import com.distopik.wampsession.message.Message;

/**
 * Hands a CALL over to the session that registered the procedure. The callee answers
 * through {@code reply} with its YIELD or ERROR message.
 *
 * @return {@code false} when the callee is gone and the call cannot be routed
 */
public interface Invocation {
	boolean invoke(Message call, Notification reply);
}
