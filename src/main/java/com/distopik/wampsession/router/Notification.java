package com.distopik.wampsession.router;

import com.distopik.wampsession.message.Message;

/** Delivers a message to a router session; {@code false} once that session is gone. */
public interface Notification {
	boolean notify(Message msg);
}
