package com.distopik.wampsession;

public enum SessionState {
	CLOSED,
	CONNECTING,
	AUTHENTICATING,
	ESTABLISHED,
	CLOSING
}
