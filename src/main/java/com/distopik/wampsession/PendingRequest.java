package com.distopik.wampsession;

import com.distopik.wampsession.message.Message;

import reactor.fn.Function;
import reactor.rx.Promise;

/**
 * A request waiting for its correlated response. The response function runs under the
 * session lock and may touch the registries; the returned completions run outside of it.
 */
final class PendingRequest<T> {
	private final int                  requestType;
	private final int                  responseType;
	private final Promise<T>           promise;
	private final Function<Message, T> onResponse;
	private final Runnable             onFailure;

	PendingRequest(int requestType, int responseType, Promise<T> promise, Function<Message, T> onResponse) {
		this(requestType, responseType, promise, onResponse, null);
	}

	PendingRequest(int requestType, int responseType, Promise<T> promise, Function<Message, T> onResponse, Runnable onFailure) {
		this.requestType  = requestType;
		this.responseType = responseType;
		this.promise      = promise;
		this.onResponse   = onResponse;
		this.onFailure    = onFailure;
	}

	int getRequestType() {
		return requestType;
	}

	int getResponseType() {
		return responseType;
	}

	Runnable accept(Message response) {
		final T value = onResponse.apply(response);
		return () -> promise.onNext(value);
	}

	Runnable fail(Throwable error) {
		if (onFailure != null)
			onFailure.run();
		return () -> promise.onError(error);
	}
}
