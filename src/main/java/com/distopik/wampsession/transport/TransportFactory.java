package com.distopik.wampsession.transport;

public interface TransportFactory {
	Transport connect() throws TransportException;
}
