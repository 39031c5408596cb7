package com.distopik.wampsession.message;

/**
 * The positional elements a WAMP message is made of. {@link #URI} holds the realm,
 * topic, procedure, error or close reason depending on the message type, {@link #Text}
 * holds plain strings such as an authentication method, and {@link #Details} doubles
 * as the options and extra dictionary.
 */
enum Field {
	MessageTypeId,
	URI,
	Text,
	SessionId,
	Details,
	RequestType,
	RequestId,
	Arguments,
	ArgumentsKeywords,
	PublicationId,
	SubscriptionId,
	RegistrationId
}
