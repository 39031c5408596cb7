package com.distopik.wampsession;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Computes the AUTHENTICATE signature for a router CHALLENGE. */
public interface ChallengeResponder {
	String respond(String authMethod, ObjectNode extra) throws Exception;
}
