package com.switchboard.dispatch.method;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Method handler that needs nothing beyond its params.
 */
@FunctionalInterface
public interface PlainHandler {

    JsonNode handle(JsonNode params);
}
