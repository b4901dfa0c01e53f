package com.switchboard.dispatch.method;

import com.fasterxml.jackson.databind.JsonNode;
import com.switchboard.core.store.OperationStore;

/**
 * Method handler that reads or writes the operation store directly.
 */
@FunctionalInterface
public interface StoreHandler {

    JsonNode handle(OperationStore store, JsonNode params);
}
