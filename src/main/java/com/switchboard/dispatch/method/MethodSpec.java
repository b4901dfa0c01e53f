package com.switchboard.dispatch.method;

import com.fasterxml.jackson.databind.JsonNode;
import com.switchboard.core.store.OperationStore;

/**
 * A registered method. Exactly one of the two handlers is set;
 * {@link #requiresStore()} tells which.
 */
public record MethodSpec(StoreHandler storeHandler, PlainHandler plainHandler) {

    public MethodSpec {
        if ((storeHandler == null) == (plainHandler == null)) {
            throw new IllegalArgumentException("exactly one handler must be given");
        }
    }

    public static MethodSpec withStore(StoreHandler handler) {
        return new MethodSpec(handler, null);
    }

    public static MethodSpec plain(PlainHandler handler) {
        return new MethodSpec(null, handler);
    }

    public boolean requiresStore() {
        return storeHandler != null;
    }

    JsonNode invoke(OperationStore store, JsonNode params) {
        return requiresStore() ? storeHandler.handle(store, params) : plainHandler.handle(params);
    }
}
