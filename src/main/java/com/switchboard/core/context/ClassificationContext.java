package com.switchboard.core.context;

import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.store.OperationStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Serves past user corrections to the classifier as few-shot exemplars.
 * <p>
 * Reads the store on every call, so a correction is visible to the very next
 * classification. Only the latest correction of each operation is served.
 */
@Service
public class ClassificationContext {

    private final OperationStore store;
    private final ContextProperties properties;

    public ClassificationContext(OperationStore store, ContextProperties properties) {
        if (properties.getRetention() < 1) {
            throw new IllegalArgumentException("switchboard.context.retention must be at least 1");
        }
        if (properties.getDefaultLimit() < 0) {
            throw new IllegalArgumentException("switchboard.context.default-limit must not be negative");
        }
        this.store = store;
        this.properties = properties;
    }

    /**
     * Most recent corrections first, at most {@code min(limit, retention)}.
     *
     * @throws IllegalArgumentException when {@code limit} is negative
     */
    public List<CorrectionExemplar> getCorrections(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        int effective = Math.min(limit, properties.getRetention());
        if (effective == 0) {
            return List.of();
        }
        return store.findCorrections(effective);
    }

    public List<CorrectionExemplar> getCorrections() {
        return getCorrections(properties.getDefaultLimit());
    }

    public boolean hasCorrections() {
        return store.hasCorrections();
    }

    public int defaultLimit() {
        return properties.getDefaultLimit();
    }
}
