package com.switchboard.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every error the core surfaces to its callers.
 * <p>
 * Each subclass fixes an {@link ErrorKind} so that transport layers can map
 * failures without inspecting messages. {@link #context()} carries optional
 * debugging attributes (never secrets) that end up in {@link #toMap()}.
 */
public abstract class SwitchboardException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean recoverable;
    private final Map<String, Object> context;

    protected SwitchboardException(ErrorKind kind, String message, boolean recoverable,
                                   Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.recoverable = recoverable;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    protected SwitchboardException(ErrorKind kind, String message, boolean recoverable) {
        this(kind, message, recoverable, Map.of(), null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean recoverable() {
        return recoverable;
    }

    public Map<String, Object> context() {
        return context;
    }

    /**
     * Structured representation for transport callers.
     */
    public Map<String, Object> toMap() {
        var body = new LinkedHashMap<String, Object>();
        body.put("kind", kind.name());
        body.put("message", getMessage());
        body.put("recoverable", recoverable);
        context.forEach((k, v) -> {
            if (v != null) {
                body.put(k, v);
            }
        });
        return body;
    }
}
