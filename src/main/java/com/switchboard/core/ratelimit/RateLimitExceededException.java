package com.switchboard.core.ratelimit;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.time.Duration;
import java.util.LinkedHashMap;

public class RateLimitExceededException extends SwitchboardException {

    private final String category;
    private final Duration retryAfter;

    public RateLimitExceededException(String category, Duration retryAfter) {
        super(ErrorKind.RATE_LIMIT_EXCEEDED,
                "Rate limit exceeded for " + category
                        + (retryAfter != null ? ", retry after " + retryAfter.toSeconds() + "s" : ""),
                true, context(category, retryAfter), null);
        this.category = category;
        this.retryAfter = retryAfter;
    }

    public String category() {
        return category;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    private static LinkedHashMap<String, Object> context(String category, Duration retryAfter) {
        var context = new LinkedHashMap<String, Object>();
        context.put("category", category);
        if (retryAfter != null) {
            context.put("retryAfterSeconds", retryAfter.toSeconds());
        }
        return context;
    }
}
