package com.switchboard.core.classifier;

import com.switchboard.core.error.ErrorKind;
import com.switchboard.core.error.SwitchboardException;

import java.util.HashMap;
import java.util.Map;

/**
 * Model output could not be turned into a valid classification, even after repair.
 */
public class ClassificationParseException extends SwitchboardException {

    private final String rawOutput;

    public ClassificationParseException(String message, String rawOutput, Throwable cause) {
        super(ErrorKind.CLASSIFICATION_PARSE, message, false, preview(rawOutput), cause);
        this.rawOutput = rawOutput;
    }

    public String rawOutput() {
        return rawOutput;
    }

    private static Map<String, Object> preview(String raw) {
        var context = new HashMap<String, Object>();
        if (raw != null) {
            context.put("rawOutput", raw.length() > 200 ? raw.substring(0, 200) + "..." : raw);
        }
        return context;
    }
}
