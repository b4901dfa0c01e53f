package com.switchboard.core.model;

import java.io.Serializable;

/**
 * @param classification parsed classification
 * @param rationale      raw model rationale kept for audit, may be null
 * @param model          name of the model that answered
 */
public record ClassificationResult(
        Classification classification,
        String rationale,
        String model
) implements Serializable {

    public boolean confident() {
        return classification.confident();
    }
}
