package com.switchboard.core.model;

public enum StageOutcome {
    PASS,
    FAIL,
    SKIPPED
}
