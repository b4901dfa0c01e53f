package com.switchboard.core.model;

public enum Verdict {
    APPROVED,
    REJECTED
}
