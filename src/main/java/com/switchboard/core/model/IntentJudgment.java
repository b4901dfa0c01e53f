package com.switchboard.core.model;

public enum IntentJudgment {
    ALIGNED,
    MISALIGNED,
    UNCERTAIN
}
