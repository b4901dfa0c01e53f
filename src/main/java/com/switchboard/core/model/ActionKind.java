package com.switchboard.core.model;

public enum ActionKind {
    RESPONSE,
    COMMAND,
    FILE_WRITE,
    FILE_DELETE;

    public boolean touchesFiles() {
        return this == FILE_WRITE || this == FILE_DELETE;
    }

    public boolean mutates() {
        return this != RESPONSE;
    }
}
