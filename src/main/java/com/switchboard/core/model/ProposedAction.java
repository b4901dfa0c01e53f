package com.switchboard.core.model;

import java.io.Serializable;

/**
 * What an agent wants to do for an operation. Never executed by the core;
 * only verified.
 *
 * @param command      shell command for {@link ActionKind#COMMAND}
 * @param targetPath   file for {@link ActionKind#FILE_WRITE} and {@link ActionKind#FILE_DELETE}
 * @param content      response text or file content
 * @param irreversible the agent declares the action cannot be undone
 */
public record ProposedAction(
        ActionKind kind,
        String command,
        String targetPath,
        String content,
        boolean irreversible
) implements Serializable {

    public static ProposedAction response(String text) {
        return new ProposedAction(ActionKind.RESPONSE, null, null, text, false);
    }

    public static ProposedAction command(String command, boolean irreversible) {
        return new ProposedAction(ActionKind.COMMAND, command, null, null, irreversible);
    }

    public static ProposedAction writeFile(String path, String content) {
        return new ProposedAction(ActionKind.FILE_WRITE, null, path, content, false);
    }

    public static ProposedAction deleteFile(String path) {
        return new ProposedAction(ActionKind.FILE_DELETE, null, path, null, true);
    }
}
