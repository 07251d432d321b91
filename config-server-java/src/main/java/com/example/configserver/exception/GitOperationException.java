package com.example.configserver.exception;

import lombok.Getter;

/**
 * A version-control operation failed. The stage and the backend's failure text are kept
 * as separate fields so callers can branch on the stage without parsing the message.
 */
@Getter
public class GitOperationException extends ConfigServerException {

    public enum Stage {
        CLONE,
        FETCH,
        RESET,
        RESOLVE,
        SHOW,
        LIST;

        public String command() {
            return name().toLowerCase();
        }
    }

    private final Stage stage;
    private final String stderr;

    public GitOperationException(Stage stage, String stderr) {
        this(stage, stderr, null);
    }

    public GitOperationException(Stage stage, String stderr, Throwable cause) {
        super(String.format("git %s failed: %s", stage.command(), stderr == null ? "" : stderr.trim()), cause);
        this.stage = stage;
        this.stderr = stderr == null ? "" : stderr.trim();
    }
}
