package com.uwb.positioning.session;

/**
 * Inline command codes carried on telemetry lines.
 */
public enum SessionCommand {

    /** Reading is discarded from storage and forwarding. */
    DISCARD(0),
    OPEN(1),
    CLOSE(3),
    /** Any other code: no session effect, reading proceeds normally. */
    OTHER(-1);

    private final int code;

    SessionCommand(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static SessionCommand of(int code) {
        for (SessionCommand command : values()) {
            if (command != OTHER && command.code == code) {
                return command;
            }
        }
        return OTHER;
    }
}
