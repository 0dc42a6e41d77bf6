package com.uwb.positioning.session;

/**
 * Effect a reading had on its user's report session.
 */
public enum SessionOutcome {
    OPENED,
    UPDATED,
    CLOSED,
    NONE;

    public boolean isOpenedOrUpdated() {
        return this == OPENED || this == UPDATED;
    }
}
