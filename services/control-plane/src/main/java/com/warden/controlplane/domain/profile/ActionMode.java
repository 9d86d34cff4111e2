package com.warden.controlplane.domain.profile;

import java.util.Locale;

/** Whether a profile remediates or alerts on failing rules. */
public enum ActionMode {
    ON("on"),
    OFF("off"),
    DRY_RUN("dry_run"),
    UNSET("");

    private final String value;

    ActionMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Column value; null for {@link #UNSET}. */
    public String storedValue() {
        return this == UNSET ? null : value;
    }

    /** Parses a mode; anything unrecognised is {@link #UNSET}. */
    public static ActionMode fromString(String value) {
        if (value == null) {
            return UNSET;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActionMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return UNSET;
    }
}
