package com.nodeguardian.domain.enums;

import java.util.Locale;

/** Whether an alert is raised by the trigger batch or by the recovery batch. */
public enum AlertType {
    TRIGGER,
    RECOVERY;

    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
