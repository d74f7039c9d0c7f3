package org.fielddispatch.engine.api;

import java.util.Locale;

public enum NotificationPriority {
    NORMAL,
    HIGH;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
