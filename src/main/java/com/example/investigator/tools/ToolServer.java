package com.example.investigator.tools;

import java.util.Locale;

/** Where a catalogued tool runs. Everything but {@link #LOCAL} is reached over the REST bridge. */
public enum ToolServer {
    INFRASTRUCTURE,
    OBSERVABILITY,
    KNOWLEDGE,
    HOME,
    LOCAL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
