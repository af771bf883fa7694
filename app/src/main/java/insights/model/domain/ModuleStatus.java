package insights.model.domain;

import java.util.Locale;

public enum ModuleStatus {
    COMPLETED, SKIPPED, FAILED;

    /** Lower-case name, as written to the results table. */
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
