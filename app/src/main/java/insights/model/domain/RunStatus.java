package insights.model.domain;

import java.util.Locale;

public enum RunStatus {
    COMPLETED, FAILED;

    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
