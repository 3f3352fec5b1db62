package org.carball.pgsight.model.plan;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum SummaryStatus {
    GOOD("good", "No issues detected", "🟢"),
    WARNING("warning", "Potential issues detected", "🟡"),
    CRITICAL("critical", "Critical issues detected", "🔴");

    private final String value;
    private final String text;
    private final String icon;

    SummaryStatus(String value, String text, String icon) {
        this.value = value;
        this.text = text;
        this.icon = icon;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
