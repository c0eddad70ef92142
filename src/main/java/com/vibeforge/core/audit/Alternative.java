package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One alternative to the audited choice. Fast reports send a bare string;
 * full reports add when the option is better or worse.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alternative {

    private final String option;
    private final String whenBetter;
    private final String whenWorse;

    public Alternative(String option, String whenBetter, String whenWorse) {
        this.option     = Objects.requireNonNull(option, "option");
        this.whenBetter = whenBetter;
        this.whenWorse  = whenWorse;
    }

    public static Alternative of(String option) {
        return new Alternative(option, null, null);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static Alternative fromJson(JsonNode node) {
        if (node.isTextual()) return of(node.asText());
        if (node.isObject() && node.hasNonNull("option")) {
            return new Alternative(
                    node.get("option").asText(),
                    node.hasNonNull("when_better") ? node.get("when_better").asText() : null,
                    node.hasNonNull("when_worse") ? node.get("when_worse").asText() : null);
        }
        throw new IllegalArgumentException("Unsupported alternative: " + node);
    }

    @JsonProperty("option")      public String getOption()     { return option; }
    @JsonProperty("when_better") public String getWhenBetter() { return whenBetter; }
    @JsonProperty("when_worse")  public String getWhenWorse()  { return whenWorse; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Alternative)) return false;
        Alternative a = (Alternative) o;
        return option.equals(a.option)
                && Objects.equals(whenBetter, a.whenBetter)
                && Objects.equals(whenWorse, a.whenWorse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(option, whenBetter, whenWorse);
    }
}
