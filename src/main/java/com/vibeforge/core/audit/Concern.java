package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.List;
import java.util.Objects;

/**
 * One audit finding. Immutable.
 *
 * {@code lineHashes} holds one content hash per entry of {@code location.lines},
 * in the same order, captured when the concern was produced. It is empty for
 * global concerns and for concerns straight from the collaborator (the audit
 * engine fills it in before persisting).
 */
@JsonDeserialize(builder = Concern.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "location", "summary", "details", "technical_summary", "impact", "default",
        "rationale", "alternatives", "lenses", "line_hashes"})
public final class Concern {

    private final String            id;
    private final ConcernLocation   location;
    private final String            summary;
    private final String            details;
    private final String            technicalSummary;
    private final Impact            impact;
    private final boolean           defaultChoice;
    private final String            rationale;
    private final List<Alternative> alternatives;
    private final ConcernLenses     lenses;
    private final List<String>      lineHashes;

    private Concern(Builder b) {
        this.id               = requireText(b.id, "id");
        this.location         = Objects.requireNonNull(b.location, "location");
        this.summary          = b.summary != null ? b.summary : "";
        this.details          = b.details;
        this.technicalSummary = b.technicalSummary;
        this.impact           = b.impact != null ? b.impact : Impact.LOW;
        this.defaultChoice    = b.defaultChoice;
        this.rationale        = b.rationale;
        this.alternatives     = b.alternatives != null ? List.copyOf(b.alternatives) : List.of();
        this.lenses           = b.lenses;
        this.lineHashes       = b.lineHashes != null ? List.copyOf(b.lineHashes) : List.of();
    }

    public Concern withLineHashes(List<String> hashes) {
        return toBuilder().lineHashes(hashes).build();
    }

    public boolean isGlobal() {
        return location.isGlobal();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    @JsonProperty("id")                public String            getId()               { return id; }
    @JsonProperty("location")          public ConcernLocation   getLocation()         { return location; }
    @JsonProperty("summary")           public String            getSummary()          { return summary; }
    @JsonProperty("details")           public String            getDetails()          { return details; }
    @JsonProperty("technical_summary") public String            getTechnicalSummary() { return technicalSummary; }
    @JsonProperty("impact")            public Impact            getImpact()           { return impact; }
    @JsonProperty("default")           public boolean           isDefaultChoice()     { return defaultChoice; }
    @JsonProperty("rationale")         public String            getRationale()        { return rationale; }
    @JsonProperty("alternatives")      public List<Alternative> getAlternatives()     { return alternatives; }
    @JsonProperty("lenses")            public ConcernLenses     getLenses()           { return lenses; }
    @JsonProperty("line_hashes")       public List<String>      getLineHashes()       { return lineHashes; }

    @Override
    public String toString() {
        return "Concern{" + id + " @ " + location + ", " + impact + "}";
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(String id, ConcernLocation location) {
        return new Builder().id(id).location(location);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).location(location).summary(summary).details(details)
                .technicalSummary(technicalSummary).impact(impact).defaultChoice(defaultChoice)
                .rationale(rationale).alternatives(alternatives).lenses(lenses)
                .lineHashes(lineHashes);
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String            id;
        private ConcernLocation   location;
        private String            summary;
        private String            details;
        private String            technicalSummary;
        private Impact            impact;
        private boolean           defaultChoice;
        private String            rationale;
        private List<Alternative> alternatives;
        private ConcernLenses     lenses;
        private List<String>      lineHashes;

        @JsonProperty("id")                public Builder id(String v)                      { this.id = v;               return this; }
        @JsonProperty("location")          public Builder location(ConcernLocation v)       { this.location = v;         return this; }
        @JsonProperty("summary")           public Builder summary(String v)                 { this.summary = v;          return this; }
        @JsonProperty("details")           public Builder details(String v)                 { this.details = v;          return this; }
        @JsonProperty("technical_summary") public Builder technicalSummary(String v)        { this.technicalSummary = v; return this; }
        @JsonProperty("impact")            public Builder impact(Impact v)                  { this.impact = v;           return this; }
        @JsonProperty("default")           public Builder defaultChoice(boolean v)          { this.defaultChoice = v;    return this; }
        @JsonProperty("rationale")         public Builder rationale(String v)               { this.rationale = v;        return this; }
        @JsonProperty("alternatives")      public Builder alternatives(List<Alternative> v) { this.alternatives = v;     return this; }
        @JsonProperty("lenses")            public Builder lenses(ConcernLenses v)           { this.lenses = v;           return this; }
        @JsonProperty("line_hashes")       public Builder lineHashes(List<String> v)        { this.lineHashes = v;       return this; }

        public Concern build() { return new Concern(this); }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Concern " + field + " is required");
        }
        return value.trim();
    }
}
