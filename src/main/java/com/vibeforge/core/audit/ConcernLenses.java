package com.vibeforge.core.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The analytic lenses a full-level concern is examined through. All free text. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConcernLenses {

    private final String uncertainty;
    private final String reproducibility;
    private final String edgeBehavior;
    private final String defaultVsExplicit;
    private final String appropriateness;
    private final String safety;

    @JsonCreator
    public ConcernLenses(@JsonProperty("uncertainty")         String uncertainty,
                         @JsonProperty("reproducibility")     String reproducibility,
                         @JsonProperty("edge_behavior")       String edgeBehavior,
                         @JsonProperty("default_vs_explicit") String defaultVsExplicit,
                         @JsonProperty("appropriateness")     String appropriateness,
                         @JsonProperty("safety")              String safety) {
        this.uncertainty       = uncertainty;
        this.reproducibility   = reproducibility;
        this.edgeBehavior      = edgeBehavior;
        this.defaultVsExplicit = defaultVsExplicit;
        this.appropriateness   = appropriateness;
        this.safety            = safety;
    }

    @JsonProperty("uncertainty")         public String getUncertainty()       { return uncertainty; }
    @JsonProperty("reproducibility")     public String getReproducibility()   { return reproducibility; }
    @JsonProperty("edge_behavior")       public String getEdgeBehavior()      { return edgeBehavior; }
    @JsonProperty("default_vs_explicit") public String getDefaultVsExplicit() { return defaultVsExplicit; }
    @JsonProperty("appropriateness")     public String getAppropriateness()   { return appropriateness; }
    @JsonProperty("safety")              public String getSafety()            { return safety; }
}
