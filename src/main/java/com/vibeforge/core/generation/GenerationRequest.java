package com.vibeforge.core.generation;

import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.data.DataTable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Input to one {@link GenerationLoop} run.
 *
 * Three shapes:
 *   fresh     - description + data only
 *   revision  - plus {@code baseCode}; GENERATING asks for a revise
 *   fix       - plus {@code codeToFix} and {@code reportedError}; GENERATING is skipped
 */
public final class GenerationRequest {

    private final String              requestId;
    private final String              description;
    private final DataTable           data;
    private final DataShape           dataShape;
    private final Map<String, String> exports;
    private final Map<String, String> imports;
    private final String              theme;
    private final String              baseCode;
    private final List<String>        baseComponentNames;
    private final String              codeToFix;
    private final String              reportedError;

    private GenerationRequest(Builder b) {
        this.requestId          = b.requestId != null ? b.requestId : UUID.randomUUID().toString();
        this.description        = Objects.requireNonNull(b.description, "description");
        this.data               = b.data != null ? b.data : DataTable.EMPTY;
        this.dataShape          = b.dataShape != null ? b.dataShape : this.data.getShape();
        this.exports            = b.exports != null ? Map.copyOf(b.exports) : Map.of();
        this.imports            = b.imports != null ? Map.copyOf(b.imports) : Map.of();
        this.theme              = b.theme;
        this.baseCode           = b.baseCode;
        this.baseComponentNames = b.baseComponentNames != null ? List.copyOf(b.baseComponentNames) : List.of();
        this.codeToFix          = b.codeToFix;
        this.reportedError      = b.reportedError;
        if ((codeToFix == null) != (reportedError == null)) {
            throw new IllegalArgumentException("codeToFix and reportedError go together");
        }
    }

    public boolean isRevision() { return baseCode != null; }
    public boolean isFix()      { return codeToFix != null; }

    public String              getRequestId()          { return requestId; }
    public String              getDescription()        { return description; }
    public DataTable           getData()               { return data; }
    public DataShape           getDataShape()          { return dataShape; }
    public Map<String, String> getExports()            { return exports; }
    public Map<String, String> getImports()            { return imports; }
    public String              getTheme()              { return theme; }
    public String              getBaseCode()           { return baseCode; }
    public List<String>        getBaseComponentNames() { return baseComponentNames; }
    public String              getCodeToFix()          { return codeToFix; }
    public String              getReportedError()      { return reportedError; }

    public static Builder builder(String description) {
        return new Builder(description);
    }

    public static final class Builder {
        private final String        description;
        private String              requestId;
        private DataTable           data;
        private DataShape           dataShape;
        private Map<String, String> exports;
        private Map<String, String> imports;
        private String              theme;
        private String              baseCode;
        private List<String>        baseComponentNames;
        private String              codeToFix;
        private String              reportedError;

        private Builder(String description) {
            this.description = description;
        }

        public Builder requestId(String v)             { this.requestId = v; return this; }
        public Builder data(DataTable v)               { this.data = v;      return this; }
        public Builder dataShape(DataShape v)          { this.dataShape = v; return this; }
        public Builder exports(Map<String, String> v)  { this.exports = v;   return this; }
        public Builder imports(Map<String, String> v)  { this.imports = v;   return this; }
        public Builder theme(String v)                 { this.theme = v;     return this; }

        public Builder base(String code, List<String> componentNames) {
            this.baseCode           = code;
            this.baseComponentNames = componentNames;
            return this;
        }

        public Builder fix(String code, String error) {
            this.codeToFix     = code;
            this.reportedError = error;
            return this;
        }

        public GenerationRequest build() { return new GenerationRequest(this); }
    }
}
