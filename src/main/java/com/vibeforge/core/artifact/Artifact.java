package com.vibeforge.core.artifact;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.vibeforge.core.data.DataShape;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable record of one generated code version.
 *
 * The code itself lives in a separate payload file named {@link #getFileName()};
 * this object is the index row. {@code lastUsedAt} and {@code baseArtifactId}
 * change by replacing the row with a copy ({@link #touchedAt}, {@link #linkedTo}),
 * never by mutation.
 *
 * {@code modelId} is informational and takes no part in the cache key.
 * The declared {@code exports} and {@code imports} are kept beside their
 * signatures so a later fix is validated against the same state contract.
 */
@JsonDeserialize(builder = Artifact.Builder.class)
public final class Artifact {

    private final String         id;
    private final String         slug;
    private final String         contentHash;
    private final String         shortHash;
    private final int            version;
    private final String         fileName;
    private final String         sourceDescription;
    private final String         dataVariableName;
    private final DataShape      dataShape;
    private final String         exportsSignature;
    private final String         importsSignature;
    private final String         themeSignature;
    private final Map<String, String> exports;
    private final Map<String, String> imports;
    private final String         modelId;
    private final Instant        createdAt;
    private final Instant        lastUsedAt;
    private final String         baseArtifactId;
    private final List<String>   componentNames;
    private final ArtifactOrigin origin;

    private Artifact(Builder b) {
        this.id                = Objects.requireNonNull(b.id, "id");
        this.slug              = Objects.requireNonNull(b.slug, "slug");
        this.contentHash       = Objects.requireNonNull(b.contentHash, "contentHash");
        this.shortHash         = b.shortHash;
        this.version           = b.version;
        this.fileName          = b.fileName;
        this.sourceDescription = b.sourceDescription;
        this.dataVariableName  = b.dataVariableName;
        this.dataShape         = b.dataShape != null ? b.dataShape : DataShape.EMPTY;
        this.exportsSignature  = b.exportsSignature != null ? b.exportsSignature : "";
        this.importsSignature  = b.importsSignature != null ? b.importsSignature : "";
        this.themeSignature    = b.themeSignature != null ? b.themeSignature : "";
        this.exports           = sortedCopy(b.exports);
        this.imports           = sortedCopy(b.imports);
        this.modelId           = b.modelId;
        this.createdAt         = b.createdAt;
        this.lastUsedAt        = b.lastUsedAt != null ? b.lastUsedAt : b.createdAt;
        this.baseArtifactId    = b.baseArtifactId;
        this.componentNames    = b.componentNames != null ? List.copyOf(b.componentNames) : List.of();
        this.origin            = b.origin != null ? b.origin : ArtifactOrigin.LOCAL;
    }

    // ----------------------------------------------------------------
    // Copies
    // ----------------------------------------------------------------

    public Artifact touchedAt(Instant when) {
        return toBuilder().lastUsedAt(when).build();
    }

    public Artifact linkedTo(String baseId) {
        return toBuilder().baseArtifactId(baseId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).slug(slug).contentHash(contentHash).shortHash(shortHash)
                .version(version).fileName(fileName)
                .sourceDescription(sourceDescription).dataVariableName(dataVariableName)
                .dataShape(dataShape)
                .exportsSignature(exportsSignature).importsSignature(importsSignature)
                .themeSignature(themeSignature)
                .exports(exports).imports(imports)
                .modelId(modelId).createdAt(createdAt).lastUsedAt(lastUsedAt)
                .baseArtifactId(baseArtifactId).componentNames(componentNames).origin(origin);
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public String         getId()                { return id; }
    public String         getSlug()              { return slug; }
    public String         getContentHash()       { return contentHash; }
    public String         getShortHash()         { return shortHash; }
    public int            getVersion()           { return version; }
    public String         getFileName()          { return fileName; }
    public String         getSourceDescription() { return sourceDescription; }
    public String         getDataVariableName()  { return dataVariableName; }
    public DataShape      getDataShape()         { return dataShape; }
    public String         getExportsSignature()  { return exportsSignature; }
    public String         getImportsSignature()  { return importsSignature; }
    public String         getThemeSignature()    { return themeSignature; }
    public Map<String, String> getExports()      { return exports; }
    public Map<String, String> getImports()      { return imports; }
    public String         getModelId()           { return modelId; }
    public Instant        getCreatedAt()         { return createdAt; }
    public Instant        getLastUsedAt()        { return lastUsedAt; }
    public String         getBaseArtifactId()    { return baseArtifactId; }
    public List<String>   getComponentNames()    { return componentNames; }
    public ArtifactOrigin getOrigin()            { return origin; }

    @JsonIgnore
    public boolean isExternal() { return origin == ArtifactOrigin.EXTERNAL; }

    private static Map<String, String> sortedCopy(Map<String, String> mapping) {
        if (mapping == null || mapping.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new TreeMap<>(mapping));
    }

    @Override
    public String toString() {
        return "Artifact{" + id + ", slug=" + slug + ", v" + version
                + (baseArtifactId != null ? ", base=" + baseArtifactId : "") + "}";
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String         id;
        private String         slug;
        private String         contentHash;
        private String         shortHash;
        private int            version = 1;
        private String         fileName;
        private String         sourceDescription;
        private String         dataVariableName;
        private DataShape      dataShape;
        private String         exportsSignature;
        private String         importsSignature;
        private String         themeSignature;
        private Map<String, String> exports;
        private Map<String, String> imports;
        private String         modelId;
        private Instant        createdAt;
        private Instant        lastUsedAt;
        private String         baseArtifactId;
        private List<String>   componentNames;
        private ArtifactOrigin origin;

        public Builder id(String v)                   { this.id = v;                return this; }
        public Builder slug(String v)                 { this.slug = v;              return this; }
        public Builder contentHash(String v)          { this.contentHash = v;       return this; }
        public Builder shortHash(String v)            { this.shortHash = v;         return this; }
        public Builder version(int v)                 { this.version = v;           return this; }
        public Builder fileName(String v)             { this.fileName = v;          return this; }
        public Builder sourceDescription(String v)    { this.sourceDescription = v; return this; }
        public Builder dataVariableName(String v)     { this.dataVariableName = v;  return this; }
        public Builder dataShape(DataShape v)         { this.dataShape = v;         return this; }
        public Builder exportsSignature(String v)     { this.exportsSignature = v;  return this; }
        public Builder importsSignature(String v)     { this.importsSignature = v;  return this; }
        public Builder themeSignature(String v)       { this.themeSignature = v;    return this; }
        public Builder exports(Map<String, String> v) { this.exports = v;           return this; }
        public Builder imports(Map<String, String> v) { this.imports = v;           return this; }
        public Builder modelId(String v)              { this.modelId = v;           return this; }
        public Builder createdAt(Instant v)           { this.createdAt = v;         return this; }
        public Builder lastUsedAt(Instant v)          { this.lastUsedAt = v;        return this; }
        public Builder baseArtifactId(String v)       { this.baseArtifactId = v;    return this; }
        public Builder componentNames(List<String> v) { this.componentNames = v;    return this; }
        public Builder origin(ArtifactOrigin v)       { this.origin = v;            return this; }

        public Artifact build() { return new Artifact(this); }
    }
}
