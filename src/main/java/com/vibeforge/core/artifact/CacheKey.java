package com.vibeforge.core.artifact;

import com.vibeforge.core.data.DataShape;
import com.vibeforge.util.Fingerprint;
import com.vibeforge.util.StableJson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CacheKey: the semantic inputs that make two generation requests interchangeable.
 *
 * Model choice and caller environment are deliberately absent. The full hash is
 * SHA-256 over a key-sorted JSON rendering of the normalized description, the
 * data variable name, the data shape and the three signatures.
 */
public final class CacheKey {

    private final String              description;
    private final String              dataVariableName;
    private final DataShape           dataShape;
    private final Map<String, String> exports;
    private final Map<String, String> imports;
    private final String              theme;

    private final String exportsSignature;
    private final String importsSignature;
    private final String themeSignature;
    private final String contentHash;

    private CacheKey(Builder b) {
        if (b.description == null || b.description.isBlank()) {
            throw new InvalidRequestException("Description cannot be empty");
        }
        if (b.dataShape == null) {
            throw new InvalidRequestException("Data shape is required");
        }
        this.description      = b.description;
        this.dataVariableName = (b.dataVariableName == null || b.dataVariableName.isBlank())
                ? null : b.dataVariableName.trim();
        this.dataShape        = b.dataShape;
        this.exports          = freeze(b.exports);
        this.imports          = freeze(b.imports);
        this.theme            = b.theme;

        this.exportsSignature = Signatures.ofMapping(exports);
        this.importsSignature = Signatures.ofMapping(imports);
        this.themeSignature   = Signatures.ofTheme(theme);

        Map<String, Object> material = new LinkedHashMap<>();
        material.put("description",       Signatures.normalizeText(description));
        material.put("data_var_name",     dataVariableName != null ? dataVariableName : "");
        material.put("rows",              dataShape.getRows());
        material.put("columns",           dataShape.getColumns());
        material.put("exports_signature", exportsSignature);
        material.put("imports_signature", importsSignature);
        material.put("theme_signature",   themeSignature);
        this.contentHash = Fingerprint.sha256(StableJson.stringify(material));
    }

    public String              getDescription()      { return description; }
    public String              getDataVariableName() { return dataVariableName; }
    public DataShape           getDataShape()        { return dataShape; }
    public Map<String, String> getExports()          { return exports; }
    public Map<String, String> getImports()          { return imports; }
    public String              getTheme()            { return theme; }
    public String              getExportsSignature() { return exportsSignature; }
    public String              getImportsSignature() { return importsSignature; }
    public String              getThemeSignature()   { return themeSignature; }
    public String              getContentHash()      { return contentHash; }
    public String              getShortHash()        { return Fingerprint.shortHash(contentHash); }

    @Override
    public String toString() {
        return "CacheKey{" + getShortHash() + ", shape=" + dataShape + "}";
    }

    private static Map<String, String> freeze(Map<String, String> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(String description, DataShape dataShape) {
        return new Builder(description, dataShape);
    }

    public static final class Builder {
        private final String    description;
        private final DataShape dataShape;
        private String              dataVariableName = null;
        private Map<String, String> exports          = null;
        private Map<String, String> imports          = null;
        private String              theme            = null;

        private Builder(String description, DataShape dataShape) {
            this.description = description;
            this.dataShape   = dataShape;
        }

        public Builder dataVariableName(String v)         { this.dataVariableName = v; return this; }
        public Builder exports(Map<String, String> v)     { this.exports = v;          return this; }
        public Builder imports(Map<String, String> v)     { this.imports = v;          return this; }
        public Builder theme(String v)                    { this.theme = v;            return this; }

        public CacheKey build() { return new CacheKey(this); }
    }
}
