package com.fleetaudit.core.normalize;

import com.fleetaudit.core.field.Coverage;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identification block of a {@link NormalizedReport}.
 *
 * @param schemaName    schema that produced the report
 * @param platform      platform label of the schema
 * @param displayName   human readable schema name
 * @param generatedAt   when normalization ran
 * @param fieldCoverage path coverage of the extraction
 */
public record ReportMetadata(String schemaName, String platform, String displayName, Instant generatedAt,
                             Coverage fieldCoverage) implements Serializable {

    public ReportMetadata {
        Objects.requireNonNull(schemaName, "schemaName must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(fieldCoverage, "fieldCoverage must not be null");
    }

    /**
     * @return {@code "schema_<name>"}
     */
    public String auditType() {
        return "schema_" + schemaName;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("audit_type", auditType());
        m.put("schema_name", schemaName);
        m.put("platform", platform);
        m.put("display_name", displayName);
        m.put("generated_at", generatedAt.toString());
        m.put("field_coverage", fieldCoverage.toMap());
        return m;
    }
}
