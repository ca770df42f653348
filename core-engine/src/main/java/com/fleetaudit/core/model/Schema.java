package com.fleetaudit.core.model;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, declarative definition of one audit domain: the fields to
 * extract from a raw bundle, the alert rules evaluated over them and the
 * widgets used to display them.
 *
 * <p>
 * Field order and alert order are preserved as declared. Alert order
 * determines the order of raised alerts.
 * </p>
 *
 * <h3>Broken paths</h3>
 * <p>
 * {@link #getBrokenPaths()} names the path fields known not to resolve
 * against the schema's reference example bundle. The set is computed when the
 * schema is loaded (see {@code SchemaLoader}) or supplied by the caller via
 * {@link #withBrokenPaths(Set)}; extraction uses it to substitute sentinels.
 * </p>
 *
 * @since 1.0.0
 */
public final class Schema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String platform;
    private final String displayName;
    private final DetectionSpec detection;
    private final Map<String, FieldSpec> fields;
    private final List<AlertRule> alerts;
    private final List<Widget> widgets;
    private final List<FleetColumn> fleetColumns;
    private final String templateOverride;

    /** Stored as a string because {@link Path} is not serializable. */
    private final String sourcePath;
    private final Set<String> brokenPaths;

    private Schema(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.platform = b.platform != null ? b.platform : b.name;
        this.displayName = b.displayName != null ? b.displayName : b.name;
        this.detection = b.detection != null ? b.detection : DetectionSpec.NONE;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
        this.alerts = List.copyOf(b.alerts);
        this.widgets = List.copyOf(b.widgets);
        this.fleetColumns = List.copyOf(b.fleetColumns);
        this.templateOverride = b.templateOverride;
        this.sourcePath = b.sourcePath;
        this.brokenPaths = Collections.unmodifiableSet(new LinkedHashSet<>(b.brokenPaths));
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * @return a builder pre-populated with this schema's contents
     */
    public Builder toBuilder() {
        Builder b = new Builder()
                .name(name)
                .platform(platform)
                .displayName(displayName)
                .detection(detection)
                .templateOverride(templateOverride)
                .brokenPaths(brokenPaths);
        b.sourcePath = sourcePath;
        fields.forEach(b::field);
        alerts.forEach(b::alert);
        widgets.forEach(b::widget);
        fleetColumns.forEach(b::fleetColumn);
        return b;
    }

    /**
     * @param brokenPaths names of path fields known to be broken
     * @return a copy of this schema carrying the given broken-path set
     */
    public Schema withBrokenPaths(Set<String> brokenPaths) {
        return toBuilder().brokenPaths(brokenPaths).build();
    }

    /**
     * @param source file the schema was loaded from
     * @return a copy of this schema remembering its source location
     */
    public Schema withSourcePath(Path source) {
        return toBuilder().sourcePath(source).build();
    }

    /**
     * Fluent builder for {@link Schema}.
     */
    public static class Builder {
        private String name;
        private String platform;
        private String displayName;
        private DetectionSpec detection;
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final List<AlertRule> alerts = new ArrayList<>();
        private final List<Widget> widgets = new ArrayList<>();
        private final List<FleetColumn> fleetColumns = new ArrayList<>();
        private String templateOverride;
        private String sourcePath;
        private Set<String> brokenPaths = Set.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder detection(DetectionSpec detection) {
            this.detection = detection;
            return this;
        }

        public Builder field(String fieldName, FieldSpec spec) {
            Objects.requireNonNull(fieldName, "field name must not be null");
            fields.put(fieldName, Objects.requireNonNull(spec, "spec must not be null"));
            return this;
        }

        public Builder alert(AlertRule rule) {
            alerts.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        public Builder widget(Widget widget) {
            widgets.add(Objects.requireNonNull(widget, "widget must not be null"));
            return this;
        }

        public Builder fleetColumn(FleetColumn column) {
            fleetColumns.add(Objects.requireNonNull(column, "column must not be null"));
            return this;
        }

        public Builder templateOverride(String templateOverride) {
            this.templateOverride = templateOverride;
            return this;
        }

        public Builder sourcePath(Path sourcePath) {
            this.sourcePath = sourcePath != null ? sourcePath.toString() : null;
            return this;
        }

        public Builder brokenPaths(Set<String> brokenPaths) {
            this.brokenPaths = brokenPaths != null ? brokenPaths : Set.of();
            return this;
        }

        /**
         * @return a new immutable {@link Schema}
         * @throws NullPointerException if {@code name} is missing
         */
        public Schema build() {
            return new Schema(this);
        }
    }

    public String getName() {
        return name;
    }

    public String getPlatform() {
        return platform;
    }

    public String getDisplayName() {
        return displayName;
    }

    public DetectionSpec getDetection() {
        return detection;
    }

    /**
     * @return unmodifiable, declaration-ordered map of field name to spec
     */
    public Map<String, FieldSpec> getFields() {
        return fields;
    }

    public List<AlertRule> getAlerts() {
        return alerts;
    }

    public List<Widget> getWidgets() {
        return widgets;
    }

    public List<FleetColumn> getFleetColumns() {
        return fleetColumns;
    }

    public Optional<String> getTemplateOverride() {
        return Optional.ofNullable(templateOverride);
    }

    /**
     * @return the file this schema was loaded from, if it came from a file
     */
    public Optional<Path> getSourcePath() {
        return Optional.ofNullable(sourcePath).map(Path::of);
    }

    public Set<String> getBrokenPaths() {
        return brokenPaths;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schema that))
            return false;
        return Objects.equals(name, that.name)
                && Objects.equals(platform, that.platform)
                && Objects.equals(fields, that.fields)
                && Objects.equals(alerts, that.alerts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, platform, fields, alerts);
    }

    @Override
    public String toString() {
        return "Schema{" +
                "name='" + name + '\'' +
                ", platform='" + platform + '\'' +
                ", fields=" + fields.size() +
                ", alerts=" + alerts.size() +
                ", widgets=" + widgets.size() +
                ", sourcePath='" + sourcePath + '\'' +
                '}';
    }
}
