package com.fleetaudit.core.field;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves dotted paths such as {@code "ansible_facts.hostname"} against a
 * raw bundle, optionally piping the result through a named transform:
 * {@code "interfaces | len_if_list"}.
 *
 * <p>
 * A segment that does not exist, or traversal through anything other than a
 * map, yields an empty result. Resolution never throws: "absent" is the only
 * failure signal. An unknown transform name is logged and the value is passed
 * through unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class FieldResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FieldResolver.class);

    private static final String PIPE = " | ";

    private final TransformRegistry transforms;

    /**
     * @param transforms registry used for {@code | name} suffixes
     */
    public FieldResolver(TransformRegistry transforms) {
        this.transforms = Objects.requireNonNull(transforms, "TransformRegistry must not be null");
    }

    public FieldResolver() {
        this(TransformRegistry.withDefaults());
    }

    /**
     * Resolve a path against a raw bundle.
     *
     * @param path dotted path, optionally with {@code " | transform"}
     * @param raw  raw bundle (nested maps)
     * @return the resolved value, or empty if absent
     */
    public Optional<Object> resolve(String path, Map<String, ?> raw) {
        if (path == null) {
            return Optional.empty();
        }

        String pathPart = path;
        String transformName = null;
        int pipe = path.indexOf(PIPE);
        if (pipe >= 0) {
            pathPart = path.substring(0, pipe).trim();
            transformName = path.substring(pipe + PIPE.length()).trim();
        }

        Object value = traverse(pathPart, raw);

        if (transformName != null) {
            Optional<FieldTransform> transform = transforms.find(transformName);
            if (transform.isPresent()) {
                value = transform.get().apply(value);
            } else {
                LOG.warn("Unknown transform '{}' in path '{}'", transformName, path);
            }
        }
        return Optional.ofNullable(value);
    }

    private static Object traverse(String path, Object root) {
        Object current = root;
        for (String segment : path.split("\\.")) {
            String key = segment.trim();
            if (key.isEmpty()) {
                continue;
            }
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }
}
