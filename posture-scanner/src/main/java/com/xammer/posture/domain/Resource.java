package com.xammer.posture.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of the attributes the provider reported for one entity.
 * Accessors never fail on a missing attribute; callers pick the default.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Resource {

    private final ServiceType service;
    private final String kind;
    private final String id;
    private final Map<String, Object> attributes;

    private Resource(ServiceType service, String kind, String id, Map<String, Object> attributes) {
        this.service = Objects.requireNonNull(service, "service");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder(ServiceType service, String kind, String id) {
        return new Builder(service, kind, id);
    }

    public boolean has(String attribute) {
        return attributes.get(attribute) != null;
    }

    public Optional<Object> get(String attribute) {
        return Optional.ofNullable(attributes.get(attribute));
    }

    public Optional<String> string(String attribute) {
        return get(attribute).map(String::valueOf);
    }

    public Optional<Boolean> bool(String attribute) {
        return get(attribute).map(value -> value instanceof Boolean
                ? (Boolean) value
                : Boolean.parseBoolean(String.valueOf(value)));
    }

    public Optional<Integer> integer(String attribute) {
        return get(attribute).map(value -> value instanceof Number
                ? ((Number) value).intValue()
                : Integer.parseInt(String.valueOf(value)));
    }

    public List<String> strings(String attribute) {
        Object value = attributes.get(attribute);
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.toList());
        }
        return value == null ? Collections.emptyList() : List.of(String.valueOf(value));
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> list(String attribute, Class<T> elementType) {
        Object value = attributes.get(attribute);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        for (Object element : (List<?>) value) {
            if (!elementType.isInstance(element)) {
                throw new IllegalStateException("Attribute " + attribute + " of " + id
                        + " holds " + element.getClass().getSimpleName() + ", expected " + elementType.getSimpleName());
            }
        }
        return (List<T>) value;
    }

    public static final class Builder {
        private final ServiceType service;
        private final String kind;
        private final String id;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(ServiceType service, String kind, String id) {
            this.service = service;
            this.kind = kind;
            this.id = id;
        }

        /** Null values are dropped so that "absent" has exactly one representation. */
        public Builder attribute(String name, Object value) {
            if (value != null) {
                attributes.put(name, value instanceof List ? List.copyOf((List<?>) value) : value);
            }
            return this;
        }

        public Resource build() {
            return new Resource(service, kind, id, attributes);
        }
    }
}
