package hle.lifecycle.monitor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A structured observability event. Events are keyed by the id of the
 * resource they describe, when there is one.
 */
public final class MonitorEvent {

    private final MonitorEventType type;
    private final String resourceId;
    private final Instant timestamp;
    private final Map<String, Object> attributes;

    private MonitorEvent(Builder builder) {
        this.type = builder.type;
        this.resourceId = builder.resourceId;
        this.timestamp = builder.timestamp;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder(MonitorEventType type) {
        return new Builder(type);
    }

    public MonitorEventType getType() {
        return type;
    }

    public Optional<String> getResourceId() {
        return Optional.ofNullable(resourceId);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public String toString() {
        return String.format("MonitorEvent[type=%s, resourceId=%s, attributes=%s]",
                type, resourceId, attributes);
    }

    public static final class Builder {
        private final MonitorEventType type;
        private String resourceId;
        private Instant timestamp = Instant.now();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(MonitorEventType type) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
        }

        public Builder resourceId(Object resourceId) {
            this.resourceId = resourceId == null ? null : resourceId.toString();
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public MonitorEvent build() {
            return new MonitorEvent(this);
        }
    }
}
