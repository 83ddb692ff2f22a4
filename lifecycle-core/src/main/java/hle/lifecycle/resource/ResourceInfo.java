package hle.lifecycle.resource;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Bookkeeping about a registered resource.
 */
public final class ResourceInfo {

    private final String typeName;
    private final Instant createdAt;
    private final Long sizeBytes;
    private final Map<String, String> metadata;

    private ResourceInfo(Builder builder) {
        this.typeName = builder.typeName;
        this.createdAt = builder.createdAt;
        this.sizeBytes = builder.sizeBytes;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static ResourceInfo of(String typeName) {
        return builder(typeName).build();
    }

    public static Builder builder(String typeName) {
        return new Builder(typeName);
    }

    public String getTypeName() {
        return typeName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public OptionalLong getSizeBytes() {
        return sizeBytes == null ? OptionalLong.empty() : OptionalLong.of(sizeBytes);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return String.format("ResourceInfo[type=%s, createdAt=%s, sizeBytes=%s, metadata=%s]",
                typeName, createdAt, sizeBytes, metadata);
    }

    public static final class Builder {
        private final String typeName;
        private Instant createdAt = Instant.now();
        private Long sizeBytes;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(String typeName) {
            this.typeName = Objects.requireNonNull(typeName, "typeName cannot be null");
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
            return this;
        }

        public Builder sizeBytes(long sizeBytes) {
            if (sizeBytes < 0) {
                throw new IllegalArgumentException("sizeBytes must be >= 0");
            }
            this.sizeBytes = sizeBytes;
            return this;
        }

        public Builder metadata(String key, String value) {
            metadata.put(Objects.requireNonNull(key, "key cannot be null"),
                    Objects.requireNonNull(value, "value cannot be null"));
            return this;
        }

        public Builder metadata(Map<String, String> entries) {
            entries.forEach(this::metadata);
            return this;
        }

        public ResourceInfo build() {
            return new ResourceInfo(this);
        }
    }
}
