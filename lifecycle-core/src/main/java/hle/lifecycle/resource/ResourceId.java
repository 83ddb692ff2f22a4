package hle.lifecycle.resource;

import java.util.Objects;
import java.util.UUID;

/**
 * Unique identifier of a tracked resource.
 */
public final class ResourceId {

    private final UUID value;

    private ResourceId(UUID value) {
        this.value = value;
    }

    /**
     * Generates a new random identifier.
     */
    public static ResourceId generate() {
        return new ResourceId(UUID.randomUUID());
    }

    public static ResourceId of(UUID value) {
        return new ResourceId(Objects.requireNonNull(value, "value cannot be null"));
    }

    public UUID getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceId)) {
            return false;
        }
        return value.equals(((ResourceId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
