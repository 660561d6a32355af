package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

import java.util.Objects;
import java.util.UUID;

public record CollectionId(UUID value) {

    public CollectionId {
        Objects.requireNonNull(value, "value");
    }

    public static CollectionId generate() {
        return new CollectionId(UUID.randomUUID());
    }

    public static CollectionId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Collection id is required");
        }
        try {
            return new CollectionId(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Invalid collection id: " + raw);
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
