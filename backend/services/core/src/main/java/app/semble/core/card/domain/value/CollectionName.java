package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

public record CollectionName(String value) {

    public static final int MAX_LENGTH = 100;

    public CollectionName {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Collection name cannot be empty");
        }
        value = value.trim();
        if (value.length() > MAX_LENGTH) {
            throw new ValidationException("Collection name cannot exceed " + MAX_LENGTH + " characters");
        }
    }

    public static CollectionName of(String value) {
        return new CollectionName(value);
    }
}
