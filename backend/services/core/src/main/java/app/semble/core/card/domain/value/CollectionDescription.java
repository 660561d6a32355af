package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

public record CollectionDescription(String value) {

    public static final int MAX_LENGTH = 500;

    public CollectionDescription {
        value = value == null ? "" : value.trim();
        if (value.length() > MAX_LENGTH) {
            throw new ValidationException("Collection description cannot exceed " + MAX_LENGTH + " characters");
        }
    }

    /**
     * Blank input means "no description".
     */
    public static CollectionDescription ofNullable(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return new CollectionDescription(value);
    }
}
