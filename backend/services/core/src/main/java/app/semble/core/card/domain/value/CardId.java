package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

import java.util.Objects;
import java.util.UUID;

public record CardId(UUID value) {

    public CardId {
        Objects.requireNonNull(value, "value");
    }

    public static CardId generate() {
        return new CardId(UUID.randomUUID());
    }

    public static CardId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Card id is required");
        }
        try {
            return new CardId(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Invalid card id: " + raw);
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
