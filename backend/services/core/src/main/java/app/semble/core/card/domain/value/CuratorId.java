package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

import java.util.regex.Pattern;

/**
 * A curator, identified by their DID ({@code did:<method>:<identifier>}).
 */
public record CuratorId(String value) {

    private static final Pattern DID = Pattern.compile("^did:[a-z]+:[a-zA-Z0-9._:%-]+$");

    public CuratorId {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Curator DID is required");
        }
        value = value.trim();
        if (!DID.matcher(value).matches()) {
            throw new ValidationException("Invalid curator DID: " + value);
        }
    }

    public static CuratorId of(String value) {
        return new CuratorId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
