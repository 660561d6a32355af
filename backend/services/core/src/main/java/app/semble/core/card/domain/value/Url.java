package app.semble.core.card.domain.value;

import app.semble.core.common.error.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * An absolute http(s) URL.
 */
public record Url(String value) {

    public Url {
        if (value == null || value.isBlank()) {
            throw new ValidationException("URL is required");
        }
        value = value.trim();
        URI parsed;
        try {
            parsed = new URI(value);
        } catch (URISyntaxException ex) {
            throw new ValidationException("Invalid URL: " + value);
        }
        String scheme = parsed.getScheme();
        if (scheme == null || parsed.getHost() == null) {
            throw new ValidationException("Invalid URL: " + value);
        }
        String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
        if (!normalizedScheme.equals("http") && !normalizedScheme.equals("https")) {
            throw new ValidationException("Unsupported URL scheme: " + scheme);
        }
    }

    public static Url of(String value) {
        return new Url(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
