package app.semble.core.card.domain.content;

import app.semble.core.card.domain.value.Url;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata fetched for a URL. Everything except the URL itself is optional.
 */
public record UrlMetadata(
        Url url,
        String title,
        String description,
        String author,
        Instant publishedDate,
        String siteName,
        String imageUrl,
        String type,
        Instant retrievedAt
) {

    public UrlMetadata {
        Objects.requireNonNull(url, "url");
    }

    public static UrlMetadata minimal(Url url, Instant retrievedAt) {
        return new UrlMetadata(url, null, null, null, null, null, null, null, retrievedAt);
    }
}
