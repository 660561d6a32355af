package app.semble.core.firehose.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fields of a {@code network.cosmik.card} record read by the firehose processors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardRecord(String type, Content content, String url, StrongRef parentCard, String createdAt) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String url, String text) {
    }

    public String resolvedUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return content == null ? null : content.url();
    }

    public String text() {
        return content == null ? null : content.text();
    }
}
