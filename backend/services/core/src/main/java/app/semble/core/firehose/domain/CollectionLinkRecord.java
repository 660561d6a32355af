package app.semble.core.firehose.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectionLinkRecord(StrongRef collection, StrongRef card, String addedBy, String addedAt) {
}
