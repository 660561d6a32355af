package app.semble.core.firehose.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StrongRef(String uri, String cid) {
}
