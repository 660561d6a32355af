package app.semble.core.atproto.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WriteRecordResponse(String uri, String cid) {
}
