package app.semble.core.atproto.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AtprotoSession(String did, String handle, String accessJwt, String refreshJwt) {
}
