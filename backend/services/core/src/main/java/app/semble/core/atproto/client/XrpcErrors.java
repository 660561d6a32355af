package app.semble.core.atproto.client;

import app.semble.core.common.error.PublisherAuthenticationException;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Set;

final class XrpcErrors {

    private static final Set<String> AUTH_ERRORS = Set.of(
            "AuthenticationRequired", "ExpiredToken", "InvalidToken", "AuthMissing", "AccountTakedown");

    private XrpcErrors() {
    }

    static boolean isAuthenticationFailure(RestClientResponseException ex, ObjectMapper objectMapper) {
        if (ex.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
            return true;
        }
        String error = errorCode(ex, objectMapper);
        return error != null && AUTH_ERRORS.contains(error);
    }

    static RuntimeException translate(String action, RestClientException ex, ObjectMapper objectMapper) {
        if (ex instanceof RestClientResponseException response) {
            if (isAuthenticationFailure(response, objectMapper)) {
                return new PublisherAuthenticationException(action + " rejected: " + describe(response, objectMapper), ex);
            }
            return new UnexpectedException(action + " failed: " + describe(response, objectMapper), ex);
        }
        return new UnexpectedException(action + " failed: " + ex.getMessage(), ex);
    }

    private static String describe(RestClientResponseException ex, ObjectMapper objectMapper) {
        String error = errorCode(ex, objectMapper);
        return ex.getStatusCode().value() + (error == null ? "" : " " + error);
    }

    private static String errorCode(RestClientResponseException ex, ObjectMapper objectMapper) {
        String body = ex.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.get("error");
            return error == null || error.isNull() ? null : error.asText();
        } catch (JsonProcessingException parseFailure) {
            // non-JSON error pages carry no XRPC error code
            return null;
        }
    }
}
