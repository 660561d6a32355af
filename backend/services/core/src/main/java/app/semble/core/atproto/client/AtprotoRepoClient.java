package app.semble.core.atproto.client;

import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.PublisherAuthenticationException;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

@Component
public class AtprotoRepoClient {

    private static final Logger log = LoggerFactory.getLogger(AtprotoRepoClient.class);

    private final RestClient restClient;
    private final AppPasswordSessionProvider sessions;
    private final ObjectMapper objectMapper;

    public AtprotoRepoClient(RestClient atprotoRestClient,
                             AppPasswordSessionProvider sessions,
                             ObjectMapper objectMapper) {
        this.restClient = atprotoRestClient;
        this.sessions = sessions;
        this.objectMapper = objectMapper;
    }

    public PublishedRecordId createRecord(CuratorId repo, String collection, JsonNode record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("repo", repo.value());
        body.put("collection", collection);
        body.put("record", record);
        WriteRecordResponse response = call(repo, "createRecord", token -> post("com.atproto.repo.createRecord", token, body)
                .body(WriteRecordResponse.class));
        return toRecordId(response, "createRecord");
    }

    public PublishedRecordId putRecord(CuratorId repo, String collection, String rkey, JsonNode record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("repo", repo.value());
        body.put("collection", collection);
        body.put("rkey", rkey);
        body.put("record", record);
        WriteRecordResponse response = call(repo, "putRecord", token -> post("com.atproto.repo.putRecord", token, body)
                .body(WriteRecordResponse.class));
        return toRecordId(response, "putRecord");
    }

    public void deleteRecord(CuratorId repo, String collection, String rkey) {
        Map<String, Object> body = Map.of("repo", repo.value(), "collection", collection, "rkey", rkey);
        call(repo, "deleteRecord", token -> post("com.atproto.repo.deleteRecord", token, body).toBodilessEntity());
    }

    private RestClient.ResponseSpec post(String nsid, String accessJwt, Object body) {
        return restClient.post()
                .uri("/xrpc/" + nsid)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessJwt)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve();
    }

    private <T> T call(CuratorId repo, String procedure, Function<String, T> request) {
        AtprotoSession session = sessions.sessionFor(repo);
        try {
            return request.apply(session.accessJwt());
        } catch (RestClientException ex) {
            RuntimeException translated = XrpcErrors.translate(procedure + " in " + repo, ex, objectMapper);
            if (translated instanceof PublisherAuthenticationException) {
                log.warn("PDS rejected session of {}, dropping it", repo);
                sessions.invalidate(repo);
            }
            throw translated;
        }
    }

    private static PublishedRecordId toRecordId(WriteRecordResponse response, String procedure) {
        if (response == null || response.uri() == null || response.cid() == null) {
            throw new UnexpectedException(procedure + " returned no record reference");
        }
        return new PublishedRecordId(response.uri(), response.cid());
    }
}
