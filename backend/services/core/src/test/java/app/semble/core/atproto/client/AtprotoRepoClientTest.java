package app.semble.core.atproto.client;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.PublisherAuthenticationException;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AtprotoRepoClientTest {

    private static final String PDS = "https://pds.test";
    private static final CuratorId ALICE = CuratorId.of("did:plc:alice");
    private static final String SESSION = """
            {"did":"did:plc:alice","handle":"alice.test","accessJwt":"jwt-1","refreshJwt":"refresh-1"}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private CacheManager cacheManager;
    private AtprotoRepoClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(PDS);
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient restClient = builder.build();
        AtprotoProps props = new AtprotoProps(AtprotoProps.PublishingMode.PDS, PDS, null,
                List.of(new AtprotoProps.Account(ALICE.value(), "alice.test", "app-pass")));
        cacheManager = new ConcurrentMapCacheManager(AppPasswordSessionProvider.CACHE_NAME);
        AppPasswordSessionProvider sessions = new AppPasswordSessionProvider(restClient, props, cacheManager, objectMapper);
        client = new AtprotoRepoClient(restClient, sessions, objectMapper);
    }

    private void expectLogin() {
        server.expect(requestTo(PDS + "/xrpc/com.atproto.server.createSession"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.identifier").value("alice.test"))
                .andRespond(withSuccess(SESSION, MediaType.APPLICATION_JSON));
    }

    @Test
    void createRecord_logsInOnceAndReturnsRecordReference() {
        expectLogin();
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.createRecord"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer jwt-1"))
                .andExpect(jsonPath("$.repo").value(ALICE.value()))
                .andExpect(jsonPath("$.collection").value("network.cosmik.card"))
                .andExpect(jsonPath("$.record.type").value("URL"))
                .andRespond(withSuccess("{\"uri\":\"at://did:plc:alice/network.cosmik.card/3k1\",\"cid\":\"bafy1\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.deleteRecord"))
                .andExpect(jsonPath("$.rkey").value("3k1"))
                .andRespond(withSuccess());

        ObjectNode record = objectMapper.createObjectNode().put("type", "URL");
        PublishedRecordId recordId = client.createRecord(ALICE, "network.cosmik.card", record);
        client.deleteRecord(ALICE, "network.cosmik.card", "3k1");

        assertThat(recordId).isEqualTo(PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/3k1", "bafy1"));
        server.verify();
    }

    @Test
    void putRecord_sendsRecordKey() {
        expectLogin();
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.putRecord"))
                .andExpect(jsonPath("$.rkey").value("3k1"))
                .andRespond(withSuccess("{\"uri\":\"at://did:plc:alice/network.cosmik.card/3k1\",\"cid\":\"bafy2\"}",
                        MediaType.APPLICATION_JSON));

        PublishedRecordId recordId = client.putRecord(ALICE, "network.cosmik.card", "3k1", objectMapper.createObjectNode());

        assertThat(recordId.cid()).isEqualTo("bafy2");
        server.verify();
    }

    @Test
    void expiredToken_isReportedAsAuthenticationFailureAndDropsSession() {
        expectLogin();
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.createRecord"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"ExpiredToken\",\"message\":\"Token has expired\"}"));

        assertThatThrownBy(() -> client.createRecord(ALICE, "network.cosmik.card", objectMapper.createObjectNode()))
                .isInstanceOf(PublisherAuthenticationException.class);
        assertThat(cacheManager.getCache(AppPasswordSessionProvider.CACHE_NAME).get(ALICE.value())).isNull();
    }

    @Test
    void unauthorized_isReportedAsAuthenticationFailure() {
        expectLogin();
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.deleteRecord"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.deleteRecord(ALICE, "network.cosmik.card", "3k1"))
                .isInstanceOf(PublisherAuthenticationException.class);
    }

    @Test
    void serverError_isReportedAsUnexpected() {
        expectLogin();
        server.expect(requestTo(PDS + "/xrpc/com.atproto.repo.createRecord"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.createRecord(ALICE, "network.cosmik.card", objectMapper.createObjectNode()))
                .isInstanceOf(UnexpectedException.class);
    }

    @Test
    void curatorWithoutAppPassword_cannotPublish() {
        CuratorId bob = CuratorId.of("did:plc:bob");

        assertThatThrownBy(() -> client.createRecord(bob, "network.cosmik.card", objectMapper.createObjectNode()))
                .isInstanceOf(PublisherAuthenticationException.class)
                .hasMessageContaining("No app password");
        server.verify();
    }
}
