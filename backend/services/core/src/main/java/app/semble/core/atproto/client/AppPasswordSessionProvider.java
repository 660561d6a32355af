package app.semble.core.atproto.client;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.common.error.PublisherAuthenticationException;
import app.semble.core.common.error.UnexpectedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

@Component
public class AppPasswordSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(AppPasswordSessionProvider.class);
    static final String CACHE_NAME = "atproto-sessions";

    private final RestClient restClient;
    private final AtprotoProps props;
    private final CacheManager cacheManager;
    private final ObjectMapper objectMapper;

    public AppPasswordSessionProvider(RestClient atprotoRestClient,
                                      AtprotoProps props,
                                      CacheManager cacheManager,
                                      ObjectMapper objectMapper) {
        this.restClient = atprotoRestClient;
        this.props = props;
        this.cacheManager = cacheManager;
        this.objectMapper = objectMapper;
    }

    public AtprotoSession sessionFor(CuratorId curatorId) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        AtprotoSession cached = safeGet(cache, curatorId);
        if (cached != null) {
            return cached;
        }

        AtprotoProps.Account account = props.findAccount(curatorId)
                .orElseThrow(() -> new PublisherAuthenticationException("No app password configured for " + curatorId));

        AtprotoSession session;
        try {
            session = restClient.post()
                    .uri("/xrpc/com.atproto.server.createSession")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("identifier", account.identifier(), "password", account.password()))
                    .retrieve()
                    .body(AtprotoSession.class);
        } catch (RestClientException ex) {
            throw XrpcErrors.translate("Login for " + curatorId, ex, objectMapper);
        }
        if (session == null || session.accessJwt() == null) {
            throw new UnexpectedException("Login for " + curatorId + " returned no session");
        }
        log.info("Opened PDS session for {}", curatorId);
        safePut(cache, curatorId, session);
        return session;
    }

    public void invalidate(CuratorId curatorId) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            return;
        }
        try {
            cache.evict(curatorId.value());
        } catch (RuntimeException ex) {
            log.warn("Cache evict failed for {}: {}", CACHE_NAME, ex.getMessage());
        }
    }

    private AtprotoSession safeGet(Cache cache, CuratorId curatorId) {
        if (cache == null) {
            return null;
        }
        try {
            return cache.get(curatorId.value(), AtprotoSession.class);
        } catch (RuntimeException ex) {
            log.warn("Cache get failed for {}: {}", CACHE_NAME, ex.getMessage());
            return null;
        }
    }

    private void safePut(Cache cache, CuratorId curatorId, AtprotoSession session) {
        if (cache == null) {
            return;
        }
        try {
            cache.put(curatorId.value(), session);
        } catch (RuntimeException ex) {
            log.warn("Cache put failed for {}: {}", CACHE_NAME, ex.getMessage());
        }
    }
}
