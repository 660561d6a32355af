package app.semble.core.firehose.service;

import app.semble.core.atproto.config.AtprotoProps;
import app.semble.core.firehose.config.FirehoseProps;
import app.semble.core.firehose.domain.FirehoseEvent;
import app.semble.core.firehose.domain.FirehoseProcessingResult;
import app.semble.core.support.CoreFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FirehoseEventRouterTest {

    private static final String CARD_URI = "at://did:plc:alice/network.cosmik.card/3kurl";

    @Mock
    FirehoseEventDeduplicator deduplicator;

    @Mock
    CardFirehoseEventProcessor cardProcessor;

    @Mock
    CollectionFirehoseEventProcessor collectionProcessor;

    @Mock
    CollectionLinkFirehoseEventProcessor collectionLinkProcessor;

    private FirehoseEventRouter router(boolean deduplicate) {
        return new FirehoseEventRouter(new AtprotoProps(null, null, null, null), new FirehoseProps(deduplicate),
                deduplicator, cardProcessor, collectionProcessor, collectionLinkProcessor);
    }

    @Test
    void route_dispatchesByCollectionNsid() {
        FirehoseEvent event = FirehoseEvent.delete("at://did:plc:alice/network.cosmik.collectionLink/3k");
        when(collectionLinkProcessor.process(event)).thenReturn(FirehoseProcessingResult.APPLIED);

        assertThat(router(false).route(event)).isEqualTo(FirehoseProcessingResult.APPLIED);
        verifyNoInteractions(cardProcessor, collectionProcessor, deduplicator);
    }

    @Test
    void route_ignoresForeignCollectionsAndMalformedUris() {
        FirehoseEventRouter router = router(true);

        assertThat(router.route(FirehoseEvent.delete("at://did:plc:alice/app.bsky.feed.post/3k")))
                .isEqualTo(FirehoseProcessingResult.IGNORED);
        assertThat(router.route(FirehoseEvent.delete("https://example.com/not-an-at-uri")))
                .isEqualTo(FirehoseProcessingResult.IGNORED);
        verifyNoInteractions(deduplicator, cardProcessor, collectionProcessor, collectionLinkProcessor);
    }

    @Test
    void route_skipsEventsAlreadyApplied() {
        FirehoseEvent event = FirehoseEvent.delete(CARD_URI);
        when(deduplicator.isAlreadyApplied(event)).thenReturn(true);

        assertThat(router(true).route(event)).isEqualTo(FirehoseProcessingResult.SKIPPED);
        verifyNoInteractions(cardProcessor);
    }

    @Test
    void route_processesAnywayWhenDuplicateCheckFails() {
        FirehoseEvent event = FirehoseEvent.delete(CARD_URI);
        when(deduplicator.isAlreadyApplied(event)).thenThrow(new IllegalStateException("db down"));
        when(cardProcessor.process(any())).thenReturn(FirehoseProcessingResult.IGNORED);

        assertThat(router(true).route(event)).isEqualTo(FirehoseProcessingResult.IGNORED);
        verify(cardProcessor).process(event);
    }

    @Test
    void unresolvableDelete_completesWithoutMutations() {
        CoreFixture fx = new CoreFixture();

        FirehoseProcessingResult deduplicated = fx.firehoseRouter(true).route(FirehoseEvent.delete(CARD_URI));
        FirehoseProcessingResult processed = fx.firehoseRouter(false).route(FirehoseEvent.delete(CARD_URI));

        assertThat(deduplicated).isEqualTo(FirehoseProcessingResult.SKIPPED);
        assertThat(processed).isEqualTo(FirehoseProcessingResult.IGNORED);
        assertThat(fx.cards.saveCount()).isZero();
        assertThat(fx.cardPublisher.calls()).isEmpty();
    }

    @Test
    void duplicateCreate_isSkippedWhenDeduplicating() {
        CoreFixture fx = new CoreFixture();
        FirehoseEventRouter router = fx.firehoseRouter(true);
        FirehoseEvent event = FirehoseEvent.create(CARD_URI, "bafyU1", FirehoseRecords.urlCard("https://example.com/a"));

        assertThat(router.route(event)).isEqualTo(FirehoseProcessingResult.APPLIED);
        int saves = fx.cards.saveCount();

        assertThat(router.route(event)).isEqualTo(FirehoseProcessingResult.SKIPPED);
        assertThat(fx.cards.saveCount()).isEqualTo(saves);
    }
}
