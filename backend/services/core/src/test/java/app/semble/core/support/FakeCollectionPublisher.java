package app.semble.core.support;

import app.semble.core.card.api.CollectionPublisher;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeCollectionPublisher implements CollectionPublisher {

    private final AtomicInteger sequence = new AtomicInteger();
    private final List<String> calls = new ArrayList<>();
    private RuntimeException unpublishLinkFailure;

    @Override
    public synchronized PublishedRecordId publish(Collection collection) {
        calls.add("publish:" + collection.getId());
        int n = sequence.incrementAndGet();
        String uri = collection.getPublishedRecordId() != null
                ? collection.getPublishedRecordId().uri()
                : "at://" + collection.getAuthorId().value() + "/network.cosmik.collection/rk" + n;
        return new PublishedRecordId(uri, "ccid" + n);
    }

    @Override
    public synchronized void unpublish(PublishedRecordId recordId) {
        calls.add("unpublish:" + recordId.uri());
    }

    @Override
    public synchronized PublishedRecordId publishCardAddedToCollection(Card card, Collection collection, CuratorId curatorId) {
        calls.add("link:" + card.getId() + ":" + collection.getId());
        int n = sequence.incrementAndGet();
        return new PublishedRecordId("at://" + curatorId.value() + "/network.cosmik.collectionLink/rk" + n, "lcid" + n);
    }

    @Override
    public synchronized void unpublishCardAddedToCollection(PublishedRecordId recordId) {
        if (unpublishLinkFailure != null) {
            throw unpublishLinkFailure;
        }
        calls.add("unlink:" + recordId.uri());
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    public void failUnlinkWith(RuntimeException failure) {
        this.unpublishLinkFailure = failure;
    }
}
