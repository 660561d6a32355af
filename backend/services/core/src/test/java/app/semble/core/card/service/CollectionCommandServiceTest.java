package app.semble.core.card.service;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.request.CreateCollectionRequest;
import app.semble.core.card.domain.request.OperationContext;
import app.semble.core.card.domain.request.UpdateCollectionRequest;
import app.semble.core.card.domain.type.CollectionAccessType;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.common.error.CollectionAccessException;
import app.semble.core.common.error.ValidationException;
import app.semble.core.support.CoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static app.semble.core.support.CoreFixture.ALICE;
import static app.semble.core.support.CoreFixture.BOB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionCommandServiceTest {

    private CoreFixture fx;
    private CollectionCommandService service;

    @BeforeEach
    void setUp() {
        fx = new CoreFixture();
        service = fx.collectionCommandService;
    }

    @Test
    void createCollection_publishesUserInitiatedCollections() {
        Collection collection = service.createCollection(
                CreateCollectionRequest.userInitiated(ALICE.value(), "  Reading ", "things to read"));

        assertThat(collection.getName().value()).isEqualTo("Reading");
        assertThat(collection.getAccessType()).isEqualTo(CollectionAccessType.CLOSED);
        assertThat(collection.getPublishedRecordId()).isNotNull();
        assertThat(fx.collections.count()).isEqualTo(1);
    }

    @Test
    void createCollection_fromFirehoseKeepsGivenRecord() {
        PublishedRecordId recordId = PublishedRecordId.of("at://did:plc:alice/network.cosmik.collection/c1", "bafyC");

        Collection collection = service.createCollection(new CreateCollectionRequest(ALICE.value(), "Reading", null,
                CollectionAccessType.OPEN, List.of(BOB.value()), OperationContext.FIREHOSE_EVENT, recordId));

        assertThat(collection.getPublishedRecordId()).isEqualTo(recordId);
        assertThat(collection.getCollaborators()).containsExactly(BOB);
        assertThat(fx.collectionPublisher.calls()).isEmpty();
    }

    @Test
    void createCollection_duringMigrationCreatesUnpublishedCollection() {
        Collection collection = service.createCollection(new CreateCollectionRequest(ALICE.value(), "Imported", null,
                CollectionAccessType.CLOSED, List.of(), OperationContext.SYSTEM_MIGRATION, null));

        assertThat(collection.getPublishedRecordId()).isNull();
        assertThat(fx.collections.count()).isEqualTo(1);
        assertThat(fx.collectionPublisher.calls()).isEmpty();
    }

    @Test
    void createCollection_rejectsOverlongName() {
        assertThatThrownBy(() -> service.createCollection(
                CreateCollectionRequest.userInitiated(ALICE.value(), "x".repeat(101), null)))
                .isInstanceOf(ValidationException.class);
        assertThat(fx.collections.count()).isZero();
    }

    @Test
    void updateCollection_republishesPublishedCollection() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));
        String uri = created.getPublishedRecordId().uri();

        Collection updated = service.updateCollection(new UpdateCollectionRequest(created.getId().toString(),
                ALICE.value(), "Renamed", "desc", OperationContext.USER_INITIATED, null));

        assertThat(updated.getName().value()).isEqualTo("Renamed");
        assertThat(updated.getPublishedRecordId().uri()).isEqualTo(uri);
        assertThat(fx.collectionPublisher.calls()).filteredOn(c -> c.startsWith("publish:")).hasSize(2);
    }

    @Test
    void updateCollection_byNonAuthorIsRejected() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));

        assertThatThrownBy(() -> service.updateCollection(new UpdateCollectionRequest(created.getId().toString(),
                BOB.value(), "Mine now", null, OperationContext.USER_INITIATED, null)))
                .isInstanceOf(CollectionAccessException.class);
    }

    @Test
    void settings_changeAccessAndCollaborators() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));
        String id = created.getId().toString();

        service.changeAccessType(id, ALICE.value(), CollectionAccessType.OPEN);
        service.addCollaborator(id, ALICE.value(), BOB.value());

        Collection reloaded = fx.reload(created);
        assertThat(reloaded.getAccessType()).isEqualTo(CollectionAccessType.OPEN);
        assertThat(reloaded.isCollaborator(BOB)).isTrue();

        service.removeCollaborator(id, ALICE.value(), BOB.value());
        assertThat(fx.reload(created).isCollaborator(BOB)).isFalse();
    }

    @Test
    void deleteCollection_unpublishesLinksAndCollection() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));
        Card card = fx.storedUrlCard(ALICE, "https://example.com/a");
        service.addCardToCollections(card.getId().toString(), List.of(created.getId().toString()), ALICE.value());

        service.deleteCollection(created.getId().toString(), ALICE.value(), OperationContext.USER_INITIATED);

        assertThat(fx.collections.count()).isZero();
        assertThat(fx.collectionPublisher.calls())
                .filteredOn(c -> c.startsWith("unlink:") || c.startsWith("unpublish:"))
                .hasSize(2)
                .first().asString().startsWith("unlink:");
    }

    @Test
    void deleteCollection_fromFirehoseDoesNotUnpublish() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));

        service.deleteCollection(created.getId().toString(), ALICE.value(), OperationContext.FIREHOSE_EVENT);

        assertThat(fx.collections.count()).isZero();
        assertThat(fx.collectionPublisher.calls()).noneMatch(c -> c.startsWith("unpublish:"));
    }

    @Test
    void deleteCollection_byNonAuthorIsRejected() {
        Collection created = service.createCollection(CreateCollectionRequest.userInitiated(ALICE.value(), "Reading", null));

        assertThatThrownBy(() -> service.deleteCollection(created.getId().toString(), BOB.value(),
                OperationContext.USER_INITIATED))
                .isInstanceOf(CollectionAccessException.class);
        assertThat(fx.collections.count()).isEqualTo(1);
    }
}
