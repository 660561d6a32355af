package app.semble.core.card.domain.model;

import app.semble.core.card.domain.content.HighlightCardContent;
import app.semble.core.card.domain.content.HighlightSelector;
import app.semble.core.card.domain.content.NoteCardContent;
import app.semble.core.card.domain.content.UrlCardContent;
import app.semble.core.card.domain.event.CardAddedToLibraryEvent;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.PublishedRecordId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.common.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardTest {

    private static final CuratorId ALICE = CuratorId.of("did:plc:alice");
    private static final CuratorId BOB = CuratorId.of("did:plc:bob");
    private static final Url URL = Url.of("https://example.com/article");

    @Test
    void urlCard_takesTypeAndUrlFromContent() {
        Card card = CardFactory.urlCard(ALICE, URL, null);

        assertThat(card.getType()).isEqualTo(CardType.URL);
        assertThat(card.getUrl()).isEqualTo(URL);
        assertThat(card.getLibraryCount()).isZero();
        assertThat(card.getPublishedRecordId()).isNull();
    }

    @Test
    void urlCard_rejectsParentAndMismatchedUrl() {
        assertThatThrownBy(() -> CardFactory.create(ALICE, UrlCardContent.of(URL), CardId.generate(), URL))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CardFactory.create(ALICE, UrlCardContent.of(URL), null, Url.of("https://other.org")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void highlightCard_requiresParent() {
        HighlightCardContent content = new HighlightCardContent("quoted",
                List.of(new HighlightSelector.TextQuote("quoted", null, null)), null, null, null);

        assertThatThrownBy(() -> CardFactory.highlightCard(ALICE, content, null, URL))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("parent");
        assertThat(CardFactory.highlightCard(ALICE, content, CardId.generate(), URL).getType())
                .isEqualTo(CardType.HIGHLIGHT);
    }

    @Test
    void addToLibrary_keepsCountInStepWithMembershipsAndRaisesEvent() {
        Card card = CardFactory.urlCard(ALICE, URL, null);

        card.addToLibrary(ALICE);
        card.addToLibrary(BOB);

        assertThat(card.getLibraryCount()).isEqualTo(2);
        assertThat(card.getLibraryMemberships()).extracting(LibraryMembership::getCuratorId)
                .containsExactly(ALICE, BOB);
        assertThat(card.pullDomainEvents())
                .hasSize(2)
                .allMatch(CardAddedToLibraryEvent.class::isInstance);
        assertThat(card.pullDomainEvents()).isEmpty();
    }

    @Test
    void addToLibrary_twiceForSameCuratorFails() {
        Card card = CardFactory.urlCard(ALICE, URL, null);
        card.addToLibrary(ALICE);

        assertThatThrownBy(() -> card.addToLibrary(ALICE)).isInstanceOf(ValidationException.class);
        assertThat(card.getLibraryCount()).isEqualTo(1);
    }

    @Test
    void removeFromLibrary_failsWhenAbsent() {
        Card card = CardFactory.urlCard(ALICE, URL, null);

        assertThatThrownBy(() -> card.removeFromLibrary(BOB)).isInstanceOf(ValidationException.class);
    }

    @Test
    void markCardInLibraryAsPublished_setsAggregateRecordOnlyOnce() {
        Card card = CardFactory.urlCard(ALICE, URL, null);
        card.addToLibrary(ALICE);
        card.addToLibrary(BOB);
        PublishedRecordId aliceRecord = PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/a", "c1");
        PublishedRecordId bobRecord = PublishedRecordId.of("at://did:plc:bob/network.cosmik.card/b", "c2");

        card.markCardInLibraryAsPublished(ALICE, aliceRecord);
        card.markCardInLibraryAsPublished(BOB, bobRecord);

        assertThat(card.getPublishedRecordId()).isEqualTo(aliceRecord);
        assertThat(card.findMembership(BOB)).get()
                .extracting(LibraryMembership::getPublishedRecordId)
                .isEqualTo(bobRecord);
    }

    @Test
    void markCardInLibraryAsPublished_acceptsNewRevisionButNotAnotherRecord() {
        Card card = CardFactory.urlCard(ALICE, URL, null);
        card.addToLibrary(ALICE);
        card.markCardInLibraryAsPublished(ALICE, PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/a", "c1"));

        card.markCardInLibraryAsPublished(ALICE, PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/a", "c2"));

        assertThat(card.getPublishedRecordId().cid()).isEqualTo("c2");
        assertThatThrownBy(() -> card.markCardInLibraryAsPublished(ALICE,
                PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/other", "c3")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void markCardInLibraryAsPublished_requiresMembership() {
        Card card = CardFactory.urlCard(ALICE, URL, null);

        assertThatThrownBy(() -> card.markCardInLibraryAsPublished(ALICE,
                PublishedRecordId.of("at://did:plc:alice/network.cosmik.card/a", "c1")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void updateNoteText_replacesTextOfNotesOnly() {
        Card note = CardFactory.noteCard(ALICE, "first", CardId.generate(), URL);
        note.updateNoteText("  second  ");

        assertThat(((NoteCardContent) note.getContent()).text()).isEqualTo("second");
        assertThatThrownBy(() -> CardFactory.urlCard(ALICE, URL, null).updateNoteText("x"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void updateContent_cannotChangeTypeOrUrl() {
        Card card = CardFactory.urlCard(ALICE, URL, null);

        assertThatThrownBy(() -> card.updateContent(NoteCardContent.of("text")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> card.updateContent(UrlCardContent.of(Url.of("https://elsewhere.net"))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void restore_rejectsLibraryCountThatDisagreesWithMemberships() {
        Instant now = Instant.now();
        List<LibraryMembership> memberships = List.of(new LibraryMembership(ALICE, now, null));

        assertThatThrownBy(() -> Card.restore(CardId.generate(), ALICE, UrlCardContent.of(URL), null, URL,
                memberships, 2, null, now, now, 0L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("library count");
    }

    @Test
    void restore_rejectsDuplicateMemberships() {
        Instant now = Instant.now();
        List<LibraryMembership> memberships = List.of(
                new LibraryMembership(ALICE, now, null),
                new LibraryMembership(ALICE, now, null));

        assertThatThrownBy(() -> Card.restore(CardId.generate(), ALICE, UrlCardContent.of(URL), null, URL,
                memberships, 2, null, now, now, 0L))
                .isInstanceOf(ValidationException.class);
    }
}
