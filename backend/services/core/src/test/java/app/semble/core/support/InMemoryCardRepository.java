package app.semble.core.support;

import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.model.LibraryMembership;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.card.repository.CardRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryCardRepository implements CardRepository {

    private final Map<CardId, Card> cards = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public Optional<Card> findById(CardId cardId) {
        return Optional.ofNullable(cards.get(cardId));
    }

    @Override
    public Card save(Card card) {
        saves.incrementAndGet();
        cards.put(card.getId(), card);
        return card;
    }

    @Override
    public void delete(CardId cardId) {
        cards.remove(cardId);
    }

    @Override
    public Optional<Card> findUsersUrlCardByUrl(Url url, CuratorId curatorId) {
        return findAuthored(CardType.URL, url, curatorId);
    }

    @Override
    public Optional<Card> findUsersNoteCardByUrl(Url url, CuratorId curatorId) {
        return findAuthored(CardType.NOTE, url, curatorId);
    }

    @Override
    public Optional<Card> findByPublishedRecordUri(String uri) {
        return cards.values().stream()
                .filter(card -> carries(card, uri))
                .findFirst();
    }

    public List<Card> findAll() {
        return List.copyOf(cards.values());
    }

    public int count() {
        return cards.size();
    }

    public int saveCount() {
        return saves.get();
    }

    private Optional<Card> findAuthored(CardType type, Url url, CuratorId curatorId) {
        return cards.values().stream()
                .filter(card -> card.getType() == type)
                .filter(card -> card.isAuthoredBy(curatorId))
                .filter(card -> url.equals(card.getUrl()))
                .min(Comparator.comparing(Card::getCreatedAt));
    }

    private static boolean carries(Card card, String uri) {
        if (card.getPublishedRecordId() != null && uri.equals(card.getPublishedRecordId().uri())) {
            return true;
        }
        return card.getLibraryMemberships().stream()
                .map(LibraryMembership::getPublishedRecordId)
                .anyMatch(id -> id != null && uri.equals(id.uri()));
    }
}
