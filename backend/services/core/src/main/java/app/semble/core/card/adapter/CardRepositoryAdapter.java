package app.semble.core.card.adapter;

import app.semble.core.card.domain.entity.CardEntity;
import app.semble.core.card.domain.model.Card;
import app.semble.core.card.domain.type.CardType;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.domain.value.Url;
import app.semble.core.card.repository.CardJpaRepository;
import app.semble.core.card.repository.CardRepository;
import app.semble.core.common.error.UnexpectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

@Component
public class CardRepositoryAdapter implements CardRepository {

    private final CardJpaRepository cardJpaRepository;
    private final CardEntityMapper mapper;

    public CardRepositoryAdapter(CardJpaRepository cardJpaRepository, CardEntityMapper mapper) {
        this.cardJpaRepository = cardJpaRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findById(CardId cardId) {
        return translate("load card " + cardId,
                () -> cardJpaRepository.findById(cardId.value()).map(mapper::toDomain));
    }

    @Override
    @Transactional
    public Card save(Card card) {
        return translate("save card " + card.getId(), () -> {
            CardEntity entity;
            if (card.getVersion() == null) {
                entity = new CardEntity();
            } else {
                entity = cardJpaRepository.findById(card.getId().value())
                        .orElseThrow(() -> new ObjectOptimisticLockingFailureException(CardEntity.class, card.getId().value()));
                if (!Objects.equals(entity.getVersion(), card.getVersion())) {
                    throw new ObjectOptimisticLockingFailureException(CardEntity.class, card.getId().value());
                }
            }
            mapper.copyToEntity(card, entity);
            return mapper.toDomain(cardJpaRepository.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional
    public void delete(CardId cardId) {
        translate("delete card " + cardId, () -> {
            cardJpaRepository.deleteById(cardId.value());
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findUsersUrlCardByUrl(Url url, CuratorId curatorId) {
        return findByUrl(CardType.URL, url, curatorId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findUsersNoteCardByUrl(Url url, CuratorId curatorId) {
        return findByUrl(CardType.NOTE, url, curatorId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Card> findByPublishedRecordUri(String uri) {
        return translate("resolve card record " + uri, () -> cardJpaRepository.findByAnyPublishedRecordUri(uri)
                .stream()
                .findFirst()
                .map(mapper::toDomain));
    }

    private Optional<Card> findByUrl(CardType type, Url url, CuratorId curatorId) {
        return translate("find " + type + " card for " + url, () -> cardJpaRepository
                .findFirstByCuratorIdAndCardTypeAndUrlOrderByCreatedAtAsc(curatorId.value(), type, url.value())
                .map(mapper::toDomain));
    }

    private static <T> T translate(String action, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            throw new UnexpectedException("Failed to " + action + ": " + ex.getMessage(), ex);
        }
    }
}
