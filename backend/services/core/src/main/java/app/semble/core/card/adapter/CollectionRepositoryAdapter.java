package app.semble.core.card.adapter;

import app.semble.core.card.domain.entity.CollectionEntity;
import app.semble.core.card.domain.model.Collection;
import app.semble.core.card.domain.value.CardId;
import app.semble.core.card.domain.value.CollectionId;
import app.semble.core.card.domain.value.CuratorId;
import app.semble.core.card.repository.CollectionJpaRepository;
import app.semble.core.card.repository.CollectionRepository;
import app.semble.core.common.error.UnexpectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

@Component
public class CollectionRepositoryAdapter implements CollectionRepository {

    private final CollectionJpaRepository collectionJpaRepository;
    private final CollectionEntityMapper mapper;

    public CollectionRepositoryAdapter(CollectionJpaRepository collectionJpaRepository, CollectionEntityMapper mapper) {
        this.collectionJpaRepository = collectionJpaRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Collection> findById(CollectionId collectionId) {
        return translate("load collection " + collectionId,
                () -> collectionJpaRepository.findById(collectionId.value()).map(mapper::toDomain));
    }

    @Override
    @Transactional
    public Collection save(Collection collection) {
        return translate("save collection " + collection.getId(), () -> {
            CollectionEntity entity;
            if (collection.getVersion() == null) {
                entity = new CollectionEntity();
            } else {
                entity = collectionJpaRepository.findById(collection.getId().value())
                        .orElseThrow(() -> new ObjectOptimisticLockingFailureException(
                                CollectionEntity.class, collection.getId().value()));
                if (!Objects.equals(entity.getVersion(), collection.getVersion())) {
                    throw new ObjectOptimisticLockingFailureException(CollectionEntity.class, collection.getId().value());
                }
            }
            mapper.copyToEntity(collection, entity);
            return mapper.toDomain(collectionJpaRepository.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional
    public void delete(CollectionId collectionId) {
        translate("delete collection " + collectionId, () -> {
            collectionJpaRepository.deleteById(collectionId.value());
            return null;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<Collection> findByCuratorContainingCard(CuratorId curatorId, CardId cardId) {
        return translate("find collections of " + curatorId + " containing " + cardId, () -> collectionJpaRepository
                .findByAuthorIdContainingCard(curatorId.value(), cardId.value())
                .stream()
                .map(mapper::toDomain)
                .toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Collection> findByPublishedRecordUri(String uri) {
        return translate("resolve collection record " + uri,
                () -> collectionJpaRepository.findFirstByPublishedRecordUri(uri).map(mapper::toDomain));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Collection> findByCardLinkPublishedRecordUri(String uri) {
        return translate("resolve collection link record " + uri, () -> collectionJpaRepository
                .findByCardLinkPublishedRecordUri(uri)
                .stream()
                .findFirst()
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
