package app.semble.core.card.repository;

import app.semble.core.card.domain.entity.CollectionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CollectionJpaRepository extends JpaRepository<CollectionEntity, UUID> {

    Optional<CollectionEntity> findFirstByPublishedRecordUri(String publishedRecordUri);

    @Query("""
            select distinct c from CollectionEntity c
            join c.cardLinks l
            where l.publishedRecordUri = :uri
            """)
    List<CollectionEntity> findByCardLinkPublishedRecordUri(@Param("uri") String uri);

    @Query("""
            select distinct c from CollectionEntity c
            join c.cardLinks l
            where c.authorId = :authorId and l.cardId = :cardId
            """)
    List<CollectionEntity> findByAuthorIdContainingCard(@Param("authorId") String authorId,
                                                        @Param("cardId") UUID cardId);
}
