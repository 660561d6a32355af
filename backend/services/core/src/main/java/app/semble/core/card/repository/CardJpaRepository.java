package app.semble.core.card.repository;

import app.semble.core.card.domain.entity.CardEntity;
import app.semble.core.card.domain.type.CardType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CardJpaRepository extends JpaRepository<CardEntity, UUID> {

    Optional<CardEntity> findFirstByCuratorIdAndCardTypeAndUrlOrderByCreatedAtAsc(String curatorId,
                                                                                 CardType cardType,
                                                                                 String url);

    @Query("""
            select distinct c from CardEntity c
            left join c.libraryMemberships m
            where c.publishedRecordUri = :uri or m.publishedRecordUri = :uri
            """)
    List<CardEntity> findByAnyPublishedRecordUri(@Param("uri") String uri);
}
