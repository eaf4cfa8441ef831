package app.scapin.memory.review.repository;

import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import app.scapin.memory.review.entity.ReviewStateEntity;
import app.scapin.memory.review.entity.ReviewStateKey;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface ReviewStateJpaRepository extends JpaRepository<ReviewStateEntity, ReviewStateKey> {

    @Query("""
            select s
            from ReviewStateEntity s
            where s.cycle = :cycle
              and s.noteType in :types
              and s.importance <> :excluded
              and (s.nextDueAt is null or s.nextDueAt <= :now)
            order by s.importanceRank asc, s.nextDueAt asc nulls first
            """)
    List<ReviewStateEntity> findDue(@Param("cycle") CycleKind cycle,
                                    @Param("types") Collection<NoteType> types,
                                    @Param("excluded") ImportanceLevel excluded,
                                    @Param("now") Instant now,
                                    Pageable pageable);

    @Query("""
            select count(s)
            from ReviewStateEntity s
            where s.cycle = :cycle
              and s.lastCompletedAt >= :since
            """)
    long countCompletedSince(@Param("cycle") CycleKind cycle,
                             @Param("since") Instant since);
}
