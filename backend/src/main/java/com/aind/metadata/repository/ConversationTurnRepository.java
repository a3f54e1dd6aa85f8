package com.aind.metadata.repository;

import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.SessionSummary;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, Long> {

    List<ConversationTurn> findBySessionIdOrderByCreatedAtAscIdAsc(String sessionId);

    /** Newest first; callers reverse for chronological order. */
    List<ConversationTurn> findBySessionIdOrderByCreatedAtDescIdDesc(String sessionId, Pageable pageable);

    Optional<ConversationTurn> findFirstBySessionIdAndRoleOrderByCreatedAtAscIdAsc(String sessionId, String role);

    boolean existsBySessionId(String sessionId);

    @Query("""
        SELECT new com.aind.metadata.model.SessionSummary(t.sessionId, MIN(t.createdAt), MAX(t.createdAt), COUNT(t))
        FROM ConversationTurn t
        GROUP BY t.sessionId
        ORDER BY MAX(t.createdAt) DESC
        """)
    List<SessionSummary> summarizeSessions();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ConversationTurn t WHERE t.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);
}
