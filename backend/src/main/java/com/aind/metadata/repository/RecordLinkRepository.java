package com.aind.metadata.repository;

import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Links are stored with source id &lt; target id, so lookups pass the pair in that order.
 */
@Repository
public interface RecordLinkRepository extends JpaRepository<RecordLink, Long> {

    Optional<RecordLink> findBySourceIdAndTargetId(String sourceId, String targetId);

    @Query("SELECT l.target FROM RecordLink l WHERE l.source.id = :recordId")
    List<MetadataRecord> findTargetsOf(@Param("recordId") String recordId);

    @Query("SELECT l.source FROM RecordLink l WHERE l.target.id = :recordId")
    List<MetadataRecord> findSourcesOf(@Param("recordId") String recordId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RecordLink l WHERE l.source.id = :sourceId AND l.target.id = :targetId")
    int deletePair(@Param("sourceId") String sourceId, @Param("targetId") String targetId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RecordLink l WHERE l.source.id = :recordId OR l.target.id = :recordId")
    int deleteIncidentTo(@Param("recordId") String recordId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        DELETE FROM RecordLink l
        WHERE l.source.id IN (SELECT r.id FROM MetadataRecord r WHERE r.sessionId = :sessionId)
           OR l.target.id IN (SELECT r.id FROM MetadataRecord r WHERE r.sessionId = :sessionId)
        """)
    int deleteTouchingSession(@Param("sessionId") String sessionId);
}
