package com.aind.metadata.repository;

import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordCategory;
import com.aind.metadata.model.RecordStatus;
import com.aind.metadata.model.RecordType;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;

@Repository
public interface MetadataRecordRepository extends JpaRepository<MetadataRecord, String>,
        JpaSpecificationExecutor<MetadataRecord> {

    List<MetadataRecord> findBySessionIdOrderByCreatedAtAsc(String sessionId);

    boolean existsBySessionId(String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM MetadataRecord r WHERE r.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);

    // Optional filters; a null argument leaves the filter out.

    static Specification<MetadataRecord> hasType(RecordType recordType) {
        return (root, query, cb) -> recordType == null ? null : cb.equal(root.get("recordType"), recordType);
    }

    static Specification<MetadataRecord> inCategory(RecordCategory category) {
        return (root, query, cb) -> category == null ? null : cb.equal(root.get("category"), category);
    }

    static Specification<MetadataRecord> inSession(String sessionId) {
        return (root, query, cb) -> sessionId == null ? null : cb.equal(root.get("sessionId"), sessionId);
    }

    static Specification<MetadataRecord> hasStatus(RecordStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    /** Case-insensitive substring match on the name or the serialized data. */
    static Specification<MetadataRecord> mentions(String text) {
        return (root, query, cb) -> {
            if (text == null || text.isBlank()) {
                return null;
            }
            String pattern = "%" + escapeLike(text.trim().toLowerCase(Locale.ROOT)) + "%";
            return cb.or(
                    cb.like(cb.lower(root.<String>get("name")), pattern, LIKE_ESCAPE),
                    cb.like(cb.lower(root.<String>get("dataJson")), pattern, LIKE_ESCAPE));
        };
    }

    char LIKE_ESCAPE = '\\';

    /** Wildcards in user text match literally. */
    static String escapeLike(String text) {
        return text.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
