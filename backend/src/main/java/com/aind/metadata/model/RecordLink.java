package com.aind.metadata.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Undirected edge between two records, stored as (lower id, higher id).
 */
@Entity
@Table(name = "record_links",
    uniqueConstraints = @UniqueConstraint(name = "uk_record_links_pair", columnNames = {"source_id", "target_id"}),
    indexes = @Index(name = "idx_record_links_target", columnList = "target_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecordLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_id", nullable = false)
    private MetadataRecord source;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "target_id", nullable = false)
    private MetadataRecord target;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static RecordLink between(MetadataRecord a, MetadataRecord b) {
        RecordLink link = new RecordLink();
        boolean inOrder = a.getId().compareTo(b.getId()) <= 0;
        link.source = inOrder ? a : b;
        link.target = inOrder ? b : a;
        link.createdAt = LocalDateTime.now();
        return link;
    }

    public static String lowerId(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static String higherId(String a, String b) {
        return a.compareTo(b) <= 0 ? b : a;
    }
}
