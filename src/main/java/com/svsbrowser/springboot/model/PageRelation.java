package com.svsbrowser.springboot.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "page_relation",
        uniqueConstraints = @UniqueConstraint(name = "uq_page_relation",
                columnNames = {"source_svs_id", "target_svs_id", "relation_type"}))
public class PageRelation {

    public static final String RELATED = "related";
    public static final String SEQUENCE = "sequence";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "relation_id", updatable = false, nullable = false)
    private UUID relationId;

    @Column(name = "source_svs_id", nullable = false)
    private Long sourceSvsId;

    @Column(name = "target_svs_id", nullable = false)
    private Long targetSvsId;

    @Column(name = "relation_type", nullable = false)
    private String relationType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
