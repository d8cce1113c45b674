package com.svsbrowser.springboot.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "page_tag",
        uniqueConstraints = @UniqueConstraint(name = "uq_page_tag", columnNames = {"svs_id", "tag_id"}))
public class PageTag {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "page_tag_id", updatable = false, nullable = false)
    private UUID pageTagId;

    @Column(name = "svs_id", nullable = false)
    private Long svsId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tag_id", nullable = false)
    private Tag tag;
}
