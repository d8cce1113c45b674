package com.svsbrowser.springboot.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A media item embedded in a page. Files, thumbnails and caption chunks are owned by the asset
 * and go away with it.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "asset")
public class Asset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "asset_id", updatable = false, nullable = false)
    private UUID assetId;

    @Column(name = "svs_id", nullable = false)
    private Long svsId;

    @Column(name = "media_type", nullable = false)
    private String mediaType;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "caption_html", columnDefinition = "TEXT")
    private String captionHtml;

    @Column(name = "caption_text", columnDefinition = "TEXT")
    private String captionText;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Builder.Default
    @OneToMany(mappedBy = "asset", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<AssetFile> files = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "asset", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<AssetThumbnail> thumbnails = new ArrayList<>();

    @Builder.Default
    @OneToMany(mappedBy = "asset", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("section ASC, chunkIndex ASC")
    private List<AssetTextChunk> textChunks = new ArrayList<>();

    public void addFile(AssetFile file) {
        file.setAsset(this);
        files.add(file);
    }

    public void addThumbnail(AssetThumbnail thumbnail) {
        thumbnail.setAsset(this);
        thumbnails.add(thumbnail);
    }

    public void addTextChunk(AssetTextChunk chunk) {
        chunk.setAsset(this);
        textChunks.add(chunk);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
