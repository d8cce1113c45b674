package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.PageTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PageTagRepository extends JpaRepository<PageTag, UUID> {

    boolean existsBySvsIdAndTag_TagId(Long svsId, UUID tagId);
}
