package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.PageRelation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PageRelationRepository extends JpaRepository<PageRelation, UUID> {

    boolean existsBySourceSvsIdAndTargetSvsIdAndRelationType(Long sourceSvsId, Long targetSvsId, String relationType);
}
