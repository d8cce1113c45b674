package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TagRepository extends JpaRepository<Tag, UUID> {

    Optional<Tag> findByTagTypeAndNormalizedValue(String tagType, String normalizedValue);
}
