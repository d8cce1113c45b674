package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.IngestRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface IngestRunRepository extends JpaRepository<IngestRun, UUID> {
}
