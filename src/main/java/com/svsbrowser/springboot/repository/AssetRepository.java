package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.Asset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssetRepository extends JpaRepository<Asset, UUID> {

    List<Asset> findBySvsIdOrderByPositionAsc(Long svsId);

    @Query("SELECT c.chunkId FROM AssetTextChunk c WHERE c.asset.svsId = :svsId")
    List<UUID> findTextChunkIdsBySvsId(@Param("svsId") Long svsId);
}
