package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.PageTextChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PageTextChunkRepository extends JpaRepository<PageTextChunk, UUID>, PageTextChunkRepositoryCustom {

    @Query("SELECT c.chunkId FROM PageTextChunk c WHERE c.svsId = :svsId")
    List<UUID> findChunkIdsBySvsId(@Param("svsId") Long svsId);

    @Modifying
    @Query("DELETE FROM PageTextChunk c WHERE c.svsId = :svsId")
    int deleteBySvsId(@Param("svsId") Long svsId);
}
