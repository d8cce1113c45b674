package com.svsbrowser.springboot.repository;

import com.svsbrowser.springboot.model.SvsPage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SvsPageRepository extends JpaRepository<SvsPage, Long>, SvsPageRepositoryCustom {

    @Query("SELECT p.svsId FROM SvsPage p " +
            "WHERE (:skipExisting = false OR p.htmlCrawledAt IS NULL) " +
            "ORDER BY p.svsId")
    List<Long> findCrawlCandidateIds(@Param("skipExisting") boolean skipExisting, Pageable pageable);

    @Query("SELECT p.svsId FROM SvsPage p " +
            "WHERE p.svsId IN :ids AND (:skipExisting = false OR p.htmlCrawledAt IS NULL) " +
            "ORDER BY p.svsId")
    List<Long> findCrawlCandidateIdsIn(@Param("ids") Collection<Long> ids,
                                       @Param("skipExisting") boolean skipExisting,
                                       Pageable pageable);

    /**
     * Pages crawled before rich content was captured, newest publications first.
     */
    @Query("SELECT p.svsId FROM SvsPage p " +
            "WHERE p.htmlCrawledAt IS NOT NULL AND p.contentJson IS NULL " +
            "ORDER BY p.publishedDate DESC NULLS LAST, p.svsId")
    List<Long> findIdsNeedingContentByRecency(Pageable pageable);

    @Query("SELECT p.svsId FROM SvsPage p " +
            "WHERE p.htmlCrawledAt IS NOT NULL AND p.contentJson IS NULL " +
            "ORDER BY p.svsId")
    List<Long> findIdsNeedingContentById(Pageable pageable);

    @Query("SELECT p FROM SvsPage p " +
            "WHERE p.thumbnailUrl IS NOT NULL AND p.thumbnailStorageUri IS NULL " +
            "ORDER BY p.svsId")
    List<SvsPage> findPagesWithUncachedThumbnails(Pageable pageable);
}
