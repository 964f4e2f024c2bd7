package com.dalatnews.backend.db.repository;

import com.dalatnews.backend.db.entity.NewsRawArticle;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NewsRawArticleRepository extends JpaRepository<NewsRawArticle, UUID> {

    List<NewsRawArticle> findBySourceUrlIn(Collection<String> sourceUrls);

    List<NewsRawArticle> findByStatus(String status);

    /**
     * Pending articles plus failed ones that still have attempts left, oldest first.
     */
    @Query("SELECT r FROM NewsRawArticle r WHERE r.status = 'pending' "
            + "OR (r.status = 'error' AND r.attempts < :maxAttempts) ORDER BY r.scrapedAt ASC")
    List<NewsRawArticle> findProcessingQueue(@Param("maxAttempts") int maxAttempts, Pageable pageable);
}
