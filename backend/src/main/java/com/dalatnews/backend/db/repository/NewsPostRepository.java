package com.dalatnews.backend.db.repository;

import com.dalatnews.backend.db.entity.NewsPost;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NewsPostRepository extends JpaRepository<NewsPost, UUID> {

    Optional<NewsPost> findFirstByContentFingerprint(String contentFingerprint);

    boolean existsBySlug(String slug);
}
