package com.dalatnews.backend.db.repository;

import com.dalatnews.backend.db.entity.CommunityEvent;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CommunityEventRepository extends JpaRepository<CommunityEvent, UUID> {

    List<CommunityEvent> findByStatusAndStartsAtGreaterThanEqual(String status, OffsetDateTime from, Pageable pageable);
}
