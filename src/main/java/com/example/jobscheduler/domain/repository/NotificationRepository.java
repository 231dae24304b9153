package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Notification entity.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    /**
     * First page of notifications due at the given time, ordered by (scheduled at, id).
     */
    @Query("""
            SELECT n FROM Notification n
            WHERE n.scheduledAt <= :before
            ORDER BY n.scheduledAt ASC, n.id ASC
            """)
    List<Notification> findDue(@Param("before") Instant before, Pageable pageable);

    /**
     * Next page of due notifications, strictly after the (scheduled at, id) cursor.
     */
    @Query("""
            SELECT n FROM Notification n
            WHERE n.scheduledAt <= :before
              AND (n.scheduledAt > :lastScheduledAt OR (n.scheduledAt = :lastScheduledAt AND n.id > :lastId))
            ORDER BY n.scheduledAt ASC, n.id ASC
            """)
    List<Notification> findDueAfter(@Param("before") Instant before,
                                    @Param("lastScheduledAt") Instant lastScheduledAt,
                                    @Param("lastId") Long lastId,
                                    Pageable pageable);
}
