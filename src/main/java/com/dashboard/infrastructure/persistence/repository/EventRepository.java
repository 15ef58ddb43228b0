package com.dashboard.infrastructure.persistence.repository;

import com.dashboard.infrastructure.persistence.entity.EventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read queries backing the events-table data source.
 */
@Repository
public interface EventRepository extends JpaRepository<EventEntity, UUID> {

    List<EventEntity> findByTimestampBetweenOrderByTimestampAsc(Instant startTime, Instant endTime);

    /**
     * Event counts per hour, oldest first.
     */
    @Query(value = "SELECT " +
           "DATE_TRUNC('hour', event_time) AS bucket_start, " +
           "COUNT(*) AS event_count " +
           "FROM events " +
           "WHERE event_time BETWEEN :startTime AND :endTime " +
           "GROUP BY DATE_TRUNC('hour', event_time) " +
           "ORDER BY bucket_start ASC",
           nativeQuery = true)
    List<Object[]> aggregateEventsByHour(
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );
}
