package com.example.jobscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A notification waiting to be sent once its scheduled time has come.
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notifications_scheduled_at", columnList = "scheduled_at, id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Where the notification goes, e.g. an email address
     */
    @Column(name = "destination", nullable = false, length = 320)
    private String destination;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;
}
