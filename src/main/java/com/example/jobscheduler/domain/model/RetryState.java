package com.example.jobscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Bookkeeping of an outstanding retry: how many retries were consumed and when
 * the next one is permitted.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class RetryState {

    private final int attempts;
    private final Instant nextAt;
}
