package com.example.jobscheduler.service.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeysetPager Tests")
class KeysetPagerTest {

    private final List<Integer> source = IntStream.rangeClosed(1, 7).boxed().toList();
    private final List<Integer> requestedCursors = new ArrayList<>();

    private List<Integer> fetch(Integer cursor, int pageSize) {
        requestedCursors.add(cursor);
        return source.stream()
                .filter(value -> cursor == null || value > cursor)
                .limit(pageSize)
                .toList();
    }

    @Test
    @DisplayName("Should walk all pages using the last element as cursor")
    void shouldWalkAllPages() {
        var result = KeysetPager.<Integer>stream(cursor -> fetch(cursor, 3), 3).toList();

        assertThat(result).containsExactly(1, 2, 3, 4, 5, 6, 7);
        assertThat(requestedCursors).containsExactly(null, 3, 6);
    }

    @Test
    @DisplayName("Should fetch one extra empty page when the last page is full")
    void shouldStopOnEmptyPage() {
        var result = KeysetPager.<Integer>stream(cursor -> fetch(cursor, 7), 7).toList();

        assertThat(result).hasSize(7);
        assertThat(requestedCursors).containsExactly(null, 7);
    }

    @Test
    @DisplayName("Should only fetch pages that are consumed")
    void shouldBeLazy() {
        var result = KeysetPager.<Integer>stream(cursor -> fetch(cursor, 2), 2).limit(2).toList();

        assertThat(result).containsExactly(1, 2);
        assertThat(requestedCursors).containsExactly((Integer) null);
    }
}
