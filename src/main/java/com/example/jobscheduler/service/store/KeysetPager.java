package com.example.jobscheduler.service.store;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily walks a result set page by page, using the last element of each page as the
 * cursor for the next one.
 * <p>
 * A page is only fetched when the previous one is consumed. A page shorter than the page
 * size ends the walk.
 *
 * @param <T> element type
 */
public final class KeysetPager<T> implements Iterator<T> {

    private final Function<T, List<T>> pageFetcher;
    private final int pageSize;

    private List<T> page = List.of();
    private int index;
    private T cursor;
    private boolean lastPageFetched;

    private KeysetPager(Function<T, List<T>> pageFetcher, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        this.pageFetcher = pageFetcher;
        this.pageSize = pageSize;
    }

    /**
     * @param pageFetcher receives the last element of the previous page, or {@code null} for the first page
     */
    public static <T> Stream<T> stream(Function<T, List<T>> pageFetcher, int pageSize) {
        var pager = new KeysetPager<>(pageFetcher, pageSize);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(pager, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public boolean hasNext() {
        if (index < page.size()) {
            return true;
        }
        if (lastPageFetched) {
            return false;
        }

        page = pageFetcher.apply(cursor);
        index = 0;
        lastPageFetched = page.size() < pageSize;
        if (page.isEmpty()) {
            return false;
        }
        cursor = page.get(page.size() - 1);
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.get(index++);
    }
}
