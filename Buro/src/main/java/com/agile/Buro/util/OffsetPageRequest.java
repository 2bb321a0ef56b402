package com.agile.Buro.util;

import com.agile.Buro.exception.InvalidInputException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Objects;

/**
 * Pageable addressed by skip/limit instead of page number, so an arbitrary offset
 * does not have to be a multiple of the page size.
 */
public final class OffsetPageRequest implements Pageable {

    private final long offset;
    private final int limit;
    private final Sort sort;

    public OffsetPageRequest(long offset, int limit, Sort sort) {
        if (offset < 0) throw new IllegalArgumentException("skip must not be negative");
        if (limit < 1) throw new IllegalArgumentException("limit must be at least 1");
        this.offset = offset;
        this.limit = limit;
        this.sort = sort == null ? Sort.unsorted() : sort;
    }

    /**
     * Builds a request from optional query parameters. A missing limit falls back to
     * {@code defaultLimit}; a larger one is capped at {@code maxLimit}.
     */
    public static OffsetPageRequest of(Integer skip, Integer limit, int defaultLimit, int maxLimit, Sort sort) {
        long s = skip == null ? 0 : skip;
        if (s < 0) {
            throw new InvalidInputException("skip must not be negative");
        }
        int l = limit == null ? defaultLimit : limit;
        if (l < 1) {
            throw new InvalidInputException("limit must be at least 1");
        }
        return new OffsetPageRequest(s, Math.min(l, maxLimit), sort);
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Pageable next() {
        return new OffsetPageRequest(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetPageRequest(Math.max(0, offset - limit), limit, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetPageRequest(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetPageRequest((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetPageRequest that)) return false;
        return offset == that.offset && limit == that.limit && sort.equals(that.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, limit, sort);
    }
}
