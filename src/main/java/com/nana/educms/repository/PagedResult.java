package com.nana.educms.repository;

import java.util.List;

/**
 * One page of a query result together with the size of the whole filtered set.
 *
 * <p>Immutable. {@code pageNumber} and {@code pageSize} are the values
 * actually used after clamping, not the ones the caller asked for.
 *
 * @param <T> item type
 */
public final class PagedResult<T> {

    private final List<T> items;
    private final int totalCount;
    private final int pageNumber;
    private final int pageSize;

    public PagedResult(List<T> items, int totalCount, int pageNumber, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
        }
        this.items      = items == null ? List.of() : List.copyOf(items);
        this.totalCount = totalCount;
        this.pageNumber = pageNumber;
        this.pageSize   = pageSize;
    }

    /** @return the items on this page, unmodifiable */
    public List<T> getItems()    { return items; }

    /** @return number of matches across all pages */
    public int getTotalCount()   { return totalCount; }

    public int getPageNumber()   { return pageNumber; }

    public int getPageSize()     { return pageSize; }

    /** @return {@code ceil(totalCount / pageSize)}; zero for an empty set */
    public int getTotalPages() {
        return (int) ((totalCount + (long) pageSize - 1) / pageSize);
    }

    public boolean hasPreviousPage() {
        return pageNumber > 1;
    }

    public boolean hasNextPage() {
        return pageNumber < getTotalPages();
    }

    @Override
    public String toString() {
        return "PagedResult{page=" + pageNumber + '/' + getTotalPages()
               + ", size=" + pageSize + ", total=" + totalCount
               + ", items=" + items.size() + '}';
    }
}
