package com.eyelevel.mediamigrator.service.state;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Walks a keyset-paged listing one page at a time. A page is fetched only when the previous one is exhausted,
 * and each fetch restarts after the last id seen, so rows changing phase mid-walk are neither repeated nor fatal.
 */
class KeysetPageIterator<T> implements Iterator<T> {

    private final Function<String, List<T>> pageFetcher;
    private final Function<T, String> idExtractor;
    private final int pageSize;

    private Iterator<T> currentPage;
    private String lastId = "";
    private boolean exhausted;

    KeysetPageIterator(Function<String, List<T>> pageFetcher, Function<T, String> idExtractor, int pageSize) {
        this.pageFetcher = pageFetcher;
        this.idExtractor = idExtractor;
        this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
        if (currentPage != null && currentPage.hasNext()) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        List<T> page = pageFetcher.apply(lastId);
        if (page.size() < pageSize) {
            exhausted = true;
        }
        currentPage = page.iterator();
        return currentPage.hasNext();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T next = currentPage.next();
        lastId = idExtractor.apply(next);
        return next;
    }
}
