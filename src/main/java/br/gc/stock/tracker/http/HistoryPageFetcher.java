package br.gc.stock.tracker.http;

import br.gc.stock.tracker.exceptions.FetchException;

import java.util.List;

/**
 * Source of paged daily history, newest entries first.
 */
public interface HistoryPageFetcher {

    /**
     * @param pageIndex zero-based page
     * @return the page's entries; an empty list once the history is exhausted
     * @throws FetchException when the page cannot be retrieved or read
     */
    List<RawHistoryEntry> fetchPage(String stockCode, int pageIndex);
}
