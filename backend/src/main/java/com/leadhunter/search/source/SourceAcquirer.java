package com.leadhunter.search.source;

import com.leadhunter.search.model.ExpandedQuery;
import com.leadhunter.search.model.RawHit;

import java.util.List;

public interface SourceAcquirer extends AutoCloseable {
    String name();

    List<RawHit> acquire(ExpandedQuery query) throws AcquisitionException, InterruptedException;

    /**
     * Releases any browser session still held by an interrupted acquisition.
     */
    @Override
    void close();
}
