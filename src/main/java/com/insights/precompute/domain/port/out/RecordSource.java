package com.insights.precompute.domain.port.out;

import com.insights.precompute.domain.model.FilterOptions;
import com.insights.precompute.domain.model.WatchRecord;

import java.util.List;

/**
 * Port for loading raw watch records.
 * Must be deterministic for a given user and filter set within the cache freshness window.
 */
public interface RecordSource {

    /**
     * Load the records of one user matching the (already preprocessed) filters
     * @throws com.insights.precompute.domain.exception.RecordSourceException when upstream data is unavailable
     */
    List<WatchRecord> loadRecords(String userId, FilterOptions filters);
}
