package com.dashboard.domain.source;

import com.dashboard.domain.exception.DataSourceUnavailableException;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;

/**
 * Supplier of fresh analytics snapshots.
 *
 * This is the only place external I/O enters the engine. Loading must be
 * idempotent and free of side effects on the backend.
 */
public interface DataSource {

    /**
     * Loads a complete snapshot for the given kind.
     *
     * @throws DataSourceUnavailableException if no snapshot could be produced
     */
    ColumnarDataset load(DatasetKind kind);
}
