package io.numstab.core.engine;

import io.numstab.core.error.StoreUnavailableException;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ResultStore;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup-or-record front of a {@link ResultStore}. Store failures never
 * propagate: a failed lookup reads as a miss, a failed insert or provenance
 * append is logged and skipped.
 */
public final class ResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResultCache.class);

    private final ResultStore store;

    public ResultCache(ResultStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Exact-match lookup on the canonical text.
     *
     * @return the cached verdict, or empty on a miss or when the store is
     *         unavailable
     */
    public Optional<StabilizerResult<String>> lookup(String cmdin) {
        try {
            return store.find(cmdin);
        } catch (StoreUnavailableException e) {
            LOG.warn("Cache lookup failed, treating as miss: cmdin={}, error={}", cmdin, e.getMessage());
            return Optional.empty();
        }
    }

    /** Stores {@code result}; if its {@code cmdin} is already cached the existing row is kept. */
    public void insert(StabilizerResult<String> result) {
        try {
            ResultStore.InsertOutcome outcome = store.insert(result);
            if (outcome == ResultStore.InsertOutcome.DUPLICATE) {
                LOG.info("Cache already holds cmdin={}, existing row kept", result.cmdin());
            }
        } catch (StoreUnavailableException e) {
            LOG.warn("Cache insert failed, continuing uncached: cmdin={}, error={}", result.cmdin(), e.getMessage());
        }
    }

    /**
     * Appends {@code dbgInfo} to the provenance of the verdict cached for
     * {@code cmdin}. If no such verdict exists, or the store fails, the record
     * is dropped with a warning.
     */
    public void recordDebugInfo(DbgInfo dbgInfo, String cmdin) {
        try {
            OptionalLong id = store.findId(cmdin);
            if (id.isEmpty()) {
                LOG.warn("No cached row for cmdin={}, debug info dropped: {}", cmdin, dbgInfo);
                return;
            }
            store.appendDebugInfo(id.getAsLong(), dbgInfo);
        } catch (StoreUnavailableException e) {
            LOG.warn("Debug info insert failed: cmdin={}, error={}", cmdin, e.getMessage());
        }
    }

    public ResultStore store() {
        return store;
    }
}
