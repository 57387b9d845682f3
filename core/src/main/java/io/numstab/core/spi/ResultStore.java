package io.numstab.core.spi;

import io.numstab.core.error.StoreUnavailableException;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.StabilizerResult;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable store of solver verdicts keyed by canonical input text, with an
 * append-only provenance table referencing the verdicts.
 *
 * <p>
 * Every method throws {@link StoreUnavailableException} when the backing store
 * cannot be opened or queried; callers decide how to degrade.
 */
public interface ResultStore {

    /** Outcome of {@link #insert}. */
    enum InsertOutcome {
        INSERTED,
        /** A row with the same {@code cmdin} already existed and was kept. */
        DUPLICATE
    }

    /** Exact-match lookup on {@code cmdin}. */
    Optional<StabilizerResult<String>> find(String cmdin);

    /** Inserts {@code result} unless a row with the same {@code cmdin} exists. */
    InsertOutcome insert(StabilizerResult<String> result);

    /** The row id of the verdict for {@code cmdin}, if stored. */
    OptionalLong findId(String cmdin);

    /** Appends a provenance row referencing verdict {@code resultId}. */
    void appendDebugInfo(long resultId, DbgInfo dbgInfo);

    /** Provenance rows referencing the verdict for {@code cmdin}, oldest first. */
    List<DbgInfo> debugInfoFor(String cmdin);
}
