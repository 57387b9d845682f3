package io.numstab.core.store;

import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ResultStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link ResultStore} held in process memory. Same contract as
 * {@link SqliteResultStore} minus durability. Thread-safe.
 */
public final class InMemoryResultStore implements ResultStore {

    private record Row(long id, StabilizerResult<String> result) {}

    private record DbgRow(long resultId, DbgInfo dbgInfo) {}

    private final Map<String, Row> rows = new HashMap<>();
    private final List<DbgRow> dbgRows = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized Optional<StabilizerResult<String>> find(String cmdin) {
        return Optional.ofNullable(rows.get(cmdin)).map(Row::result);
    }

    @Override
    public synchronized InsertOutcome insert(StabilizerResult<String> result) {
        if (rows.containsKey(result.cmdin())) {
            return InsertOutcome.DUPLICATE;
        }
        rows.put(result.cmdin(), new Row(nextId++, result));
        return InsertOutcome.INSERTED;
    }

    @Override
    public synchronized OptionalLong findId(String cmdin) {
        Row row = rows.get(cmdin);
        return row == null ? OptionalLong.empty() : OptionalLong.of(row.id());
    }

    @Override
    public synchronized void appendDebugInfo(long resultId, DbgInfo dbgInfo) {
        dbgRows.add(new DbgRow(resultId, dbgInfo));
    }

    @Override
    public synchronized List<DbgInfo> debugInfoFor(String cmdin) {
        OptionalLong id = findId(cmdin);
        if (id.isEmpty()) {
            return List.of();
        }
        return dbgRows.stream()
                .filter(row -> row.resultId() == id.getAsLong())
                .map(DbgRow::dbgInfo)
                .toList();
    }

    /** Number of stored verdicts. */
    public synchronized int size() {
        return rows.size();
    }
}
