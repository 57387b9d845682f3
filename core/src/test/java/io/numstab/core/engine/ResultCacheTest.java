package io.numstab.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.numstab.core.error.StoreUnavailableException;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ResultStore;
import io.numstab.core.store.InMemoryResultStore;
import java.sql.SQLException;
import java.util.OptionalLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ResultCacheTest {

    private static final StabilizerResult<String> VERDICT =
            new StabilizerResult<>("(- v0 v1)", "(- v0 v1)", 0.5, 0.5);

    private ListAppender<ILoggingEvent> logAppender;
    private Logger cacheLogger;

    @BeforeEach
    void setUp() {
        cacheLogger = (Logger) LoggerFactory.getLogger(ResultCache.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        cacheLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        cacheLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static StoreUnavailableException unavailable() {
        return new StoreUnavailableException("disk gone", new SQLException("SQLITE_CANTOPEN"));
    }

    private boolean warned(String prefix) {
        return logAppender.list.stream()
                .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().startsWith(prefix));
    }

    @Test
    void hitAndMiss() {
        ResultCache cache = new ResultCache(new InMemoryResultStore());
        cache.insert(VERDICT);

        assertThat(cache.lookup(VERDICT.cmdin())).contains(VERDICT);
        assertThat(cache.lookup("(- v1 v0)")).isEmpty();
    }

    @Test
    void failedLookupReadsAsMiss() {
        ResultStore store = mock(ResultStore.class);
        when(store.find(any())).thenThrow(unavailable());

        assertThat(new ResultCache(store).lookup(VERDICT.cmdin())).isEmpty();
        assertThat(warned("Cache lookup failed")).isTrue();
    }

    @Test
    void failedInsertIsLoggedNotThrown() {
        ResultStore store = mock(ResultStore.class);
        when(store.insert(any())).thenThrow(unavailable());

        new ResultCache(store).insert(VERDICT);

        assertThat(warned("Cache insert failed")).isTrue();
    }

    @Test
    void duplicateInsertLoggedAtInfo() {
        ResultCache cache = new ResultCache(new InMemoryResultStore());
        cache.insert(VERDICT);
        cache.insert(VERDICT);

        assertThat(logAppender.list)
                .anySatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.INFO);
                    assertThat(e.getFormattedMessage()).contains("existing row kept");
                });
    }

    @Test
    void debugInfoAttachedToCachedRow() {
        InMemoryResultStore store = new InMemoryResultStore();
        ResultCache cache = new ResultCache(store);
        cache.insert(VERDICT);

        cache.recordDebugInfo(DbgInfo.of("Geometry", "area"), VERDICT.cmdin());

        assertThat(store.debugInfoFor(VERDICT.cmdin())).containsExactly(DbgInfo.of("Geometry", "area"));
    }

    @Test
    void debugInfoWithoutCachedRowDropped() {
        ResultStore store = mock(ResultStore.class);
        when(store.findId(any())).thenReturn(OptionalLong.empty());

        new ResultCache(store).recordDebugInfo(DbgInfo.of("Geometry", "area"), VERDICT.cmdin());

        verify(store, never()).appendDebugInfo(anyLong(), any());
        assertThat(warned("No cached row")).isTrue();
    }

    @Test
    void failedDebugInsertIsLoggedNotThrown() {
        ResultStore store = mock(ResultStore.class);
        when(store.findId(any())).thenReturn(OptionalLong.of(1));
        doThrow(unavailable()).when(store).appendDebugInfo(anyLong(), any());

        new ResultCache(store).recordDebugInfo(DbgInfo.of("Geometry", "area"), VERDICT.cmdin());

        assertThat(warned("Debug info insert failed")).isTrue();
    }
}
