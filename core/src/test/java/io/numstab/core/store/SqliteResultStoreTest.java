package io.numstab.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.numstab.core.error.FailureKind;
import io.numstab.core.error.StoreUnavailableException;
import io.numstab.core.spi.ResultStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteResultStoreTest extends ResultStoreContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected ResultStore createStore() {
        return new SqliteResultStore(tempDir.resolve("cache"));
    }

    @Test
    void cacheDirectoryCreatedOnFirstUse() {
        Path dir = tempDir.resolve("nested/deeper");
        SqliteResultStore sqlite = new SqliteResultStore(dir);

        assertThat(sqlite.find("(sqrt v0)")).isEmpty();

        assertThat(sqlite.databaseFile()).isEqualTo(dir.resolve("stabilizer.db"));
        assertThat(sqlite.databaseFile()).exists();
    }

    @Test
    void verdictsSurviveAcrossInstances() {
        store.insert(VERDICT);

        SqliteResultStore reopened = new SqliteResultStore(tempDir.resolve("cache"));

        assertThat(reopened.find(VERDICT.cmdin())).contains(VERDICT);
    }

    @Test
    void schemaHasResultAndDebugTables() throws Exception {
        store.insert(VERDICT);
        Path db = ((SqliteResultStore) store).databaseFile();

        List<String> tables = new ArrayList<>();
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
                ResultSet rs = conn.createStatement()
                        .executeQuery("SELECT name FROM sqlite_master WHERE type IN ('table', 'index') ORDER BY name")) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }

        assertThat(tables).contains("StabilizerResults", "StabilizerResultsIndex", "DbgInfo");
    }

    @Test
    void unusableDirectoryIsStoreUnavailable() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        SqliteResultStore broken = new SqliteResultStore(blocker);

        assertThatThrownBy(() -> broken.find("(sqrt v0)"))
                .isInstanceOf(StoreUnavailableException.class)
                .satisfies(e -> assertThat(((StoreUnavailableException) e).kind())
                        .isEqualTo(FailureKind.STORE_UNAVAILABLE));
    }
}
