package io.numstab.core.store;

import io.numstab.core.error.StoreUnavailableException;
import io.numstab.core.model.DbgInfo;
import io.numstab.core.model.StabilizerResult;
import io.numstab.core.spi.ResultStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link ResultStore} in a SQLite file, {@value #DATABASE_FILE} under the
 * configured cache directory.
 *
 * <p>
 * Every operation opens its own connection, creates the directory and schema if
 * missing, runs its statement and closes the connection. Concurrent processes
 * rely on SQLite's file locking; the {@code UNIQUE} constraint on {@code cmdin}
 * keeps the first verdict when two of them insert the same key.
 */
public final class SqliteResultStore implements ResultStore {

    public static final String DATABASE_FILE = "stabilizer.db";

    private static final String CREATE_RESULTS = "CREATE TABLE IF NOT EXISTS StabilizerResults"
            + " ( id INTEGER PRIMARY KEY"
            + ", cmdin  TEXT UNIQUE NOT NULL"
            + ", cmdout TEXT        NOT NULL"
            + ", errin  DOUBLE      NOT NULL"
            + ", errout DOUBLE      NOT NULL"
            + ")";
    private static final String CREATE_RESULTS_INDEX =
            "CREATE INDEX IF NOT EXISTS StabilizerResultsIndex ON StabilizerResults(cmdin)";
    private static final String CREATE_DBG_INFO = "CREATE TABLE IF NOT EXISTS DbgInfo"
            + " ( id INTEGER PRIMARY KEY"
            + ", resid INTEGER NOT NULL"
            + ", dbgComments TEXT"
            + ", modName TEXT"
            + ", functionName TEXT"
            + ", functionType TEXT"
            + ")";

    private static final String SELECT_RESULT =
            "SELECT cmdin, cmdout, errin, errout FROM StabilizerResults WHERE cmdin = ?";
    private static final String SELECT_ID = "SELECT id FROM StabilizerResults WHERE cmdin = ?";
    private static final String INSERT_RESULT = "INSERT INTO StabilizerResults (cmdin, cmdout, errin, errout)"
            + " VALUES (?, ?, ?, ?) ON CONFLICT(cmdin) DO NOTHING";
    private static final String INSERT_DBG_INFO =
            "INSERT INTO DbgInfo (resid, dbgComments, modName, functionName, functionType) VALUES (?, ?, ?, ?, ?)";
    private static final String SELECT_DBG_INFO = "SELECT d.dbgComments, d.modName, d.functionName, d.functionType"
            + " FROM DbgInfo d JOIN StabilizerResults r ON d.resid = r.id"
            + " WHERE r.cmdin = ? ORDER BY d.id";

    private final Path cacheDir;
    private final Path databaseFile;

    /**
     * @param cacheDir directory holding the database file; created on first use
     */
    public SqliteResultStore(Path cacheDir) {
        this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir must not be null");
        this.databaseFile = cacheDir.resolve(DATABASE_FILE);
    }

    public Path databaseFile() {
        return databaseFile;
    }

    @Override
    public Optional<StabilizerResult<String>> find(String cmdin) {
        try (Connection conn = open();
                PreparedStatement stmt = conn.prepareStatement(SELECT_RESULT)) {
            stmt.setString(1, cmdin);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new StabilizerResult<>(
                        rs.getString("cmdin"), rs.getString("cmdout"), rs.getDouble("errin"), rs.getDouble("errout")));
            }
        } catch (SQLException e) {
            throw unavailable("lookup", e);
        }
    }

    @Override
    public InsertOutcome insert(StabilizerResult<String> result) {
        try (Connection conn = open();
                PreparedStatement stmt = conn.prepareStatement(INSERT_RESULT)) {
            stmt.setString(1, result.cmdin());
            stmt.setString(2, result.cmdout());
            stmt.setDouble(3, result.errin());
            stmt.setDouble(4, result.errout());
            return stmt.executeUpdate() == 0 ? InsertOutcome.DUPLICATE : InsertOutcome.INSERTED;
        } catch (SQLException e) {
            throw unavailable("insert", e);
        }
    }

    @Override
    public OptionalLong findId(String cmdin) {
        try (Connection conn = open();
                PreparedStatement stmt = conn.prepareStatement(SELECT_ID)) {
            stmt.setString(1, cmdin);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? OptionalLong.of(rs.getLong(1)) : OptionalLong.empty();
            }
        } catch (SQLException e) {
            throw unavailable("id lookup", e);
        }
    }

    @Override
    public void appendDebugInfo(long resultId, DbgInfo dbgInfo) {
        try (Connection conn = open();
                PreparedStatement stmt = conn.prepareStatement(INSERT_DBG_INFO)) {
            stmt.setLong(1, resultId);
            stmt.setString(2, dbgInfo.comments());
            stmt.setString(3, dbgInfo.moduleName());
            stmt.setString(4, dbgInfo.functionName());
            stmt.setString(5, dbgInfo.functionType());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("debug info insert", e);
        }
    }

    @Override
    public List<DbgInfo> debugInfoFor(String cmdin) {
        try (Connection conn = open();
                PreparedStatement stmt = conn.prepareStatement(SELECT_DBG_INFO)) {
            stmt.setString(1, cmdin);
            List<DbgInfo> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new DbgInfo(
                            rs.getString("dbgComments"),
                            rs.getString("modName"),
                            rs.getString("functionName"),
                            rs.getString("functionType")));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw unavailable("debug info lookup", e);
        }
    }

    /** Opens a connection with the schema in place. Caller closes it. */
    private Connection open() throws SQLException {
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot create cache directory " + cacheDir, e);
        }
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_RESULTS);
            stmt.execute(CREATE_RESULTS_INDEX);
            stmt.execute(CREATE_DBG_INFO);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private StoreUnavailableException unavailable(String operation, SQLException e) {
        return new StoreUnavailableException(
                "SQLite " + operation + " failed on " + databaseFile + ": " + e.getMessage(), e);
    }
}
