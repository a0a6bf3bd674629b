package com.nayem.tether.store;

import com.nayem.tether.core.MutationOperation;
import com.nayem.tether.core.MutationOperationCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * SQLite-backed repository. Each transaction runs inside {@code BEGIN IMMEDIATE}
 * on its own connection, so the row, the sequence counter and the attempted flag
 * always commit together.
 */
public class JdbcPendingMutationRepository implements PendingMutationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPendingMutationRepository.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final MutationOperationCodec codec;

    public JdbcPendingMutationRepository(Path dbFile, MutationOperationCodec codec, int busyTimeoutMs) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile;
        this.codec = codec;

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = config.toProperties();
    }

    public void init() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create directory for " + dbFile, e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_mutations (
                        identifier TEXT PRIMARY KEY,
                        operations TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        created_at TEXT NOT NULL,
                        attempted INTEGER NOT NULL DEFAULT 0,
                        unsent TEXT NOT NULL DEFAULT '[]'
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sequence_counter (
                        id INTEGER PRIMARY KEY CHECK (id = 0),
                        value INTEGER NOT NULL
                    )
                    """);
            st.execute("INSERT OR IGNORE INTO sequence_counter(id, value) VALUES (0, 0)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_pending_sequence ON pending_mutations(sequence)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize schema in " + dbFile, e);
        }
        log.info("Pending mutation store ready at {}", dbFile);
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    @Override
    public Optional<PersistedRow> find(String identifier) {
        try (Connection conn = openConnection()) {
            return select(conn, identifier);
        } catch (SQLException e) {
            throw new StorageException("Failed to read pending row for " + identifier, e);
        }
    }

    @Override
    public List<PersistedRow> findAll() {
        List<PersistedRow> rows = new ArrayList<>();
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT identifier, operations, sequence, created_at, attempted, unsent FROM pending_mutations ORDER BY sequence");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                readRow(rs).ifPresent(rows::add);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list pending rows", e);
        }
        return rows;
    }

    @Override
    public <R> R transaction(String identifier, Function<PendingTransaction, R> work) {
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try {
                StagedPendingTransaction tx = new StagedPendingTransaction(identifier, select(conn, identifier),
                        () -> nextSequence(conn));
                R result = work.apply(tx);
                if (tx.isDirty()) {
                    Optional<PersistedRow> staged = tx.staged();
                    if (staged.isPresent()) {
                        upsert(conn, staged.get());
                    } else {
                        delete(conn, identifier);
                    }
                }
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Transaction failed for " + identifier, e);
        }
    }

    private Optional<PersistedRow> select(Connection conn, String identifier) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT identifier, operations, sequence, created_at, attempted, unsent FROM pending_mutations WHERE identifier = ?")) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? readRow(rs) : Optional.empty();
            }
        }
    }

    private Optional<PersistedRow> readRow(ResultSet rs) throws SQLException {
        String identifier = rs.getString("identifier");
        try {
            List<MutationOperation> operations = codec.read(rs.getString("operations"));
            return Optional.of(new PersistedRow(identifier, operations, rs.getLong("sequence"),
                    Instant.parse(rs.getString("created_at")), rs.getInt("attempted") != 0,
                    codec.read(rs.getString("unsent"))));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.error("Skipping unreadable pending row for {}", identifier, e);
            return Optional.empty();
        }
    }

    private long nextSequence(Connection conn) {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("UPDATE sequence_counter SET value = value + 1 WHERE id = 0");
            try (ResultSet rs = st.executeQuery("SELECT value FROM sequence_counter WHERE id = 0")) {
                if (!rs.next()) {
                    throw new StorageException("Sequence counter row is missing");
                }
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to advance sequence counter", e);
        }
    }

    private void upsert(Connection conn, PersistedRow row) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO pending_mutations(identifier, operations, sequence, created_at, attempted, unsent)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT(identifier) DO UPDATE SET
                    operations = excluded.operations,
                    sequence = excluded.sequence,
                    created_at = excluded.created_at,
                    attempted = excluded.attempted,
                    unsent = excluded.unsent
                """)) {
            ps.setString(1, row.identifier());
            ps.setString(2, codec.write(row.operations()));
            ps.setLong(3, row.sequence());
            ps.setString(4, row.createdAt().toString());
            ps.setInt(5, row.attempted() ? 1 : 0);
            ps.setString(6, codec.write(row.unsent()));
            ps.executeUpdate();
        }
    }

    private void delete(Connection conn, String identifier) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM pending_mutations WHERE identifier = ?")) {
            ps.setString(1, identifier);
            ps.executeUpdate();
        }
    }
}
