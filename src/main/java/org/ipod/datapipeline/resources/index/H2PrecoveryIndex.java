package org.ipod.datapipeline.resources.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.ipod.datapipeline.api.index.IPrecoveryIndex;
import org.ipod.datapipeline.api.index.IndexOpenException;
import org.ipod.datapipeline.api.index.IndexOpenOptions;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.model.Timestamp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Precovery index stored in an H2 file database, accessed through a HikariCP pool of one
 * connection.
 * <p>
 * Schema:
 * <pre>
 * index_meta(meta_key PRIMARY KEY, meta_value)
 * observations(obs_id PRIMARY KEY, dataset_id, mjd_days, mjd_nanos, mjd, obscode,
 *              ra_deg, dec_deg, ra_sigma, dec_sigma)
 * </pre>
 * Many read-only handles on the same directory may be open at once in one process; they share
 * the embedded database. Closing a handle therefore only closes its pool and never issues
 * {@code SHUTDOWN}, which would terminate the connections of every other handle.
 * <p>
 * <strong>Thread Safety:</strong> A handle is used by one thread at a time.
 */
public class H2PrecoveryIndex implements IPrecoveryIndex {

    private static final Logger log = LoggerFactory.getLogger(H2PrecoveryIndex.class);

    /** Format version written by and expected from this implementation. */
    public static final String FORMAT_VERSION = "1";

    /** Base name of the database file inside the index directory. */
    public static final String DATABASE_NAME = "precovery";

    private static final String FORMAT_VERSION_KEY = "format_version";
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final Path directory;
    private final IndexOpenOptions options;
    private final HikariDataSource dataSource;
    private final String formatVersion;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens (or creates) the index in the given directory.
     *
     * @param directory Index directory.
     * @param options   Open options.
     * @throws IndexOpenException if the index does not exist, cannot be opened or has an
     *                            unsupported format version.
     */
    public H2PrecoveryIndex(Path directory, IndexOpenOptions options) {
        this.directory = directory;
        this.options = options;
        validateDirectory(directory, options);

        String jdbcUrl = jdbcUrl(directory, options);
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(1);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setUsername("sa");
        hikariConfig.setPassword("");
        hikariConfig.setReadOnly(options.readOnly());
        hikariConfig.setPoolName("precovery-index-" + POOL_COUNTER.incrementAndGet());

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("Precovery index '{}' connection pool started (readOnly={})", directory, options.readOnly());
        } catch (RuntimeException e) {
            Throwable cause = rootCause(e);
            String errorMsg = String.format("Failed to open precovery index '%s': %s: %s",
                    directory, cause.getClass().getSimpleName(), cause.getMessage());
            log.error(errorMsg);
            throw new IndexOpenException(errorMsg, e);
        }

        try {
            if (options.create()) {
                createSchema();
            }
            this.formatVersion = readFormatVersion();
        } catch (SQLException | IndexOpenException e) {
            dataSource.close();
            if (e instanceof IndexOpenException indexOpenException) {
                throw indexOpenException;
            }
            throw new IndexOpenException("Failed to read precovery index metadata from '" + directory + "': " + e.getMessage(), e);
        }

        if (!FORMAT_VERSION.equals(formatVersion)) {
            if (!options.allowVersionMismatch()) {
                dataSource.close();
                throw new IndexOpenException(String.format(
                        "Precovery index '%s' has format version %s, expected %s", directory, formatVersion, FORMAT_VERSION));
            }
            log.warn("Precovery index '{}' has format version {}, expected {}. Continuing because version mismatches are allowed.",
                    directory, formatVersion, FORMAT_VERSION);
        }
    }

    @Override
    public String formatVersion() {
        return formatVersion;
    }

    @Override
    public List<Observation> findObservations(double startMjd, double endMjd, double minDec, double maxDec,
                                              Set<String> datasets) {
        ensureOpen();
        StringBuilder sql = new StringBuilder(
                "SELECT obs_id, dataset_id, mjd_days, mjd_nanos, obscode, ra_deg, dec_deg, ra_sigma, dec_sigma "
                        + "FROM observations WHERE mjd BETWEEN ? AND ? AND dec_deg BETWEEN ? AND ?");
        if (!datasets.isEmpty()) {
            sql.append(" AND dataset_id IN (")
                    .append(String.join(", ", Collections.nCopies(datasets.size(), "?")))
                    .append(')');
        }
        sql.append(" ORDER BY mjd_days, mjd_nanos, obscode, obs_id");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int param = 1;
            stmt.setDouble(param++, startMjd);
            stmt.setDouble(param++, endMjd);
            stmt.setDouble(param++, minDec);
            stmt.setDouble(param++, maxDec);
            for (String dataset : datasets) {
                stmt.setString(param++, dataset);
            }

            List<Observation> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new Observation(
                            rs.getString("obs_id"),
                            rs.getString("dataset_id"),
                            new Timestamp(rs.getLong("mjd_days"), rs.getLong("mjd_nanos")),
                            rs.getString("obscode"),
                            rs.getDouble("ra_deg"),
                            rs.getDouble("dec_deg"),
                            nullableDouble(rs, "ra_sigma"),
                            nullableDouble(rs, "dec_sigma")));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new IndexOpenException("Failed to query precovery index '" + directory + "': " + e.getMessage(), e);
        }
    }

    @Override
    public long observationCount() {
        ensureOpen();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM observations")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new IndexOpenException("Failed to count observations in '" + directory + "': " + e.getMessage(), e);
        }
    }

    /**
     * Adds observations to a writable index. Observations already indexed are replaced.
     *
     * @param observations Observations to index.
     * @throws IllegalStateException if the index was opened read-only.
     */
    public void addObservations(Collection<Observation> observations) {
        ensureOpen();
        if (options.readOnly()) {
            throw new IllegalStateException("Precovery index '" + directory + "' is open read-only");
        }
        String sql = "MERGE INTO observations (obs_id, dataset_id, mjd_days, mjd_nanos, mjd, obscode, ra_deg, dec_deg, "
                + "ra_sigma, dec_sigma) KEY (obs_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            conn.setAutoCommit(false);
            try {
                for (Observation obs : observations) {
                    stmt.setString(1, obs.id());
                    stmt.setString(2, obs.datasetId());
                    stmt.setLong(3, obs.time().days());
                    stmt.setLong(4, obs.time().nanos());
                    stmt.setDouble(5, obs.time().mjd());
                    stmt.setString(6, obs.originCode());
                    stmt.setDouble(7, obs.ra());
                    stmt.setDouble(8, obs.dec());
                    stmt.setObject(9, obs.raSigmaArcsec());
                    stmt.setObject(10, obs.decSigmaArcsec());
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            log.debug("Indexed {} observations in '{}'", observations.size(), directory);
        } catch (SQLException e) {
            throw new IndexOpenException("Failed to write to precovery index '" + directory + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            log.debug("Precovery index '{}' already closed", directory);
            return;
        }
        dataSource.close();
        log.debug("Precovery index '{}' connection pool closed", directory);
    }

    public boolean isClosed() {
        return closed.get();
    }

    static String jdbcUrl(Path directory, IndexOpenOptions options) {
        StringBuilder url = new StringBuilder("jdbc:h2:file:")
                .append(directory.toAbsolutePath().resolve(DATABASE_NAME).toString().replace('\\', '/'));
        if (!options.create()) {
            url.append(";IFEXISTS=TRUE");
        }
        if (options.readOnly()) {
            url.append(";ACCESS_MODE_DATA=r");
        }
        return url.toString();
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS index_meta ("
                    + "meta_key VARCHAR PRIMARY KEY, meta_value VARCHAR NOT NULL)");
            stmt.execute("CREATE TABLE IF NOT EXISTS observations ("
                    + "obs_id VARCHAR PRIMARY KEY, dataset_id VARCHAR, mjd_days BIGINT NOT NULL, "
                    + "mjd_nanos BIGINT NOT NULL, mjd DOUBLE PRECISION NOT NULL, obscode VARCHAR NOT NULL, "
                    + "ra_deg DOUBLE PRECISION NOT NULL, dec_deg DOUBLE PRECISION NOT NULL, "
                    + "ra_sigma DOUBLE PRECISION, dec_sigma DOUBLE PRECISION)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_observations_mjd ON observations (mjd)");
            stmt.execute("MERGE INTO index_meta (meta_key, meta_value) KEY (meta_key) VALUES ('"
                    + FORMAT_VERSION_KEY + "', '" + FORMAT_VERSION + "')");
        }
    }

    private String readFormatVersion() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT meta_value FROM index_meta WHERE meta_key = ?")) {
            stmt.setString(1, FORMAT_VERSION_KEY);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new IndexOpenException("Precovery index '" + directory + "' has no format version");
                }
                return rs.getString(1);
            }
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IndexOpenException("Precovery index '" + directory + "' is closed");
        }
    }

    private static void validateDirectory(Path directory, IndexOpenOptions options) {
        if (options.create()) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new IndexOpenException("Cannot create precovery index directory '" + directory + "'", e);
            }
        } else if (!Files.isDirectory(directory)) {
            throw new IndexOpenException("Precovery index directory '" + directory + "' does not exist");
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }
}
