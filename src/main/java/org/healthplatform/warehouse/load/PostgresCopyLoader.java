package org.healthplatform.warehouse.load;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.healthplatform.warehouse.config.TransformProperties;
import org.healthplatform.warehouse.exception.EmptyResultException;
import org.healthplatform.warehouse.exception.LoadException;
import org.healthplatform.warehouse.exception.SchemaMismatchException;
import org.healthplatform.warehouse.exception.TransformException;
import org.healthplatform.warehouse.normalize.CanonicalRecord;
import org.postgresql.PGConnection;
import org.postgresql.copy.PGCopyOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Loads canonical rows with PostgreSQL {@code COPY ... FROM STDIN}, streaming CSV straight into the
 * copy protocol. Column check, copy and commit share one connection and one transaction; any
 * failure cancels the copy and rolls back.
 *
 * <p>Assumes it is the only writer to the table for the duration of the transaction.
 */
@Component
public class PostgresCopyLoader implements WarehouseLoader {

    private static final Logger log = LoggerFactory.getLogger(PostgresCopyLoader.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private final DataSource dataSource;
    private final String schema;
    private final String table;
    private final int bufferSize;

    public PostgresCopyLoader(DataSource dataSource, TransformProperties properties) {
        TransformProperties.Warehouse warehouse = properties.getWarehouse();
        this.dataSource = dataSource;
        this.schema = requireIdentifier("transform.warehouse.schema", warehouse.getSchema());
        this.table = requireIdentifier("transform.warehouse.table", warehouse.getTable());
        this.bufferSize = warehouse.getCopyBufferSize();
    }

    String copyStatement() {
        return String.format("COPY %s.%s (%s) FROM STDIN WITH (FORMAT csv)",
            schema, table, String.join(", ", CanonicalRecord.COLUMNS));
    }

    @Override
    public long load(List<CanonicalRecord> records) {
        if (records.isEmpty()) {
            throw new EmptyResultException("Refusing to load an empty batch into " + schema + "." + table);
        }
        long started = System.currentTimeMillis();

        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                verifyColumns(connection);
                long written = copy(connection, records);
                if (written != records.size()) {
                    throw new LoadException(String.format("COPY reported %d rows for a batch of %d",
                        written, records.size()));
                }
                connection.commit();

                long elapsed = Math.max(System.currentTimeMillis() - started, 1);
                log.info("COPY into {}.{}: {} rows in {} ms ({} rows/s)",
                    schema, table, written, elapsed, written * 1000 / elapsed);
                return written;
            } catch (SQLException | IOException | RuntimeException e) {
                rollback(connection, e);
                if (e instanceof TransformException) {
                    throw (TransformException) e;
                }
                throw new LoadException("Bulk copy into " + schema + "." + table + " failed: " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new LoadException("Warehouse connection failed: " + e.getMessage(), e);
        }
    }

    /**
     * Compares the declared columns of the target table, in ordinal order, with the canonical row.
     */
    void verifyColumns(Connection connection) throws SQLException {
        TreeMap<Integer, String> byPosition = new TreeMap<>();
        DatabaseMetaData metaData = connection.getMetaData();
        String escape = metaData.getSearchStringEscape();
        try (ResultSet columns = metaData.getColumns(null,
                likeLiteral(schema, escape), likeLiteral(table, escape), null)) {
            while (columns.next()) {
                byPosition.put(columns.getInt("ORDINAL_POSITION"), columns.getString("COLUMN_NAME"));
            }
        }
        List<String> actual = new ArrayList<>(byPosition.values());
        if (!actual.equals(CanonicalRecord.COLUMNS)) {
            throw new SchemaMismatchException(schema + "." + table, CanonicalRecord.COLUMNS, actual);
        }
    }

    /**
     * Metadata lookups take LIKE patterns; {@code _} in an identifier would otherwise match any character.
     */
    static String likeLiteral(String identifier, String escape) {
        if (escape == null || escape.isEmpty()) {
            return identifier;
        }
        return identifier
            .replace(escape, escape + escape)
            .replace("_", escape + "_")
            .replace("%", escape + "%");
    }

    private long copy(Connection connection, List<CanonicalRecord> records) throws SQLException, IOException {
        PGCopyOutputStream out = new PGCopyOutputStream(
            connection.unwrap(PGConnection.class), copyStatement(), bufferSize);
        try {
            // Not closed: closing would end the copy; endCopy() below does that explicitly
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            CSVPrinter printer = new CSVPrinter(writer, CSVFormat.POSTGRESQL_CSV);
            for (CanonicalRecord record : records) {
                printer.printRecord(
                    record.getCountryName(),
                    record.getCountryCode(),
                    record.getYear(),
                    record.getSex().getLabel(),
                    Double.toString(record.getLifeExpectancy()),
                    TIMESTAMP_FORMAT.format(record.getIngestedAt()));
            }
            printer.flush();
            return out.endCopy();
        } catch (SQLException | IOException | RuntimeException e) {
            cancel(out, e);
            throw e;
        }
    }

    private static void cancel(PGCopyOutputStream out, Exception cause) {
        if (!out.isActive()) {
            return;
        }
        try {
            out.cancelCopy();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
            log.warn("Rolled back load into {}.{} after: {}", schema, table, cause.getMessage());
        } catch (SQLException e) {
            log.error("Rollback of load into {}.{} failed", schema, table, e);
            cause.addSuppressed(e);
        }
    }

    private static String requireIdentifier(String property, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(property + " must be a lower-case SQL identifier, was '" + value + "'");
        }
        return value;
    }
}
