package io.github.yok.sqlitevault.core;

import io.github.yok.sqlitevault.schema.ColumnDescriptor;
import java.io.IOException;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes the decoded rows of a table as CSV.
 *
 * <p>
 * The header lists the columns in declaration order. {@code null} is written as an empty field
 * and timestamps in ISO-8601 local form. The target is flushed but not closed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvTableExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /**
     * Exports one table.
     *
     * @param database source handle
     * @param table table name
     * @param out CSV target
     * @return number of data rows written
     * @throws TableNotFoundException if the table does not exist
     * @throws SQLException if reading fails
     * @throws IOException if writing fails
     */
    public int export(SqliteDatabase database, String table, Appendable out)
            throws SQLException, IOException {
        List<ColumnDescriptor> columns =
                database.columns(table).orElseThrow(() -> new TableNotFoundException(table));
        String[] header = columns.stream().map(ColumnDescriptor::getName).toArray(String[]::new);
        List<Map<String, Object>> rows =
                database.fetch(Collections.emptyMap(), table, FetchMode.ALL).asRecords();

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(header).build();
        CSVPrinter printer = new CSVPrinter(out, format);
        for (Map<String, Object> row : rows) {
            List<String> fields = new ArrayList<>(header.length);
            for (String column : header) {
                fields.add(formatField(row.get(column)));
            }
            printer.printRecord(fields);
        }
        printer.flush();
        log.info("Table[{}] exported {} row(s) as CSV", table, rows.size());
        return rows.size();
    }

    static String formatField(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP_FORMAT);
        }
        return String.valueOf(value);
    }
}
