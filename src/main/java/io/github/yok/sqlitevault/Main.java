package io.github.yok.sqlitevault;

import io.github.yok.sqlitevault.core.CsvTableExporter;
import io.github.yok.sqlitevault.core.SqliteDatabase;
import io.github.yok.sqlitevault.db.SqliteDatabaseFactory;
import io.github.yok.sqlitevault.schema.ColumnDescriptor;
import io.github.yok.sqlitevault.schema.TableSnapshot;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Opens the database configured under {@code vault} in {@code application.yml} and runs one
 * inspection command. Values are decoded with the configured data mode.
 * </p>
 *
 * <ul>
 * <li>{@code --tables} or {@code -l} lists the user tables with their row counts (default).</li>
 * <li>{@code --columns <table>} or {@code -c <table>} lists the columns of a table.</li>
 * <li>{@code --print <table>} or {@code -p <table>} prints the stored rows as a table.</li>
 * <li>{@code --dump <table>} or {@code -d <table>} writes the decoded rows as CSV.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final SqliteDatabaseFactory databaseFactory;

    // Command output; replaced in tests
    PrintStream out = System.out;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Parses arguments and runs the selected command.
     *
     * @param args command-line arguments
     * @throws IllegalStateException if a command is missing its table name or fails
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = null;
        String table = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tables":
                case "-l":
                    mode = "tables";
                    break;
                case "--columns":
                case "-c":
                    mode = "columns";
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--print":
                case "-p":
                    mode = "print";
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--dump":
                case "-d":
                    mode = "dump";
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if (mode == null) {
            mode = "tables";
        }
        if (!"tables".equals(mode) && (table == null || table.isEmpty())) {
            String msg = "Table name is required in " + mode + " mode.";
            log.error(msg);
            throw new IllegalStateException(msg);
        }

        SqliteDatabase database = databaseFactory.create();
        log.info("Mode: {}, Table: {}, Database: {} ({})", mode, table, database.getPath(),
                database.getDataMode());
        try {
            switch (mode) {
                case "columns":
                    printColumns(database, table);
                    break;
                case "print":
                    printTable(database, table);
                    break;
                case "dump":
                    new CsvTableExporter().export(database, table, out);
                    break;
                case "tables":
                default:
                    printTables(database);
            }
            out.flush();
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            throw new IllegalStateException("Fatal error: " + e.getMessage(), e);
        }
    }

    private void printTables(SqliteDatabase database) throws Exception {
        List<TableSnapshot> tables = database.tables();
        for (TableSnapshot snapshot : tables) {
            out.println(snapshot.getName() + "\t" + snapshot.getRowCount());
        }
        log.info("{} table(s) listed", tables.size());
    }

    private void printColumns(SqliteDatabase database, String table) throws Exception {
        Optional<List<ColumnDescriptor>> columns = database.columns(table);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table not found: " + table);
        }
        for (ColumnDescriptor column : columns.get()) {
            List<String> flags = new ArrayList<>();
            if (column.isPrimaryKey()) {
                flags.add("PRIMARY KEY");
            }
            if (column.isNotNull()) {
                flags.add("NOT NULL");
            }
            out.println(column.getName() + "\t" + column.getDisplayType() + "\t"
                    + column.getKind() + (flags.isEmpty() ? "" : "\t" + String.join(" ", flags)));
        }
    }

    private void printTable(SqliteDatabase database, String table) throws Exception {
        TableSnapshot snapshot = database.snapshot(table)
                .orElseThrow(() -> new IllegalArgumentException("Table not found: " + table));
        out.println(snapshot.prettyPrint());
    }
}
