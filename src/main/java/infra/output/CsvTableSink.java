package infra.output;

import domain.output.TableFileNamePolicy;
import domain.output.TableSink;
import domain.table.AssembledTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link TableSink} that stores each table as a CSV file.
 * <p>
 * Output layout: {@code <outDir>/<State><Table>.csv}. Missing cells are written as empty
 * fields. The file is written beside the target and moved into place, so a failed write
 * never leaves a partial table behind.
 */
public final class CsvTableSink implements TableSink {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setRecordSeparator("\n")
            .build();

    private final Path outDir;

    public CsvTableSink(Path outDir) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");
        this.outDir = outDir;
    }

    public Path targetFor(String state, String tableName) {
        return outDir.resolve(TableFileNamePolicy.build(state, tableName));
    }

    @Override
    public void write(String state, AssembledTable table) {
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir, e);
        }

        Path target = targetFor(state, table.getTableName());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, FORMAT)) {
            printer.printRecord(table.header());
            for (AssembledTable.Row row : table.getRows()) {
                printer.print(row.getGeoId());
                for (int i = 0; i < row.size(); i++) {
                    printer.print(row.cell(i));
                }
                printer.println();
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new IllegalStateException("Failed to write table: " + target, e);
        }

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new IllegalStateException("Failed to move table into place: " + target, e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            System.out.println("[WARN] could not delete temp file " + p + ": " + e.getMessage());
        }
    }
}
