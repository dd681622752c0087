package infra.output;

import domain.appendix.AppendixIndex;
import domain.appendix.TableDescriptor;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the index of every table in the appendix: {@code name,title}, one row per table.
 */
public final class TableIndexCsvWriter {

    public void write(Path target, AppendixIndex appendix) {
        if (target == null) throw new IllegalArgumentException("target is null");

        try {
            Path parent = target.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create table index parent dir: " + target, e);
        }

        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, CsvTableSink.FORMAT)) {
            printer.printRecord("name", "title");
            for (TableDescriptor d : appendix.descriptors()) {
                printer.printRecord(d.getName(), d.getTitle());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write table index: " + target, e);
        }
    }
}
