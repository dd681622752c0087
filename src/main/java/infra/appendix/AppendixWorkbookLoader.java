package infra.appendix;

import domain.appendix.AppendixIndex;
import domain.error.MalformedMetadataException;
import domain.error.SourceUnavailableException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Appendix A workbook loader (ACS_&lt;year&gt;_SF_5YR_Appendices.xls).
 *
 * <p>First sheet, first row is a header. The five meaningful columns are, in order:
 * table name, table title, restriction flag, sequence number, start-end range.
 * Blank rows are skipped; any other row missing its sequence or range aborts the load.</p>
 */
public class AppendixWorkbookLoader {

    static final int COL_NAME = 0;
    static final int COL_TITLE = 1;
    static final int COL_RESTRICTION = 2;
    static final int COL_SEQUENCE = 3;
    static final int COL_RANGE = 4;

    private final DataFormatter formatter = new DataFormatter();

    public AppendixIndex load(Path workbook) {
        if (workbook == null || !Files.isRegularFile(workbook)) {
            throw new SourceUnavailableException("Appendix workbook not found: " + workbook);
        }
        try (InputStream is = Files.newInputStream(workbook)) {
            return load(is);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to open appendix workbook: " + workbook, e);
        }
    }

    public AppendixIndex load(InputStream in) {
        AppendixIndex.Builder builder = AppendixIndex.builder();

        try (Workbook wb = WorkbookFactory.create(in)) {
            Sheet sheet = wb.getSheetAt(0);
            int rowIdx = 0;
            int added = 0;

            for (Row row : sheet) {
                // header
                if (rowIdx++ == 0) continue;

                String name = get(row, COL_NAME);
                String title = get(row, COL_TITLE);
                String restriction = get(row, COL_RESTRICTION);
                String sequence = get(row, COL_SEQUENCE);
                String range = get(row, COL_RANGE);

                if (name.isEmpty() && title.isEmpty() && sequence.isEmpty() && range.isEmpty()) continue;

                builder.addRow(row.getRowNum() + 1, name, title, restriction, sequence, range);
                added++;
            }

            System.out.println("[INIT] Appendix rows = " + added);

        } catch (MalformedMetadataException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MalformedMetadataException("Failed to read appendix workbook", e);
        }
        return builder.build();
    }

    private String get(Row row, int idx) {
        Cell cell = row.getCell(idx);
        if (cell == null) return "";
        return formatter.formatCellValue(cell).trim();
    }
}
