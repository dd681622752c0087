package infra.output;

import domain.report.BuildReport;
import domain.report.StateBuildSummary;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * XLSX build report writer (--report).
 *
 * <p>Sheets:
 * <ul>
 *   <li>states: built/empty/skipped counters and state-level failure</li>
 *   <li>skipped: one row per skipped (state, table) with the reason</li>
 * </ul>
 */
public final class BuildReportXlsxWriter {

    private static void writeStatesSheet(Workbook wb, BuildReport report) {
        Sheet sh = wb.createSheet("states");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("state");
        header.createCell(1)
                .setCellValue("built");
        header.createCell(2)
                .setCellValue("empty");
        header.createCell(3)
                .setCellValue("skipped");
        header.createCell(4)
                .setCellValue("failure");

        for (StateBuildSummary s : report.summaries()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(s.getState());
            row.createCell(1)
                    .setCellValue(s.getBuilt());
            row.createCell(2)
                    .setCellValue(s.getEmpty());
            row.createCell(3)
                    .setCellValue(s.getSkipped());
            row.createCell(4)
                    .setCellValue(nullToEmpty(s.getFailure()));
        }
    }

    private static void writeSkippedSheet(Workbook wb, BuildReport report) {
        Sheet sh = wb.createSheet("skipped");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("state");
        header.createCell(1)
                .setCellValue("table");
        header.createCell(2)
                .setCellValue("reason");

        for (StateBuildSummary s : report.summaries()) {
            for (Map.Entry<String, String> e : s.getSkippedTables().entrySet()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(s.getState());
                row.createCell(1)
                        .setCellValue(e.getKey());
                row.createCell(2)
                        .setCellValue(nullToEmpty(e.getValue()));
            }
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(Path reportXlsx, BuildReport report) {
        if (reportXlsx == null) throw new IllegalArgumentException("reportXlsx is null");
        if (report == null) throw new IllegalArgumentException("report is null");

        try {
            Path parent = reportXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + reportXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeStatesSheet(wb, report);
            writeSkippedSheet(wb, report);

            try (OutputStream os = Files.newOutputStream(reportXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + reportXlsx, e);
        }
    }
}
