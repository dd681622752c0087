package infra.template;

import domain.error.MissingTemplateException;
import domain.error.SourceUnavailableException;
import domain.template.TemplateStore;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Summary File templates archive loader (&lt;year&gt;_5yr_Summary_FileTemplates.zip).
 *
 * <p>Each entry is a one-sheet workbook. Column names come from the first data row
 * (sheet row 1), not the header row: the header holds field codes, row 1 the names the
 * Bureau uses everywhere else. Width is taken from the header row.</p>
 */
public class TemplateArchiveLoader {

    private final DataFormatter formatter = new DataFormatter();

    public TemplateStore load(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new SourceUnavailableException("Templates archive not found: " + archive);
        }
        try (InputStream is = Files.newInputStream(archive)) {
            return load(is);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to open templates archive: " + archive, e);
        }
    }

    public TemplateStore load(InputStream in) {
        Map<String, List<String>> templates = new LinkedHashMap<>();

        try (ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.isDirectory()) continue;

                Optional<String> key = TemplateStore.keyForEntry(entry.getName());
                if (key.isEmpty()) continue;

                // WorkbookFactory may close the stream it is given; hand it a copy
                byte[] bytes = zis.readAllBytes();
                templates.put(key.get(), readColumnNames(key.get(), entry.getName(), bytes));
            }
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read templates archive", e);
        }

        System.out.println("[INIT] Templates loaded = " + templates.size()
                + (templates.containsKey(TemplateStore.GEO_KEY) ? " (incl. geo)" : " (no geo template)"));
        return new TemplateStore(templates);
    }

    List<String> readColumnNames(String key, String entryName, byte[] bytes) {
        try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            Sheet sheet = wb.getSheetAt(0);
            Row header = sheet.getRow(0);
            Row names = sheet.getRow(1);
            if (header == null || names == null) {
                throw new MissingTemplateException(key, "Template " + entryName + " has no column-name row", null);
            }

            int width = Math.max(header.getLastCellNum(), names.getLastCellNum());
            List<String> out = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                Cell cell = names.getCell(i);
                out.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
            }
            return out;
        } catch (MissingTemplateException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MissingTemplateException(key, "Template " + entryName + " is not a readable workbook", e);
        }
    }
}
