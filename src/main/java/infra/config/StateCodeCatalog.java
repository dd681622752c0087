package infra.config;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in state name -> USPS code table ({@code states.csv} on the classpath).
 *
 * <p>Names are spelled the way the Census Bureau spells them in archive file names
 * (no spaces, e.g. "NewYork", "DistrictOfColumbia").</p>
 */
public final class StateCodeCatalog {

    static final String RESOURCE = "states.csv";

    private StateCodeCatalog() {
    }

    public static Map<String, String> load() {
        InputStream is = Thread.currentThread()
                .getContextClassLoader()
                .getResourceAsStream(RESOURCE);
        if (is == null) {
            throw new IllegalStateException("State code table not found on classpath: " + RESOURCE);
        }

        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setHeader()
                     .setSkipHeaderRecord(true)
                     .setTrim(true)
                     .build()
                     .parse(reader)) {

            Map<String, String> out = new LinkedHashMap<>();
            for (CSVRecord r : parser) {
                out.put(r.get("name"), r.get("code"));
            }
            return Collections.unmodifiableMap(out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load state code table: " + RESOURCE, e);
        }
    }
}
