package domain.template;

import domain.error.MissingTemplateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Column-name templates of the Summary File: one per sequence plus the geography template.
 *
 * <p>Keys are 4-digit sequence ids, or {@link #GEO_KEY} for the geography file.</p>
 */
public final class TemplateStore {

    public static final String GEO_KEY = "geo";

    private static final String SEQ_MARKER = "Seq";
    private static final String GEO_MARKER = "Geo";

    private final Map<String, List<String>> templates;

    public TemplateStore(Map<String, List<String>> templates) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : templates.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        this.templates = Collections.unmodifiableMap(copy);
    }

    /**
     * Classify a template archive entry by its file name.
     * <ul>
     *   <li>{@code .../Seq12.xls} -> {@code "0012"}</li>
     *   <li>{@code .../2015_SFGeoFileTemplate.xls} -> {@code "geo"}</li>
     *   <li>anything else (directories, readme files) -> empty</li>
     * </ul>
     * "Seq" is checked before "Geo".
     */
    public static Optional<String> keyForEntry(String entryName) {
        if (entryName == null || entryName.isBlank() || entryName.endsWith("/")) {
            return Optional.empty();
        }
        String fileName = entryName;
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (slash >= 0) fileName = fileName.substring(slash + 1);

        int idx = fileName.indexOf(SEQ_MARKER);
        if (idx >= 0) {
            String rest = fileName.substring(idx + SEQ_MARKER.length());
            int dot = rest.indexOf('.');
            String number = dot >= 0 ? rest.substring(0, dot) : rest;
            if (number.isBlank()) return Optional.empty();
            return Optional.of(SequenceIds.normalize(number));
        }
        if (fileName.contains(GEO_MARKER)) {
            return Optional.of(GEO_KEY);
        }
        return Optional.empty();
    }

    /**
     * @throws MissingTemplateException when no template was loaded for the key
     */
    public List<String> templateFor(String key) {
        List<String> t = templates.get(key);
        if (t == null) throw new MissingTemplateException(key);
        return t;
    }

    public List<String> geographyTemplate() {
        return templateFor(GEO_KEY);
    }

    public boolean contains(String key) {
        return templates.containsKey(key);
    }

    public Set<String> keys() {
        return templates.keySet();
    }

    public int size() {
        return templates.size();
    }
}
