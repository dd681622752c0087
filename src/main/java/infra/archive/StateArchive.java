package infra.archive;

import domain.error.SourceUnavailableException;
import domain.geography.GeographyIndex;
import domain.sequence.SequenceRowSet;
import domain.table.SequenceSource;
import infra.geography.GeographyCsvReader;
import infra.sequence.SequenceRecordReader;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * One state's Summary File archive (&lt;State&gt;_Tracts_Block_Groups_Only.zip).
 *
 * <p>Member layout:
 * <ul>
 *   <li>geography: {@code g<year>5<st>.csv}</li>
 *   <li>estimates: {@code e<year>5<st><seq>000.txt}</li>
 *   <li>margins:   {@code m<year>5<st><seq>000.txt}</li>
 * </ul>
 * The sequence id is characters 9-12 (1-based) of the member file name.</p>
 */
public final class StateArchive implements SequenceSource, Closeable {

    static final int SEQ_BEGIN = 8;
    static final int SEQ_END = 12;

    private final String state;
    private final ZipFile zip;
    private final List<String> geographyMembers;
    private final Map<String, String> estimateMembers;
    private final Map<String, String> marginMembers;

    private final SequenceRecordReader recordReader;
    private final GeographyCsvReader geographyReader;

    private StateArchive(String state, ZipFile zip,
                         SequenceRecordReader recordReader, GeographyCsvReader geographyReader) {
        this.state = state;
        this.zip = zip;
        this.recordReader = recordReader;
        this.geographyReader = geographyReader;

        List<String> geo = new ArrayList<>();
        Map<String, String> e = new LinkedHashMap<>();
        Map<String, String> m = new LinkedHashMap<>();

        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (entry.isDirectory()) continue;

            String name = entry.getName();
            String fileName = fileName(name);
            if (fileName.startsWith("g") && fileName.endsWith("csv")) {
                geo.add(name);
            } else if (fileName.startsWith("e") && fileName.length() >= SEQ_END) {
                e.put(fileName.substring(SEQ_BEGIN, SEQ_END), name);
            } else if (fileName.startsWith("m") && fileName.length() >= SEQ_END) {
                m.put(fileName.substring(SEQ_BEGIN, SEQ_END), name);
            }
        }
        Collections.sort(geo);
        this.geographyMembers = geo;
        this.estimateMembers = e;
        this.marginMembers = m;
    }

    /**
     * @throws SourceUnavailableException when the archive is missing or not a zip file
     */
    public static StateArchive open(String state, Path archive,
                                    SequenceRecordReader recordReader, GeographyCsvReader geographyReader) {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new SourceUnavailableException("Summary file archive not found for " + state + ": " + archive);
        }
        try {
            return new StateArchive(state, new ZipFile(archive.toFile()), recordReader, geographyReader);
        } catch (IOException e) {
            throw new SourceUnavailableException("Summary file archive unreadable for " + state + ": " + archive, e);
        }
    }

    private static String fileName(String entryName) {
        int slash = entryName.lastIndexOf('/');
        return slash >= 0 ? entryName.substring(slash + 1) : entryName;
    }

    public String getState() {
        return state;
    }

    /**
     * Geography member name. With a state code, {@code g*<code>.csv} is preferred; otherwise
     * the first geography CSV in name order.
     *
     * @throws SourceUnavailableException when the archive has no geography CSV
     */
    public String geographyMember(String stateCode) {
        if (geographyMembers.isEmpty()) {
            throw new SourceUnavailableException("No geography CSV in summary file archive for " + state);
        }
        if (stateCode != null && !stateCode.isBlank()) {
            String suffix = stateCode.trim().toLowerCase(Locale.ROOT) + ".csv";
            for (String g : geographyMembers) {
                if (fileName(g).toLowerCase(Locale.ROOT).endsWith(suffix)) return g;
            }
        }
        return geographyMembers.get(0);
    }

    public GeographyIndex readGeography(List<String> geoTemplate, String summaryLevel, String stateCode) {
        String member = geographyMember(stateCode);
        try (InputStream in = open(member)) {
            return geographyReader.read(in, geoTemplate, summaryLevel, member);
        } catch (IOException e) {
            throw new SourceUnavailableException("Geography file error for " + state + ": " + member, e);
        }
    }

    @Override
    public SequenceRowSet estimates(String sequenceId, List<String> template) {
        return read(estimateMembers.get(sequenceId), "Estimates", sequenceId, template);
    }

    @Override
    public SequenceRowSet margins(String sequenceId, List<String> template) {
        return read(marginMembers.get(sequenceId), "Margins", sequenceId, template);
    }

    public boolean hasSequence(String sequenceId) {
        return estimateMembers.containsKey(sequenceId) && marginMembers.containsKey(sequenceId);
    }

    private SequenceRowSet read(String member, String kind, String sequenceId, List<String> template) {
        if (member == null) {
            throw new SourceUnavailableException(kind + " file for sequence " + sequenceId + " not found for " + state);
        }
        try (InputStream in = open(member)) {
            return recordReader.read(in, sequenceId, template, member);
        } catch (IOException e) {
            throw new SourceUnavailableException(kind + " file " + member + " error for " + state, e);
        }
    }

    private InputStream open(String member) throws IOException {
        ZipEntry entry = zip.getEntry(member);
        if (entry == null) {
            throw new SourceUnavailableException("Archive member vanished: " + member);
        }
        return zip.getInputStream(entry);
    }

    @Override
    public void close() throws IOException {
        zip.close();
    }
}
