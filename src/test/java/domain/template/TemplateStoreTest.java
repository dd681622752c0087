package domain.template;

import domain.error.MissingTemplateException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TemplateStoreTest {

    @Test
    void should_classify_sequence_entries_and_pad_to_four_digits() {
        assertEquals(Optional.of("0001"), TemplateStore.keyForEntry("Seq1.xls"));
        assertEquals(Optional.of("0012"), TemplateStore.keyForEntry("templates/Seq12.xlsx"));
        assertEquals(Optional.of("0122"), TemplateStore.keyForEntry("Seq122.xls"));
    }

    @Test
    void should_classify_geography_entry() {
        assertEquals(Optional.of(TemplateStore.GEO_KEY), TemplateStore.keyForEntry("2015_SFGeoFileTemplate.xls"));
    }

    @Test
    void should_skip_other_entries() {
        assertTrue(TemplateStore.keyForEntry("templates/").isEmpty());
        assertTrue(TemplateStore.keyForEntry("readme.txt").isEmpty());
        assertTrue(TemplateStore.keyForEntry("Seq.xls").isEmpty());
    }

    @Test
    void should_return_template_or_fail_with_missing_template() {
        TemplateStore store = new TemplateStore(Map.of(
                "0001", List.of("a", "b"),
                TemplateStore.GEO_KEY, List.of("g")));

        assertEquals(List.of("a", "b"), store.templateFor("0001"));
        assertEquals(List.of("g"), store.geographyTemplate());

        MissingTemplateException ex = assertThrows(MissingTemplateException.class, () -> store.templateFor("0002"));
        assertEquals("0002", ex.getTemplateKey());
    }

    @Test
    void normalize_should_pad_short_ids_only() {
        assertEquals("0007", SequenceIds.normalize("7"));
        assertEquals("0007", SequenceIds.normalize(" 0007 "));
        assertEquals("12345", SequenceIds.normalize("12345"));
        assertTrue(SequenceIds.isValid("0123"));
        assertFalse(SequenceIds.isValid("12345"));
    }
}
