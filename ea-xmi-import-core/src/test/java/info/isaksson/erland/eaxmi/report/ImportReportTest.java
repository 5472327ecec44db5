package info.isaksson.erland.eaxmi.report;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ImportReportTest {

    @Test
    public void keepsInsertionOrderAndPrefixesMessages() {
        ImportReport report = new ImportReport("ea-xmi-uml", "model.xmi");
        report.warn("b-code", "second", "elementId", "E2");
        report.info("a-code", "first");
        report.warn("a-code", "third");

        List<ImportIssue> issues = report.issues();
        assertEquals(3, issues.size());
        assertEquals("model.xmi: second", issues.get(0).message);
        assertEquals(Map.of("elementId", "E2"), issues.get(0).context);
        assertEquals(List.of("model.xmi: second", "model.xmi: third"), report.warningMessages());
        assertEquals(1, report.infos().size());
        assertTrue(report.hasWarnings());
        assertEquals("ea-xmi-uml", report.source());
    }

    @Test
    public void deterministicListSortsByLevelThenCode() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        report.info("z", "info");
        report.warn("b", "warn b");
        report.warn("a", "warn a");

        List<ImportIssue> sorted = report.toDeterministicList();
        assertEquals("a", sorted.get(0).code);
        assertEquals("b", sorted.get(1).code);
        assertEquals(ImportIssue.Level.INFO, sorted.get(2).level);

        Map<String, Integer> counts = report.countsByCode();
        assertEquals(List.of("a", "b", "z"), List.copyOf(counts.keySet()));
    }

    @Test
    public void emptyReportHasNoWarnings() {
        ImportReport report = new ImportReport("ea-xmi-uml", "  ");
        assertFalse(report.hasWarnings());
        assertEquals(0, report.size());
        report.info("x", "hello");
        assertEquals("hello", report.issues().get(0).message);
        assertFalse(report.hasWarnings());
    }
}
