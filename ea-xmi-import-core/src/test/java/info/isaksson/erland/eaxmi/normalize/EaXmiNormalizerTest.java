package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.ir.IrModel;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrUmlMembers;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.parse.AssociationParser;
import info.isaksson.erland.eaxmi.report.ImportIssue;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EaXmiNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC);

    @Test
    public void folderWithUnknownParentMovesToRoot() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        IrModel in = new IrModel(List.of(
                new IrFolder("F1", " Root ", null, "  ", null, null, null),
                new IrFolder("F2", "Orphan", "GONE", null, null, null, null)),
                null, null, null, null);

        IrModel out = new EaXmiNormalizer(report, CLOCK).normalize(in);

        assertNull(out.folders.get(1).parentId);
        assertEquals("Root", out.folders.get(0).name);
        assertNull(out.folders.get(0).documentation);
        List<ImportIssue> warnings = report.warnings();
        assertEquals(1, warnings.size());
        assertEquals("ea-xmi:folder-missing-parent", warnings.get(0).code);
        assertTrue(warnings.get(0).message.contains("F2"));
        assertTrue(warnings.get(0).message.contains("GONE"));
    }

    @Test
    public void elementsAndViewsWithUnknownFolderMoveToRoot() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        IrModel in = new IrModel(
                List.of(new IrFolder("F1", "Root", null, null, null, null, null)),
                List.of(new IrElement("E1", "uml.class", "A", null, "F1", null, null, null, null),
                        new IrElement("E2", "uml.class", "B", null, "F9", null, null, null, null)),
                null,
                List.of(new IrView("V1", "View", null, "F8", null, null, null, null, null)),
                null);

        IrModel out = new EaXmiNormalizer(report, CLOCK).normalize(in);

        assertEquals("F1", out.findElement("E1").folderId);
        assertNull(out.findElement("E2").folderId);
        assertNull(out.findView("V1").folderId);
        assertEquals(List.of("ea-xmi:element-missing-folder", "ea-xmi:view-missing-folder"), Xmi.codes(report));
    }

    @Test
    public void modelMetaDefaultsKeepExistingValues() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("format", "ea-xmi-archimate");
        IrModel out = new EaXmiNormalizer(new ImportReport("t"), CLOCK)
                .normalize(new IrModel(null, null, null, null, meta));

        assertEquals("ea-xmi-archimate", out.meta.get("format"));
        assertEquals(EaXmiNormalizer.DEFAULT_TOOL, out.meta.get("tool"));
        assertEquals("sparx-ea", out.meta.get("sourceSystem"));
        assertEquals("2024-05-06T07:08:09Z", out.meta.get("importedAtIso"));
    }

    @Test
    public void memberPayloadReadBackFromJsonIsSanitized() {
        Map<String, Object> attr = new LinkedHashMap<>();
        attr.put("name", " id ");
        attr.put("isStatic", "yes");
        Map<String, Object> blank = new LinkedHashMap<>();
        blank.put("name", " ");
        Map<String, Object> members = new LinkedHashMap<>();
        members.put("attributes", List.of(attr, blank));
        members.put("operations", List.of());
        IrElement e = new IrElement("E1", "uml.class", "A", null, null, null, null, null,
                Map.of(IrUmlMembers.META_KEY, members));

        IrModel out = new EaXmiNormalizer(new ImportReport("t"), CLOCK)
                .normalize(new IrModel(null, List.of(e), null, null, null));

        IrUmlMembers cleaned = (IrUmlMembers) out.elements.get(0).meta.get(IrUmlMembers.META_KEY);
        assertEquals(1, cleaned.attributes.size());
        assertEquals("id", cleaned.attributes.get(0).name);
        assertEquals(Boolean.TRUE, cleaned.attributes.get(0).isStatic);
    }

    @Test
    public void associationEndAttributesAreSanitized() {
        Map<String, Object> ends = new LinkedHashMap<>();
        ends.put("sourceRole", " owner ");
        ends.put("targetNavigable", "true");
        ends.put("sourceNavigable", "maybe");
        IrRelationship withEnds = new IrRelationship("R1", "uml.association", "A", "B", null, null, null, null, null,
                Map.of(AssociationParser.UML_ATTRS, ends));
        IrRelationship empty = new IrRelationship("R2", "uml.association", "A", "B", null, null, null, null, null,
                Map.of(AssociationParser.UML_ATTRS, Map.of("sourceRole", " ")));

        IrModel out = new EaXmiNormalizer(new ImportReport("t"), CLOCK)
                .normalize(new IrModel(null, null, List.of(withEnds, empty), null, null));

        @SuppressWarnings("unchecked")
        Map<String, Object> cleaned = (Map<String, Object>) out.relationships.get(0).meta.get(AssociationParser.UML_ATTRS);
        assertEquals("owner", cleaned.get("sourceRole"));
        assertEquals(Boolean.TRUE, cleaned.get("targetNavigable"));
        assertFalse(cleaned.containsKey("sourceNavigable"));
        assertFalse(out.relationships.get(1).meta.containsKey(AssociationParser.UML_ATTRS));
    }

    @Test
    public void nullModelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EaXmiNormalizer(new ImportReport("t"), CLOCK).normalize(null));
    }
}
