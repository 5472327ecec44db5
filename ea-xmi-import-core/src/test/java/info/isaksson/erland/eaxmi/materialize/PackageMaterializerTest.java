package info.isaksson.erland.eaxmi.materialize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.ir.IrViewNodeKind;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PackageMaterializerTest {

    private static final PackageIdAliases ALIASES = PackageIdAliases.build(Xmi.parse(Xmi.withEaExtension("",
            "<elements>"
                    + "<element xmi:idref=\"EAPK_DOMAIN\"><model package2=\"EAID_DOMAIN\" ea_eleType=\"package\"/></element>"
                    + "<element xmi:idref=\"EAPK_INFRA\"><model package2=\"EAID_INFRA\" ea_eleType=\"package\"/></element>"
                    + "</elements>")));

    private static final List<IrFolder> FOLDERS = List.of(
            new IrFolder("EAPK_ROOT", "Model", null, null, null, null, null),
            new IrFolder("EAPK_DOMAIN", "Domain", "EAPK_ROOT", "Business types", null, null, null),
            new IrFolder("EAPK_INFRA", "Infrastructure", "EAPK_ROOT", null, null, null, null),
            new IrFolder("P_PLAIN", null, "EAPK_ROOT", null, null, null, null));

    private static final List<IrElement> ELEMENTS = List.of(
            new IrElement("C1", "uml.class", "Customer", null, "EAPK_DOMAIN", null, null, null, null));

    private static final List<IrRelationship> RELATIONSHIPS = List.of(
            new IrRelationship("D1", "uml.dependency", "C1", "EAID_INFRA", null, null, null, null, null, null));

    private static final List<IrView> VIEWS = List.of(new IrView("V1", "Overview", null, "EAPK_ROOT", null,
            List.of(new IrViewNode("N1", IrViewNodeKind.ELEMENT, null, null, null, null, null,
                    Map.of(IrViewNode.META_REF_RAW, Map.of("subject", "EAID_DOMAIN")))),
            null, null, null));

    @Test
    public void diagramReferencedPackageBecomesElement() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        PackageMaterializer.Result result = new PackageMaterializer(ALIASES, PackageElementPolicy.DIAGRAM_REFERENCED, report)
                .apply(FOLDERS, ELEMENTS, RELATIONSHIPS, VIEWS);

        assertEquals(2, result.createdPackageElements);
        assertEquals(List.of("C1", "EAPK_DOMAIN", "EAPK_INFRA"), ids(result.elements));
        IrElement pkg = result.elements.get(1);
        assertEquals("EAPK_DOMAIN", pkg.id);
        assertEquals("uml.package", pkg.type);
        assertEquals("Domain", pkg.name);
        assertEquals("Business types", pkg.documentation);
        assertEquals("EAPK_ROOT", pkg.folderId);
        assertTrue(pkg.externalIds.contains(IrExternalId.of("sparx-ea", "EAID_DOMAIN", "package-eaid")));
        assertEquals(Boolean.TRUE, pkg.meta.get("derivedFromFolder"));

        // INFRA is not on a diagram, but the dependency names it through its alias.
        IrElement infra = result.elements.get(2);
        assertEquals("uml.package", infra.type);
        assertTrue(infra.externalIds.contains(IrExternalId.of("sparx-ea", "EAID_INFRA", "package-eaid")));
        assertEquals("EAPK_INFRA", result.relationships.get(0).targetId);
        assertEquals(1, result.rewrittenEndpoints);
        assertEquals(List.of("ea-xmi:package-elements-created", "ea-xmi:package-eaid-endpoint-rewrite"), Xmi.codes(report));
        assertFalse(report.hasWarnings());
    }

    @Test
    public void referencedPolicyIncludesRelationshipEndpoints() {
        PackageMaterializer.Result result = new PackageMaterializer(ALIASES, PackageElementPolicy.REFERENCED, new ImportReport("t"))
                .apply(FOLDERS, ELEMENTS, RELATIONSHIPS, VIEWS);

        assertEquals(List.of("C1", "EAPK_DOMAIN", "EAPK_INFRA"), ids(result.elements));
        assertEquals("EAPK_INFRA", result.relationships.get(0).targetId);
    }

    @Test
    public void alwaysAndNever() {
        PackageMaterializer.Result always = new PackageMaterializer(ALIASES, PackageElementPolicy.ALWAYS, new ImportReport("t"))
                .apply(FOLDERS, ELEMENTS, List.of(), List.of());
        assertEquals(List.of("C1", "EAPK_ROOT", "EAPK_DOMAIN", "EAPK_INFRA", "EAPK_P_PLAIN"), ids(always.elements));
        assertEquals("Package", always.elements.get(4).name);

        ImportReport report = new ImportReport("t");
        PackageMaterializer.Result never = new PackageMaterializer(ALIASES, PackageElementPolicy.NEVER, report)
                .apply(FOLDERS, ELEMENTS, List.of(), VIEWS);
        assertEquals(List.of("C1"), ids(never.elements));
        assertEquals(0, report.size());
    }

    @Test
    public void neverPolicyRewritesAliasEndpointToFolderOnly() {
        PackageMaterializer.Result result = new PackageMaterializer(ALIASES, PackageElementPolicy.NEVER, new ImportReport("t"))
                .apply(FOLDERS, ELEMENTS, RELATIONSHIPS, VIEWS);

        assertEquals(List.of("C1"), ids(result.elements));
        assertEquals("EAPK_INFRA", result.relationships.get(0).targetId);
    }

    @Test
    public void existingElementIsNotDuplicated() {
        List<IrElement> elements = List.of(
                new IrElement("EAPK_DOMAIN", "uml.package", "Domain", null, "EAPK_ROOT", null, null, null, null));
        PackageMaterializer.Result result = new PackageMaterializer(ALIASES, PackageElementPolicy.DIAGRAM_REFERENCED, new ImportReport("t"))
                .apply(FOLDERS, elements, List.of(), VIEWS);

        assertEquals(1, result.elements.size());
        assertEquals(0, result.createdPackageElements);
    }

    @Test
    public void policyParsing() {
        assertEquals(PackageElementPolicy.DIAGRAM_REFERENCED, PackageElementPolicy.parseCli(null));
        assertEquals(PackageElementPolicy.ALWAYS, PackageElementPolicy.parseCli(" Always "));
        assertThrows(IllegalArgumentException.class, () -> PackageElementPolicy.parseCli("sometimes"));
    }

    private static List<String> ids(List<IrElement> elements) {
        return elements.stream().map(e -> e.id).collect(Collectors.toList());
    }
}
