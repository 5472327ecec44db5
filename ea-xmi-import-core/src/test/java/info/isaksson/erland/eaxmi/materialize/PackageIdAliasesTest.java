package info.isaksson.erland.eaxmi.materialize;

import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PackageIdAliasesTest {

    @Test
    public void package2RecordsMapBothWays() {
        String xml = Xmi.withEaExtension("", "<elements>"
                + "<element xmi:idref=\"EAPK_DOMAIN\" xmi:type=\"uml:Package\"><model package2=\"EAID_DOMAIN\" package=\"EAPK_ROOT\" ea_eleType=\"package\"/></element>"
                + "<element xmi:idref=\"PKG_OTHER\"><model package2=\"42\" ea_eleType=\"package\"/></element>"
                + "<element xmi:idref=\"EAID_CLASS\"><model package=\"EAPK_DOMAIN\" ea_eleType=\"element\"/></element>"
                + "<element xmi:idref=\"CLS2\"><model package2=\"77\" ea_eleType=\"element\"/></element>"
                + "</elements>");

        PackageIdAliases aliases = PackageIdAliases.build(Xmi.parse(xml));

        assertEquals("EAPK_DOMAIN", aliases.xmiIdFor("EAID_DOMAIN"));
        assertEquals("EAID_DOMAIN", aliases.eaidFor("EAPK_DOMAIN"));
        assertEquals("PKG_OTHER", aliases.xmiIdFor("42"));
        assertNull(aliases.xmiIdFor("77"));
        assertNull(aliases.eaidFor("EAID_CLASS"));
        assertNull(aliases.xmiIdFor(null));
        assertEquals(2, aliases.eaidToXmiId().size());
    }

    @Test
    public void modelRecordsOutsideTheExtensionAreIgnored() {
        String xml = Xmi.document("<element xmi:idref=\"EAPK_A\"><model package2=\"EAID_A\"/></element>", null);

        assertTrue(PackageIdAliases.build(Xmi.parse(xml)).isEmpty());
    }
}
