package info.isaksson.erland.eaxmi.materialize;

import info.isaksson.erland.eaxmi.parse.ElementSupport;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * EA gives each package two ids: the XMI id of its {@code packagedElement} (often {@code EAPK_*})
 * and a repository id (often {@code EAID_*}) exposed as {@code <model package2="..">} on the
 * extension {@code element} record. Diagrams tend to reference packages by the latter.
 */
public final class PackageIdAliases {

    private static final List<String> PACKAGE2_ATTRS = List.of("package2", "package_2", "package2id", "package2_id");
    private static final List<String> ELE_TYPE_ATTRS = List.of("ea_eleType", "ea_eletype", "ea_ele_type");

    private final Map<String, String> eaidToXmiId;
    private final Map<String, String> xmiIdToEaid;

    PackageIdAliases(Map<String, String> eaidToXmiId, Map<String, String> xmiIdToEaid) {
        this.eaidToXmiId = Collections.unmodifiableMap(eaidToXmiId);
        this.xmiIdToEaid = Collections.unmodifiableMap(xmiIdToEaid);
    }

    public static PackageIdAliases build(Document doc) {
        Map<String, String> eaidToXmiId = new LinkedHashMap<>();
        Map<String, String> xmiIdToEaid = new LinkedHashMap<>();
        for (Element el : XmlDom.descendantsByLocalName(doc, "element")) {
            if (!ElementSupport.isInsideExtension(el)) continue;
            String idref = XmlDom.attrAny(el, List.of("xmi:idref", "idref"));
            if (idref == null) continue;

            String package2 = null;
            String eleType = null;
            for (Element model : XmlDom.childrenByLocalName(el, "model")) {
                String p2 = XmlDom.attrAnyExact(model, PACKAGE2_ATTRS);
                if (p2 != null) package2 = p2;
                eleType = XmlDom.attrAnyExact(model, ELE_TYPE_ATTRS);
                if (eleType == null) eleType = XmlDom.blankToNull(XmlDom.attrExact(model, "type"));
            }
            if (package2 == null) continue;

            boolean looksLikePackage = package2.startsWith("EAID_")
                    || "package".equalsIgnoreCase(eleType)
                    || idref.startsWith(PackageMaterializer.PACKAGE_ID_PREFIX);
            if (!looksLikePackage) continue;

            eaidToXmiId.putIfAbsent(package2, idref);
            xmiIdToEaid.putIfAbsent(idref, package2);
        }
        return new PackageIdAliases(eaidToXmiId, xmiIdToEaid);
    }

    /** XMI package id for an {@code EAID_*} alias, or null. */
    public String xmiIdFor(String eaid) {
        return eaid == null ? null : eaidToXmiId.get(eaid);
    }

    public String eaidFor(String xmiId) {
        return xmiId == null ? null : xmiIdToEaid.get(xmiId);
    }

    public Map<String, String> eaidToXmiId() {
        return eaidToXmiId;
    }

    public Map<String, String> xmiIdToEaid() {
        return xmiIdToEaid;
    }

    public boolean isEmpty() {
        return eaidToXmiId.isEmpty();
    }
}
