package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.EaExtensions;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One {@code <connector>} record from an EA extension {@code <connectors>} block.
 *
 * <p>Endpoints are already swapped when {@code properties@direction} reads
 * {@code Destination -> Source}.</p>
 */
final class EaConnector {

    private static final List<String> ID_ATTRS = List.of("connectorid", "connectorId", "id");
    private static final List<String> ENDPOINT_ATTRS = List.of("subject", "element", "classifier", "start", "end", "ref");

    final Element el;
    /** Id found on the record, null when the record has none. */
    final String id;
    final String sourceId;
    final String targetId;
    final String stereotype;
    final String direction;
    final String eaType;
    final String name;
    final String associationClassRef;

    private EaConnector(Element el) {
        this.el = el;
        String idref = XmlDom.xmiIdRef(el);
        if (idref == null) idref = XmlDom.xmiId(el);
        this.id = idref != null ? idref : XmlDom.attrAny(el, ID_ATTRS);

        Element props = XmlDom.childByLocalName(el, "properties");
        this.stereotype = props == null ? null : XmlDom.attrAny(props, ElementSupport.STEREOTYPE_ATTRS);
        this.direction = props == null ? null : XmlDom.attrTrim(props, "direction");
        String type = props == null ? null : XmlDom.attrAny(props, List.of("ea_type", "eaType"));
        if (type == null && props != null) type = XmlDom.blankToNull(XmlDom.attrExact(props, "type"));
        this.eaType = type;

        Element ext = XmlDom.childByLocalName(el, "extendedProperties");
        this.associationClassRef = ext == null ? null : XmlDom.attrAny(ext, List.of("associationclass", "associationClass"));
        this.name = XmlDom.attrAny(el, List.of("name", "label"));

        String src = endpoint(XmlDom.childByLocalName(el, "source"));
        String tgt = endpoint(XmlDom.childByLocalName(el, "target"));
        if (swapsDirection(direction)) {
            this.sourceId = tgt;
            this.targetId = src;
        } else {
            this.sourceId = src;
            this.targetId = tgt;
        }
    }

    static List<EaConnector> read(Document doc) {
        List<EaConnector> out = new ArrayList<>();
        for (Element block : EaExtensions.blocks(doc, "connectors")) {
            for (Element c : XmlDom.childrenByLocalName(block, "connector")) {
                out.add(new EaConnector(c));
            }
        }
        return out;
    }

    private static String endpoint(Element endpointEl) {
        if (endpointEl == null) return null;
        String idref = XmlDom.xmiIdRef(endpointEl);
        if (idref != null) return idref;
        String id = XmlDom.xmiId(endpointEl);
        return id != null ? id : XmlDom.attrAny(endpointEl, ENDPOINT_ATTRS);
    }

    /** {@code Destination -> Source} swaps; {@code Source -> Destination} and {@code Unspecified} do not. */
    static boolean swapsDirection(String direction) {
        String d = direction == null ? "" : direction.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        if (d.isEmpty() || d.contains("unspecified")) return false;
        return d.contains("destination") && d.contains("source") && d.startsWith("destination");
    }

    boolean hasArchimateStereotype() {
        return ArchimateVocabulary.isArchimateStereotype(stereotype);
    }

    boolean hasBpmnStereotype() {
        return stereotype != null && stereotype.toLowerCase(Locale.ROOT).contains("bpmn");
    }
}
