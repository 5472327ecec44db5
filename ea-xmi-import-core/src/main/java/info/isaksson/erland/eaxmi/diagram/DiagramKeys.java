package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate attribute names for EA diagram records, most specific first.
 *
 * <p>EA versions and export options disagree on tag and attribute names, so every lookup goes
 * through one of these ordered lists and {@link #first}.</p>
 */
public final class DiagramKeys {

    public static final List<String> GUID = List.of("ea_guid", "ea:guid", "guid", "uuid");

    public static final List<String> DIAGRAM_ID = List.of("xmi:id", "xmi:idref", "id", "diagramid", "diagram_id", "diagramID");
    public static final List<String> DIAGRAM_NAME = List.of("name", "diagramname", "diagram_name", "title");
    public static final List<String> DIAGRAM_TYPE = List.of("diagramtype", "diagram_type", "diagramType", "type", "kind");
    public static final List<String> DIAGRAM_PACKAGE = List.of("package", "packageid", "packageId", "package_id", "owner", "ownerid", "parent");
    public static final List<String> DIAGRAM_NOTES = List.of("notes", "note", "documentation", "description");
    public static final List<String> CHILD_REF = List.of("xmi:idref", "idref", "ref", "href", "xmi:id");

    public static final List<String> OBJECT_ID = List.of("xmi:id", "id", "objectid", "object_id", "diagramobjectid", "diagram_object_id");
    public static final List<String> LEFT = List.of("l", "left", "x1", "lx");
    public static final List<String> RIGHT = List.of("r", "right", "x2", "rx");
    public static final List<String> TOP = List.of("t", "top", "y1", "ty");
    public static final List<String> BOTTOM = List.of("b", "bottom", "y2", "by");
    public static final List<String> X = List.of("x", "px", "posx", "pos_x");
    public static final List<String> Y = List.of("y", "py", "posy", "pos_y");
    public static final List<String> WIDTH = List.of("w", "width");
    public static final List<String> HEIGHT = List.of("h", "height");
    public static final List<String> BOUNDS_STRING = List.of("geometry", "bounds", "rect", "rectangle", "position", "pos");
    public static final List<String> NODE_KIND = List.of("type", "kind", "objecttype", "objectType", "style", "stereotype");
    public static final List<String> NODE_LABEL = List.of("name", "label");

    /** Node references, in resolution priority. */
    public static final List<String> NODE_REF = List.of(
            "subject", "subjectid", "subject_id",
            "element", "elementid", "element_id",
            "classifier", "classifierid", "classifier_id",
            "instance", "instanceid", "instance_id",
            "xmi:idref", "idref", "ref", "href");

    public static final List<String> LINK_ID = List.of("xmi:id", "id", "linkid", "link_id", "diagramlinkid", "diagram_link_id");
    public static final List<String> LINK_RELATIONSHIP = List.of(
            "connector", "connectorid", "connector_id",
            "relationship", "relationshipid", "relationship_id",
            "rel", "relid", "xmi:idref", "idref", "ref", "href");
    public static final List<String> LINK_SOURCE = List.of(
            "source", "sourceid", "source_id", "src", "from", "start", "startid", "start_id", "object1", "client");
    public static final List<String> LINK_TARGET = List.of(
            "target", "targetid", "target_id", "tgt", "to", "end", "endid", "end_id", "object2", "supplier");
    public static final List<String> LINK_POINTS = List.of("points", "waypoints", "bendpoint", "bendpoints", "path", "route", "routing");

    /** Connection relationship references, in resolution priority. */
    public static final List<String> CONNECTION_RELATIONSHIP = List.of(
            "subject", "connector", "connectorid", "connector_id",
            "relationship", "relationshipid", "relationship_id",
            "rel", "relid", "xmi:idref", "idref", "ref", "href",
            "ea_guid", "guid", "uuid");

    private DiagramKeys() {}

    /** First non-blank attribute over {@code keys}, trimmed; exact names only. */
    public static String first(Element el, List<String> keys) {
        return XmlDom.attrAnyExact(el, keys);
    }

    /** First non-blank value of a reference map over {@code keys}. */
    public static String first(Map<String, String> refs, List<String> keys) {
        for (String k : keys) {
            String v = refs.get(k);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    /** Every non-blank attribute named in {@code keys}, keyed by the candidate name. */
    public static Map<String, String> capture(Element el, List<String> keys) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String k : keys) {
            String v = XmlDom.blankToNull(XmlDom.attrExact(el, k));
            if (v != null) out.put(k, v);
        }
        return out;
    }
}
