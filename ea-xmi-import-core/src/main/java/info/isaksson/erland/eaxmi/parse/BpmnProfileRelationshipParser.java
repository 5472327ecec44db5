package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

/** BPMN flows and associations from the EA BPMN 2.0 profile. */
public final class BpmnProfileRelationshipParser extends ProfileRelationshipParser {

    public BpmnProfileRelationshipParser(EaParseContext ctx) {
        super(ctx);
    }

    @Override protected String namespaceMarker() {
        return BpmnProfileElementParser.NAMESPACE_MARKER;
    }

    @Override protected String relationshipType(Element el) {
        return BpmnVocabulary.relationshipType(XmlDom.localName(el));
    }

    @Override protected String synthPrefix() {
        return "eaBpmnRel_synth";
    }

    @Override protected String metaPrefix() {
        return "bpmnProfile";
    }

    @Override protected String label() {
        return "BPMN";
    }
}
