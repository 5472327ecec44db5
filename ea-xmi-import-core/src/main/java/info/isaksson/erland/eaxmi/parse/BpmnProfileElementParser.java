package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

/** EA BPMN 2.0 profile elements. */
public final class BpmnProfileElementParser extends ProfileElementParser {

    public static final String NAMESPACE_MARKER = "sparxsystems.com/profiles/bpmn";

    public BpmnProfileElementParser(EaParseContext ctx) {
        super(ctx);
    }

    @Override protected String namespaceMarker() {
        return NAMESPACE_MARKER;
    }

    @Override protected boolean isRelationshipTag(Element el) {
        return BpmnVocabulary.relationshipType(XmlDom.localName(el)) != null;
    }

    @Override protected String elementType(Element el) {
        return BpmnVocabulary.elementType(el);
    }

    @Override protected String sourceToken(Element el) {
        return el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    }

    @Override protected String synthPrefix() {
        return "eaBpmnEl_synth";
    }

    @Override protected String metaPrefix() {
        return "bpmnProfile";
    }

    @Override protected String label() {
        return "BPMN";
    }
}
