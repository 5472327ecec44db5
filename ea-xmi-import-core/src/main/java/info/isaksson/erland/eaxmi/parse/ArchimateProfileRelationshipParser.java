package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

/** {@code ArchiMate_*} relationship stereotypes applied to UML connectors. */
public final class ArchimateProfileRelationshipParser extends ProfileRelationshipParser {

    public ArchimateProfileRelationshipParser(EaParseContext ctx) {
        super(ctx);
    }

    @Override protected String namespaceMarker() {
        return ArchimateProfileElementParser.NAMESPACE_MARKER;
    }

    @Override protected String relationshipType(Element el) {
        return ArchimateVocabulary.relationshipType(XmlDom.localName(el));
    }

    @Override protected String synthPrefix() {
        return "eaArchRel_synth";
    }

    @Override protected String metaPrefix() {
        return "archimateProfile";
    }

    @Override protected String label() {
        return "ArchiMate";
    }
}
