package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

/** EA ArchiMate profile elements ({@code ArchiMate_*} tags). */
public final class ArchimateProfileElementParser extends ProfileElementParser {

    public static final String NAMESPACE_MARKER = "sparxsystems.com/profiles/archimate";

    public ArchimateProfileElementParser(EaParseContext ctx) {
        super(ctx);
    }

    @Override protected String namespaceMarker() {
        return NAMESPACE_MARKER;
    }

    @Override protected boolean isRelationshipTag(Element el) {
        return ArchimateVocabulary.relationshipType(XmlDom.localName(el)) != null;
    }

    @Override protected String elementType(Element el) {
        return ArchimateVocabulary.elementType(XmlDom.localName(el));
    }

    @Override protected String sourceToken(Element el) {
        return ArchimateVocabulary.sourceToken(el.getLocalName() != null ? el.getLocalName() : el.getTagName());
    }

    @Override protected String synthPrefix() {
        return "eaArchEl_synth";
    }

    @Override protected String metaPrefix() {
        return "archimateProfile";
    }

    @Override protected String label() {
        return "ArchiMate";
    }
}
