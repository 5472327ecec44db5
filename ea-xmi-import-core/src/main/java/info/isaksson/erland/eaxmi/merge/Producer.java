package info.isaksson.erland.eaxmi.merge;

/** The parser pass an element or relationship came from, in default precedence order per kind. */
public enum Producer {
    UML("uml", true),
    ARCHIMATE_PROFILE("archimate-profile", false),
    BPMN_PROFILE("bpmn-profile", false),
    EA_CONNECTOR("ea-connector", false),
    UML_CONNECTOR("uml-connector", true),
    UML_LINKS("uml-links", true),
    UML_ASSOCIATION("uml-association", true);

    public final String label;
    public final boolean uml;

    Producer(String label, boolean uml) {
        this.label = label;
        this.uml = uml;
    }
}
