package info.isaksson.erland.eaxmi.parse;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * EA ArchiMate profile tags ({@code ArchiMate_BusinessActor}, ...) to {@code archimate.*} types.
 *
 * <p>Keys are lower-cased tag names without the {@code archimate_} prefix. British spellings
 * ({@code Realisation}, {@code Specialisation}) and a few ArchiMate 2 names are accepted.</p>
 */
public final class ArchimateVocabulary {

    public static final String TYPE_PREFIX = "archimate.";

    private static final Map<String, String> ELEMENTS = new LinkedHashMap<>();
    private static final Map<String, String> RELATIONSHIPS = new LinkedHashMap<>();

    static {
        for (String n : new String[]{
                // strategy
                "Resource", "Capability", "ValueStream", "CourseOfAction",
                // business
                "BusinessActor", "BusinessRole", "BusinessCollaboration", "BusinessInterface",
                "BusinessProcess", "BusinessFunction", "BusinessInteraction", "BusinessEvent",
                "BusinessService", "BusinessObject", "Contract", "Representation", "Product",
                // application
                "ApplicationComponent", "ApplicationCollaboration", "ApplicationInterface",
                "ApplicationFunction", "ApplicationInteraction", "ApplicationProcess",
                "ApplicationEvent", "ApplicationService", "DataObject",
                // technology
                "Node", "Device", "SystemSoftware", "TechnologyCollaboration", "TechnologyInterface",
                "Path", "CommunicationNetwork", "TechnologyFunction", "TechnologyProcess",
                "TechnologyInteraction", "TechnologyEvent", "TechnologyService", "Artifact",
                // physical
                "Equipment", "Facility", "DistributionNetwork", "Material",
                // implementation and migration
                "WorkPackage", "Deliverable", "ImplementationEvent", "Plateau", "Gap",
                // motivation
                "Stakeholder", "Driver", "Assessment", "Goal", "Outcome", "Principle",
                "Requirement", "Constraint", "Meaning", "Value",
                // other
                "Grouping", "Location", "Junction"}) {
            ELEMENTS.put(n.toLowerCase(Locale.ROOT), TYPE_PREFIX + lowerCamel(n));
        }
        ELEMENTS.put("infrastructureservice", TYPE_PREFIX + "technologyService");
        ELEMENTS.put("infrastructureinterface", TYPE_PREFIX + "technologyInterface");
        ELEMENTS.put("infrastructurefunction", TYPE_PREFIX + "technologyFunction");
        ELEMENTS.put("network", TYPE_PREFIX + "communicationNetwork");
        ELEMENTS.put("andjunction", TYPE_PREFIX + "junction");
        ELEMENTS.put("orjunction", TYPE_PREFIX + "junction");

        for (String n : new String[]{"Association", "Serving", "Realization", "Flow", "Composition",
                "Aggregation", "Assignment", "Access", "Influence", "Triggering", "Specialization"}) {
            RELATIONSHIPS.put(n.toLowerCase(Locale.ROOT), TYPE_PREFIX + lowerCamel(n));
        }
        RELATIONSHIPS.put("realisation", TYPE_PREFIX + "realization");
        RELATIONSHIPS.put("specialisation", TYPE_PREFIX + "specialization");
        RELATIONSHIPS.put("usedby", TYPE_PREFIX + "serving");
    }

    private ArchimateVocabulary() {}

    /** Tag or stereotype without namespace prefix and {@code ArchiMate_} prefix, lower-cased. */
    public static String token(String tagOrStereotype) {
        if (tagOrStereotype == null) return "";
        String t = tagOrStereotype.trim();
        int colon = t.lastIndexOf(':');
        if (colon >= 0) t = t.substring(colon + 1);
        t = t.toLowerCase(Locale.ROOT);
        if (t.startsWith("archimate_")) t = t.substring("archimate_".length());
        return t.replace(" ", "");
    }

    /** Source token as written in EA, e.g. {@code BusinessActor} for {@code ArchiMate_BusinessActor}. */
    public static String sourceToken(String tagOrStereotype) {
        if (tagOrStereotype == null) return "";
        String t = tagOrStereotype.trim();
        int colon = t.lastIndexOf(':');
        if (colon >= 0) t = t.substring(colon + 1);
        if (t.regionMatches(true, 0, "archimate_", 0, "archimate_".length())) t = t.substring("archimate_".length());
        return t;
    }

    public static String elementType(String tagOrStereotype) {
        return ELEMENTS.get(token(tagOrStereotype));
    }

    public static String relationshipType(String tagOrStereotype) {
        return RELATIONSHIPS.get(token(tagOrStereotype));
    }

    public static boolean isArchimateStereotype(String stereotype) {
        return stereotype != null && stereotype.trim().toLowerCase(Locale.ROOT).startsWith("archimate_");
    }

    public static boolean isArchimateType(String type) {
        return type != null && type.startsWith(TYPE_PREFIX);
    }

    static String lowerCamel(String pascal) {
        return pascal.isEmpty() ? pascal : Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }
}
