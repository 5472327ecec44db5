package info.isaksson.erland.eaxmi.parse;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** UML metaclass to IR type tables. Lookups are by exact metaclass name. */
public final class UmlTypes {

    public static final String PACKAGE = "uml.package";
    public static final String NOTE = "uml.note";
    public static final String ACTION = "uml.action";
    public static final String ACTIVITY = "uml.activity";
    public static final String ASSOCIATION_CLASS = "uml.associationClass";

    private static final Map<String, String> ELEMENTS = new LinkedHashMap<>();
    private static final Map<String, String> RELATIONSHIPS = new LinkedHashMap<>();
    private static final Map<String, String> LINKS = new LinkedHashMap<>();

    /** Types that carry {@code meta.umlMembers}. */
    public static final Set<String> MEMBER_OWNERS = Set.of("uml.class", "uml.interface", "uml.datatype", ASSOCIATION_CLASS);

    /** Activity node types that belong to a containing {@code uml.activity}. */
    public static final Set<String> ACTIVITY_NODES = Set.of(
            ACTION, "uml.initialNode", "uml.activityFinalNode", "uml.flowFinalNode", "uml.decisionNode",
            "uml.mergeNode", "uml.forkNode", "uml.joinNode", "uml.objectNode");

    static {
        ELEMENTS.put("Class", "uml.class");
        ELEMENTS.put("Interface", "uml.interface");
        ELEMENTS.put("Enumeration", "uml.enum");
        ELEMENTS.put("Enum", "uml.enum");
        ELEMENTS.put("DataType", "uml.datatype");
        ELEMENTS.put("PrimitiveType", "uml.primitiveType");
        ELEMENTS.put("Package", PACKAGE);
        ELEMENTS.put("Component", "uml.component");
        ELEMENTS.put("Artifact", "uml.artifact");
        ELEMENTS.put("Node", "uml.node");
        ELEMENTS.put("Device", "uml.device");
        ELEMENTS.put("ExecutionEnvironment", "uml.executionEnvironment");
        ELEMENTS.put("Actor", "uml.actor");
        ELEMENTS.put("UseCase", "uml.usecase");
        ELEMENTS.put("Comment", NOTE);
        ELEMENTS.put("Note", NOTE);
        ELEMENTS.put("AssociationClass", ASSOCIATION_CLASS);

        ELEMENTS.put("Activity", ACTIVITY);
        for (String a : new String[]{"Action", "OpaqueAction", "CallBehaviorAction", "CallOperationAction",
                "SendSignalAction", "AcceptEventAction", "AcceptCallAction", "CreateObjectAction",
                "DestroyObjectAction", "ReadVariableAction", "AddVariableValueAction", "ValueSpecificationAction"}) {
            ELEMENTS.put(a, ACTION);
        }
        ELEMENTS.put("InitialNode", "uml.initialNode");
        ELEMENTS.put("ActivityFinalNode", "uml.activityFinalNode");
        ELEMENTS.put("FlowFinalNode", "uml.flowFinalNode");
        ELEMENTS.put("DecisionNode", "uml.decisionNode");
        ELEMENTS.put("MergeNode", "uml.mergeNode");
        ELEMENTS.put("ForkNode", "uml.forkNode");
        ELEMENTS.put("JoinNode", "uml.joinNode");
        ELEMENTS.put("ObjectNode", "uml.objectNode");
        ELEMENTS.put("CentralBufferNode", "uml.objectNode");
        ELEMENTS.put("DataStoreNode", "uml.objectNode");
        ELEMENTS.put("ActivityParameterNode", "uml.objectNode");

        RELATIONSHIPS.put("Association", "uml.association");
        RELATIONSHIPS.put("Aggregation", "uml.aggregation");
        RELATIONSHIPS.put("Composition", "uml.composition");
        RELATIONSHIPS.put("Dependency", "uml.dependency");
        RELATIONSHIPS.put("Usage", "uml.dependency");
        RELATIONSHIPS.put("Abstraction", "uml.abstraction");
        RELATIONSHIPS.put("Generalization", "uml.generalization");
        RELATIONSHIPS.put("Realization", "uml.realization");
        RELATIONSHIPS.put("Realisation", "uml.realization");
        RELATIONSHIPS.put("InterfaceRealization", "uml.realization");
        RELATIONSHIPS.put("Include", "uml.include");
        RELATIONSHIPS.put("Extend", "uml.extend");
        RELATIONSHIPS.put("Deployment", "uml.deployment");
        RELATIONSHIPS.put("CommunicationPath", "uml.communicationPath");
        RELATIONSHIPS.put("ControlFlow", "uml.controlFlow");
        RELATIONSHIPS.put("ObjectFlow", "uml.objectFlow");
        RELATIONSHIPS.put("InformationFlow", "uml.informationFlow");
        RELATIONSHIPS.put("NoteLink", "uml.noteLink");

        LINKS.put("notelink", "uml.noteLink");
        LINKS.put("informationflow", "uml.informationFlow");
        LINKS.put("abstraction", "uml.abstraction");
        LINKS.put("association", "uml.association");
        LINKS.put("aggregation", "uml.aggregation");
        LINKS.put("composition", "uml.composition");
        LINKS.put("dependency", "uml.dependency");
        LINKS.put("usage", "uml.dependency");
        LINKS.put("generalization", "uml.generalization");
        LINKS.put("realisation", "uml.realization");
        LINKS.put("realization", "uml.realization");
        LINKS.put("interfacerealization", "uml.realization");
        LINKS.put("include", "uml.include");
        LINKS.put("extend", "uml.extend");
        LINKS.put("deployment", "uml.deployment");
        LINKS.put("communicationpath", "uml.communicationPath");
        LINKS.put("controlflow", "uml.controlFlow");
        LINKS.put("objectflow", "uml.objectFlow");
    }

    private UmlTypes() {}

    public static String elementType(String metaclass) {
        return metaclass == null ? null : ELEMENTS.get(metaclass.trim());
    }

    public static String relationshipType(String metaclass) {
        return metaclass == null ? null : RELATIONSHIPS.get(metaclass.trim());
    }

    /** {@code include}/{@code extend}/{@code deployment} stereotypes re-type a dependency. */
    public static String relationshipTypeFromStereotype(String stereotype) {
        String st = stereotype == null ? "" : stereotype.trim().toLowerCase(Locale.ROOT);
        switch (st) {
            case "include": return "uml.include";
            case "extend": return "uml.extend";
            case "deployment": return "uml.deployment";
            default: return null;
        }
    }

    /** Type for an EA {@code <links>} child tag or an EA connector {@code ea_type}; null when unknown. */
    public static String linkType(String tagOrEaType) {
        if (tagOrEaType == null) return null;
        return LINKS.get(tagOrEaType.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean isUmlType(String type) {
        return type != null && type.startsWith("uml.");
    }
}
