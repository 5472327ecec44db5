package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * EA BPMN 2.0 profile tags to {@code bpmn.*} types.
 *
 * <p>Generic tags ({@code Activity}, {@code Gateway}, {@code IntermediateEvent}) are refined by
 * the {@code activityType}/{@code taskType}, {@code gatewayType} and {@code eventType} attributes.</p>
 */
public final class BpmnVocabulary {

    public static final String TYPE_PREFIX = "bpmn.";
    public static final String POOL = "bpmn.pool";
    public static final String LANE = "bpmn.lane";

    private static final Map<String, String> ELEMENTS = new LinkedHashMap<>();
    private static final Map<String, String> RELATIONSHIPS = new LinkedHashMap<>();

    static {
        ELEMENTS.put("pool", POOL);
        ELEMENTS.put("participant", POOL);
        ELEMENTS.put("lane", LANE);
        ELEMENTS.put("task", "bpmn.task");
        ELEMENTS.put("usertask", "bpmn.userTask");
        ELEMENTS.put("servicetask", "bpmn.serviceTask");
        ELEMENTS.put("scripttask", "bpmn.scriptTask");
        ELEMENTS.put("manualtask", "bpmn.manualTask");
        ELEMENTS.put("callactivity", "bpmn.callActivity");
        ELEMENTS.put("subprocess", "bpmn.subProcess");
        ELEMENTS.put("startevent", "bpmn.startEvent");
        ELEMENTS.put("endevent", "bpmn.endEvent");
        ELEMENTS.put("intermediatecatchevent", "bpmn.intermediateCatchEvent");
        ELEMENTS.put("intermediatethrowevent", "bpmn.intermediateThrowEvent");
        ELEMENTS.put("boundaryevent", "bpmn.boundaryEvent");
        ELEMENTS.put("exclusivegateway", "bpmn.gatewayExclusive");
        ELEMENTS.put("parallelgateway", "bpmn.gatewayParallel");
        ELEMENTS.put("inclusivegateway", "bpmn.gatewayInclusive");
        ELEMENTS.put("eventbasedgateway", "bpmn.gatewayEventBased");
        ELEMENTS.put("dataobject", "bpmn.dataObjectReference");
        ELEMENTS.put("dataobjectreference", "bpmn.dataObjectReference");
        ELEMENTS.put("datastore", "bpmn.dataStoreReference");
        ELEMENTS.put("datastorereference", "bpmn.dataStoreReference");
        ELEMENTS.put("textannotation", "bpmn.textAnnotation");
        ELEMENTS.put("group", "bpmn.group");

        RELATIONSHIPS.put("sequenceflow", "bpmn.sequenceFlow");
        RELATIONSHIPS.put("messageflow", "bpmn.messageFlow");
        RELATIONSHIPS.put("association", "bpmn.association");
        RELATIONSHIPS.put("dataassociation", "bpmn.dataAssociation");
        RELATIONSHIPS.put("datainputassociation", "bpmn.dataAssociation");
        RELATIONSHIPS.put("dataoutputassociation", "bpmn.dataAssociation");
    }

    private BpmnVocabulary() {}

    static String token(String tag) {
        if (tag == null) return "";
        String t = tag.trim();
        int colon = t.lastIndexOf(':');
        if (colon >= 0) t = t.substring(colon + 1);
        t = t.toLowerCase(Locale.ROOT);
        if (t.startsWith("bpmn_")) t = t.substring("bpmn_".length());
        return t.replace(" ", "");
    }

    public static String relationshipType(String tag) {
        return RELATIONSHIPS.get(token(tag));
    }

    /** Element type for a profile tag, refined by its type attributes; null when unknown. */
    public static String elementType(Element el) {
        String t = token(XmlDom.localName(el));
        String direct = ELEMENTS.get(t);
        switch (t) {
            case "activity":
                return activityType(el);
            case "gateway":
                return gatewayType(el);
            case "intermediateevent":
                return intermediateEventType(el);
            default:
                return direct;
        }
    }

    private static String activityType(Element el) {
        String kind = token(XmlDom.attrAny(el, List.of("activityType", "activitytype")));
        if (kind.equals("subprocess")) return "bpmn.subProcess";
        if (kind.equals("callactivity")) return "bpmn.callActivity";
        String task = token(XmlDom.attrAny(el, List.of("taskType", "tasktype")));
        switch (task) {
            case "user": return "bpmn.userTask";
            case "service": return "bpmn.serviceTask";
            case "script": return "bpmn.scriptTask";
            case "manual": return "bpmn.manualTask";
            default: return "bpmn.task";
        }
    }

    private static String gatewayType(Element el) {
        String kind = token(XmlDom.attrAny(el, List.of("gatewayType", "gatewaytype")));
        switch (kind) {
            case "parallel": return "bpmn.gatewayParallel";
            case "inclusive": return "bpmn.gatewayInclusive";
            case "eventbased": return "bpmn.gatewayEventBased";
            default: return "bpmn.gatewayExclusive";
        }
    }

    private static String intermediateEventType(Element el) {
        String kind = token(XmlDom.attrAny(el, List.of("eventType", "eventtype", "catchOrThrow")));
        if (kind.contains("throw")) return "bpmn.intermediateThrowEvent";
        if (kind.contains("boundary") || kind.equals("edge")) return "bpmn.boundaryEvent";
        return "bpmn.intermediateCatchEvent";
    }

    public static boolean isBpmnType(String type) {
        return type != null && type.startsWith(TYPE_PREFIX);
    }
}
