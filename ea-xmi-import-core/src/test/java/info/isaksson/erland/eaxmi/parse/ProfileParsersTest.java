package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrTaggedValue;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProfileParsersTest {

    private static final String ARCHIMATE_MODEL =
            "<packagedElement xmi:type=\"uml:Package\" xmi:id=\"PKG\" name=\"Business\">"
                    + "  <packagedElement xmi:type=\"uml:Class\" xmi:id=\"ACTOR_BASE\" name=\"Customer\"/>"
                    + "  <packagedElement xmi:type=\"uml:Class\" xmi:id=\"SVC_BASE\" name=\"Ordering\"/>"
                    + "  <packagedElement xmi:type=\"uml:Dependency\" xmi:id=\"DEP_BASE\" client=\"SVC_BASE\" supplier=\"ACTOR_BASE\"/>"
                    + "</packagedElement>";

    private static final String ARCHIMATE_TAGS =
            "<ArchiMate3:ArchiMate_BusinessActor xmi:id=\"TAG1\" base_Class=\"ACTOR_BASE\"/>"
                    + "<ArchiMate3:ArchiMate_BusinessService xmi:id=\"TAG2\" base_Class=\"SVC_BASE\" name=\"Order Service\"/>"
                    + "<ArchiMate3:ArchiMate_Serving xmi:id=\"TAG3\" base_Dependency=\"DEP_BASE\"/>"
                    + "<ArchiMate3:ArchiMate_Hologram xmi:id=\"TAG4\"/>";

    @Test
    public void archimateTagsTakeTheirBaseElementIdentity() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        EaParseContext ctx = Xmi.context(Xmi.document(ARCHIMATE_MODEL, ARCHIMATE_TAGS), report);

        Map<String, IrElement> byId = new ArchimateProfileElementParser(ctx).parse().stream()
                .collect(Collectors.toMap(e -> e.id, Function.identity()));

        assertEquals(3, byId.size());
        IrElement actor = byId.get("ACTOR_BASE");
        assertEquals("archimate.businessActor", actor.type);
        assertEquals("Customer", actor.name);
        assertEquals("PKG", actor.folderId);
        assertTrue(actor.externalIds.contains(IrExternalId.of("xmi", "TAG1", "xmi-id")));
        assertTrue(actor.externalIds.contains(IrExternalId.of("xmi", "ACTOR_BASE", "xmi-base-id")));
        assertTrue(actor.taggedValues.contains(new IrTaggedValue("profileTag", "ArchiMate3:ArchiMate_BusinessActor")));
        assertEquals(Xmi.ARCHIMATE_NS, actor.meta.get("archimateProfileUri"));

        assertEquals("Order Service", byId.get("SVC_BASE").name);
        assertEquals("archimate.businessService", byId.get("SVC_BASE").type);

        IrElement unknown = byId.get("TAG4");
        assertEquals("Unknown", unknown.type);
        assertEquals("Hologram", unknown.name);
        assertEquals("Hologram", unknown.meta.get("sourceType"));
        assertFalse(report.hasWarnings());
    }

    @Test
    public void archimateRelationshipTagUsesBaseConnectorEndpoints() {
        EaParseContext ctx = Xmi.context(Xmi.document(ARCHIMATE_MODEL, ARCHIMATE_TAGS));

        List<IrRelationship> rels = new ArchimateProfileRelationshipParser(ctx).parse();

        assertEquals(1, rels.size());
        IrRelationship serving = rels.get(0);
        assertEquals("DEP_BASE", serving.id);
        assertEquals("archimate.serving", serving.type);
        assertEquals("SVC_BASE", serving.sourceId);
        assertEquals("ACTOR_BASE", serving.targetId);
    }

    private static final String BPMN_TAGS =
            "<BPMN2.0:Pool xmi:id=\"POOL1\" name=\"Shop\"/>"
                    + "<BPMN2.0:Lane xmi:id=\"LANE1\" name=\"Sales\"/>"
                    + "<BPMN2.0:Activity xmi:id=\"A1\" name=\"Take order\" taskType=\"User\"/>"
                    + "<BPMN2.0:Activity xmi:id=\"A2\" name=\"Fulfil\" activityType=\"SubProcess\"/>"
                    + "<BPMN2.0:Gateway xmi:id=\"G1\" name=\"Split\" gatewayType=\"Parallel\"/>"
                    + "<BPMN2.0:IntermediateEvent xmi:id=\"E1\" eventType=\"Throw\"/>"
                    + "<BPMN2.0:StartEvent name=\"Start\"/>"
                    + "<BPMN2.0:SequenceFlow xmi:id=\"SF1\" source=\"A1\" target=\"G1\"/>"
                    + "<BPMN2.0:MessageFlow xmi:id=\"MF1\" source=\"A1\"/>";

    @Test
    public void bpmnTagsAreRefinedByTheirTypeAttributes() {
        ImportReport report = new ImportReport("ea-xmi-bpmn");
        EaParseContext ctx = Xmi.context(Xmi.document("", BPMN_TAGS), report);

        List<IrElement> elements = new BpmnProfileElementParser(ctx).parse();
        Map<String, String> types = elements.stream().collect(Collectors.toMap(e -> e.id, e -> e.type));

        assertEquals("bpmn.pool", types.get("POOL1"));
        assertEquals("bpmn.lane", types.get("LANE1"));
        assertEquals("bpmn.userTask", types.get("A1"));
        assertEquals("bpmn.subProcess", types.get("A2"));
        assertEquals("bpmn.gatewayParallel", types.get("G1"));
        assertEquals("bpmn.intermediateThrowEvent", types.get("E1"));
        assertEquals("bpmn.startEvent", types.get("eaBpmnEl_synth_1"));
        assertFalse(types.containsKey("SF1"));
        assertEquals(List.of("ea-xmi:element-missing-id"), Xmi.codes(report));
    }

    @Test
    public void bpmnFlowsNeedBothEndpoints() {
        ImportReport report = new ImportReport("ea-xmi-bpmn");
        EaParseContext ctx = Xmi.context(Xmi.document("", BPMN_TAGS), report);

        List<IrRelationship> rels = new BpmnProfileRelationshipParser(ctx).parse();

        assertEquals(1, rels.size());
        assertEquals("bpmn.sequenceFlow", rels.get(0).type);
        assertEquals("A1", rels.get(0).sourceId);
        assertEquals("G1", rels.get(0).targetId);
        assertEquals(List.of("ea-xmi:relationship-unresolved-endpoints"), Xmi.codes(report));
    }

    @Test
    public void vocabularies() {
        assertEquals("archimate.serving", ArchimateVocabulary.relationshipType("ArchiMate_UsedBy"));
        assertEquals("archimate.technologyService", ArchimateVocabulary.elementType("ArchiMate3:ArchiMate_InfrastructureService"));
        assertEquals("BusinessActor", ArchimateVocabulary.sourceToken("ArchiMate3:ArchiMate_BusinessActor"));
        assertTrue(ArchimateVocabulary.isArchimateStereotype(" archimate_Flow"));
        assertEquals("bpmn.dataAssociation", BpmnVocabulary.relationshipType("BPMN2.0:DataInputAssociation"));
        assertNull(BpmnVocabulary.relationshipType("Pool"));
    }
}
