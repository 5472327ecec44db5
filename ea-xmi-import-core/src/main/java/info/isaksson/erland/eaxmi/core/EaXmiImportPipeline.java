package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.diagram.DiagramCatalogParser;
import info.isaksson.erland.eaxmi.diagram.DiagramConnectionParser;
import info.isaksson.erland.eaxmi.diagram.DiagramObjectParser;
import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.ir.IrModel;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.materialize.PackageIdAliases;
import info.isaksson.erland.eaxmi.materialize.PackageMaterializer;
import info.isaksson.erland.eaxmi.merge.NotationSignals;
import info.isaksson.erland.eaxmi.merge.Produced;
import info.isaksson.erland.eaxmi.merge.Producer;
import info.isaksson.erland.eaxmi.merge.ProducerMerge;
import info.isaksson.erland.eaxmi.normalize.EaXmiNormalizer;
import info.isaksson.erland.eaxmi.parse.ArchimateConnectorParser;
import info.isaksson.erland.eaxmi.parse.ArchimateProfileElementParser;
import info.isaksson.erland.eaxmi.parse.ArchimateProfileRelationshipParser;
import info.isaksson.erland.eaxmi.parse.AssociationParser;
import info.isaksson.erland.eaxmi.parse.BpmnProfileElementParser;
import info.isaksson.erland.eaxmi.parse.BpmnProfileRelationshipParser;
import info.isaksson.erland.eaxmi.parse.EaLinksRelationshipParser;
import info.isaksson.erland.eaxmi.parse.EaParseContext;
import info.isaksson.erland.eaxmi.parse.PackageParser;
import info.isaksson.erland.eaxmi.parse.UmlConnectorParser;
import info.isaksson.erland.eaxmi.parse.UmlElementParser;
import info.isaksson.erland.eaxmi.parse.UmlRelationshipParser;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The pass sequence over one parsed document. One instance per import. */
final class EaXmiImportPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(EaXmiImportPipeline.class);

    private final EaParseContext ctx;
    private final EaXmiImportOptions options;

    EaXmiImportPipeline(Document doc, EaXmiImportOptions options, ImportReport report) {
        this.ctx = new EaParseContext(doc, report);
        this.options = options;
    }

    IrModel run() {
        ImportReport report = ctx.report;

        PackageParser.Result packages = new PackageParser(ctx).parse();
        List<IrFolder> folders = packages.folders;

        List<IrElement> umlElements = new UmlElementParser(ctx).parse();
        List<IrElement> archimateElements = new ArchimateProfileElementParser(ctx).parse();
        List<IrElement> bpmnElements = new BpmnProfileElementParser(ctx).parse();

        List<Produced<IrElement>> elementEntries = new ArrayList<>();
        elementEntries.addAll(Produced.all(Producer.UML, umlElements));
        elementEntries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, archimateElements));
        elementEntries.addAll(Produced.all(Producer.BPMN_PROFILE, bpmnElements));
        List<IrElement> elements = ProducerMerge.mergeElements(elementEntries, report);
        LOG.debug("Parsed {} folders and {} elements ({} UML, {} ArchiMate, {} BPMN)",
                folders.size(), elements.size(), umlElements.size(), archimateElements.size(), bpmnElements.size());

        List<IrView> views = new DiagramCatalogParser(ctx).parse();
        boolean hasUmlViews = NotationSignals.hasUmlViews(views);

        Map<String, String> elementTypes = new HashMap<>();
        for (IrElement e : elements) elementTypes.put(e.id, e.type);

        List<IrRelationship> connectorRels = new ArchimateConnectorParser(ctx, elementTypes).parse();
        List<IrRelationship> umlConnectorRels = new UmlConnectorParser(ctx).parse();
        List<IrRelationship> archimateProfileRels = new ArchimateProfileRelationshipParser(ctx).parse();
        List<IrRelationship> bpmnRels = new BpmnProfileRelationshipParser(ctx).parse();
        List<IrRelationship> linkRels = new EaLinksRelationshipParser(ctx).parse();
        List<IrRelationship> umlRels = new UmlRelationshipParser(ctx).parse();
        List<IrRelationship> associationRels = new AssociationParser(ctx).parse();

        boolean pureNotation = (NotationSignals.looksLikeArchimate(connectorRels, archimateElements, archimateProfileRels)
                || NotationSignals.looksLikeBpmn(bpmnElements, bpmnRels)) && !hasUmlViews;
        boolean suppressUml = options.suppressUmlInPureNotationFiles && pureNotation;

        List<Produced<IrRelationship>> relEntries = new ArrayList<>();
        relEntries.addAll(Produced.all(Producer.EA_CONNECTOR, connectorRels));
        relEntries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, archimateProfileRels));
        relEntries.addAll(Produced.all(Producer.BPMN_PROFILE, bpmnRels));
        relEntries.addAll(Produced.all(Producer.UML_CONNECTOR, umlConnectorRels));
        relEntries.addAll(Produced.all(Producer.UML_LINKS, linkRels));
        relEntries.addAll(Produced.all(Producer.UML, umlRels));
        relEntries.addAll(Produced.all(Producer.UML_ASSOCIATION, associationRels));
        List<IrRelationship> relationships = ProducerMerge.mergeRelationships(relEntries, suppressUml, report);
        LOG.debug("Merged {} relationships (UML suppressed: {})", relationships.size(), suppressUml);

        views = new DiagramObjectParser(ctx).parse(views);
        views = new DiagramConnectionParser(ctx).parse(views);

        PackageIdAliases aliases = PackageIdAliases.build(ctx.doc);
        PackageMaterializer.Result materialized = new PackageMaterializer(aliases, options.packageElementPolicy, report)
                .apply(folders, elements, relationships, views);
        elements = materialized.elements;
        relationships = materialized.relationships;

        if (folders.isEmpty()) {
            report.warn("ea-xmi:no-folders",
                    "EA XMI: Parsed 0 UML packages into folders. The file may not be a UML XMI export, or it may use an uncommon structure.");
        }

        IrModel ir = new IrModel(folders, elements, relationships, views, meta(packages, aliases));
        if (!options.normalize) return ir;
        return new EaXmiNormalizer(report, options.clock).normalize(ir);
    }

    private Map<String, Object> meta(PackageParser.Result packages, PackageIdAliases aliases) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("format", EaXmiNormalizer.DEFAULT_FORMAT);
        meta.put("tool", EaXmiNormalizer.DEFAULT_TOOL);
        String modelName = packages.modelElement == null ? null : XmlDom.attrTrim(packages.modelElement, "name");
        if (modelName != null) meta.put("modelName", modelName);
        if (!aliases.isEmpty()) meta.put("eaPackageIdAliases", new LinkedHashMap<>(aliases.eaidToXmiId()));
        meta.put("importedAtIso", Instant.now(options.clock).toString());
        meta.put("sourceSystem", EaXmiNormalizer.DEFAULT_SOURCE_SYSTEM);
        return meta;
    }
}
