package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.ir.IrModel;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrUmlMembers;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.parse.AssociationParser;
import info.isaksson.erland.eaxmi.report.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Post-processing of an imported EA XMI model.
 *
 * <p>Runs once after all parsers: string cleanup, rehoming of unknown folder references, payload
 * sanitizing, association class links, view reference resolution, activity and BPMN containment,
 * and view kind inference. It only adds to the report.</p>
 */
public final class EaXmiNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(EaXmiNormalizer.class);

    public static final String DEFAULT_FORMAT = "ea-xmi-uml";
    public static final String DEFAULT_TOOL = "Sparx Enterprise Architect";
    public static final String DEFAULT_SOURCE_SYSTEM = "sparx-ea";

    private final ImportReport report;
    private final Clock clock;

    public EaXmiNormalizer(ImportReport report, Clock clock) {
        if (report == null) throw new IllegalArgumentException("report must not be null");
        this.report = report;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public IrModel normalize(IrModel in) {
        if (in == null) throw new IllegalArgumentException("model must not be null");

        Set<String> folderIds = new HashSet<>();
        for (IrFolder f : in.folders) folderIds.add(f.id);

        List<IrFolder> folders = new ArrayList<>(in.folders.size());
        for (IrFolder f : in.folders) folders.add(folder(f, folderIds));

        List<IrElement> elements = new ArrayList<>(in.elements.size());
        for (IrElement e : in.elements) elements.add(element(e, folderIds));

        List<IrRelationship> relationships = new ArrayList<>(in.relationships.size());
        for (IrRelationship r : in.relationships) relationships.add(relationship(r));

        AssociationClassLinks links = AssociationClassLinks.apply(elements, relationships, report);
        elements = links.elements;
        relationships = links.relationships;

        ViewReferenceResolver resolver = new ViewReferenceResolver(
                IdLookup.ofElements(elements), IdLookup.ofRelationships(relationships), relationships, report);
        List<IrView> views = new ArrayList<>(in.views.size());
        for (IrView v : in.views) views.add(resolver.resolve(view(v, folderIds)));

        elements = ActivityContainment.apply(elements, views);

        Map<String, String> elementTypes = new HashMap<>();
        for (IrElement e : elements) elementTypes.putIfAbsent(e.id, e.type);
        Map<String, String> relationshipTypes = new HashMap<>();
        for (IrRelationship r : relationships) relationshipTypes.putIfAbsent(r.id, r.type);

        views = BpmnContainment.apply(views, elementTypes);
        views = ViewKindInference.apply(views, elementTypes, relationshipTypes);

        LOG.debug("Normalized {} folders, {} elements, {} relationships, {} views",
                folders.size(), elements.size(), relationships.size(), views.size());
        return new IrModel(folders, elements, relationships, views, meta(in.meta));
    }

    private IrFolder folder(IrFolder f, Set<String> folderIds) {
        String parentId = f.parentId;
        if (parentId != null && !folderIds.contains(parentId)) {
            report.warn("ea-xmi:folder-missing-parent",
                    "EA XMI Normalize: Folder \"" + f.id + "\" referenced missing parent \"" + parentId + "\"; moved to root.",
                    "folderId", f.id, "parentId", parentId);
            parentId = null;
        }
        return new IrFolder(f.id, MemberSanitizer.trim(f.name), parentId, MemberSanitizer.trim(f.documentation),
                f.externalIds, f.taggedValues, f.meta);
    }

    private IrElement element(IrElement e, Set<String> folderIds) {
        IrElement out = e.withText(MemberSanitizer.trim(e.name), MemberSanitizer.trim(e.documentation));
        if (e.folderId != null && !folderIds.contains(e.folderId)) {
            report.warn("ea-xmi:element-missing-folder",
                    "EA XMI Normalize: Element \"" + e.id + "\" referenced missing folderId \"" + e.folderId + "\"; moved to root.",
                    "elementId", e.id, "folderId", e.folderId);
            out = out.withFolderId(null);
        }
        if (e.meta.containsKey(IrUmlMembers.META_KEY)) {
            Map<String, Object> meta = new LinkedHashMap<>(e.meta);
            IrUmlMembers members = MemberSanitizer.members(meta.get(IrUmlMembers.META_KEY));
            if (members == null) meta.remove(IrUmlMembers.META_KEY);
            else meta.put(IrUmlMembers.META_KEY, members);
            out = out.withMeta(meta);
        }
        return out;
    }

    private IrRelationship relationship(IrRelationship r) {
        IrRelationship out = r.withText(MemberSanitizer.trim(r.name), MemberSanitizer.trim(r.documentation));
        if (r.meta.containsKey(AssociationParser.UML_ATTRS)) {
            Map<String, Object> meta = new LinkedHashMap<>(r.meta);
            Map<String, Object> umlAttrs = MemberSanitizer.relationshipAttrs(meta.get(AssociationParser.UML_ATTRS));
            if (umlAttrs == null) meta.remove(AssociationParser.UML_ATTRS);
            else meta.put(AssociationParser.UML_ATTRS, umlAttrs);
            out = out.withMeta(meta);
        }
        return out;
    }

    private IrView view(IrView v, Set<String> folderIds) {
        IrView out = v.withText(MemberSanitizer.trim(v.name), MemberSanitizer.trim(v.viewpoint), MemberSanitizer.trim(v.documentation));
        if (v.folderId != null && !folderIds.contains(v.folderId)) {
            report.warn("ea-xmi:view-missing-folder",
                    "EA XMI Normalize: View \"" + v.id + "\" referenced missing folderId \"" + v.folderId + "\"; moved to root.",
                    "viewId", v.id, "folderId", v.folderId);
            out = out.withFolderId(null);
        }
        return out;
    }

    private Map<String, Object> meta(Map<String, Object> in) {
        Map<String, Object> meta = new LinkedHashMap<>(in);
        meta.putIfAbsent("format", DEFAULT_FORMAT);
        meta.putIfAbsent("tool", DEFAULT_TOOL);
        meta.putIfAbsent("sourceSystem", DEFAULT_SOURCE_SYSTEM);
        meta.putIfAbsent("importedAtIso", Instant.now(clock).toString());
        return meta;
    }
}
