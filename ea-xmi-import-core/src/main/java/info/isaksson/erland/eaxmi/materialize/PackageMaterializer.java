package info.isaksson.erland.eaxmi.materialize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.report.ImportReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns referenced UML packages (imported as folders) into {@code uml.package} elements and
 * rewrites relationship endpoints that name a package by its {@code EAID_*} alias.
 *
 * <p>Which packages count as referenced is decided by {@link PackageElementPolicy}. A package named
 * by an alias endpoint always gets an element unless the policy is {@code NEVER}. View nodes are
 * not rewritten: their {@code refRaw} stays verbatim and resolves through the element's
 * {@code package-eaid} external id.</p>
 */
public final class PackageMaterializer {

    public static final String PACKAGE_ID_PREFIX = "EAPK_";

    public static final class Result {
        public final List<IrElement> elements;
        public final List<IrRelationship> relationships;
        public final int createdPackageElements;
        public final int rewrittenEndpoints;

        Result(List<IrElement> elements, List<IrRelationship> relationships, int created, int rewritten) {
            this.elements = elements;
            this.relationships = relationships;
            this.createdPackageElements = created;
            this.rewrittenEndpoints = rewritten;
        }
    }

    private final PackageIdAliases aliases;
    private final PackageElementPolicy policy;
    private final ImportReport report;

    public PackageMaterializer(PackageIdAliases aliases, PackageElementPolicy policy, ImportReport report) {
        this.aliases = aliases;
        this.policy = policy == null ? PackageElementPolicy.DIAGRAM_REFERENCED : policy;
        this.report = report;
    }

    /** Element id for a package folder: the folder id when it already has the {@code EAPK_} prefix. */
    public static String packageElementId(String folderId) {
        return folderId.startsWith(PACKAGE_ID_PREFIX) ? folderId : PACKAGE_ID_PREFIX + folderId;
    }

    public Result apply(List<IrFolder> folders, List<IrElement> elements, List<IrRelationship> relationships, List<IrView> views) {
        Map<String, IrFolder> folderById = new LinkedHashMap<>();
        for (IrFolder f : folders) folderById.put(f.id, f);

        Set<String> selected = new LinkedHashSet<>();
        switch (policy) {
            case ALWAYS:
                selected.addAll(folderById.keySet());
                break;
            case REFERENCED:
                selected.addAll(referencedFromViews(views, folderById));
                selected.addAll(referencedFromRelationships(relationships, folderById));
                break;
            case DIAGRAM_REFERENCED:
                selected.addAll(referencedFromViews(views, folderById));
                break;
            case NEVER:
            default:
                break;
        }
        // An alias endpoint must end on a package element, whatever the policy selected above.
        if (policy != PackageElementPolicy.NEVER) {
            selected.addAll(aliasedFromRelationships(relationships, folderById));
        }

        Map<String, IrElement> byId = new LinkedHashMap<>();
        for (IrElement e : elements) byId.put(e.id, e);

        // folder id -> element id for the packages that exist as elements after this pass
        Map<String, String> elementIdByFolder = new LinkedHashMap<>();
        int created = 0;
        for (String folderId : selected) {
            IrFolder folder = folderById.get(folderId);
            if (folder == null) {
                report.warn("ea-xmi:package-folder-missing",
                        "EA XMI: Found a diagram/relationship reference to a package, but the package folder was not imported.",
                        "xmiId", folderId);
                continue;
            }
            String elementId = packageElementId(folderId);
            elementIdByFolder.put(folderId, elementId);
            if (byId.containsKey(elementId)) continue;
            byId.put(elementId, packageElement(elementId, folder));
            created++;
        }
        if (created > 0) {
            report.info("ea-xmi:package-elements-created",
                    "EA XMI: Materialized UML packages as elements because they were referenced as diagram nodes or relationship endpoints.",
                    "count", Integer.toString(created));
        }

        int rewritten = 0;
        List<IrRelationship> relsOut = new ArrayList<>(relationships.size());
        for (IrRelationship r : relationships) {
            String s = rewrite(r.sourceId, folderById, elementIdByFolder);
            String t = rewrite(r.targetId, folderById, elementIdByFolder);
            if (!s.equals(r.sourceId)) rewritten++;
            if (!t.equals(r.targetId)) rewritten++;
            relsOut.add(s.equals(r.sourceId) && t.equals(r.targetId) ? r : r.withEndpoints(s, t));
        }
        if (rewritten > 0) {
            report.info("ea-xmi:package-eaid-endpoint-rewrite",
                    "EA XMI: Rewrote relationship endpoints referencing packages via EAID_* to their package ids (EAPK_*).",
                    "count", Integer.toString(rewritten));
        }

        return new Result(new ArrayList<>(byId.values()), relsOut, created, rewritten);
    }

    /** Alias or folder id to the package element id when one exists, else the folder id for an alias. */
    private String rewrite(String endpoint, Map<String, IrFolder> folderById, Map<String, String> elementIdByFolder) {
        String folderId = folderById.containsKey(endpoint) ? endpoint : aliases.xmiIdFor(endpoint);
        if (folderId == null || !folderById.containsKey(folderId)) return endpoint;
        String elementId = elementIdByFolder.get(folderId);
        return elementId != null ? elementId : folderId;
    }

    private IrElement packageElement(String elementId, IrFolder folder) {
        Set<IrExternalId> externalIds = new LinkedHashSet<>();
        externalIds.add(IrExternalId.of("xmi", folder.id, "xmi-id"));
        String eaid = aliases.eaidFor(folder.id);
        if (eaid != null) externalIds.add(IrExternalId.of("sparx-ea", eaid, "package-eaid"));
        externalIds.addAll(folder.externalIds);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("metaclass", "Package");
        meta.put("xmiType", "uml:Package");
        meta.put("derivedFromFolder", Boolean.TRUE);

        String name = folder.name == null ? "Package" : folder.name;
        return new IrElement(elementId, "uml.package", name, folder.documentation, folder.parentId,
                new ArrayList<>(externalIds), null, null, meta);
    }

    private Set<String> referencedFromViews(List<IrView> views, Map<String, IrFolder> folderById) {
        Set<String> out = new LinkedHashSet<>();
        for (IrView v : views) {
            for (IrViewNode n : v.nodes) {
                for (String raw : n.refRaw().values()) {
                    addIfPackage(raw, folderById, out);
                }
            }
        }
        return out;
    }

    private Set<String> referencedFromRelationships(List<IrRelationship> relationships, Map<String, IrFolder> folderById) {
        Set<String> out = new LinkedHashSet<>();
        for (IrRelationship r : relationships) {
            addIfPackage(r.sourceId, folderById, out);
            addIfPackage(r.targetId, folderById, out);
        }
        return out;
    }

    /** Folders that relationship endpoints name through an {@code EAID_*} alias. */
    private Set<String> aliasedFromRelationships(List<IrRelationship> relationships, Map<String, IrFolder> folderById) {
        Set<String> out = new LinkedHashSet<>();
        for (IrRelationship r : relationships) {
            for (String endpoint : new String[] {r.sourceId, r.targetId}) {
                if (endpoint == null || folderById.containsKey(endpoint)) continue;
                String mapped = aliases.xmiIdFor(endpoint);
                if (mapped != null && folderById.containsKey(mapped)) out.add(mapped);
            }
        }
        return out;
    }

    private void addIfPackage(String token, Map<String, IrFolder> folderById, Set<String> out) {
        if (token == null) return;
        if (folderById.containsKey(token)) out.add(token);
        String mapped = aliases.xmiIdFor(token);
        if (mapped != null && folderById.containsKey(mapped)) out.add(mapped);
    }
}
