package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrFolder;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the UML package hierarchy into IR folders.
 *
 * <p>Packages never become elements here; {@code uml.package} elements are materialized later
 * from the folders when a policy asks for them.</p>
 */
public final class PackageParser {

    public static final String SYNTH_PREFIX = "eaPkg_synth";

    /** Folders in depth-first document order plus the located model root (may be null). */
    public static final class Result {
        public final List<IrFolder> folders;
        public final Element modelElement;

        Result(List<IrFolder> folders, Element modelElement) {
            this.folders = List.copyOf(folders);
            this.modelElement = modelElement;
        }
    }

    private final EaParseContext ctx;
    private final List<IrFolder> folders = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    public PackageParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public Result parse() {
        Element model = findModelRoot();
        Element start = model;
        if (start == null) {
            ctx.report.warn("ea-xmi:no-model-root",
                    "EA XMI: Could not find a UML Model root; scanning document for top-level packages.");
            start = ctx.doc.getDocumentElement();
        }
        for (Element child : XmlDom.children(start)) {
            if (ElementSupport.isPackage(child)) visit(child, null);
        }
        return new Result(folders, model);
    }

    private Element findModelRoot() {
        Element root = ctx.doc.getDocumentElement();
        if (root == null) return null;
        if (isModel(root)) return root;
        for (Element el : XmlDom.descendants(root)) {
            if (isModel(el)) return el;
        }
        return null;
    }

    static boolean isModel(Element el) {
        String t = ElementSupport.lower(XmlDom.xmiType(el));
        if (t.equals("uml:model") || t.endsWith(":model")) return true;
        return XmlDom.localName(el).equals("model");
    }

    private void visit(Element pkg, String parentId) {
        String id = idFor(pkg);
        if (!seen.add(id)) {
            ctx.report.warn("ea-xmi:duplicate-package-id",
                    "EA XMI: Duplicate package id \"" + id + "\" encountered; skipping subsequent occurrence.",
                    "packageId", id);
            return;
        }

        String xmiId = XmlDom.xmiId(pkg);
        String guid = ElementSupport.guid(pkg);
        List<IrExternalId> externalIds = new ArrayList<>();
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "package-id"));
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "package-guid"));

        Map<String, Object> meta = new LinkedHashMap<>();
        String xmiType = XmlDom.xmiType(pkg);
        if (xmiType != null) meta.put("xmiType", xmiType);

        folders.add(new IrFolder(
                id,
                packageName(pkg),
                parentId,
                ElementSupport.documentation(pkg, ctx.extensionDocs),
                externalIds,
                null,
                meta));

        for (Element child : XmlDom.children(pkg)) {
            if (ElementSupport.isPackage(child)) visit(child, id);
        }
    }

    private String idFor(Element pkg) {
        String xmiId = XmlDom.xmiId(pkg);
        if (xmiId != null) return xmiId;
        String existing = ctx.synthetic.lookup(pkg);
        if (existing != null) return existing;
        String id = ctx.synthetic.assign(pkg, SYNTH_PREFIX);
        ctx.report.warn("ea-xmi:package-missing-id",
                "EA XMI: Package missing xmi:id; generated synthetic folder id \"" + id + "\" (name=\"" + packageName(pkg) + "\").",
                "folderId", id);
        return id;
    }

    static String packageName(Element pkg) {
        String n = XmlDom.attrTrim(pkg, "name");
        if (n != null) return n;
        String label = XmlDom.attrAny(pkg, List.of("xmi:label", "label"));
        return label != null ? label : "Package";
    }
}
