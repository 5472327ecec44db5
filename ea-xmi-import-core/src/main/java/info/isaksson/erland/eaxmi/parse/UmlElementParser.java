package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrTaggedValue;
import info.isaksson.erland.eaxmi.ir.IrUmlMembers;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * UML classifiers (and activity nodes) to IR elements.
 *
 * <p>Only metaclasses known to {@link UmlTypes} are accepted; packages are folders and are skipped.
 * Records inside {@code xmi:Extension} are vendor data and never classifiers.</p>
 */
public final class UmlElementParser {

    public static final String SYNTH_PREFIX = "eaEl_synth";

    private final EaParseContext ctx;
    private final MemberParser members;

    public UmlElementParser(EaParseContext ctx) {
        this.ctx = ctx;
        this.members = new MemberParser(ctx.ids, new TypeNameResolver(ctx.ids));
    }

    public List<IrElement> parse() {
        List<IrElement> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element el : XmlDom.descendants(ctx.doc)) {
            if (ElementSupport.isInsideExtension(el)) continue;
            String metaclass = candidateMetaclass(el);
            if (metaclass == null) continue;

            IrElement element = toElement(el, metaclass, UmlTypes.elementType(metaclass));
            if (!seen.add(element.id)) {
                ctx.report.warn("ea-xmi:duplicate-element-id",
                        "EA XMI: Duplicate element id \"" + element.id + "\" encountered; skipping subsequent occurrence.",
                        "elementId", element.id);
                continue;
            }
            out.add(element);
        }
        return out;
    }

    /** Metaclass when {@code el} is an accepted non-package classifier, else null. */
    static String candidateMetaclass(Element el) {
        String metaclass = ElementSupport.metaclassFromXmiType(XmlDom.xmiType(el));
        if (metaclass == null) {
            // Explicit uml:Class style tags: accept only an exact metaclass local name.
            metaclass = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
        }
        String type = UmlTypes.elementType(metaclass);
        return type == null || UmlTypes.PACKAGE.equals(type) ? null : metaclass;
    }

    private IrElement toElement(Element el, String metaclass, String type) {
        String xmiId = XmlDom.xmiId(el);
        String id = xmiId;
        if (id == null) {
            id = ctx.synthetic.assign(el, SYNTH_PREFIX);
            ctx.report.warn("ea-xmi:element-missing-id",
                    "EA XMI: Element missing xmi:id; generated synthetic element id \"" + id + "\" (metaclass=\""
                            + metaclass + "\", name=\"" + nullToEmpty(XmlDom.attrTrim(el, "name")) + "\").",
                    "elementId", id);
        }

        String documentation = ElementSupport.documentation(el, ctx.extensionDocs);
        String name = XmlDom.attrTrim(el, "name");
        if (name == null) {
            if (UmlTypes.NOTE.equals(type)) {
                String line = ElementSupport.firstLine(documentation, 60);
                name = line != null ? line : "Note";
            } else {
                name = metaclass;
            }
        }

        List<IrExternalId> externalIds = new ArrayList<>();
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
        String guid = ElementSupport.guid(el);
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "element-guid"));

        List<IrTaggedValue> tagged = new ArrayList<>();
        String stereotype = ElementSupport.stereotype(el, ctx.extensionStereotypes);
        if (stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, stereotype));

        Map<String, Object> attrs = new LinkedHashMap<>();
        if (UmlTypes.ACTION.equals(type) && !"Action".equals(metaclass)) attrs.put("actionKind", metaclass);

        Map<String, Object> meta = new LinkedHashMap<>();
        String xmiType = XmlDom.xmiType(el);
        if (xmiType != null) meta.put("xmiType", xmiType);
        meta.put("metaclass", metaclass);
        if (UmlTypes.MEMBER_OWNERS.contains(type)) {
            IrUmlMembers m = members.parse(el);
            meta.put(IrUmlMembers.META_KEY, m);
        }

        return new IrElement(
                id,
                type,
                name,
                documentation,
                ElementSupport.owningFolderId(el, ctx.synthetic),
                externalIds,
                tagged,
                attrs,
                meta);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
