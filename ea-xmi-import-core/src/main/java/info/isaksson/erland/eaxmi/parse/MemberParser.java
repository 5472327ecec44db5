package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrMultiplicity;
import info.isaksson.erland.eaxmi.ir.IrUmlAttribute;
import info.isaksson.erland.eaxmi.ir.IrUmlMembers;
import info.isaksson.erland.eaxmi.ir.IrUmlOperation;
import info.isaksson.erland.eaxmi.ir.IrUmlParameter;
import info.isaksson.erland.eaxmi.xmi.XmiIdIndex;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Reads attributes and operations of a class-like classifier. */
public final class MemberParser {

    private static final Set<String> VISIBILITIES = Set.of("public", "private", "protected", "package");

    private final XmiIdIndex ids;
    private final TypeNameResolver types;

    public MemberParser(XmiIdIndex ids, TypeNameResolver types) {
        this.ids = ids;
        this.types = types;
    }

    public IrUmlMembers parse(Element classifier) {
        return new IrUmlMembers(attributes(classifier), operations(classifier));
    }

    private List<IrUmlAttribute> attributes(Element classifier) {
        List<IrUmlAttribute> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element a : XmlDom.childrenByLocalName(classifier, "ownedAttribute")) {
            String id = XmlDom.xmiId(a);
            if (id != null) seen.add(id);
            IrUmlAttribute parsed = attribute(a);
            if (parsed != null) out.add(parsed);
        }

        // EA wrapper form: <attributes><attribute xmi:idref="..."/></attributes>, property defined elsewhere.
        for (Element wrapper : XmlDom.childrenByLocalName(classifier, "attributes")) {
            for (Element ref : XmlDom.childrenByLocalName(wrapper, "attribute")) {
                String idref = XmlDom.xmiIdRef(ref);
                if (idref == null || seen.contains(idref)) continue;
                Element resolved = ids.resolve(idref);
                if (resolved == null) continue;
                seen.add(idref);
                IrUmlAttribute parsed = attribute(resolved);
                if (parsed != null) out.add(parsed);
            }
        }
        return out;
    }

    private IrUmlAttribute attribute(Element a) {
        String name = XmlDom.attrTrim(a, "name");
        if (name == null) return null;
        TypeNameResolver.Resolution type = types.resolve(a);
        return new IrUmlAttribute(
                name,
                type.name,
                type.ref,
                visibility(XmlDom.attrExact(a, "visibility")),
                trueOrNull(XmlDom.attrAny(a, List.of("isStatic", "static"))),
                multiplicity(a),
                defaultValue(a));
    }

    private List<IrUmlOperation> operations(Element classifier) {
        List<IrUmlOperation> out = new ArrayList<>();
        for (Element o : XmlDom.childrenByLocalName(classifier, "ownedOperation")) {
            String name = XmlDom.attrTrim(o, "name");
            if (name == null) continue;

            List<IrUmlParameter> params = new ArrayList<>();
            String returnType = null;
            for (Element p : XmlDom.childrenByLocalName(o, "ownedParameter")) {
                String typeName = types.resolve(p).name;
                if ("return".equals(XmlDom.attrTrim(p, "direction"))) {
                    if (typeName != null) returnType = typeName;
                    continue;
                }
                String pn = XmlDom.attrTrim(p, "name");
                if (pn == null) continue;
                params.add(new IrUmlParameter(pn, typeName));
            }

            out.add(new IrUmlOperation(
                    name,
                    returnType,
                    visibility(XmlDom.attrExact(o, "visibility")),
                    trueOrNull(XmlDom.attrAny(o, List.of("isStatic", "static"))),
                    trueOrNull(XmlDom.attrAny(o, List.of("isAbstract", "abstract"))),
                    params));
        }
        return out;
    }

    static IrMultiplicity multiplicity(Element el) {
        String lower = boundValue(XmlDom.childByLocalName(el, "lowerValue"));
        String upper = boundValue(XmlDom.childByLocalName(el, "upperValue"));
        if (lower == null && upper == null) return null;
        return new IrMultiplicity(lower, upper);
    }

    private static String boundValue(Element bound) {
        return bound == null ? null : XmlDom.attrAny(bound, List.of("value", "body"));
    }

    private static String defaultValue(Element el) {
        Element dv = XmlDom.childByLocalName(el, "defaultValue");
        if (dv == null) return null;
        String v = XmlDom.attrAny(dv, List.of("value", "body"));
        if (v != null) return v;
        Element valueChild = XmlDom.childByLocalName(dv, "value");
        return XmlDom.blankToNull(XmlDom.text(valueChild != null ? valueChild : dv));
    }

    static String visibility(String raw) {
        String v = raw == null ? "" : raw.trim();
        return VISIBILITIES.contains(v) ? v : null;
    }

    /** Boolean-ish flag: {@code Boolean.TRUE} for true/1/yes, null otherwise (false is the default). */
    static Boolean trueOrNull(String raw) {
        Boolean b = parseBool(raw);
        return Boolean.TRUE.equals(b) ? Boolean.TRUE : null;
    }

    public static Boolean parseBool(String raw) {
        String s = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "true":
            case "1":
            case "yes":
                return Boolean.TRUE;
            case "false":
            case "0":
            case "no":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
