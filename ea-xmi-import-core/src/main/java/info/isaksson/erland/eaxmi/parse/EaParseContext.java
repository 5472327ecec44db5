package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.xmi.SyntheticIds;
import info.isaksson.erland.eaxmi.xmi.XmiIdIndex;
import org.w3c.dom.Document;

import java.util.Map;

/**
 * Per-import state shared by the parser passes: the parsed document, its id index, the synthetic
 * id side table, the EA extension indexes and the report.
 */
public final class EaParseContext {
    public final Document doc;
    public final XmiIdIndex ids;
    public final SyntheticIds synthetic;
    public final ImportReport report;
    /** xmi:idref to documentation text from EA extension {@code element/properties} records. */
    public final Map<String, String> extensionDocs;
    /** xmi:idref to stereotype from EA extension {@code element/properties} records. */
    public final Map<String, String> extensionStereotypes;

    public EaParseContext(Document doc, ImportReport report) {
        this(doc, XmiIdIndex.build(doc), new SyntheticIds(), report);
    }

    public EaParseContext(Document doc, XmiIdIndex ids, SyntheticIds synthetic, ImportReport report) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        if (report == null) throw new IllegalArgumentException("report must not be null");
        this.doc = doc;
        this.ids = ids;
        this.synthetic = synthetic;
        this.report = report;
        this.extensionDocs = ElementSupport.buildExtensionPropertyIndex(doc, ElementSupport.DOCUMENTATION_ATTRS);
        this.extensionStereotypes = ElementSupport.buildExtensionPropertyIndex(doc, ElementSupport.STEREOTYPE_ATTRS);
    }
}
