package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.ir.IrModel;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.xmi.XmlDecoding;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Core (server-friendly) API for importing Sparx EA XMI exports.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. The
 * service holds no state; every call owns its own report.</p>
 */
public final class EaXmiImportService {

    private static final Logger LOG = LoggerFactory.getLogger(EaXmiImportService.class);

    /** True when the input looks like an EA UML XMI export. */
    public boolean sniff(SniffContext ctx) {
        return EaXmiSniffer.sniff(ctx);
    }

    /** Import an XMI file from disk. */
    public EaXmiImportResult importFile(Path file, EaXmiImportOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        if (options == null) options = new EaXmiImportOptions();
        if (options.sourceLabel == null && file.getFileName() != null) {
            EaXmiImportOptions labelled = copy(options);
            labelled.sourceLabel = file.getFileName().toString();
            options = labelled;
        }
        return importBytes(Files.readAllBytes(file), options);
    }

    /** Import raw file bytes: BOM, then the declared encoding, else UTF-8. */
    public EaXmiImportResult importBytes(byte[] bytes, EaXmiImportOptions options) {
        if (bytes == null) throw new IllegalArgumentException("bytes must not be null");
        return importText(XmlDecoding.decode(bytes), options);
    }

    /**
     * Import already decoded XMI text.
     *
     * @throws EaXmiImportException when the text is not well-formed XML or its root is not an XMI element
     */
    public EaXmiImportResult importText(String xml, EaXmiImportOptions options) {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        if (options == null) options = new EaXmiImportOptions();

        Document doc;
        try {
            doc = XmlDom.parse(xml);
        } catch (SAXException e) {
            throw new EaXmiImportException("EA XMI: Failed to parse XML: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (root == null || !XmlDom.localName(root).contains("xmi")) {
            throw new EaXmiImportException("EA XMI: Expected XMI root element (<xmi:XMI ...>), but found <"
                    + (root == null ? "unknown" : root.getTagName()) + ">.");
        }

        ImportReport report = new ImportReport(EaXmiImportResult.FORMAT, options.sourceLabel);
        IrModel ir = new EaXmiImportPipeline(doc, options, report).run();

        LOG.info("Imported EA XMI{}: {} folders, {} elements, {} relationships, {} views, {} warnings",
                options.sourceLabel == null ? "" : " " + options.sourceLabel,
                ir.folders.size(), ir.elements.size(), ir.relationships.size(), ir.views.size(), report.warnings().size());
        return new EaXmiImportResult(ir, report);
    }

    private static EaXmiImportOptions copy(EaXmiImportOptions in) {
        EaXmiImportOptions out = new EaXmiImportOptions();
        out.packageElementPolicy = in.packageElementPolicy;
        out.sourceLabel = in.sourceLabel;
        out.clock = in.clock;
        out.normalize = in.normalize;
        out.suppressUmlInPureNotationFiles = in.suppressUmlInPureNotationFiles;
        return out;
    }
}
