package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.ir.IrModel;
import info.isaksson.erland.eaxmi.report.ImportReport;

/** Import result container for programmatic usage. */
public final class EaXmiImportResult {
    public static final String FORMAT = "ea-xmi-uml";

    /** The imported model; partial when the report carries warnings. */
    public final IrModel ir;

    public final ImportReport report;

    EaXmiImportResult(IrModel ir, ImportReport report) {
        this.ir = ir;
        this.report = report;
    }

    public String format() {
        return FORMAT;
    }
}
