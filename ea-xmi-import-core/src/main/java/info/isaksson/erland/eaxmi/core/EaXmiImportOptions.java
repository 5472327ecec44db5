package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.materialize.PackageElementPolicy;

import java.time.Clock;

/**
 * Core (server-friendly) options for an EA XMI import.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class EaXmiImportOptions {
    /** Which package folders also become {@code uml.package} elements. */
    public PackageElementPolicy packageElementPolicy = PackageElementPolicy.DIAGRAM_REFERENCED;

    /** Optional label (usually the file name) prepended to every report message. */
    public String sourceLabel = null;

    /** Source of {@code meta.importedAtIso}; fix it for reproducible output. */
    public Clock clock = Clock.systemUTC();

    /** Run the normalization pass. Only tests and debugging turn this off. */
    public boolean normalize = true;

    /**
     * Drop raw UML relationships from files that carry ArchiMate or BPMN content but no UML
     * diagrams.
     */
    public boolean suppressUmlInPureNotationFiles = true;
}
