package info.isaksson.erland.eaxmi.report;

import info.isaksson.erland.eaxmi.core.EaXmiImportResult;
import info.isaksson.erland.eaxmi.ir.IrModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report of one import.
 *
 * <p>Issues are listed in their deterministic order so two runs over the same file produce the
 * same report.</p>
 */
public final class MarkdownReportWriter {

    private MarkdownReportWriter() {}

    public static void write(Path reportPath, Path inputPath, Path irPath, EaXmiImportResult result) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, render(inputPath, irPath, result));
    }

    static String render(Path inputPath, Path irPath, EaXmiImportResult result) {
        IrModel ir = result.ir;
        ImportReport report = result.report;

        StringBuilder sb = new StringBuilder();
        sb.append("# ea-xmi-import report\n\n");

        sb.append("## Summary\n\n");
        sb.append("- Input: `").append(inputPath).append("`\n");
        sb.append("- IR: `").append(irPath).append("`\n");
        sb.append("- Format: `").append(result.format()).append("`\n");
        Object modelName = ir.meta.get("modelName");
        if (modelName != null) sb.append("- Model name: `").append(modelName).append("`\n");
        sb.append("- Folders: **").append(ir.folders.size()).append("**\n");
        sb.append("- Elements: **").append(ir.elements.size()).append("**\n");
        sb.append("- Relationships: **").append(ir.relationships.size()).append("**\n");
        sb.append("- Views: **").append(ir.views.size()).append("**\n");
        sb.append("- Warnings: **").append(report.warnings().size()).append("**\n");
        sb.append("- Infos: **").append(report.infos().size()).append("**\n\n");

        sb.append("## Issues by code\n\n");
        Map<String, Integer> counts = report.countsByCode();
        if (counts.isEmpty()) {
            sb.append("_(none)_\n");
        } else {
            sb.append("| Code | Count |\n");
            sb.append("|---|---|\n");
            for (Map.Entry<String, Integer> e : counts.entrySet()) {
                sb.append("| `").append(e.getKey()).append("` | ").append(e.getValue()).append(" |\n");
            }
        }

        appendIssues(sb, "Warnings", ImportIssue.Level.WARNING, report.toDeterministicList());
        appendIssues(sb, "Infos", ImportIssue.Level.INFO, report.toDeterministicList());
        return sb.toString();
    }

    private static void appendIssues(StringBuilder sb, String title, ImportIssue.Level level, List<ImportIssue> issues) {
        sb.append("\n## ").append(title).append("\n\n");
        int n = 0;
        for (ImportIssue i : issues) {
            if (i.level != level) continue;
            n++;
            sb.append("- `").append(i.code).append("` ").append(i.message.replace("\n", " ")).append("\n");
            if (!i.context.isEmpty()) {
                sb.append("  - context: ");
                boolean first = true;
                for (Map.Entry<String, String> e : i.context.entrySet()) {
                    if (!first) sb.append(", ");
                    sb.append(e.getKey()).append("=`").append(e.getValue()).append("`");
                    first = false;
                }
                sb.append("\n");
            }
        }
        if (n == 0) sb.append("_(none)_\n");
    }
}
