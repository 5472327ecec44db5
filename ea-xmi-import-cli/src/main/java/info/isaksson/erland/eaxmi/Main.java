package info.isaksson.erland.eaxmi;

import info.isaksson.erland.eaxmi.core.EaXmiImportException;
import info.isaksson.erland.eaxmi.core.EaXmiImportOptions;
import info.isaksson.erland.eaxmi.core.EaXmiImportResult;
import info.isaksson.erland.eaxmi.core.EaXmiImportService;
import info.isaksson.erland.eaxmi.ir.IrJson;
import info.isaksson.erland.eaxmi.materialize.PackageElementPolicy;
import info.isaksson.erland.eaxmi.report.MarkdownReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command line entry point: imports one EA XMI file and writes the IR as JSON, plus an optional
 * markdown report of the import issues.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static final EaXmiImportService SERVICE = new EaXmiImportService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath)) {
            System.err.println("Error: --input does not exist: " + inputPath);
            return 1;
        }
        if (Files.isDirectory(inputPath)) {
            System.err.println("Error: --input must be a file: " + inputPath);
            return 1;
        }

        final Path irOut = resolveIrOutput(parsed.output);
        final Path reportOut = parsed.report == null ? null : Paths.get(parsed.report).toAbsolutePath().normalize();

        final EaXmiImportResult res;
        try {
            res = SERVICE.importFile(inputPath, toCoreOptions(parsed));
        } catch (EaXmiImportException | IOException e) {
            LOG.debug("Import of {} failed", inputPath, e);
            System.err.println("Error: import failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            IrJson.write(res.ir, irOut);
        } catch (IOException e) {
            System.err.println("Error: could not write IR to: " + irOut);
            System.err.println(e.getMessage());
            return 2;
        }

        if (reportOut != null) {
            try {
                MarkdownReportWriter.write(reportOut, inputPath, irOut, res);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        int warnings = res.report.warnings().size();
        System.out.println(
                "ea-xmi-import\n" +
                "- Input: " + inputPath + "\n" +
                "- IR: " + irOut + "\n" +
                (reportOut != null ? "- Report: " + reportOut + "\n" : "") +
                "- Folders: " + res.ir.folders.size() + "\n" +
                "- Elements: " + res.ir.elements.size() + "\n" +
                "- Relationships: " + res.ir.relationships.size() + "\n" +
                "- Views: " + res.ir.views.size() + "\n" +
                "- Warnings: " + warnings
        );

        if (parsed.failOnWarnings && warnings > 0) {
            System.err.println("Import warnings present (" + warnings + ") and --fail-on-warnings is set.");
            if (reportOut != null) System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static EaXmiImportOptions toCoreOptions(CliArgs parsed) {
        EaXmiImportOptions o = new EaXmiImportOptions();
        o.packageElementPolicy = parsed.packageElements;
        return o;
    }

    static Path resolveIrOutput(String outputArg) {
        // A path ending with .json is the IR file itself; anything else is an output directory.
        if (outputArg != null && outputArg.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve("model.ir.json");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        String report;
        PackageElementPolicy packageElements = PackageElementPolicy.DIAGRAM_REFERENCED;
        boolean failOnWarnings = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--package-elements":
                        out.packageElements = PackageElementPolicy.parseCli(requireValue(args, ++i, "--package-elements"));
                        break;
                    case "--fail-on-warnings":
                        out.failOnWarnings = parseBoolean(requireValue(args, ++i, "--fail-on-warnings"), "--fail-on-warnings");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // a bare path is shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "ea-xmi-import\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar ea-xmi-import-cli.jar --input <file.xmi> [--output <dir|file.json>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>              Sparx EA XMI export to import (required; a bare path also works)\n" +
                    "  --output <path>             Output folder or .json file (default: ./output/model.ir.json)\n" +
                    "  --report <file.md>          Write a markdown report of the import issues\n" +
                    "  --package-elements <mode>   Which packages also become uml.package elements. Modes:\n" +
                    "                              never | diagram | referenced | always (default: diagram)\n" +
                    "  --fail-on-warnings <bool>   Exit with code 3 when the import reports warnings.\n" +
                    "                              Default: false.\n" +
                    "  -h, --help                  Show help\n" +
                    "\n" +
                    "Exit codes:\n" +
                    "  0 ok, 1 usage error, 2 import or I/O failure, 3 warnings with --fail-on-warnings true\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar ea-xmi-import-cli.jar --input model.xmi --output out\n" +
                    "  java -jar ea-xmi-import-cli.jar model.xmi --report out/report.md --fail-on-warnings true\n"
            );
        }
    }
}
