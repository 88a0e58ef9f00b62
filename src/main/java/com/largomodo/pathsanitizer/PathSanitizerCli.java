package com.largomodo.pathsanitizer;

import com.largomodo.pathsanitizer.core.PathFlavor;
import com.largomodo.pathsanitizer.core.PathSanitizationException;
import com.largomodo.pathsanitizer.core.PathSanitizer;
import com.largomodo.pathsanitizer.core.RoleHint;
import com.largomodo.pathsanitizer.core.SanitizationPolicy;
import com.largomodo.pathsanitizer.core.SanitizedPath;
import com.largomodo.pathsanitizer.core.WarningSinks;
import com.largomodo.pathsanitizer.scan.ScanObserver;
import com.largomodo.pathsanitizer.scan.ScanSummary;
import com.largomodo.pathsanitizer.scan.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for portable path sanitization.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Three modes:
 * - Paths given as arguments: each is sanitized and printed, one per line
 * - No arguments: paths are read from standard input, one per line
 * - --scan DIR: reports entries below DIR whose names are not portable (nothing is renamed)
 * <p>
 * Change warnings go to the log (stderr); sanitized output goes to stdout.
 */
@Command(
        name = "pathsanitize",
        mixinStandardHelpOptions = true,
        resourceBundle = "pathsanitizer.pathsanitizer",
        version = "${bundle:application.version}",
        header = "Makes file paths legal on both POSIX and Windows filesystems.",
        description = {
                "Replaces illegal characters, wraps reserved device names (NUL, COM1, ...), strips trailing" +
                        " dots and spaces, and enforces the 254 character node limit.",
                "",
                "Both '/' and '\\' are treated as separators, whatever the host platform."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Sanitization failed (long UNC path, contradictory hints, node too long) or I/O error",
                "2:Invalid command line arguments"
        }
)
public class PathSanitizerCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PathSanitizerCli.class);

    @Parameters(paramLabel = "PATH", arity = "0..*",
            description = {
                    "Paths to sanitize.",
                    "If omitted (and --scan is not given), paths are read from standard input, one per line."
            })
    List<String> paths;

    @Option(names = "--node", description = "Treat each argument as a single path node instead of a path")
    boolean nodeMode;

    @Option(names = "--file", description = "The last node is a file")
    boolean file;

    @Option(names = "--dir", description = "The last node is a directory")
    boolean dir;

    @Option(names = "--root", arity = "1", paramLabel = "BOOLEAN",
            description = "With --node: whether the node is the root or a drive (default: unknown)")
    Boolean root;

    @Option(names = "--fat", description = "Also avoid names reserved on FAT volumes (CLOCK$, LST, ...)")
    boolean fatCompatible;

    @Option(names = "--trim", description = "Truncate nodes longer than 254 characters instead of failing")
    boolean trimToLimit;

    @Option(names = "--flavor", defaultValue = "POSIX",
            description = {
                    "Separator convention of the output.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    PathFlavor flavor;

    @Option(names = "--scan", paramLabel = "DIR",
            description = "Report entries below DIR whose relative paths are not portable")
    File scanRoot;

    @Option(names = {"-q", "--quiet"}, description = "Do not log a warning for each changed path")
    boolean quiet;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Spec
    CommandSpec spec;

    InputStream stdin = System.in;

    public static void main(String[] args) {
        int exitCode = createCommandLine(new PathSanitizerCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the configured command line; shared by main() and tests.
     */
    static CommandLine createCommandLine(PathSanitizerCli cli) {
        CommandLine cmd = new CommandLine(cli);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof PathSanitizationException || ex instanceof IOException) {
                log.error("FAILED: {}", ex.getMessage());
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger rootLogger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (file && dir) {
            throw new ParameterException(spec.commandLine(), "--file and --dir are mutually exclusive");
        }
        if (root != null && !nodeMode) {
            throw new ParameterException(spec.commandLine(), "--root is only valid with --node");
        }
        if (scanRoot != null && (nodeMode || (paths != null && !paths.isEmpty()))) {
            throw new ParameterException(spec.commandLine(), "--scan cannot be combined with --node or PATH arguments");
        }
        if (scanRoot != null && !scanRoot.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Scan root is not a directory: " + scanRoot.getAbsolutePath());
        }

        SanitizationPolicy policy = new SanitizationPolicy(fatCompatible, trimToLimit, flavor,
                quiet ? WarningSinks.silent() : WarningSinks.logging());
        PrintWriter out = spec.commandLine().getOut();

        if (scanRoot != null) {
            return runScan(new PathSanitizer(policy.withWarningSink(WarningSinks.silent())), scanRoot.toPath(), out);
        }

        PathSanitizer sanitizer = new PathSanitizer(policy);
        RoleHint fileHint = file ? RoleHint.ASSERTED_TRUE : dir ? RoleHint.ASSERTED_FALSE : RoleHint.UNKNOWN;
        RoleHint rootHint = RoleHint.of(root);

        for (String input : inputs()) {
            MDC.put("path", input);
            try {
                String sanitized = nodeMode
                        ? sanitizer.sanitizeNode(input, fileHint, rootHint)
                        : sanitizer.sanitizePath(input, fileHint);
                out.println(sanitized);
            } finally {
                MDC.remove("path");
            }
        }
        out.flush();
        return 0;
    }

    private List<String> inputs() throws IOException {
        if (paths != null && !paths.isEmpty()) {
            return paths;
        }
        List<String> lines = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    /**
     * Print "old -> new" for every non-portable entry; exit code 1 if any entry failed.
     */
    private static int runScan(PathSanitizer sanitizer, Path root, PrintWriter out) throws IOException {
        ScanObserver observer = new ScanObserver() {
            @Override
            public void onChange(Path entry, SanitizedPath proposal) {
                out.println(entry + " -> " + proposal.path());
            }
        };
        ScanSummary summary = new TreeScanner(sanitizer).scan(root, observer);
        out.flush();
        return summary.failed() > 0 ? 1 : 0;
    }
}
