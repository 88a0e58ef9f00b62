package com.largomodo.pathsanitizer.scan;

import com.largomodo.pathsanitizer.core.PathSanitizationException;
import com.largomodo.pathsanitizer.core.PathSanitizer;
import com.largomodo.pathsanitizer.core.RoleHint;
import com.largomodo.pathsanitizer.core.SanitizedPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reports which entries of a directory tree have names that are not portable.
 * <p>
 * Read-only: nothing is renamed. Each entry's path relative to the root is passed to the
 * sanitizer as pre-split nodes, with the file/directory role known from the filesystem.
 * Every relative node is a plain name, never a root or drive.
 * Failures on one entry are reported to the observer and the walk continues.
 */
public class TreeScanner {

    private static final Logger log = LoggerFactory.getLogger(TreeScanner.class);

    private final PathSanitizer sanitizer;

    public TreeScanner(PathSanitizer sanitizer) {
        if (sanitizer == null) {
            throw new IllegalArgumentException("PathSanitizer cannot be null");
        }
        this.sanitizer = sanitizer;
    }

    /**
     * Walk the tree below root, depth-first.
     *
     * @param root     directory to scan
     * @param observer receives changes and failures
     * @return counters for the walk
     * @throws IOException if root cannot be traversed
     */
    public ScanSummary scan(Path root, ScanObserver observer) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Scan root is not a directory: " + root);
        }

        int scanned = 0;
        int changed = 0;
        int failed = 0;

        try (Stream<Path> stream = Files.walk(root)) {
            Iterator<Path> entries = stream.iterator();
            while (entries.hasNext()) {
                Path entry = entries.next();
                if (entry.equals(root)) {
                    continue;
                }
                Path relative = root.relativize(entry);
                scanned++;
                MDC.put("path", relative.toString());
                try {
                    List<String> names = namesOf(relative);
                    SanitizedPath proposal = sanitizer.sanitizeNodes(anchored(names),
                            Files.isDirectory(entry) ? RoleHint.ASSERTED_FALSE : RoleHint.ASSERTED_TRUE);
                    String current = String.join(sanitizer.policy().flavor().separator(), names);
                    if (!proposal.path().equals(current)) {
                        changed++;
                        log.debug("Non-portable entry: {} → {}", relative, proposal.path());
                        observer.onChange(relative, proposal);
                    }
                } catch (PathSanitizationException e) {
                    failed++;
                    log.error("FAILED: {} - {}", relative, e.getMessage());
                    observer.onFailure(relative, e);
                } finally {
                    MDC.remove("path");
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        log.info("Scan complete: {} entries, {} non-portable, {} failed", scanned, changed, failed);
        return new ScanSummary(scanned, changed, failed);
    }

    private static List<String> namesOf(Path relative) {
        List<String> names = new ArrayList<>(relative.getNameCount());
        for (Path name : relative) {
            names.add(name.toString());
        }
        return names;
    }

    // A leading "." keeps the first real name from being read as a drive ("c:" is a legal POSIX name)
    private static List<String> anchored(List<String> names) {
        List<String> nodes = new ArrayList<>(names.size() + 1);
        nodes.add(".");
        nodes.addAll(names);
        return nodes;
    }
}
