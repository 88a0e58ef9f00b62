package com.largomodo.pathsanitizer.scan;

import com.largomodo.pathsanitizer.core.PathSanitizationException;
import com.largomodo.pathsanitizer.core.SanitizedPath;

import java.nio.file.Path;

/**
 * Observer interface for directory scan events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only the
 * events they care about.
 * </p>
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * ScanObserver observer = new ScanObserver() {
 *     @Override
 *     public void onChange(Path entry, SanitizedPath proposal) {
 *         System.out.println(entry + " -> " + proposal.path());
 *     }
 * };
 * }</pre>
 *
 * @see TreeScanner
 */
public interface ScanObserver {

    /**
     * Called for an entry whose relative path would change.
     *
     * @param entry    the entry, relative to the scan root
     * @param proposal the sanitized relative path
     */
    default void onChange(Path entry, SanitizedPath proposal) {}

    /**
     * Called for an entry whose relative path cannot be sanitized.
     *
     * @param entry the entry, relative to the scan root
     * @param e     the failure
     */
    default void onFailure(Path entry, PathSanitizationException e) {}
}
