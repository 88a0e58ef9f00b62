package com.largomodo.pathsanitizer.scan;

/**
 * Counters from one directory scan.
 *
 * @param scanned entries visited (the root itself excluded)
 * @param changed entries whose sanitized path differs
 * @param failed  entries that could not be sanitized
 */
public record ScanSummary(int scanned, int changed, int failed) {
}
