package com.largomodo.pathsanitizer.core;

/**
 * Thrown for paths that use a deliberately unsupported feature (long UNC paths, "\\?\").
 */
public class UnsupportedPathException extends PathSanitizationException {

    public UnsupportedPathException(String message, String path) {
        super(message, path);
    }
}
