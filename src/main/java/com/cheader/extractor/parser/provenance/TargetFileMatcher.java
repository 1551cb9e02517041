package com.cheader.extractor.parser.provenance;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a file name stamped in the AST denotes the target header.
 *
 * Canonical (real) paths are compared when both sides can be resolved on disk;
 * file names are resolved against the working directory the frontend ran in,
 * which is this process's. When either side cannot be canonicalized the
 * matcher falls back to a path-suffix comparison against the header's file
 * name, which cannot tell apart two same-named headers in different include
 * directories.
 */
public class TargetFileMatcher {
    private static final Logger log = LoggerFactory.getLogger(TargetFileMatcher.class);

    private final Path targetName;
    private final Path canonicalTarget;
    private final Map<String, Boolean> cache = new HashMap<>();

    public TargetFileMatcher(Path targetHeader) {
        Path fileName = targetHeader.getFileName();
        this.targetName = fileName != null ? fileName : targetHeader;
        this.canonicalTarget = canonicalize(targetHeader);
    }

    public boolean matches(String file) {
        if (file == null || file.isEmpty()) {
            return false;
        }
        return cache.computeIfAbsent(file, this::resolve);
    }

    private boolean resolve(String file) {
        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            log.debug("Unusable file name in AST: {}", file);
            return file.endsWith(targetName.toString());
        }

        if (canonicalTarget != null) {
            Path canonical = canonicalize(path);
            if (canonical != null) {
                return canonical.equals(canonicalTarget);
            }
        }
        return path.equals(targetName) || path.endsWith(targetName);
    }

    private static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException | SecurityException e) {
            log.debug("Cannot canonicalize {}, falling back to name matching: {}", path, e.getMessage());
            return null;
        }
    }
}
