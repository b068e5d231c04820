package uk.gegc.aiready.features.conversion.domain;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Naming rules for converted output files.
 */
public final class OutputFilenames {

    private static final String FALLBACK_BASE_NAME = "converted";

    private OutputFilenames() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Builds the output name for a source file: base name without directories or extension plus the
     * format's extension. {@code reports/Q3.final.xlsx} rendered as JSON becomes {@code Q3.final.json}.
     */
    public static String forSource(String originalFilename, OutputFormat format) {
        return baseName(originalFilename) + format.getExtension();
    }

    /**
     * Returns {@code candidate} if no name in {@code taken} equals it (ignoring case), otherwise the first
     * free of {@code name_2.ext}, {@code name_3.ext}, ...
     */
    public static String deduplicate(String candidate, Collection<String> taken) {
        Set<String> used = taken.stream()
                .filter(name -> name != null)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (!used.contains(candidate.toLowerCase(Locale.ROOT))) {
            return candidate;
        }

        int dot = candidate.lastIndexOf('.');
        String stem = dot > 0 ? candidate.substring(0, dot) : candidate;
        String extension = dot > 0 ? candidate.substring(dot) : "";
        int suffix = 2;
        String next;
        do {
            next = stem + "_" + suffix++ + extension;
        } while (used.contains(next.toLowerCase(Locale.ROOT)));
        return next;
    }

    /**
     * Strips directory segments (either separator) and the last extension.
     */
    public static String baseName(String filename) {
        if (filename == null) {
            return FALLBACK_BASE_NAME;
        }
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = name.trim();
        return name.isEmpty() ? FALLBACK_BASE_NAME : name;
    }

    /**
     * Lower-cased extension including the dot, or an empty string when the name has none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = slash >= 0 ? filename.substring(slash + 1) : filename;
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
