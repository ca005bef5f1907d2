package org.panes.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.panes.model.enums.EntryKind;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

@UtilityClass
public class EntryClassifier {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "jp2", "j2k");
    private static final Set<String> ARCHIVE_EXTENSIONS = Set.of("zip", "cbz", "rar", "cbr", "7z", "cb7");
    private static final Set<String> SYSTEM_FILES = Set.of("thumbs.db", "desktop.ini");
    private static final String MACOS_METADATA_DIRECTORY = "__MACOSX";
    private static final Map<String, String> FORMAT_LABELS = Map.ofEntries(
            Map.entry("jpg", "JPEG"),
            Map.entry("jpeg", "JPEG"),
            Map.entry("png", "PNG"),
            Map.entry("gif", "GIF"),
            Map.entry("webp", "WebP"),
            Map.entry("bmp", "BMP"),
            Map.entry("tiff", "TIFF"),
            Map.entry("tif", "TIFF"),
            Map.entry("heic", "HEIC"),
            Map.entry("heif", "HEIC"),
            Map.entry("jp2", "JPEG 2000"),
            Map.entry("j2k", "JPEG 2000")
    );

    public static EntryKind classify(String name) {
        if (isIgnored(name)) {
            return EntryKind.IGNORED;
        }
        String extension = extension(name);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return EntryKind.IMAGE;
        }
        if (ARCHIVE_EXTENSIONS.contains(extension)) {
            return EntryKind.NESTED_ARCHIVE;
        }
        return EntryKind.IGNORED;
    }

    /**
     * Platform metadata and hidden files: anything under {@code __MACOSX} or a dot-directory, dotfiles (which
     * covers AppleDouble {@code ._} files) and Windows shell files.
     */
    public static boolean isIgnored(String name) {
        if (StringUtils.isEmpty(name)) {
            return true;
        }
        String normalized = normalize(name);
        if (normalized.endsWith("/")) {
            return true;
        }
        for (String segment : normalized.split("/")) {
            if (segment.equals(MACOS_METADATA_DIRECTORY) || isHidden(segment)) {
                return true;
            }
        }
        return SYSTEM_FILES.contains(baseName(normalized).toLowerCase(Locale.ROOT));
    }

    private static boolean isHidden(String segment) {
        return segment.startsWith(".") && !segment.equals(".") && !segment.equals("..");
    }

    public static String normalize(String path) {
        return path == null ? "" : path.replace('\\', '/');
    }

    public static String baseName(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /**
     * Directory part of an entry path, up to the last separator. Entries at the container root map to {@code "/"}.
     */
    public static String directoryOf(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash > 0 ? normalized.substring(0, slash) : "/";
    }

    public static String extension(String path) {
        String baseName = baseName(path);
        int dot = baseName.lastIndexOf('.');
        if (dot < 0 || dot == baseName.length() - 1) {
            return "";
        }
        return baseName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String formatLabel(String path) {
        String extension = extension(path);
        return FORMAT_LABELS.getOrDefault(extension, extension.toUpperCase(Locale.ROOT));
    }
}
