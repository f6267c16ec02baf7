package net.unishelf.application.resource;

import java.util.Locale;
import java.util.Map;

/**
 * Derives the short format label of an uploaded file.
 */
final class ResourceFormats {

    static final String LINK = "link";
    static final String OTHER = "other";

    private static final Map<String, String> BY_MIME_TYPE = Map.ofEntries(
        Map.entry("application/pdf", "pdf"),
        Map.entry("application/msword", "doc"),
        Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
        Map.entry("application/vnd.ms-powerpoint", "ppt"),
        Map.entry("application/vnd.openxmlformats-officedocument.presentationml.presentation", "pptx"),
        Map.entry("text/plain", "txt"),
        Map.entry("video/mp4", "mp4"),
        Map.entry("audio/mpeg", "mp3"),
        Map.entry("image/jpeg", "jpg"),
        Map.entry("image/png", "png")
    );

    private ResourceFormats() {
    }

    /**
     * MIME type first, then the file extension, then {@code other}.
     * Returns {@code link} when there is no file at all.
     */
    static String derive(String fileUrl, String fileName, String mimeType) {
        boolean hasFile = (fileUrl != null && !fileUrl.isBlank()) || (fileName != null && !fileName.isBlank());
        if (!hasFile) {
            return LINK;
        }
        if (mimeType != null) {
            String known = BY_MIME_TYPE.get(mimeType.trim().toLowerCase(Locale.ROOT));
            if (known != null) {
                return known;
            }
        }
        String extension = extension(fileName != null && !fileName.isBlank() ? fileName : fileUrl);
        return extension == null ? OTHER : extension;
    }

    private static String extension(String name) {
        String path = name;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int slash = path.lastIndexOf('/');
        if (slash >= 0) {
            path = path.substring(slash + 1);
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return null;
        }
        return path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
