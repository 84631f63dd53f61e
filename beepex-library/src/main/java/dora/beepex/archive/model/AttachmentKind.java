package dora.beepex.archive.model;

import java.util.Locale;

public enum AttachmentKind {
    IMAGE,
    VIDEO,
    AUDIO,
    OTHER;

    /**
     * Maps the wire tag of an attachment. A missing tag is treated as a plain file,
     * an unrecognized one is rejected so that new media types do not vanish from
     * the export unnoticed.
     */
    public static AttachmentKind fromWireType(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "img", "image" -> IMAGE;
            case "video" -> VIDEO;
            case "audio" -> AUDIO;
            case "unknown", "file" -> OTHER;
            default -> throw new IllegalArgumentException("Unsupported attachment type: " + type);
        };
    }
}
