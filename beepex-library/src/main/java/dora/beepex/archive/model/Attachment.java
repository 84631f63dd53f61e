package dora.beepex.archive.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Attachment {
    @NonNull
    AttachmentKind kind;

    /** Reference returned by the service before hydration, shared by aliasing attachments. */
    @NonNull
    String remoteRef;

    @NonNull
    String fileName;

    Integer width;
    Integer height;

    public boolean hasDimensions() {
        return width != null && height != null && width > 0 && height > 0;
    }
}
