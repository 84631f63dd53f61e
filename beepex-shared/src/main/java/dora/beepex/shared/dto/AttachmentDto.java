package dora.beepex.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttachmentDto {
    @JsonProperty("type")
    private String type; // "img", "video", "audio", "unknown"

    /**
     * Source reference: {@code mxc://} or {@code localmxc://} for assets that still
     * have to be downloaded by Beeper, {@code file://} for cached ones.
     */
    @JsonProperty("srcURL")
    private String srcUrl;

    @JsonProperty("fileName")
    private String fileName;

    @JsonProperty("mimeType")
    private String mimeType;

    @JsonProperty("fileSize")
    private Long fileSize;

    @JsonProperty("size")
    private AttachmentSizeDto size;

    @JsonProperty("isGif")
    private Boolean isGif;

    @JsonProperty("isSticker")
    private Boolean isSticker;

    @JsonProperty("isVoiceNote")
    private Boolean isVoiceNote;

    @JsonProperty("duration")
    private Double duration;

    @JsonProperty("posterImg")
    private String posterImg;
}
