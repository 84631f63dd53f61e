package dora.beepex.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageDto {
    @JsonProperty("id")
    private String id;

    @JsonProperty("chatID")
    private String chatId;

    @JsonProperty("accountID")
    private String accountId;

    @JsonProperty("senderID")
    private String senderId;

    @JsonProperty("senderName")
    private String senderName;

    @JsonProperty("timestamp")
    private String timestamp; // ISO-8601 with offset

    @JsonProperty("sortKey")
    private String sortKey;

    @JsonProperty("type")
    private String type;

    @JsonProperty("text")
    private String text;

    @JsonProperty("isSender")
    private Boolean isSender;

    @JsonProperty("isUnread")
    private Boolean isUnread;

    @JsonProperty("linkedMessageID")
    private String linkedMessageId;

    @JsonProperty("attachments")
    private List<AttachmentDto> attachments;

    @JsonProperty("reactions")
    private List<ReactionDto> reactions;
}
