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
public class ChatDto {
    @JsonProperty("id")
    private String id;

    @JsonProperty("accountID")
    private String accountId;

    @JsonProperty("network")
    private String network;

    @JsonProperty("title")
    private String title;

    @JsonProperty("type")
    private String type; // "single", "group"

    @JsonProperty("participants")
    private ParticipantsDto participants;

    @JsonProperty("lastActivity")
    private String lastActivity;

    @JsonProperty("unreadCount")
    private Integer unreadCount;

    @JsonProperty("isArchived")
    private Boolean isArchived;

    @JsonProperty("isMuted")
    private Boolean isMuted;

    @JsonProperty("isPinned")
    private Boolean isPinned;
}
