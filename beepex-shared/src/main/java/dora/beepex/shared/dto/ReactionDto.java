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
public class ReactionDto {
    @JsonProperty("id")
    private String id;

    @JsonProperty("participantID")
    private String participantId;

    @JsonProperty("reactionKey")
    private String reactionKey;

    @JsonProperty("emoji")
    private Boolean emoji;

    @JsonProperty("imgURL")
    private String imgUrl;
}
