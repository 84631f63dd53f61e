package dora.beepex.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Participant list of a chat. Chat listings may return only the first few
 * participants ({@code hasMore = true}); the chat detail returns all of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParticipantsDto {
    @JsonProperty("items")
    private List<UserDto> items;

    @JsonProperty("hasMore")
    private Boolean hasMore;

    @JsonProperty("total")
    private Integer total;
}
