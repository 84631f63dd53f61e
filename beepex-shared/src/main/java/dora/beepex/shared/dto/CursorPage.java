package dora.beepex.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a cursor-paginated listing. Older entries are requested by passing
 * {@link #oldestCursor} back with {@code direction=before}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CursorPage<T> {
    @JsonProperty("items")
    private List<T> items;

    @JsonProperty("hasMore")
    private Boolean hasMore;

    @JsonProperty("oldestCursor")
    private String oldestCursor;

    @JsonProperty("newestCursor")
    private String newestCursor;
}
