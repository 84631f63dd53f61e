package dora.beepex.archive.source;

import dora.beepex.shared.dto.AssetDownloadDto;
import dora.beepex.shared.dto.ChatDto;
import dora.beepex.shared.dto.CursorPage;
import dora.beepex.shared.dto.MessageDto;

import java.util.concurrent.CompletableFuture;

/**
 * The chat-aggregation service the export reads from.
 * <p>
 * Listings are cursor paginated: a {@code null} cursor asks for the newest page,
 * any other cursor asks for the page before it. Failures are reported as
 * {@link RemoteSourceException}.
 */
public interface RemoteSource {

    CursorPage<ChatDto> listChats(String cursor);

    /** Chat detail, including the full participant list. */
    ChatDto retrieveChat(String chatId);

    CursorPage<MessageDto> listMessages(String chatId, String cursor);

    /**
     * Asks the service to make a local copy of an attachment. The future completes
     * with the location of the copy or with an error description; it may also
     * complete exceptionally.
     */
    CompletableFuture<AssetDownloadDto> downloadAsset(String url);
}
