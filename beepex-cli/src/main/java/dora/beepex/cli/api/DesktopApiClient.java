package dora.beepex.cli.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dora.beepex.archive.source.RemoteSource;
import dora.beepex.archive.source.RemoteSourceException;
import dora.beepex.shared.dto.AssetDownloadDto;
import dora.beepex.shared.dto.AssetDownloadRequest;
import dora.beepex.shared.dto.ChatDto;
import dora.beepex.shared.dto.CursorPage;
import dora.beepex.shared.dto.MessageDto;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Client of the local Beeper Desktop API. Listing calls block until their page
 * arrives; asset downloads stay asynchronous so that many can run at once.
 */
@Slf4j
public class DesktopApiClient implements RemoteSource {

    private static final TypeReference<CursorPage<ChatDto>> CHAT_PAGE = new TypeReference<>() {
    };
    private static final TypeReference<CursorPage<MessageDto>> MESSAGE_PAGE = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String accessToken;
    private final Duration requestTimeout;

    public DesktopApiClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                            String accessToken, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CursorPage<ChatDto> listChats(String cursor) {
        return join(get("/v1/chats" + pageQuery(cursor), CHAT_PAGE, "list chats"));
    }

    @Override
    public ChatDto retrieveChat(String chatId) {
        return join(get("/v1/chats/" + encode(chatId), new TypeReference<ChatDto>() {
        }, "retrieve chat " + chatId));
    }

    @Override
    public CursorPage<MessageDto> listMessages(String chatId, String cursor) {
        return join(get("/v1/chats/" + encode(chatId) + "/messages" + pageQuery(cursor), MESSAGE_PAGE,
                "list messages of chat " + chatId));
    }

    @Override
    public CompletableFuture<AssetDownloadDto> downloadAsset(String url) {
        try {
            String jsonBody = objectMapper.writeValueAsString(new AssetDownloadRequest(url));
            HttpRequest httpRequest = createRequestBuilder("/v1/assets/download")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .header("Content-Type", "application/json")
                    .build();
            return send(httpRequest, new TypeReference<AssetDownloadDto>() {
            }, "download " + url);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> CompletableFuture<T> get(String endpoint, TypeReference<T> type, String what) {
        HttpRequest httpRequest = createRequestBuilder(endpoint)
                .GET()
                .build();
        return send(httpRequest, type, what);
    }

    private <T> CompletableFuture<T> send(HttpRequest httpRequest, TypeReference<T> type, String what) {
        log.debug("{} {}", httpRequest.method(), httpRequest.uri());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .exceptionally(e -> {
                    throw connectionFailure(e, what);
                })
                .thenApply(response -> {
                    if (response.statusCode() >= 200 && response.statusCode() < 300) {
                        try {
                            return objectMapper.readValue(response.body(), type);
                        } catch (IOException e) {
                            throw new RemoteSourceException("Failed to parse the response to " + what, e);
                        }
                    }
                    String errorMessage = extractErrorMessage(response.body());
                    throw new RemoteSourceException(
                            "Failed to " + what + ": HTTP " + response.statusCode()
                                    + (errorMessage != null ? " - " + errorMessage : ""),
                            response.statusCode());
                });
    }

    private HttpRequest.Builder createRequestBuilder(String endpoint) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + endpoint))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + accessToken);
    }

    private RuntimeException connectionFailure(Throwable e, String what) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RemoteSourceException) {
            return (RemoteSourceException) cause;
        }
        if (cause instanceof ConnectException || cause instanceof HttpConnectTimeoutException) {
            return new RemoteSourceException("Cannot connect to " + baseUrl
                    + ", make sure Beeper Desktop is running and its API is enabled", cause);
        }
        return new RemoteSourceException("Failed to " + what + ": " + cause.getMessage(), cause);
    }

    /**
     * Extracts error message from response body, handling JSON and plain text responses.
     */
    String extractErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.trim().isEmpty()) {
            return null;
        }
        try {
            JsonNode jsonNode = objectMapper.readTree(responseBody);
            if (jsonNode.hasNonNull("message")) {
                return jsonNode.get("message").asText();
            }
            if (jsonNode.hasNonNull("error")) {
                return jsonNode.get("error").asText();
            }
            return responseBody;
        } catch (IOException e) {
            // plain text
            return responseBody;
        }
    }

    private static String pageQuery(String cursor) {
        if (cursor == null) {
            return "";
        }
        return "?cursor=" + encode(cursor) + "&direction=before";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RemoteSourceException("Request failed: " + e.getMessage(), e);
        }
    }
}
