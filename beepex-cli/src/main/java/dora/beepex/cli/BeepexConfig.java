package dora.beepex.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dora.beepex.archive.model.ExportSettings;
import dora.beepex.archive.source.ArchiveIntegrityException;
import dora.beepex.archive.source.RemoteSource;
import dora.beepex.archive.source.RemoteSourceException;
import dora.beepex.archive.thumb.ThumbnailException;
import dora.beepex.cli.api.DesktopApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;

@Slf4j
@Configuration
public class BeepexConfig {

    @Value("${beepex.base-url:http://localhost:23373}")
    private String baseUrl;

    @Value("${beepex.access-token:}")
    private String accessToken;

    @Value("${beepex.output-dir:beepex-export}")
    private String outputDir;

    @Value("${beepex.time-zone:}")
    private String timeZone;

    @Value("${beepex.request-timeout:30s}")
    private String requestTimeout;

    @Value("${beepex.hydration-timeout:0s}")
    private String hydrationTimeout;

    @Value("${beepex.thumbnails.jpeg-max-dimension:512}")
    private int jpegMaxDimension;

    @Value("${beepex.thumbnails.png-max-dimension:800}")
    private int pngMaxDimension;

    @Value("${beepex.thumbnails.quality:0.75}")
    private float thumbnailQuality;

    @Value("${beepex.thumbnails.workers:2}")
    private int thumbnailWorkers;

    @Value("${beepex.thumbnails.queue-capacity:4096}")
    private int thumbnailQueueCapacity;

    @Bean
    public ExportSettings exportSettings() {
        return ExportSettings.builder()
                .outputRoot(Paths.get(outputDir))
                .localZone(timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone))
                .hydrationTimeout(DurationStyle.detectAndParse(hydrationTimeout))
                .jpegMaxDimension(jpegMaxDimension)
                .pngMaxDimension(pngMaxDimension)
                .thumbnailQuality(thumbnailQuality)
                .thumbnailWorkers(thumbnailWorkers)
                .thumbnailQueueCapacity(thumbnailQueueCapacity)
                .build();
    }

    @Bean
    public ObjectMapper beeperObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public HttpClient beeperHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public RemoteSource remoteSource(HttpClient beeperHttpClient, ObjectMapper beeperObjectMapper) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new MissingCredentialException(
                    "No access token: set BEEPER_ACCESS_TOKEN or beepex.access-token");
        }
        log.debug("Using the Desktop API at {}", baseUrl);
        return new DesktopApiClient(beeperHttpClient, beeperObjectMapper, baseUrl, accessToken,
                DurationStyle.detectAndParse(requestTimeout));
    }

    @Bean
    public ExitCodeExceptionMapper exitCodeExceptionMapper() {
        return BeepexConfig::exitCodeOf;
    }

    /** Exit code of a failed run, from the innermost exception we know. */
    static int exitCodeOf(Throwable exception) {
        for (Throwable e = exception; e != null; e = e.getCause()) {
            if (e instanceof MissingCredentialException) {
                return MissingCredentialException.EXIT_CODE;
            }
            if (e instanceof RemoteSourceException) {
                return 3;
            }
            if (e instanceof ArchiveIntegrityException) {
                return 4;
            }
            if (e instanceof ThumbnailException) {
                return 5;
            }
        }
        return 1;
    }
}
