package dora.beepex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.beepex.archive.export.ChatFilter;
import dora.beepex.archive.export.ExportOrchestrator;
import dora.beepex.archive.export.ExportSummary;
import dora.beepex.archive.model.ExportSettings;
import dora.beepex.archive.source.RemoteSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one export when the application starts. Chat selection comes from the
 * {@code --include-*} and {@code --exclude-*} arguments, in command-line order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportRunner implements ApplicationRunner {

    private final RemoteSource remoteSource;
    private final ExportSettings exportSettings;
    private final ObjectMapper beeperObjectMapper;

    private final AtomicBoolean running = new AtomicBoolean();

    @Override
    public void run(ApplicationArguments args) throws Exception {
        ChatFilter filter = ChatFilter.parse(Arrays.asList(args.getSourceArgs()));
        Thread abortHook = new Thread(() -> {
            if (running.get()) {
                log.error("Export aborted");
            }
        }, "export-abort");
        Runtime.getRuntime().addShutdownHook(abortHook);

        running.set(true);
        try {
            ExportSummary summary = new ExportOrchestrator(remoteSource, exportSettings, beeperObjectMapper)
                    .export(filter);
            log.info("Export finished: {} chats, {} messages, {} thumbnails",
                    summary.getChats(), summary.getMessages(), summary.getThumbnailsQueued());
        } catch (Exception e) {
            log.error("Export failed: {}", e.getMessage());
            throw e;
        } finally {
            running.set(false);
            try {
                Runtime.getRuntime().removeShutdownHook(abortHook);
            } catch (IllegalStateException e) {
                log.debug("JVM is already shutting down");
            }
        }
    }
}
