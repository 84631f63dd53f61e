package dora.beepex.archive.model;

import java.nio.file.Path;

/**
 * Where an export puts its files:
 * <pre>
 * index.html
 * chat/&lt;account&gt;/&lt;chat&gt;.html
 * gallery/&lt;account&gt;/&lt;chat&gt;.html
 * media/full/&lt;account&gt;/&lt;chat&gt;/...
 * media/thumb/&lt;account&gt;/&lt;chat&gt;/...
 * media/beepex/   (stylesheets, gallery script)
 * </pre>
 */
public class ExportLayout {
    private static final String PAGE_EXTENSION = ".html";

    private final Path root;
    private final Path resourceDir;

    public ExportLayout(ExportSettings settings) {
        this.root = settings.getOutputRoot().toAbsolutePath().normalize();
        this.resourceDir = root.resolve(settings.getResourceDir()).normalize();
    }

    public Path getRoot() {
        return root;
    }

    public Path indexPage() {
        return root.resolve("index.html");
    }

    public Path resourceDir() {
        return resourceDir;
    }

    public Path chatPage(String accountDir, String chatFile) {
        return root.resolve("chat").resolve(accountDir).resolve(chatFile + PAGE_EXTENSION);
    }

    public Path galleryPage(String accountDir, String chatFile) {
        return root.resolve("gallery").resolve(accountDir).resolve(chatFile + PAGE_EXTENSION);
    }

    public Path mediaDir(String accountDir, String chatFile) {
        return root.resolve("media").resolve("full").resolve(accountDir).resolve(chatFile);
    }

    public Path thumbnailDir(String accountDir, String chatFile) {
        return root.resolve("media").resolve("thumb").resolve(accountDir).resolve(chatFile);
    }

    public ExportPaths pathsFor(String accountDir, String chatFile) {
        return new ExportPaths(
                chatPage(accountDir, chatFile),
                galleryPage(accountDir, chatFile),
                mediaDir(accountDir, chatFile),
                thumbnailDir(accountDir, chatFile));
    }
}
