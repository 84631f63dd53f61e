package dora.beepex.archive;

import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.AttachmentKind;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.model.User;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

public final class Fixtures {

    public static final OffsetDateTime T0 = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private Fixtures() {
    }

    public static User user(String id, String name) {
        return User.builder().id(id).displayName(name).build();
    }

    public static User self(String id, String name) {
        return User.builder().id(id).displayName(name).self(true).build();
    }

    public static Chat chat(String id, String rawTitle, User... participants) {
        return new Chat(id, "acct-1", "whatsapp", rawTitle, List.of(participants));
    }

    public static Message.MessageBuilder message(String id, String senderId, int minutes) {
        return Message.builder()
                .id(id)
                .chatId("c1")
                .timestamp(T0.plusMinutes(minutes))
                .senderId(senderId)
                .senderDisplayName(senderId);
    }

    public static Message text(String id, String senderId, int minutes) {
        return message(id, senderId, minutes).text("message " + id).build();
    }

    public static Attachment image(String ref, String fileName) {
        return Attachment.builder().kind(AttachmentKind.IMAGE).remoteRef(ref).fileName(fileName).build();
    }

    public static Path writePng(Path file, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(new Color(200, 40, 40, 128));
            g.fillRect(0, 0, width / 2, height);
            g.setColor(Color.BLUE);
            g.fillRect(width / 2, 0, width - width / 2, height);
        } finally {
            g.dispose();
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    public static Path writeJpeg(Path file, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.GREEN);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        ImageIO.write(image, "jpg", file.toFile());
        return file;
    }
}
