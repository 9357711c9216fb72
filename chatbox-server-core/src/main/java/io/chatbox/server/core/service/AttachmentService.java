package io.chatbox.server.core.service;

import io.chatbox.core.ChatException;
import io.chatbox.core.PrivateChatMessage;
import io.chatbox.server.core.ChatServerConfig;
import io.chatbox.server.spi.AttachmentRecord;
import io.chatbox.server.spi.ChatStore;
import io.chatbox.server.spi.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Photo attachments for private messages. Bytes live in files under the attachment directory, metadata in the
 * durable store; both expire after the retention period.
 */
public final class AttachmentService {
    private static final Logger logger = LoggerFactory.getLogger(AttachmentService.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/png", ".png",
            "image/gif", ".gif",
            "image/webp", ".webp");

    private final ChatStore store;
    private final PresenceManager presence;
    private final SettingsService settings;
    private final ChatServerConfig config;
    private final Clock clock;

    public AttachmentService(ChatStore store, PresenceManager presence, SettingsService settings,
                             ChatServerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AttachmentRecord upload(String username, String sessionId, String mimeType, byte[] bytes) {
        SessionRecord session = presence.requireLiveSession(username, sessionId);
        if (!settings.getBoolean(SettingsService.ALLOW_PHOTO_UPLOADS, true)) {
            throw new ChatException.Forbidden("photo uploads are disabled");
        }
        String type = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) type = type.substring(0, semicolon).trim();
        String extension = EXTENSIONS.get(type);
        if (extension == null) {
            throw new ChatException.Validation("unsupported attachment type " + mimeType);
        }
        if (bytes == null || bytes.length == 0) {
            throw new ChatException.Validation("attachment is empty");
        }
        long max = maxBytes();
        if (bytes.length > max) {
            throw new ChatException.Validation("attachment exceeds " + max + " bytes");
        }

        String ref = "att_" + UUID.randomUUID().toString().replace("-", "");
        Path file = config.attachmentDir().resolve(ref + extension);
        try {
            Files.createDirectories(config.attachmentDir());
            Files.write(file, bytes);
        } catch (IOException e) {
            throw new ChatException.TransientStore("attachment storage unavailable", e);
        }
        Instant now = clock.instant();
        AttachmentRecord record = new AttachmentRecord(ref, file.toString(), bytes.length, type, session.username(),
                session.sessionId(), now, now.plus(config.attachmentRetention()), null);
        store.putAttachment(record);
        logger.debug("Stored attachment {} ({} bytes) for {}", ref, bytes.length, session.username());
        return record;
    }

    /**
     * Checks that {@code ref} can be attached to a new private message from {@code uploaderSessionId}.
     */
    AttachmentRecord requireLinkable(String ref, String uploaderSessionId) {
        AttachmentRecord record = store.findAttachment(ref)
                .orElseThrow(() -> new ChatException.NotFound("attachment " + ref + " not found"));
        if (record.isExpired(clock.instant())) {
            throw new ChatException.NotFound("attachment " + ref + " has expired");
        }
        if (!record.uploaderSessionId().equals(uploaderSessionId)) {
            throw new ChatException.Forbidden("attachment belongs to another session");
        }
        if (record.messageId() != null) {
            throw new ChatException.Conflict("attachment is already attached to a message");
        }
        return record;
    }

    /**
     * Resolves an attachment for download. Readable by the uploading session and by both parties of the private
     * message it is linked to.
     */
    public AttachmentRecord open(String ref, String username, String sessionId) {
        SessionRecord session = presence.requireLiveSession(username, sessionId);
        AttachmentRecord record = store.findAttachment(ref == null ? "" : ref.trim())
                .filter(a -> !a.isExpired(clock.instant()))
                .orElseThrow(() -> new ChatException.NotFound("attachment not found"));
        boolean uploader = record.uploaderSessionId().equals(session.sessionId());
        boolean party = record.messageId() != null && store.findPrivateMessage(record.messageId())
                .map(pm -> involves(pm, session))
                .orElse(false);
        if (!uploader && !party) {
            throw new ChatException.NotFound("attachment not found");
        }
        return record;
    }

    /** Deletes expired rows and their files. */
    public int purgeExpired() {
        List<AttachmentRecord> expired = store.deleteAttachmentsExpiredBefore(clock.instant());
        for (AttachmentRecord record : expired) {
            try {
                Files.deleteIfExists(Path.of(record.storagePath()));
            } catch (IOException e) {
                logger.warn("Could not delete attachment file {}", record.storagePath(), e);
            }
        }
        if (!expired.isEmpty()) {
            logger.info("Purged {} expired attachments", expired.size());
        }
        return expired.size();
    }

    private long maxBytes() {
        int mb = settings.getInt(SettingsService.MAX_PHOTO_SIZE_MB, 0);
        return mb > 0 ? Math.min(config.attachmentMaxBytes(), mb * 1024L * 1024L) : config.attachmentMaxBytes();
    }

    private static boolean involves(PrivateChatMessage pm, SessionRecord session) {
        return pm.involves(session.username(), session.sessionId());
    }
}
