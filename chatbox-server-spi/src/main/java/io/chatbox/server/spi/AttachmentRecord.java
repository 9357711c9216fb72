package io.chatbox.server.spi;

import java.time.Instant;

/**
 * Uploaded file referenced by at most one private message.
 *
 * @param messageId linked private message id, {@code null} while unlinked
 */
public record AttachmentRecord(
        String ref,
        String storagePath,
        long size,
        String mimeType,
        String uploadedBy,
        String uploaderSessionId,
        Instant createdAt,
        Instant expiresAt,
        Long messageId
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public AttachmentRecord linkedTo(long privateMessageId) {
        return new AttachmentRecord(ref, storagePath, size, mimeType, uploadedBy, uploaderSessionId, createdAt,
                expiresAt, privateMessageId);
    }
}
