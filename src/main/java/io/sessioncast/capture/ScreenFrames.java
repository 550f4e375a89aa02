package io.sessioncast.capture;

import io.sessioncast.model.MessageTypes;
import io.sessioncast.model.RelayMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPOutputStream;

/**
 * Builds {@code screen} / {@code screenGz} frames from pane snapshots.
 */
public final class ScreenFrames {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScreenFrames.class);

    /** Clear screen, cursor home. */
    public static final String CLEAR_AND_HOME = "\u001b[2J\u001b[H";
    public static final int MIN_COMPRESS_BYTES = 512;

    private ScreenFrames() {
    }

    public static RelayMessage frame(String sessionId, String snapshot) {
        byte[] data = (CLEAR_AND_HOME + snapshot).getBytes(StandardCharsets.UTF_8);
        if (data.length > MIN_COMPRESS_BYTES) {
            try {
                return RelayMessage.of(MessageTypes.SCREEN_GZ, sessionId, Base64.getEncoder().encodeToString(gzip(data)));
            } catch (IOException e) {
                LOGGER.warn("Screen compression failed, sending uncompressed: {}", e.getMessage());
            }
        }
        return RelayMessage.of(MessageTypes.SCREEN, sessionId, Base64.getEncoder().encodeToString(data));
    }

    static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gz = new GZIPOutputStream(buffer)) {
            gz.write(data);
        }
        return buffer.toByteArray();
    }
}
