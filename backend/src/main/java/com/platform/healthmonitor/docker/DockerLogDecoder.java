package com.platform.healthmonitor.docker;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Decodes the body of {@code GET /containers/{name}/logs}.
 * 
 * Containers without a TTY return a multiplexed stream: frames made of an 8-byte
 * header (stream type, three zero bytes, big-endian payload length) followed by the
 * payload. Containers with a TTY return raw text. Invalid UTF-8 is replaced.
 */
public final class DockerLogDecoder {
    
    private static final int HEADER_SIZE = 8;
    
    private DockerLogDecoder() {
    }
    
    public static String decode(byte[] body) {
        if (body == null || body.length == 0) {
            return "";
        }
        if (!isMultiplexed(body)) {
            return new String(body, StandardCharsets.UTF_8);
        }
        
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length);
        ByteBuffer buffer = ByteBuffer.wrap(body);
        while (buffer.remaining() >= HEADER_SIZE) {
            buffer.get();
            buffer.position(buffer.position() + 3);
            int length = buffer.getInt();
            if (length < 0) {
                break;
            }
            int available = Math.min(length, buffer.remaining());
            out.write(body, buffer.position(), available);
            buffer.position(buffer.position() + available);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
    
    static boolean isMultiplexed(byte[] body) {
        return body.length >= HEADER_SIZE
            && body[0] >= 0 && body[0] <= 2
            && body[1] == 0 && body[2] == 0 && body[3] == 0;
    }
}
