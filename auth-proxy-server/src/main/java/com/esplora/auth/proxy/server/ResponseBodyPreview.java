package com.esplora.auth.proxy.server;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import lombok.extern.slf4j.Slf4j;

/**
 * Passes the upstream body through unchanged while keeping its first bytes for a diagnostic log line.
 */
@Slf4j
class ResponseBodyPreview extends FilterInputStream {

    private final int limit;
    private final String label;
    private final ByteArrayOutputStream captured;
    private long seen;
    private boolean logged;

    ResponseBodyPreview(InputStream in, int limit, String label) {
        super(in);
        this.limit = limit;
        this.label = label;
        this.captured = new ByteArrayOutputStream(Math.min(limit, 4096));
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b >= 0) {
            capture(new byte[] {(byte) b}, 0, 1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, len);
        if (n > 0) {
            capture(b, off, n);
        }
        return n;
    }

    private void capture(byte[] b, int off, int n) {
        seen += n;
        int room = limit - captured.size();
        if (room > 0) {
            captured.write(b, off, Math.min(room, n));
        }
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            if (!logged) {
                logged = true;
                log.info("Response body {} ({} bytes read, first {}): {}", label, seen, captured.size(),
                    printable(captured.toByteArray()));
            }
        }
    }

    static String printable(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c == '\uFFFD' || (Character.isISOControl(c) && c != '\n' && c != '\t') ? '.' : c);
        }
        return sb.toString();
    }
}
