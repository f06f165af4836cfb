package com.esplora.auth.proxy.server;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Response handed back to the listener. The body is usually the live upstream stream and must be closed.
 *
 * @param contentLength declared body length, {@code -1} when unknown
 */
public record ProxyResponse(int status, Map<String, List<String>> headers, long contentLength, InputStream body)
    implements Closeable {

    public ProxyResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? InputStream.nullInputStream() : body;
    }

    public static ProxyResponse of(int status, String contentType, byte[] body) {
        return new ProxyResponse(status, Map.of("Content-Type", List.of(contentType)), body.length,
            new ByteArrayInputStream(body));
    }

    /**
     * Copies the body to the caller. Read failures surface as {@link UpstreamException};
     * write failures (caller gone) as {@link IOException}.
     */
    public long transferTo(OutputStream out) throws IOException {
        byte[] buf = new byte[8192];
        long total = 0;
        while (true) {
            int n;
            try {
                n = body.read(buf);
            } catch (IOException e) {
                throw new UpstreamException(UpstreamException.Kind.BODY_STREAM_FAILURE,
                    "Upstream body stream failed after " + total + " bytes", e);
            }
            if (n < 0) {
                return total;
            }
            out.write(buf, 0, n);
            total += n;
        }
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
