package com.exampack.core.transport;

import com.exampack.core.spi.PackTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;
import java.time.Duration;

/**
 * 基于 {@link URLConnection} 的传输实现，支持 http(s) 与 file
 */
@Slf4j
public class UrlConnectionPackTransport implements PackTransport {

    private static final String USER_AGENT = "exampack-client";

    @Override
    public TransportResponse open(URI uri, Duration timeout) throws IOException {
        URLConnection connection = uri.toURL().openConnection();
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        connection.setConnectTimeout(timeoutMillis);
        connection.setReadTimeout(timeoutMillis);

        if (connection instanceof HttpURLConnection) {
            HttpURLConnection http = (HttpURLConnection) connection;
            http.setRequestProperty("User-Agent", USER_AGENT);
            http.setInstanceFollowRedirects(true);
            int code = http.getResponseCode();
            if (code / 100 != 2) {
                http.disconnect();
                throw new IOException("Request for " + uri + " returned with a response code of "
                        + code + " (" + http.getResponseMessage() + ")");
            }
        }

        InputStream in = connection.getInputStream();
        long length = connection.getContentLengthLong();
        log.debug("Opened {} (length={})", uri, length);
        return new UrlConnectionResponse(connection, in, length);
    }

    private static final class UrlConnectionResponse implements TransportResponse {
        private final URLConnection connection;
        private final InputStream in;
        private final long contentLength;

        UrlConnectionResponse(URLConnection connection, InputStream in, long contentLength) {
            this.connection = connection;
            this.in = in;
            this.contentLength = contentLength;
        }

        @Override
        public long getContentLength() {
            return contentLength;
        }

        @Override
        public InputStream getInputStream() {
            return in;
        }

        @Override
        public void close() throws IOException {
            try {
                in.close();
            } finally {
                if (connection instanceof HttpURLConnection) {
                    ((HttpURLConnection) connection).disconnect();
                }
            }
        }
    }
}
