package com.exampack.core.spi;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;

/**
 * 字节传输 SPI
 * <p>
 * 只负责打开流，进度、超时判定与取消由调用方在读取循环中处理。
 */
public interface PackTransport {

    /**
     * 打开资源
     *
     * @param uri     资源地址
     * @param timeout 连接与单次读取的超时
     * @throws IOException 网络错误或非 2xx 响应
     */
    TransportResponse open(URI uri, Duration timeout) throws IOException;

    /**
     * 已打开的响应
     */
    interface TransportResponse extends AutoCloseable {

        /**
         * 内容长度，未知时返回 -1
         */
        long getContentLength();

        InputStream getInputStream();

        @Override
        void close() throws IOException;
    }
}
