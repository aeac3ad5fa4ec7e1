package com.waypoint.transport;

import com.waypoint.core.config.WaypointProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams a plan file over TCP in 1 KiB chunks, then half-closes the connection so the
 * receiver sees end-of-file.
 */
@Component
public class SocketMissionTransport implements MissionTransport {

    private static final Logger log = LoggerFactory.getLogger(SocketMissionTransport.class);

    static final int CHUNK_SIZE = 1024;

    private final String host;
    private final int port;
    private final int connectTimeoutMs;

    @Autowired
    public SocketMissionTransport(WaypointProperties properties) {
        this(properties.getTransport().getHost(), properties.getTransport().getPort(),
                properties.getTransport().getConnectTimeoutMs());
    }

    public SocketMissionTransport(String host, int port, int connectTimeoutMs) {
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public void send(Path file) {
        log.info("Sending {} to {}:{}", file.getFileName(), host, port);
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            long sent = 0;
            try (InputStream in = Files.newInputStream(file)) {
                OutputStream out = socket.getOutputStream();
                byte[] buffer = new byte[CHUNK_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    sent += read;
                }
                out.flush();
            }
            socket.shutdownOutput();
            log.info("Sent {} byte(s) to {}:{}", sent, host, port);
        } catch (IOException e) {
            log.error("Failed to send {} to {}:{}", file, host, port, e);
            throw new TransportException("Failed to send mission to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }
}
