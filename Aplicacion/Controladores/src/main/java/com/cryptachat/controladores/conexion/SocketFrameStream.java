package com.cryptachat.controladores.conexion;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Frames JSON delimitados por salto de línea sobre un socket TCP.
 */
public class SocketFrameStream implements FrameStream {

    private static final Logger LOGGER = Logger.getLogger(SocketFrameStream.class.getName());

    public static final String PING_FRAME = "{\"type\":\"ping\"}";

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final int maxFrameBytes;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SocketFrameStream(Socket socket, int maxFrameBytes) throws IOException {
        this(socket, maxFrameBytes, () -> { });
    }

    public SocketFrameStream(Socket socket, int maxFrameBytes, Runnable onClose) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.maxFrameBytes = maxFrameBytes;
        this.onClose = Objects.requireNonNull(onClose, "onClose");
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public String readFrame(Duration timeout) throws IOException {
        socket.setSoTimeout((int) Math.max(1L, timeout.toMillis()));
        StringBuilder line = new StringBuilder();
        int bytes = 0;
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                int end = line.length();
                if (end > 0 && line.charAt(end - 1) == '\r') {
                    line.setLength(end - 1);
                }
                return line.toString();
            }
            bytes += utf8Length((char) c);
            if (bytes > maxFrameBytes) {
                throw new FrameTooLargeException(maxFrameBytes);
            }
            line.append((char) c);
        }
        // EOF, una línea incompleta no cuenta como frame
        return null;
    }

    @Override
    public void writeFrame(String json) throws IOException {
        synchronized (writer) {
            writer.write(json);
            writer.write('\n');
            writer.flush();
        }
    }

    @Override
    public void writePing() throws IOException {
        writeFrame(PING_FRAME);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error cerrando socket", e);
        } finally {
            onClose.run();
        }
    }

    public String remoteAddress() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800 || Character.isSurrogate(c)) {
            return 2;
        }
        return 3;
    }
}
