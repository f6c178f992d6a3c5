package org.netpreserve.pagekeeper.cdp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.pagekeeper.util.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Message transport between the client and the browser process.
 */
public interface RPC {
    ObjectMapper JSON = new ObjectMapper(new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder().maxStringLength(300 * 1024 * 1024).build())
            .build())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    void send(Command message) throws IOException;

    void close();

    /**
     * Opens a transport that delivers every incoming message to {@code messageHandler} and calls
     * {@code closeHandler} once the remote end goes away.
     */
    @FunctionalInterface
    interface Factory {
        RPC open(Consumer<ServerMessage> messageHandler, Runnable closeHandler) throws IOException;
    }

    record Command(long id, String method, Map<String, Object> params, String sessionId) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
    @JsonSubTypes({@JsonSubTypes.Type(Event.class), @JsonSubTypes.Type(Response.class)})
    interface ServerMessage {
        String sessionId();
    }

    record Event(String method, ObjectNode params, String sessionId) implements ServerMessage {
    }

    record Response(long id, ObjectNode result, Error error, String sessionId) implements ServerMessage {
    }

    record Error(int code, String message) {
    }

    /**
     * Transport over the browser's {@code --remote-debugging-pipe} file descriptors. Each message is a JSON
     * document terminated by a null byte.
     */
    class Pipe implements RPC {
        private static final Logger log = LoggerFactory.getLogger(Pipe.class);
        private final InputStream inputStream;
        private final OutputStream outputStream;
        private final Consumer<ServerMessage> messageHandler;
        private final Runnable closeHandler;
        private final Lock writeLock = new ReentrantLock();
        private volatile boolean closed;

        public Pipe(InputStream inputStream, OutputStream outputStream, Consumer<ServerMessage> messageHandler,
                    Runnable closeHandler) {
            this.inputStream = inputStream;
            this.outputStream = outputStream;
            this.messageHandler = messageHandler;
            this.closeHandler = closeHandler;
            var thread = new Thread(this::readMessages, "CDP.Pipe");
            thread.setDaemon(true);
            thread.start();
        }

        private void readMessages() {
            var pending = new ByteArrayOutputStream();
            byte[] buffer = new byte[64 * 1024];
            try {
                int length;
                while ((length = inputStream.read(buffer)) >= 0) {
                    int start = 0;
                    for (int i = 0; i < length; i++) {
                        if (buffer[i] != 0) continue;
                        pending.write(buffer, start, i - start);
                        dispatch(pending.toByteArray());
                        pending.reset();
                        start = i + 1;
                    }
                    // an incomplete message continues in the next read
                    pending.write(buffer, start, length - start);
                }
                log.debug("CDP pipe reached end of stream");
            } catch (IOException e) {
                if (closed) {
                    log.debug("CDP pipe closed", e);
                } else {
                    log.error("Error reading CDP pipe", e);
                }
            } finally {
                close();
                closeHandler.run();
            }
        }

        private void dispatch(byte[] message) {
            String text = new String(message, StandardCharsets.UTF_8);
            if (log.isTraceEnabled()) log.trace("<- {}", LogUtils.ellipses(text));
            ServerMessage serverMessage;
            try {
                serverMessage = JSON.readValue(message, ServerMessage.class);
            } catch (IOException e) {
                log.error("Skipping unparseable CDP message: {}", LogUtils.ellipses(text), e);
                return;
            }
            messageHandler.accept(serverMessage);
        }

        @Override
        public void send(Command message) throws IOException {
            byte[] json = JSON.writeValueAsBytes(message);
            if (log.isTraceEnabled()) {
                log.trace("-> {}", LogUtils.ellipses(new String(json, StandardCharsets.UTF_8)));
            }
            writeLock.lock();
            try {
                outputStream.write(json);
                outputStream.write(0);
                outputStream.flush();
            } finally {
                writeLock.unlock();
            }
        }

        @Override
        public void close() {
            closed = true;
            try {
                outputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe output", e);
            }
            try {
                inputStream.close();
            } catch (IOException e) {
                log.debug("Error closing CDP pipe input", e);
            }
        }
    }
}
