package org.netpreserve.pagekeeper.cdp.protocol;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class RPCPipeTest {
    private final PipedOutputStream browserOut = new PipedOutputStream();
    private final ByteArrayOutputStream clientOut = new ByteArrayOutputStream();
    private CDPClient client;

    interface Page {
        @Unwrap("frameId")
        CompletableFuture<String> navigateAsync(String url);

        CompletableFuture<Void> reloadAsync();

        Subscription onLoadEventFired(Consumer<LoadEventFired> handler);

        record LoadEventFired(double timestamp) {
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        client = new CDPClient(new PipedInputStream(browserOut), clientOut);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        browserOut.close();
    }

    private void browserWrites(String data) throws IOException {
        browserOut.write(data.getBytes(StandardCharsets.UTF_8));
        browserOut.flush();
    }

    @Test
    void commandsAreWrittenAsNullTerminatedJson() throws Exception {
        client.domain(Page.class).navigateAsync("http://example.com/");

        byte[] written = clientOut.toByteArray();
        assertEquals(0, written[written.length - 1]);
        var command = RPC.JSON.readTree(written, 0, written.length - 1);
        assertEquals(1, command.get("id").asLong());
        assertEquals("Page.navigate", command.get("method").asText());
        assertEquals("http://example.com/", command.at("/params/url").asText());
        assertFalse(command.has("sessionId"));
    }

    @Test
    void messagesSplitAcrossReadsAreReassembled() throws Exception {
        var page = client.domain(Page.class);
        BlockingQueue<Double> loads = new LinkedBlockingQueue<>();
        page.onLoadEventFired(event -> loads.add(event.timestamp()));
        var frameId = page.navigateAsync("http://example.com/");

        browserWrites("{\"id\":1,\"res");
        browserWrites("ult\":{\"frameId\":\"frame-1\"}}\0{\"method\":\"Page.loadEventFired\",\"params\":{\"timestamp\":2.5}}\0");

        assertEquals("frame-1", frameId.get(5, TimeUnit.SECONDS));
        assertEquals(2.5, loads.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void unparseableMessagesAreSkipped() throws Exception {
        BlockingQueue<Double> loads = new LinkedBlockingQueue<>();
        client.domain(Page.class).onLoadEventFired(event -> loads.add(event.timestamp()));

        browserWrites("not json\0{\"method\":\"Page.loadEventFired\",\"params\":{\"timestamp\":1.0}}\0");

        assertEquals(1.0, loads.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void endOfStreamFailsPendingCommands() throws Exception {
        var reload = client.domain(Page.class).reloadAsync();

        browserOut.close();

        var e = assertThrows(ExecutionException.class, () -> reload.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CDPClosedException.class, e.getCause());
    }
}
