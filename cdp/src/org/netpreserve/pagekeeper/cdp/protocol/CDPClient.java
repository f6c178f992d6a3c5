package org.netpreserve.pagekeeper.cdp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Browser-level connection. Messages tagged with a session id are routed to the {@link CDPSession} of the
 * target with that id, everything else is handled here.
 */
public class CDPClient extends CDPBase implements Connection, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CDPClient.class);
    private final AtomicLong idSeq = new AtomicLong();
    final Map<String, CDPSession> sessions = new ConcurrentHashMap<>();
    final RPC rpc;

    public CDPClient(InputStream inputStream, OutputStream outputStream) {
        this.rpc = new RPC.Pipe(inputStream, outputStream, this::handleMessage, this::handleRpcClose);
    }

    public CDPClient(RPC.Factory transport) throws IOException {
        this.rpc = transport.open(this::handleMessage, this::handleRpcClose);
    }

    @Override
    public void close() {
        rpc.close();
        sessions.values().forEach(CDPSession::close);
        super.close();
    }

    @Override
    protected void handleMessage(RPC.ServerMessage message) {
        if (message.sessionId() == null) {
            super.handleMessage(message);
        } else {
            var session = sessions.get(message.sessionId());
            if (session != null) {
                session.handleMessage(message);
            } else {
                log.debug("Ignoring CDP message for unknown session: {}", message);
            }
        }
    }

    @Override
    protected void handleRpcClose() {
        super.handleRpcClose();
        sessions.values().forEach(CDPSession::handleRpcClose);
    }

    @Override
    public CDPSession session(String targetId) {
        return sessions.computeIfAbsent(targetId, id -> new CDPSession(this, id));
    }

    @Override
    public void closeSession(String targetId) {
        var session = sessions.get(targetId);
        if (session != null) session.close();
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        rpc.send(new RPC.Command(commandId, method, params, null));
    }

    @Override
    protected long nextCommandId() {
        return idSeq.incrementAndGet();
    }
}
