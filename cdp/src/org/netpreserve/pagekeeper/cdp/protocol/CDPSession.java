package org.netpreserve.pagekeeper.cdp.protocol;

import java.io.IOException;
import java.util.Map;

/**
 * Command channel to a single target. Outgoing commands carry the target id as their session id.
 */
public class CDPSession extends CDPBase {
    private final String targetId;
    private final CDPClient client;

    CDPSession(CDPClient client, String targetId) {
        super();
        this.client = client;
        this.targetId = targetId;
    }

    @Override
    protected void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException {
        client.rpc.send(new RPC.Command(commandId, method, params, targetId));
    }

    @Override
    protected long nextCommandId() {
        return client.nextCommandId();
    }

    @Override
    public void close() {
        client.sessions.remove(targetId, this);
        handleRpcClose();
        super.close();
    }

    public String targetId() {
        return targetId;
    }

    @Override
    public String toString() {
        return "CDPSession[" + targetId + "]";
    }
}
