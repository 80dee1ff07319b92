package com.deepansh.agentplatform.event;

import java.io.IOException;

/**
 * A user's live connection, independent of the transport behind it.
 */
public interface UserEventChannel {

    String getUserId();

    boolean isOpen();

    /** May block on the transport; the bridge bounds the wait. */
    void send(AgentEvent event) throws IOException;

    void close();
}
