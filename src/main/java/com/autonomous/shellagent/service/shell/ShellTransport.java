package com.autonomous.shellagent.service.shell;

/**
 * Ordered, half-duplex connection to a shell. Implementations strip terminal control codes from what they
 * return; the engine never opens or closes the connection itself.
 */
public interface ShellTransport extends AutoCloseable {

    void send(String data);

    /**
     * Returns whatever output arrived since the last call, or an empty string. Never blocks.
     */
    String readAvailable();

    boolean isConnected();

    @Override
    void close();
}
