package org.profd.node.spi;

/**
 * A long-running, manageable background process within the Node.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block while the process runs.
     */
    void start();

    /**
     * Stops the process gracefully and releases its resources.
     */
    void stop();
}
