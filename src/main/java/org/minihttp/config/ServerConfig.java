package org.minihttp.config;

/**
 * Server settings. Field defaults apply to any key missing from the JSON
 * configuration file; Gson fills the rest.
 */
public final class ServerConfig {

    /** Largest chunk handed to a connection per read. */
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 65535;

    private int port = 8080;
    private String bindAddress = "0.0.0.0";
    private int backlog = 20;
    private int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;
    private boolean concurrent = false;
    private boolean enforceMethods = false;
    private String serverId = "minihttp-1";

    public int getPort() { return port; }
    public String getBindAddress() { return bindAddress; }
    public int getBacklog() { return backlog; }
    public int getReceiveBufferSize() { return receiveBufferSize; }
    public boolean isConcurrent() { return concurrent; }
    public boolean isEnforceMethods() { return enforceMethods; }
    public String getServerId() { return serverId; }

    public ServerConfig port(int port) { this.port = port; return this; }
    public ServerConfig bindAddress(String bindAddress) { this.bindAddress = bindAddress; return this; }
    public ServerConfig backlog(int backlog) { this.backlog = backlog; return this; }
    public ServerConfig receiveBufferSize(int size) { this.receiveBufferSize = size; return this; }
    public ServerConfig concurrent(boolean concurrent) { this.concurrent = concurrent; return this; }
    public ServerConfig enforceMethods(boolean enforce) { this.enforceMethods = enforce; return this; }
    public ServerConfig serverId(String serverId) { this.serverId = serverId; return this; }

    /**
     * @return this, for chaining
     * @throws IllegalArgumentException if a value is out of range
     */
    public ServerConfig validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be in [0,65535]: " + port);
        }
        if (bindAddress == null || bindAddress.isBlank()) {
            throw new IllegalArgumentException("bindAddress must not be blank");
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("backlog must be positive: " + backlog);
        }
        if (receiveBufferSize < 1) {
            throw new IllegalArgumentException("receiveBufferSize must be positive: " + receiveBufferSize);
        }
        if (serverId == null || serverId.isBlank()) {
            throw new IllegalArgumentException("serverId must not be blank");
        }
        return this;
    }

    @Override
    public String toString() {
        return "ServerConfig{port=" + port + ", bindAddress=" + bindAddress + ", backlog=" + backlog
                + ", receiveBufferSize=" + receiveBufferSize + ", concurrent=" + concurrent
                + ", enforceMethods=" + enforceMethods + ", serverId=" + serverId + "}";
    }
}
