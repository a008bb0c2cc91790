package api.interfaces;

/*
AutoCloseable so the server can sit in try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Blocks serving connections until closed. */
    void start() throws Exception;
    @Override void close() throws Exception;
}
