package org.javai.errorwire.encode;

import java.io.IOException;
import java.io.OutputStream;

/**
 * The response being written, as seen by the encoder.
 *
 * <p>Writes arrive in protocol order: headers, then the status line, then the body.
 * Once {@link #writeStatus(int)} has been called the status cannot change.
 * A sink serves a single response.
 */
public interface ResponseSink {

    /**
     * Sets a response header. Called only before {@link #writeStatus(int)}.
     */
    void setHeader(String name, String value);

    /**
     * Commits the status line.
     */
    void writeStatus(int status);

    /**
     * The response body stream. Called only after {@link #writeStatus(int)}.
     */
    OutputStream body() throws IOException;
}
