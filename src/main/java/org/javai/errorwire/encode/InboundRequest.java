package org.javai.errorwire.encode;

/**
 * The parts of an inbound request the encoder consults.
 */
@FunctionalInterface
public interface InboundRequest {

    /**
     * Returns the first value of a header, or {@code null} if absent.
     * Header names are matched case-insensitively by implementations.
     */
    String header(String name);
}
