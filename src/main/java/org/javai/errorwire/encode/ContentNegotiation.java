package org.javai.errorwire.encode;

/**
 * Decides whether a client gets JSON or plain text.
 *
 * <p>A missing {@code Accept} header means JSON. Otherwise JSON is chosen when the header
 * contains {@code *}{@code /*} or {@code application/json} anywhere; media ranges and
 * quality values are not parsed.
 */
public final class ContentNegotiation {

    public static final String ACCEPT = "Accept";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";

    private static final String ANY = "*/*";

    private ContentNegotiation() {
        // Utility class
    }

    public static boolean acceptsJson(InboundRequest request) {
        return acceptsJson(request.header(ACCEPT));
    }

    public static boolean acceptsJson(String acceptHeader) {
        if (acceptHeader == null || acceptHeader.isEmpty()) {
            return true;
        }
        return acceptHeader.contains(ANY) || acceptHeader.contains(APPLICATION_JSON);
    }
}
