package org.javai.errorwire.encode;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.javai.errorwire.ClassifiedError;
import org.javai.errorwire.ErrorEnvelope;
import org.javai.errorwire.ErrorWireConfig;
import org.javai.errorwire.FieldViolation;
import org.javai.errorwire.HttpStatus;
import org.javai.errorwire.classify.DefaultErrorClassifier;
import org.javai.errorwire.classify.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Writes error responses as a JSON {@link ErrorEnvelope} or as a single plaintext line.
 *
 * <p>Every entry point is a terminal write: it sets the content type, commits the status
 * line and then writes the body. A body that fails to encode is logged; the status line is
 * already on its way to the client and is not retracted.
 *
 * <p>Usage:
 * <pre>{@code
 * ResponseEncoder encoder = new ResponseEncoder(config);
 *
 * List<FieldViolation> violations = engine.validate(validators, payload);
 * if (!violations.isEmpty()) {
 *     encoder.writeValidationErrors(sink, violations);
 *     return;
 * }
 * try {
 *     handler.handle(payload);
 * } catch (Exception e) {
 *     encoder.writeError(request, sink, e);
 * }
 * }</pre>
 */
public class ResponseEncoder {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

    private final ErrorClassifier classifier;
    private final Logger logger;

    public ResponseEncoder(ErrorWireConfig config) {
        this(new DefaultErrorClassifier(config));
    }

    public ResponseEncoder(ErrorClassifier classifier) {
        this(classifier, LoggerFactory.getLogger(ResponseEncoder.class));
    }

    /**
     * Package-private for testing.
     */
    ResponseEncoder(ErrorClassifier classifier, Logger logger) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * Writes the error in whichever format the request accepts.
     */
    public void writeError(InboundRequest request, ResponseSink sink, Throwable error) {
        Objects.requireNonNull(request, "request must not be null");
        if (ContentNegotiation.acceptsJson(request)) {
            writeJsonError(sink, error);
        } else {
            writePlaintextError(sink, error);
        }
    }

    /**
     * Classifies the error and writes it as a one-entry envelope with the classified status.
     */
    public void writeJsonError(ResponseSink sink, Throwable error) {
        Objects.requireNonNull(sink, "sink must not be null");
        ClassifiedError classified = classifier.classify(error);

        sink.setHeader(ContentNegotiation.CONTENT_TYPE, ContentNegotiation.APPLICATION_JSON);
        sink.writeStatus(classified.httpStatus());

        writeEnvelope(sink, ErrorEnvelope.of(classified));
    }

    /**
     * Writes field violations as an envelope with status 400.
     */
    public void writeValidationErrors(ResponseSink sink, List<FieldViolation> violations) {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(violations, "violations must not be null");
        if (violations.isEmpty()) {
            logger.warn("Writing a validation error response without any violations");
        }

        sink.setHeader(ContentNegotiation.CONTENT_TYPE, ContentNegotiation.APPLICATION_JSON);
        sink.writeStatus(HttpStatus.BAD_REQUEST);

        writeEnvelope(sink, ErrorEnvelope.ofViolations(violations));
    }

    /**
     * Writes {@code "<name>: <message>"} as text/plain with the classified status.
     */
    public void writePlaintextError(ResponseSink sink, Throwable error) {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(error, "error must not be null");
        ClassifiedError classified = classifier.classify(error);

        sink.setHeader(ContentNegotiation.CONTENT_TYPE, ContentNegotiation.TEXT_PLAIN);
        sink.writeStatus(classified.httpStatus());

        String message = error.getMessage() != null ? error.getMessage() : "";
        String line = classified.typeName() + ": " + message;
        try {
            OutputStream body = sink.body();
            body.write(line.getBytes(StandardCharsets.UTF_8));
            body.flush();
        } catch (IOException e) {
            logger.error("Error writing plaintext error response: {}", e.getMessage(), e);
        }
    }

    /**
     * Builds the envelope {@link #writeJsonError} would write, without writing it.
     */
    public ErrorEnvelope toEnvelope(Throwable error) {
        return ErrorEnvelope.of(classifier.classify(error));
    }

    /**
     * Builds the envelope {@link #writeValidationErrors} would write, without writing it.
     */
    public ErrorEnvelope toEnvelope(List<FieldViolation> violations) {
        return ErrorEnvelope.ofViolations(violations);
    }

    private void writeEnvelope(ResponseSink sink, ErrorEnvelope envelope) {
        try {
            OutputStream body = sink.body();
            MAPPER.writeValue(body, envelope);
            body.flush();
        } catch (IOException e) {
            logger.error("Error marshalling error response with {} entries into JSON output: {}",
                    envelope.errors().size(), e.getMessage(), e);
        }
    }
}
