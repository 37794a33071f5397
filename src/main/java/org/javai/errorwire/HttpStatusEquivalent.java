package org.javai.errorwire;

/**
 * Capability an error may implement to declare the HTTP status it corresponds to.
 */
public interface HttpStatusEquivalent {

    /**
     * @return the HTTP status code this error maps to
     */
    int httpStatus();
}
