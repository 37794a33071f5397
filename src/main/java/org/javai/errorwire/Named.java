package org.javai.errorwire;

/**
 * Capability an error may implement to supply its public type name.
 *
 * <p>When {@link #errorName()} returns a non-empty string, classification uses it verbatim
 * regardless of any other configuration.
 */
public interface Named {

    /**
     * @return the public name of this error, or an empty string to defer to other resolution rules
     */
    String errorName();
}
