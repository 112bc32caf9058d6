package org.carball.stackcost.parser;

/**
 * Raised by template sources when a template cannot be supplied.
 */
public class TemplateException extends Exception {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
