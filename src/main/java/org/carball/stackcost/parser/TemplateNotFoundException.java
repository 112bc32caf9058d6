package org.carball.stackcost.parser;

public class TemplateNotFoundException extends TemplateException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
