package org.carball.stackcost.parser;

import org.carball.stackcost.model.template.CloudTemplate;

import java.nio.file.Path;

/**
 * Supplies parsed templates to the analyzer.
 */
public interface TemplateSource {

    CloudTemplate load(Path location) throws TemplateException;
}
