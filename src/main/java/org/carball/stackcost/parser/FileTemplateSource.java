package org.carball.stackcost.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.stackcost.model.template.CloudTemplate;
import org.carball.stackcost.model.template.TemplateFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads JSON or YAML templates from the file system. The format follows the file extension.
 */
@Slf4j
@RequiredArgsConstructor
public class FileTemplateSource implements TemplateSource {

    private final TemplateParser parser;

    public FileTemplateSource() {
        this(new TemplateParser());
    }

    @Override
    public CloudTemplate load(Path location) throws TemplateException {
        if (!Files.isRegularFile(location)) {
            throw new TemplateNotFoundException("Template file not found: " + location);
        }

        String content;
        try {
            content = Files.readString(location);
        } catch (IOException e) {
            throw new TemplateException("Unable to read template " + location + ": " + e.getMessage(), e);
        }

        TemplateFormat format = TemplateFormat.fromPath(location);
        log.debug("Parsing {} template {}", format, location);
        return parser.parse(content, format);
    }
}
