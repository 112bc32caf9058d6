package org.carball.stackcost.model.template;

import java.nio.file.Path;
import java.util.Locale;

public enum TemplateFormat {
    JSON,
    YAML;

    public static TemplateFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return JSON;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
    }
}
