package org.carball.stackcost.config;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class AnalyzerConfig {
    private String command;
    private List<Path> templateFiles = new ArrayList<>();
    private String outputFile;
    private OutputFormat outputFormat;
    private String name;
    private List<String> architectureNames = new ArrayList<>();
    private Path assumptionsFile;
    private boolean includeTemplate;
    private boolean verbose;
    private AnalyzerSettings settings;
}
