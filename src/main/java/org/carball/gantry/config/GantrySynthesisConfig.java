package org.carball.gantry.config;

import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;

@Data
public class GantrySynthesisConfig {
    private Path trainingFile;
    private Path benchmarkFile;
    private Path targetDistributionFile;
    private int count;
    private int trainingLimit;
    private int benchmarkLimit;
    private String outputFile;
    private OutputFormat outputFormat;
    @ToString.Exclude
    private String openAiApiKey;
    private boolean auxiliary;
    private boolean verbose;
    private SynthesisSettings settings;
}
