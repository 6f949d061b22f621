package org.dxworks.surveyreports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.surveyreports.report.TextAppendixAssembler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class SurveyReportsConfig {

    private static final String CONFIG_FILE_NAME = "survey-reports-config.yml";
    private static final boolean DEFAULT_INCLUDE_BLOCK_HEADERS = true;
    private static final int DEFAULT_N_THRESHOLD = TextAppendixAssembler.DEFAULT_N_THRESHOLD;

    private final boolean includeBlockHeaders;
    private final int nThreshold;
    private final Set<ReportKind> enabledReports;

    private SurveyReportsConfig(boolean includeBlockHeaders, int nThreshold, Set<ReportKind> enabledReports) {
        this.includeBlockHeaders = includeBlockHeaders;
        this.nThreshold = nThreshold;
        this.enabledReports = Collections.unmodifiableSet(enabledReports);
    }

    public boolean isIncludeBlockHeaders() {
        return includeBlockHeaders;
    }

    public int getNThreshold() {
        return nThreshold;
    }

    public boolean isReportEnabled(ReportKind kind) {
        return enabledReports.contains(kind);
    }

    public static SurveyReportsConfig defaults() {
        return new SurveyReportsConfig(DEFAULT_INCLUDE_BLOCK_HEADERS, DEFAULT_N_THRESHOLD,
                EnumSet.allOf(ReportKind.class));
    }

    public static SurveyReportsConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static SurveyReportsConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveIncludeBlockHeaders = (yamlConfig.includeBlockHeaders != null)
                        ? yamlConfig.includeBlockHeaders
                        : DEFAULT_INCLUDE_BLOCK_HEADERS;
                int effectiveNThreshold = (yamlConfig.nThreshold != null && yamlConfig.nThreshold >= 0)
                        ? yamlConfig.nThreshold
                        : DEFAULT_N_THRESHOLD;

                return new SurveyReportsConfig(effectiveIncludeBlockHeaders, effectiveNThreshold,
                        enabledReports(yamlConfig.reports));
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static SurveyReportsConfig with(boolean includeBlockHeaders, int nThreshold) {
        int effectiveNThreshold = nThreshold >= 0 ? nThreshold : DEFAULT_N_THRESHOLD;
        return new SurveyReportsConfig(includeBlockHeaders, effectiveNThreshold, EnumSet.allOf(ReportKind.class));
    }

    private static Set<ReportKind> enabledReports(List<String> names) {
        if (names == null) {
            return EnumSet.allOf(ReportKind.class);
        }
        Set<ReportKind> enabled = EnumSet.noneOf(ReportKind.class);
        for (String name : names) {
            Optional<ReportKind> kind = ReportRegistry.byName(name);
            if (kind.isPresent()) {
                enabled.add(kind.get());
            } else {
                System.err.println("Warning: unknown report '" + name + "' in " + CONFIG_FILE_NAME
                        + ", expected one of " + ReportRegistry.allReportNames());
            }
        }
        return enabled;
    }

    private static class YamlConfig {
        public Boolean includeBlockHeaders;
        public Integer nThreshold;
        public List<String> reports;
    }
}
