package org.dxworks.plcframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class PlcframeConfig {

    private static final String CONFIG_FILE_NAME = "plcframe-config.yml";
    private static final boolean DEFAULT_STRICT_OVERLAYS = false;
    private static final boolean DEFAULT_INCLUDE_CFGS = false;

    private final boolean strictOverlays;
    private final String fsmConfigPath;
    private final boolean includeCfgs;

    private PlcframeConfig(boolean strictOverlays, String fsmConfigPath, boolean includeCfgs) {
        this.strictOverlays = strictOverlays;
        this.fsmConfigPath = fsmConfigPath;
        this.includeCfgs = includeCfgs;
    }

    /** Report controllers that expect an overlay and were given none. */
    public boolean isStrictOverlays() {
        return strictOverlays;
    }

    /** FSM hint file, or null when extraction runs without hints. */
    public String getFsmConfigPath() {
        return fsmConfigPath;
    }

    public boolean isIncludeCfgs() {
        return includeCfgs;
    }

    public static PlcframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PlcframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveStrict = yamlConfig.strictOverlays != null
                        ? yamlConfig.strictOverlays
                        : DEFAULT_STRICT_OVERLAYS;
                String effectiveFsmConfig = (yamlConfig.fsmConfig != null && !yamlConfig.fsmConfig.isBlank())
                        ? yamlConfig.fsmConfig.trim()
                        : null;
                boolean effectiveIncludeCfgs = yamlConfig.includeCfgs != null
                        ? yamlConfig.includeCfgs
                        : DEFAULT_INCLUDE_CFGS;
                return new PlcframeConfig(effectiveStrict, effectiveFsmConfig, effectiveIncludeCfgs);
            }
        } catch (IOException e) {
            System.err.println("[PlcframeConfig] Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static PlcframeConfig with(boolean strictOverlays, String fsmConfigPath, boolean includeCfgs) {
        String effectiveFsmConfig = (fsmConfigPath != null && !fsmConfigPath.isBlank()) ? fsmConfigPath : null;
        return new PlcframeConfig(strictOverlays, effectiveFsmConfig, includeCfgs);
    }

    private static PlcframeConfig defaults() {
        return new PlcframeConfig(DEFAULT_STRICT_OVERLAYS, null, DEFAULT_INCLUDE_CFGS);
    }

    private static class YamlConfig {
        public Boolean strictOverlays;
        public String fsmConfig;
        public Boolean includeCfgs;
    }
}
