package org.dxworks.plcframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.plcframe.fsm.FsmConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * FSM hints keyed by controller name. A controller without its own entry gets the
 * {@code default} entry, and no hints at all when that is absent too.
 *
 * <pre>
 * controllers:
 *   default:
 *     explicit_states: [IDLE, RUNNING]
 *   Line1:
 *     state_var: HMI_P1_STATE
 * </pre>
 */
public class FsmConfigLoader implements Function<String, FsmConfig> {

    public static final String DEFAULT_ENTRY = "default";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, FsmConfig> controllers;

    private FsmConfigLoader(Map<String, FsmConfig> controllers) {
        this.controllers = controllers;
    }

    public static FsmConfigLoader empty() {
        return new FsmConfigLoader(Map.of());
    }

    public static FsmConfigLoader of(Map<String, FsmConfig> controllers) {
        return new FsmConfigLoader(new LinkedHashMap<>(controllers));
    }

    /**
     * Missing file means no hints.
     *
     * @throws IOException if the file exists but is not valid hint YAML
     */
    public static FsmConfigLoader load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static FsmConfigLoader load(InputStream in) throws IOException {
        HintFile file = YAML_MAPPER.readValue(in, HintFile.class);
        if (file == null || file.controllers == null) {
            return empty();
        }
        Map<String, FsmConfig> controllers = new LinkedHashMap<>();
        file.controllers.forEach((name, config) -> {
            if (config != null) {
                controllers.put(name, config);
            }
        });
        return new FsmConfigLoader(controllers);
    }

    public FsmConfig forController(String controller) {
        FsmConfig own = controllers.get(controller);
        if (own != null) {
            return own;
        }
        return controllers.getOrDefault(DEFAULT_ENTRY, FsmConfig.EMPTY);
    }

    @Override
    public FsmConfig apply(String controller) {
        return forController(controller);
    }

    public Map<String, FsmConfig> getControllers() {
        return Map.copyOf(controllers);
    }

    private static class HintFile {
        public Map<String, FsmConfig> controllers;
    }
}
