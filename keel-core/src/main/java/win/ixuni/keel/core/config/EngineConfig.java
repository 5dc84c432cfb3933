package win.ixuni.keel.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Engine configuration
 * <p>
 * Generic structure; engine-specific settings (blob store kind, storage root, ...) live in
 * {@link #properties}.
 */
@Data
public class EngineConfig {

    /**
     * Engine instance name
     */
    private String name = "default";

    /**
     * Engine type
     */
    private String type = "standard";

    /**
     * Engine-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public static EngineConfig of(String name, Map<String, Object> properties) {
        EngineConfig config = new EngineConfig();
        config.setName(name);
        config.setProperties(new HashMap<>(properties));
        return config;
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
