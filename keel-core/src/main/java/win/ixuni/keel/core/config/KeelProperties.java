package win.ixuni.keel.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * S3Keel main configuration
 *
 * <pre>
 * keel:
 *   engine:
 *     name: default
 *     type: standard
 *     properties:
 *       blob-store: local
 *       root-dir: ./data
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "keel")
public class KeelProperties {

    /**
     * The storage engine behind the endpoint
     */
    private EngineConfig engine = new EngineConfig();
}
