package win.ixuni.keel.core.engine;

import win.ixuni.keel.core.config.EngineConfig;

/**
 * Engine factory interface
 * <p>
 * Each engine type provides a factory that creates instances from configuration.
 * Implementations are discovered through {@link EngineFactoryLoader}.
 */
public interface EngineFactory {

    /**
     * @return engine type identifier (e.g. "standard")
     */
    String getEngineType();

    StorageEngine createEngine(EngineConfig config);

    default String getDescription() {
        return getEngineType() + " storage engine";
    }
}
