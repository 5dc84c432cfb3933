package win.ixuni.keel.engine;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.keel.core.config.EngineConfig;
import win.ixuni.keel.core.engine.EngineFactory;
import win.ixuni.keel.core.engine.StorageEngine;
import win.ixuni.keel.engine.context.StandardEngineContext;

/**
 * Standard engine factory, registered through {@code META-INF/services}
 */
@Slf4j
public class StandardEngineFactory implements EngineFactory {

    @Override
    public String getEngineType() {
        return StandardEngineContext.ENGINE_TYPE;
    }

    @Override
    public StorageEngine createEngine(EngineConfig config) {
        log.info("Creating standard engine instance: {}", config.getName());
        return new StandardStorageEngine(config);
    }

    @Override
    public String getDescription() {
        return "In-memory index with memory or local-file blob storage";
    }
}
