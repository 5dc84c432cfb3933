package win.ixuni.keel.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.config.EngineConfig;
import win.ixuni.keel.core.config.KeelProperties;
import win.ixuni.keel.core.engine.EngineFactory;
import win.ixuni.keel.core.engine.EngineFactoryLoader;
import win.ixuni.keel.core.engine.StorageEngine;

/**
 * 引擎管理器
 * <p>
 * Creates the storage engine from {@code keel.engine} at startup and shuts it down with the
 * application context. The factory is discovered through SPI; an unknown engine type fails
 * startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineManager {

    private final KeelProperties properties;

    private StorageEngine engine;

    @PostConstruct
    public void initialize() {
        EngineConfig config = properties.getEngine();
        EngineFactory factory = EngineFactoryLoader.find(config.getType())
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown engine type '" + config.getType() + "' for engine '" + config.getName() + "'"));

        StorageEngine created = factory.createEngine(config);
        created.initialize().block();
        this.engine = created;
        log.info("Created engine instance: {} (type: {})", config.getName(), config.getType());
    }

    @PreDestroy
    public void shutdown() {
        if (engine == null) {
            return;
        }
        engine.shutdown()
                .doOnSuccess(v -> log.info("Engine '{}' shutdown complete", engine.getEngineName()))
                .onErrorResume(e -> {
                    log.error("Error shutting down engine '{}': {}", engine.getEngineName(), e.getMessage());
                    return Mono.empty();
                })
                .block();
    }

    public StorageEngine getEngine() {
        if (engine == null) {
            throw new IllegalStateException("Storage engine not initialized");
        }
        return engine;
    }
}
