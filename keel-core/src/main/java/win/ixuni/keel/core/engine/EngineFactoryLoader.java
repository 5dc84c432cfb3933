package win.ixuni.keel.core.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Engine factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover EngineFactory implementations on the classpath.
 * An engine module only needs to declare itself in META-INF/services to be picked up.
 *
 * <pre>
 * StorageEngine engine = EngineFactoryLoader.find("standard")
 *         .orElseThrow()
 *         .createEngine(config);
 * </pre>
 */
@Slf4j
public final class EngineFactoryLoader {

    private EngineFactoryLoader() {
        // Utility class, not instantiable
    }

    public static List<EngineFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static List<EngineFactory> load(ClassLoader classLoader) {
        ServiceLoader<EngineFactory> loader = ServiceLoader.load(EngineFactory.class, classLoader);
        List<EngineFactory> factories = new ArrayList<>();

        for (EngineFactory factory : loader) {
            factories.add(factory);
            log.info("Discovered engine factory via SPI: {} - {}",
                    factory.getEngineType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No EngineFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory for an engine type
     *
     * @param engineType engine type identifier
     * @return the matching factory, empty if none is on the classpath
     */
    public static Optional<EngineFactory> find(String engineType) {
        return load().stream()
                .filter(factory -> factory.getEngineType().equals(engineType))
                .findFirst();
    }
}
