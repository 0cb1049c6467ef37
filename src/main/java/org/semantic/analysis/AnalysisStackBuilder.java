package org.semantic.analysis;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;

/**
 * Assembles a layered analysis from configuration.
 * <p>
 * Layers are listed innermost first under {@code analysis.layers}; each entry names a class
 * implementing {@link IAnalysis} and optional {@code options}:
 * <pre>
 * analysis.layers = [
 *   { className = "org.semantic.analysis.deadcode.DeadCodeAnalysis" }
 *   { className = "org.semantic.analysis.tracing.TracingAnalysis", options { max-entries = 1000 } }
 * ]
 * </pre>
 * Each class must provide a public constructor {@code (IAnalysis inner, Config options)}.
 */
public final class AnalysisStackBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisStackBuilder.class);

    private AnalysisStackBuilder() {
    }

    /**
     * Wraps the base analysis in the configured layers.
     *
     * @param base            The innermost analysis.
     * @param evaluatorConfig The {@code evaluator} configuration block.
     * @return The outermost analysis, or {@code base} if no layers are configured.
     * @throws IllegalArgumentException if a layer class cannot be instantiated.
     */
    @SuppressWarnings("unchecked")
    public static <L, T, V> IAnalysis<L, T, V> build(IAnalysis<L, T, V> base, Config evaluatorConfig) {
        if (!evaluatorConfig.hasPath("analysis.layers")) {
            return base;
        }
        IAnalysis<L, T, V> current = base;
        for (Config layerConfig : evaluatorConfig.getConfigList("analysis.layers")) {
            current = (IAnalysis<L, T, V>) createLayer(current, layerConfig);
            LOG.debug("Added analysis layer {}", current.getClass().getSimpleName());
        }
        return current;
    }

    private static IAnalysis<?, ?, ?> createLayer(IAnalysis<?, ?, ?> inner, Config layerConfig) {
        String className = layerConfig.getString("className");
        try {
            Class<?> clazz = Class.forName(className);
            if (!IAnalysis.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IAnalysis");
            }
            Constructor<?> constructor = clazz.getConstructor(IAnalysis.class, Config.class);
            Config options = layerConfig.hasPath("options") ? layerConfig.getConfig("options") : ConfigFactory.empty();
            return (IAnalysis<?, ?, ?>) constructor.newInstance(inner, options);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate analysis layer: " + className, e);
        }
    }
}
