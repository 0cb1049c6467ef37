package org.semantic.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.semantic.data.EmptyExportsPolicy;
import org.semantic.data.MergePolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Policies an evaluator applies when resolving imports.
 *
 * @param emptyExportsPolicy What importers see of a module that declares no exports.
 * @param mergePolicy        Which binding wins when same-named module candidates collide.
 */
public record EvaluatorSettings(EmptyExportsPolicy emptyExportsPolicy, MergePolicy mergePolicy) {

    public EvaluatorSettings {
        Objects.requireNonNull(emptyExportsPolicy, "emptyExportsPolicy");
        Objects.requireNonNull(mergePolicy, "mergePolicy");
    }

    /**
     * The settings declared in the classpath {@code reference.conf}.
     */
    public static EvaluatorSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig(ConfigLoader.EVALUATOR_BLOCK));
    }

    /**
     * Reads settings through the {@link ConfigLoader} cascade.
     *
     * @param explicitFile File chosen by the caller, or {@code null} to search for one.
     * @param workingDir   Directory searched for {@code config/semantic.conf}.
     * @return The settings.
     */
    public static EvaluatorSettings load(Path explicitFile, Path workingDir) {
        return fromConfig(ConfigLoader.loadEvaluatorConfig(explicitFile, workingDir));
    }

    /**
     * Reads settings from an {@code evaluator} configuration block.
     *
     * @param evaluatorConfig The block, e.g. {@code config.getConfig("evaluator")}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or holds an unknown policy name.
     */
    public static EvaluatorSettings fromConfig(Config evaluatorConfig) {
        return new EvaluatorSettings(
                evaluatorConfig.getEnum(EmptyExportsPolicy.class, "exports.empty-policy"),
                evaluatorConfig.getEnum(MergePolicy.class, "modules.merge-policy"));
    }

    public EvaluatorSettings withEmptyExportsPolicy(EmptyExportsPolicy policy) {
        return new EvaluatorSettings(policy, mergePolicy);
    }

    public EvaluatorSettings withMergePolicy(MergePolicy policy) {
        return new EvaluatorSettings(emptyExportsPolicy, policy);
    }
}
