package org.semantic.evaluator;

import com.typesafe.config.Config;
import org.semantic.analysis.AnalysisStackBuilder;
import org.semantic.analysis.Capability;
import org.semantic.analysis.EmptyModuleListException;
import org.semantic.analysis.EvaluateModule;
import org.semantic.analysis.IAnalysis;
import org.semantic.analysis.IModuleEvaluationHandler;
import org.semantic.analysis.IModuleEvaluationInterceptor;
import org.semantic.analysis.ModuleLoader;
import org.semantic.config.ConfigLoader;
import org.semantic.config.EvaluatorSettings;
import org.semantic.data.Configuration;
import org.semantic.data.Environment;
import org.semantic.data.Exports;
import org.semantic.data.Live;
import org.semantic.data.Module;
import org.semantic.data.ModuleName;
import org.semantic.data.ModuleTable;
import org.semantic.data.Store;
import org.semantic.term.ITermDecomposer;
import org.semantic.term.Node;
import org.semantic.term.Subterm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Runs one analysis over terms and modules, threading environment, store and module tables.
 * <p>
 * State components are persistent values held in plain fields; every mutation replaces a whole
 * value, and every scoped operation restores the previous value in a {@code finally} block. An
 * evaluator serves a single analysis run on a single thread.
 * <p>
 * Module loading raises {@link EvaluateModule} signals that are dispatched to the innermost handler
 * installed by {@link #evaluateModule}; registered {@link IModuleEvaluationInterceptor}s wrap that
 * handler.
 *
 * @param <L> Address type.
 * @param <T> Term type.
 * @param <V> Abstract value type.
 */
public class Evaluator<L, T, V> implements IEnvironmentCapability<L>, IStoreCapability<L, V>, IModuleTableCapability<L, T> {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final IAnalysis<L, T, V> analysis;
    private final ITermDecomposer<T> decomposer;
    private final EvaluatorSettings settings;
    private final ModuleLoader<L, T, V> loader;
    private final List<IModuleEvaluationInterceptor<T, V>> interceptors = new ArrayList<>();
    private final Deque<IModuleEvaluationHandler<T, V>> handlers = new ArrayDeque<>();

    private Environment<L> globalEnv = Environment.empty();
    private Environment<L> localEnv = Environment.empty();
    private Exports<L> exports = Exports.empty();
    private Store<L, V> store = Store.empty();
    private ModuleTable<Environment<L>> evaluatedModules = ModuleTable.empty();
    private ModuleTable<Module<T>> pendingModules = ModuleTable.empty();

    /**
     * Constructs an evaluator with default settings.
     *
     * @param analysis   The (possibly layered) analysis to run.
     * @param decomposer Exposes the children of terms.
     */
    public Evaluator(IAnalysis<L, T, V> analysis, ITermDecomposer<T> decomposer) {
        this(analysis, decomposer, EvaluatorSettings.defaults());
    }

    /**
     * Constructs an evaluator.
     *
     * @param analysis   The (possibly layered) analysis to run.
     * @param decomposer Exposes the children of terms.
     * @param settings   Export and merge policies.
     */
    public Evaluator(IAnalysis<L, T, V> analysis, ITermDecomposer<T> decomposer, EvaluatorSettings settings) {
        this.analysis = Objects.requireNonNull(analysis, "analysis");
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.loader = new ModuleLoader<>(this, settings.emptyExportsPolicy(), settings.mergePolicy());
    }

    /**
     * Builds an evaluator from an {@code evaluator} configuration block: the base analysis is
     * wrapped in the configured {@code analysis.layers} and the import policies are read from
     * the same block.
     *
     * @param base            The innermost analysis.
     * @param decomposer      Exposes the children of terms.
     * @param evaluatorConfig The block, e.g. {@link ConfigLoader#loadEvaluatorConfig}.
     * @return The configured evaluator.
     */
    public static <L, T, V> Evaluator<L, T, V> fromConfig(IAnalysis<L, T, V> base, ITermDecomposer<T> decomposer,
                                                          Config evaluatorConfig) {
        IAnalysis<L, T, V> stack = AnalysisStackBuilder.build(base, evaluatorConfig);
        EvaluatorSettings settings = EvaluatorSettings.fromConfig(evaluatorConfig);
        LOG.debug("Configured evaluator with analysis {} and {}", stack.getClass().getSimpleName(), settings);
        return new Evaluator<>(stack, decomposer, settings);
    }

    // === Term evaluation ===

    /**
     * Evaluates a term with the semantics of the analysis. Each child is handed to the analysis as a
     * subterm whose value is the (memoized) evaluation of that child.
     *
     * @param term The term to evaluate.
     * @return Its abstract value.
     */
    public V evaluateTerm(T term) {
        List<Subterm<T, V>> children = new ArrayList<>();
        for (T child : decomposer.children(term)) {
            children.add(Subterm.of(child, () -> evaluateTerm(child)));
        }
        return analysis.analyzeTerm(this, new Node<>(term, children));
    }

    /**
     * Evaluates a root-level module. While it runs, {@link EvaluateModule} signals raised by imports
     * are handled by evaluating the requested module the same way.
     *
     * @param module The module to evaluate.
     * @return The value of the module.
     */
    public V evaluateModule(Module<T> module) {
        IModuleEvaluationHandler<T, V> handler = signal -> interceptedEvaluation(signal.module(), 0);
        return withModuleHandler(handler, () -> analyzeModule(module));
    }

    /**
     * Runs an action with the given modules available for import.
     */
    public <A> A withModules(List<Module<T>> modules, Supplier<A> action) {
        return localModuleTable(table -> ModuleTable.fromModules(modules), action);
    }

    /**
     * Evaluates a program given as a list of modules. The head is the entry point; the tail is
     * available for import while it runs.
     *
     * @param modules The program's modules, entry point first.
     * @return The value of the entry module.
     * @throws EmptyModuleListException if the list is empty.
     */
    public V evaluateModules(List<Module<T>> modules) {
        if (modules.isEmpty()) {
            throw new EmptyModuleListException();
        }
        Module<T> entry = modules.get(0);
        LOG.debug("Evaluating entry module {} with {} importable module(s)", entry.name(), modules.size() - 1);
        return withModules(modules.subList(1, modules.size()), () -> evaluateModule(entry));
    }

    /**
     * Imports a module: the cached exported environment, evaluating the module first if needed.
     */
    public Environment<L> require(ModuleName name) {
        return loader.require(name);
    }

    /**
     * Evaluates a module unconditionally and returns its exported environment.
     */
    public Environment<L> load(ModuleName name) {
        return loader.load(name);
    }

    /**
     * Runs an action isolated from the caller's global environment and exports, as defined by the analysis.
     */
    public <A> A isolate(Supplier<A> action) {
        return analysis.isolate(this, action);
    }

    private V analyzeModule(Module<T> module) {
        return analysis.analyzeModule(this, module.map(body -> Subterm.of(body, () -> evaluateTerm(body))));
    }

    private V interceptedEvaluation(Module<T> module, int index) {
        if (index == interceptors.size()) {
            return analyzeModule(module);
        }
        return interceptors.get(index).intercept(module, next -> interceptedEvaluation(next, index + 1));
    }

    // === Module evaluation signal ===

    /**
     * Raises a module evaluation request and blocks until the innermost handler resumes with a value.
     *
     * @param signal The request.
     * @return The value produced by the handler.
     * @throws IllegalStateException if no handler is installed.
     */
    public V raise(EvaluateModule<T> signal) {
        IModuleEvaluationHandler<T, V> handler = handlers.peek();
        if (handler == null) {
            throw new IllegalStateException(
                    "No module evaluation handler installed while loading " + signal.module().name());
        }
        return handler.handle(signal);
    }

    /**
     * Runs an action with the given handler installed as the innermost one.
     */
    public <A> A withModuleHandler(IModuleEvaluationHandler<T, V> handler, Supplier<A> action) {
        handlers.push(handler);
        try {
            return action.get();
        } finally {
            handlers.pop();
        }
    }

    /**
     * Registers an interceptor around the evaluation of modules requested by imports.
     * Interceptors run in registration order.
     */
    public Evaluator<L, T, V> addInterceptor(IModuleEvaluationInterceptor<T, V> interceptor) {
        interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
        return this;
    }

    // === Environment ===

    @Override
    public Environment<L> getGlobalEnv() {
        return globalEnv;
    }

    @Override
    public void putGlobalEnv(Environment<L> environment) {
        this.globalEnv = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public Environment<L> askLocalEnv() {
        return localEnv;
    }

    @Override
    public <A> A localEnv(UnaryOperator<Environment<L>> f, Supplier<A> action) {
        Environment<L> saved = localEnv;
        localEnv = Objects.requireNonNull(f.apply(saved), "local environment");
        try {
            return action.get();
        } finally {
            localEnv = saved;
        }
    }

    @Override
    public Exports<L> getExports() {
        return exports;
    }

    @Override
    public void putExports(Exports<L> exports) {
        this.exports = Objects.requireNonNull(exports, "exports");
    }

    // === Store ===

    @Override
    public Store<L, V> getStore() {
        return store;
    }

    @Override
    public void putStore(Store<L, V> store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    // === Module tables ===

    @Override
    public ModuleTable<Environment<L>> getModuleTable() {
        return evaluatedModules;
    }

    @Override
    public void modifyModuleTable(UnaryOperator<ModuleTable<Environment<L>>> f) {
        evaluatedModules = Objects.requireNonNull(f.apply(evaluatedModules), "module table");
    }

    @Override
    public ModuleTable<Module<T>> askModuleTable() {
        return pendingModules;
    }

    @Override
    public <A> A localModuleTable(UnaryOperator<ModuleTable<Module<T>>> f, Supplier<A> action) {
        ModuleTable<Module<T>> saved = pendingModules;
        pendingModules = Objects.requireNonNull(f.apply(saved), "module table");
        try {
            return action.get();
        } finally {
            pendingModules = saved;
        }
    }

    // === Configurations ===

    /**
     * The addresses currently reachable. Empty unless a subclass tracks roots.
     */
    public Live<L> askRoots() {
        return Live.empty();
    }

    /**
     * Snapshot of the evaluation state at the given term.
     */
    public Configuration<L, T, V> getConfiguration(T term) {
        return new Configuration<>(term, askRoots(), askLocalEnv(), getStore());
    }

    /**
     * Snapshot of all state components.
     */
    public EvaluatorState<L, T, V> snapshot() {
        return new EvaluatorState<>(globalEnv, localEnv, exports, store, evaluatedModules, pendingModules);
    }

    /**
     * The capabilities this evaluator provides to analyses.
     */
    public Set<Capability> providedCapabilities() {
        return Collections.unmodifiableSet(EnumSet.allOf(Capability.class));
    }

    public IAnalysis<L, T, V> getAnalysis() {
        return analysis;
    }

    public ITermDecomposer<T> getDecomposer() {
        return decomposer;
    }

    public EvaluatorSettings getSettings() {
        return settings;
    }
}
