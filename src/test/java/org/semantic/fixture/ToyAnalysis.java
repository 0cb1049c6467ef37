package org.semantic.fixture;

import org.semantic.analysis.Capability;
import org.semantic.analysis.EvaluationException;
import org.semantic.analysis.IAnalysis;
import org.semantic.data.Environment;
import org.semantic.data.Module;
import org.semantic.data.ModuleName;
import org.semantic.evaluator.Evaluator;
import org.semantic.term.Node;
import org.semantic.term.Subterm;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Concrete-ish base analysis of the test language. Every assignment allocates a fresh address,
 * so bindings from different module candidates never share a cell.
 * Counts how often each module body is analyzed.
 */
public class ToyAnalysis implements IAnalysis<Integer, ToyTerm, ToyValue> {

    private final Map<ModuleName, Integer> moduleEvaluations = new HashMap<>();

    @Override
    public Set<Capability> requiredCapabilities() {
        return EnumSet.allOf(Capability.class);
    }

    @Override
    public ToyValue analyzeModule(Evaluator<Integer, ToyTerm, ToyValue> ev, Module<Subterm<ToyTerm, ToyValue>> module) {
        moduleEvaluations.merge(module.name(), 1, Integer::sum);
        return module.body().value();
    }

    @Override
    public ToyValue analyzeTerm(Evaluator<Integer, ToyTerm, ToyValue> ev, Node<ToyTerm, Subterm<ToyTerm, ToyValue>> node) {
        ToyTerm term = node.term();
        switch (term.kind()) {
            case "program": {
                ToyValue last = ToyValue.UNIT;
                for (Subterm<ToyTerm, ToyValue> statement : node.children()) {
                    last = statement.value();
                }
                return last;
            }
            case "int":
                return new ToyValue.Int(Integer.parseInt(term.text()));
            case "assign": {
                ToyValue value = node.child(0).value();
                int address = allocate(ev, value);
                ev.modifyGlobalEnv(env -> env.insert(term.text(), address));
                return value;
            }
            case "var": {
                Integer address = ev.askLocalEnv().lookup(term.text())
                        .or(() -> ev.getGlobalEnv().lookup(term.text()))
                        .orElseThrow(() -> new EvaluationException("Unbound variable: " + term.text()));
                return ToyValue.join(ev.getStore().lookup(address));
            }
            case "import": {
                Environment<Integer> imported = ev.isolate(() -> ev.require(new ModuleName(term.text())));
                ev.modifyGlobalEnv(imported::union);
                return ToyValue.UNIT;
            }
            case "export": {
                String[] parts = term.text().split(":", 2);
                String alias = parts.length == 2 ? parts[1] : parts[0];
                ev.modifyExports(exports -> exports.insert(parts[0], alias, null));
                return ToyValue.UNIT;
            }
            case "if": {
                ToyValue condition = node.child(0).value();
                boolean truthy = !(condition instanceof ToyValue.Int i) || i.value() != 0;
                return truthy ? node.child(1).value() : node.child(2).value();
            }
            case "let": {
                ToyValue value = node.child(0).value();
                int address = allocate(ev, value);
                return ev.localEnv(env -> env.insert(term.text(), address), () -> node.child(1).value());
            }
            case "fail":
                throw new EvaluationException(term.text());
            default:
                throw new EvaluationException("Unknown term kind: " + term.kind());
        }
    }

    private static int allocate(Evaluator<Integer, ToyTerm, ToyValue> ev, ToyValue value) {
        int address = ev.getStore().size();
        ev.modifyStore(store -> store.insert(address, value));
        return address;
    }

    public int evaluationsOf(String moduleName) {
        return moduleEvaluations.getOrDefault(new ModuleName(moduleName), 0);
    }

    public Map<ModuleName, Integer> getModuleEvaluations() {
        return Collections.unmodifiableMap(moduleEvaluations);
    }
}
