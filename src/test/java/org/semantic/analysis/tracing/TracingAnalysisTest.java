package org.semantic.analysis.tracing;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.semantic.analysis.Capability;
import org.semantic.data.Configuration;
import org.semantic.evaluator.Evaluator;
import org.semantic.fixture.Toy;
import org.semantic.fixture.ToyAnalysis;
import org.semantic.fixture.ToyTerm;
import org.semantic.fixture.ToyValue;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.semantic.fixture.ToyTerm.assign;
import static org.semantic.fixture.ToyTerm.let;
import static org.semantic.fixture.ToyTerm.num;
import static org.semantic.fixture.ToyTerm.var;

@Tag("unit")
class TracingAnalysisTest {

    @Test
    void recordsOneConfigurationPerAnalyzedTermInOrder() {
        TracingAnalysis<Integer, ToyTerm, ToyValue> tracing = new TracingAnalysis<>(new ToyAnalysis());
        Evaluator<Integer, ToyTerm, ToyValue> evaluator = Toy.evaluator(tracing);
        ToyTerm program = ToyTerm.program(assign("x", num(1)), var("x"));

        evaluator.evaluateTerm(program);

        List<Configuration<Integer, ToyTerm, ToyValue>> trace = tracing.getTrace();
        assertThat(trace).extracting(Configuration::term)
                .containsExactly(program, assign("x", num(1)), num(1), var("x"));
        assertThat(trace.get(0).store().isEmpty()).isTrue();
        assertThat(trace.get(3).store().lookup(0)).containsExactly(new ToyValue.Int(1));
    }

    @Test
    void configurationsCaptureLocalEnvironment() {
        TracingAnalysis<Integer, ToyTerm, ToyValue> tracing = new TracingAnalysis<>(new ToyAnalysis());

        Toy.evaluator(tracing).evaluateTerm(let("y", num(4), var("y")));

        Configuration<Integer, ToyTerm, ToyValue> atVar = tracing.getTrace().get(2);
        assertThat(atVar.term()).isEqualTo(var("y"));
        assertThat(atVar.environment().names()).containsExactly("y");
        assertThat(tracing.getTrace().get(0).environment().isEmpty()).isTrue();
    }

    @Test
    void maxEntriesBoundsTheTrace() {
        TracingAnalysis<Integer, ToyTerm, ToyValue> tracing =
                new TracingAnalysis<>(new ToyAnalysis(), ConfigFactory.parseString("max-entries = 2"));

        Toy.evaluator(tracing).evaluateTerm(ToyTerm.program(num(1), num(2), num(3)));

        assertThat(tracing.getTrace()).hasSize(2);
    }

    @Test
    void negativeMaxEntriesIsRejected() {
        assertThatThrownBy(() -> new TracingAnalysis<>(new ToyAnalysis(), ConfigFactory.parseString("max-entries = -1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requiresEnvironmentAndStore() {
        TracingAnalysis<Integer, ToyTerm, ToyValue> tracing = new TracingAnalysis<>(new ToyAnalysis());

        assertThat(tracing.requiredCapabilities()).contains(Capability.ENVIRONMENT, Capability.STORE);
    }
}
