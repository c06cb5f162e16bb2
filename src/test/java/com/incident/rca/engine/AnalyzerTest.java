package com.incident.rca.engine;

import com.incident.rca.model.AnalyzerResult;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureType;
import com.incident.rca.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.function.Consumer;

import static com.incident.rca.testutil.TestDataFactory.createEvidence;
import static org.assertj.core.api.Assertions.assertThat;

class AnalyzerTest {

    private static final EvidenceRecord FIRST = createEvidence(EvidenceSource.LOG, Severity.CRITICAL, "orders-db");

    @Test
    void analyze_stackExhaustedMidScan_crashWithPartialEvidence() {
        Analyzer<String> analyzer = failingWith(new StackOverflowError());

        AnalyzerResult result = analyzer.analyze("input");

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getFailure().getType()).isEqualTo(FailureType.ANALYZER_CRASHED);
        assertThat(result.getFailure().getMessage()).startsWith("StackOverflowError");
        assertThat(result.getEvidence()).containsExactly(FIRST);
    }

    @Test
    void analyze_runtimeExceptionMidScan_crashWithPartialEvidence() {
        Analyzer<String> analyzer = failingWith(new IllegalStateException("boom"));

        AnalyzerResult result = analyzer.analyze("input");

        assertThat(result.getFailure().getType()).isEqualTo(FailureType.ANALYZER_CRASHED);
        assertThat(result.getFailure().getMessage()).isEqualTo("IllegalStateException: boom");
        assertThat(result.getEvidence()).containsExactly(FIRST);
    }

    private static Analyzer<String> failingWith(Throwable failure) {
        return new Analyzer<>() {
            @Override
            public EvidenceSource getSource() {
                return EvidenceSource.LOG;
            }

            @Override
            public void detect(String input, Consumer<EvidenceRecord> sink) {
                sink.accept(FIRST);
                if (failure instanceof Error error) {
                    throw error;
                }
                throw (RuntimeException) failure;
            }
        };
    }
}
