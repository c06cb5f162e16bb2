package com.incident.rca.engine;

import com.incident.rca.exception.InputMalformedException;
import com.incident.rca.model.AnalyzerResult;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.FailureReason;
import com.incident.rca.model.FailureType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Contract shared by the fixed set of analyzers (logs, metrics, design).
 * Each implementation turns one input modality into evidence.
 *
 * @param <I> the already-parsed input the analyzer consumes
 */
public interface Analyzer<I> {

    /**
     * The evidence source this analyzer reports as.
     */
    EvidenceSource getSource();

    /**
     * Scan the input and hand every finding to the sink as soon as it is produced.
     *
     * @param input the analyzer's input, never null
     * @param sink  receives findings in production order
     * @throws InputMalformedException when the input is structurally invalid
     */
    void detect(I input, Consumer<EvidenceRecord> sink);

    /**
     * Run {@link #detect} and capture its outcome. Findings emitted before an error are
     * returned together with the failure marker. Runtime exceptions and stack exhaustion
     * are reported as a crash; nothing is thrown.
     */
    default AnalyzerResult analyze(I input) {
        long start = System.currentTimeMillis();
        List<EvidenceRecord> collected = new ArrayList<>();
        try {
            if (input == null) {
                throw new InputMalformedException(getSource() + " input is missing");
            }
            detect(input, collected::add);
            return AnalyzerResult.success(getSource(), collected, System.currentTimeMillis() - start);
        } catch (InputMalformedException e) {
            return AnalyzerResult.failure(getSource(), collected,
                    FailureReason.of(FailureType.INPUT_MALFORMED, e.getMessage()),
                    System.currentTimeMillis() - start);
        } catch (RuntimeException | StackOverflowError e) {
            return AnalyzerResult.failure(getSource(), collected,
                    FailureReason.of(FailureType.ANALYZER_CRASHED,
                            e.getClass().getSimpleName() + ": " + e.getMessage()),
                    System.currentTimeMillis() - start);
        }
    }
}
