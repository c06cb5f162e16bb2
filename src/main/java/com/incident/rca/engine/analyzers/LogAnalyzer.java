package com.incident.rca.engine.analyzers;

import com.incident.rca.engine.Analyzer;
import com.incident.rca.engine.EvidenceKinds;
import com.incident.rca.model.EvidenceRecord;
import com.incident.rca.model.EvidenceSource;
import com.incident.rca.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans raw log text line by line with fixed patterns.
 *
 * Emits:
 *  - log_error for lines carrying ERROR / FATAL / CRITICAL (FATAL and CRITICAL are critical,
 *    ERROR is a warning)
 *  - stack_trace for each contiguous block: a marker line (severity or exception header)
 *    followed by indented, "at ", "Caused by:" or "... N more" lines. A severity line that
 *    opens a block, directly or through the exception header on the next line, is reported
 *    by the block record, which is then critical. A block without a severity line is a warning.
 *  - log_anomaly for known failure phrases (timeouts, refused or reset connections,
 *    unavailability, out of memory, deadlocks), and an info-level long_line anomaly for
 *    lines longer than 500 characters
 *  - one log_summary with per-severity counts of the above, always last
 *
 * Patterns are applied to one line at a time; nothing spans the whole text. Exception names
 * are looked up in the excerpt only, so an arbitrarily long line costs one bounded match.
 */
@Component
public class LogAnalyzer implements Analyzer<String> {

    private static final Logger log = LoggerFactory.getLogger(LogAnalyzer.class);

    static final int MAX_EXCERPT = 200;
    static final int LONG_LINE = 500;

    private static final Pattern HIGH_SEVERITY = Pattern.compile("\\b(FATAL|CRITICAL)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ERROR = Pattern.compile("\\bERROR\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern EXCEPTION_HEADER = Pattern.compile(
            "^\\s*(?:Traceback \\(most recent call last\\)|Exception in thread\\b|[\\w.$]+(?:Exception|Error)(?::|\\s|$))");
    private static final Pattern EXCEPTION_NAME = Pattern.compile(
            "\\b([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*(?:Exception|Error))\\b");
    private static final Pattern CONTINUATION = Pattern.compile(
            "^(?:\\s+\\S|at\\s|Caused by:|\\.\\.\\.\\s\\d+\\s+more)");

    private static final List<Phrase> PHRASES = List.of(
            new Phrase("timeout", Pattern.compile("\\btime[d ]?\\s?outs?\\b", Pattern.CASE_INSENSITIVE), Severity.WARNING),
            new Phrase("connection_refused", Pattern.compile("\\bconnection refused\\b", Pattern.CASE_INSENSITIVE), Severity.WARNING),
            new Phrase("connection_reset", Pattern.compile("\\bconnection reset\\b", Pattern.CASE_INSENSITIVE), Severity.WARNING),
            new Phrase("unavailable", Pattern.compile("\\bunavailable\\b", Pattern.CASE_INSENSITIVE), Severity.WARNING),
            new Phrase("out_of_memory", Pattern.compile("\\bout of memory\\b|OutOfMemoryError", Pattern.CASE_INSENSITIVE), Severity.CRITICAL),
            new Phrase("deadlock", Pattern.compile("\\bdeadlock", Pattern.CASE_INSENSITIVE), Severity.CRITICAL));

    @Override
    public EvidenceSource getSource() {
        return EvidenceSource.LOG;
    }

    @Override
    public void detect(String text, Consumer<EvidenceRecord> sink) {
        Scan scan = new Scan(sink);
        Iterator<String> lines = text.lines().iterator();
        while (lines.hasNext()) {
            scan.accept(lines.next());
        }
        scan.finish();
    }

    private static String excerpt(String line) {
        String trimmed = line.strip();
        return trimmed.length() <= MAX_EXCERPT ? trimmed : trimmed.substring(0, MAX_EXCERPT);
    }

    private record Phrase(String name, Pattern pattern, Severity severity) {
    }

    /** A line that could open a stack-trace block, held until the next line is seen. */
    private record Opener(int line, String excerpt, String marker, String exception) {
    }

    /** Single-pass state: at most one pending opener or one open block at a time. */
    private static final class Scan {
        private final Consumer<EvidenceRecord> sink;
        private final Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        private int lineNo;
        private int markerLines;
        private int stackTraces;
        private Opener opener;
        private Opener blockOpener;
        private int blockEnd;
        private String blockException;

        Scan(Consumer<EvidenceRecord> sink) {
            this.sink = sink;
            for (Severity severity : Severity.values()) {
                counts.put(severity, 0);
            }
        }

        void accept(String line) {
            lineNo++;
            boolean continuation = CONTINUATION.matcher(line).find();

            if (blockOpener != null) {
                if (continuation) {
                    extendBlock(line);
                    scanPhrases(line);
                    return;
                }
                closeBlock();
            } else if (opener != null) {
                if (continuation) {
                    blockOpener = opener;
                    blockException = opener.exception();
                    opener = null;
                    extendBlock(line);
                    scanPhrases(line);
                    return;
                }
                if (opener.marker() != null && opener.exception() == null
                        && EXCEPTION_HEADER.matcher(line).find()) {
                    // "ERROR msg" followed by the exception header: one trace, reported at the ERROR line
                    opener = new Opener(opener.line(), opener.excerpt(), opener.marker(), exceptionIn(line));
                    scanPhrases(line);
                    return;
                }
                flushOpener();
            }

            String marker = markerOf(line);
            if (marker != null) {
                markerLines++;
            }
            if (marker != null || EXCEPTION_HEADER.matcher(line).find()) {
                opener = new Opener(lineNo, excerpt(line), marker, exceptionIn(line));
            }
            scanPhrases(line);
        }

        void finish() {
            if (blockOpener != null) {
                closeBlock();
            } else if (opener != null) {
                flushOpener();
            }

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("total_lines", lineNo);
            attributes.put("marker_lines", markerLines);
            attributes.put("stack_traces", stackTraces);
            attributes.put("critical", counts.get(Severity.CRITICAL));
            attributes.put("warning", counts.get(Severity.WARNING));
            attributes.put("info", counts.get(Severity.INFO));

            sink.accept(EvidenceRecord.builder()
                    .source(EvidenceSource.LOG)
                    .kind(EvidenceKinds.LOG_SUMMARY)
                    .severity(Severity.INFO)
                    .description(String.format(Locale.ROOT,
                            "Scanned %d line(s): %d critical, %d warning, %d info finding(s), %d stack trace(s)",
                            lineNo, counts.get(Severity.CRITICAL), counts.get(Severity.WARNING),
                            counts.get(Severity.INFO), stackTraces))
                    .attributes(attributes)
                    .confidence(1.0)
                    .build());
        }

        private void extendBlock(String line) {
            blockEnd = lineNo;
            if (blockException == null && line.stripLeading().startsWith("Caused by:")) {
                blockException = exceptionIn(line);
            }
        }

        private void closeBlock() {
            Opener first = blockOpener;
            Severity severity = first.marker() != null ? Severity.CRITICAL : Severity.WARNING;

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("start_line", first.line());
            attributes.put("end_line", blockEnd);
            attributes.put("line_count", blockEnd - first.line() + 1);
            if (first.marker() != null) {
                attributes.put("marker", first.marker());
            }
            if (blockException != null) {
                attributes.put("exception", blockException);
            }
            attributes.put("excerpt", first.excerpt());

            emit(EvidenceKinds.STACK_TRACE, severity, String.format(Locale.ROOT,
                    "Stack trace at lines %d-%d%s: %s",
                    first.line(), blockEnd,
                    blockException != null ? " (" + blockException + ")" : "",
                    first.excerpt()), attributes);
            stackTraces++;

            blockOpener = null;
            blockException = null;
        }

        private void flushOpener() {
            Opener pending = opener;
            opener = null;
            if (pending.marker() == null) {
                // Exception header without a trace: phrase scan already covered it
                return;
            }
            Severity severity = "ERROR".equals(pending.marker()) ? Severity.WARNING : Severity.CRITICAL;

            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("line", pending.line());
            attributes.put("marker", pending.marker());
            attributes.put("excerpt", pending.excerpt());

            emit(EvidenceKinds.LOG_ERROR, severity, String.format(Locale.ROOT,
                    "%s at line %d: %s", pending.marker(), pending.line(), pending.excerpt()), attributes);
        }

        private void scanPhrases(String line) {
            for (Phrase phrase : PHRASES) {
                if (phrase.pattern().matcher(line).find()) {
                    String excerpt = excerpt(line);
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put("line", lineNo);
                    attributes.put("pattern", phrase.name());
                    attributes.put("excerpt", excerpt);

                    emit(EvidenceKinds.LOG_ANOMALY, phrase.severity(), String.format(Locale.ROOT,
                            "Anomalous pattern '%s' at line %d: %s", phrase.name(), lineNo, excerpt), attributes);
                }
            }
            if (line.length() > LONG_LINE) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("line", lineNo);
                attributes.put("pattern", "long_line");
                attributes.put("length", line.length());
                attributes.put("excerpt", excerpt(line));

                emit(EvidenceKinds.LOG_ANOMALY, Severity.INFO, String.format(Locale.ROOT,
                        "Unusually long line %d (%d characters)", lineNo, line.length()), attributes);
            }
        }

        private void emit(String kind, Severity severity, String description, Map<String, Object> attributes) {
            counts.merge(severity, 1, Integer::sum);
            log.debug("{} {} {}", kind, severity, description);
            sink.accept(EvidenceRecord.builder()
                    .source(EvidenceSource.LOG)
                    .kind(kind)
                    .severity(severity)
                    .description(description)
                    .attributes(attributes)
                    .confidence(1.0)
                    .build());
        }

        private static String markerOf(String line) {
            Matcher high = HIGH_SEVERITY.matcher(line);
            if (high.find()) {
                return high.group(1).toUpperCase(Locale.ROOT);
            }
            return ERROR.matcher(line).find() ? "ERROR" : null;
        }

        private static String exceptionIn(String line) {
            Matcher matcher = EXCEPTION_NAME.matcher(excerpt(line));
            return matcher.find() ? matcher.group(1) : null;
        }
    }
}
