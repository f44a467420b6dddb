package com.flowgraph.engine.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Logs the end-of-run summary: pipeline, status, total time, then one line per node.
 */
public final class RunSummaryPrinter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryPrinter.class);

    private RunSummaryPrinter() {
    }

    public static void print(RunReport report) {
        if (!log.isInfoEnabled()) return;
        log.info(format(report));
    }

    /** Summary text as logged. */
    public static String format(RunReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Pipeline Execution Summary\n");
        sb.append("Pipeline: ").append(report.getPipelineName()).append('\n');
        sb.append("Status: ").append(report.getStatus().getValue()).append('\n');
        sb.append("Total Time: ").append(seconds(report.getTotalTime())).append('\n');
        sb.append("Node Results:");
        for (Map.Entry<String, NodeReport> e : report.getNodes().entrySet()) {
            NodeReport n = e.getValue();
            sb.append("\n  ").append(symbol(n)).append(' ').append(e.getKey()).append(": ")
                    .append(n.status().getValue())
                    .append(" (").append(n.executionTime() != null ? seconds(n.executionTime()) : "N/A").append(')');
            if (n.error() != null) {
                sb.append("\n    Error: ").append(n.error());
            }
        }
        return sb.toString();
    }

    private static String symbol(NodeReport n) {
        return switch (n.status()) {
            case SUCCEEDED -> "✓";
            case FAILED -> "✗";
            default -> "○";
        };
    }

    private static String seconds(Duration d) {
        return String.format(Locale.ROOT, "%.2fs", d.toNanos() / 1_000_000_000.0);
    }
}
