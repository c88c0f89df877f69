package com.threatintel.riskengine.domain.service.report;

import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.EscalationDecision;
import com.threatintel.riskengine.domain.model.PairEvidence;
import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.ReasonCode;
import com.threatintel.riskengine.domain.model.ScoreDimension;
import com.threatintel.riskengine.domain.model.SourceType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Markdown case pack for one thread, the hand-off format for analysts.
 */
@Component
public class ThreadCasePackRenderer {

    private static final DateTimeFormatter TS = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    public String render(CorrelationThread thread, Instant generatedAt) {
        List<String> lines = new ArrayList<>();
        lines.add("# Incident Thread Case Pack");
        lines.add("");
        lines.add("Generated: " + TS.format(generatedAt));
        lines.add("");
        lines.add("## Thread Snapshot");
        lines.add("- `thread_id`: `" + thread.threadId() + "`");
        lines.add("- `label`: **" + thread.label() + "**");
        lines.add("- members: **" + thread.memberCount() + "**");
        lines.add("- source types: " + sourceTypes(thread));
        lines.add("- time window: **" + TS.format(thread.windowStart()) + " -> " + TS.format(thread.windowEnd()) + "**");
        for (ScoreDimension dimension : ScoreDimension.values()) {
            Double max = thread.maxScoreByDimension() != null ? thread.maxScoreByDimension().get(dimension) : null;
            if (max != null) {
                lines.add("- max " + dimension.code() + ": **" + format1(max) + "**");
            }
        }
        lines.add("- confidence: **" + String.format(Locale.ROOT, "%.2f", thread.confidence()) + "**");
        lines.add("- recommended tier: **" + thread.recommendedTier() + "**"
                + (thread.recommendedTier() != thread.scoreTier() ? " (score tier " + thread.scoreTier() + ")" : ""));
        lines.add("");

        lines.add("## Correlation Evidence");
        lines.add("- reason codes: " + joinOrNone(thread.reasonCodes().stream().map(ReasonCode::code).sorted().toList()));
        lines.add("- shared pivots: " + joinOrNone(thread.sharedPivots().stream().map(p -> "`" + p.literal() + "`").toList()));
        lines.add("");
        lines.add("| Record A | Record B | Reason Codes | Shared Pivots | Delta |");
        lines.add("|---|---|---|---|---:|");
        for (PairEvidence e : thread.evidence()) {
            lines.add("| " + e.recordA() + " | " + e.recordB()
                    + " | " + joinOrNone(e.reasonCodes().stream().map(ReasonCode::code).sorted().toList())
                    + " | " + joinOrNone(e.sharedPivots().stream().map(Pivot::literal).toList())
                    + " | " + formatDelta(e.deltaSeconds()) + " |");
        }
        lines.add("");

        lines.add("## Members");
        thread.memberIds().forEach(id -> lines.add("- " + id));
        lines.add("");

        lines.add("## Analyst Action");
        EscalationDecision escalation = thread.escalation();
        if (escalation != null) {
            lines.add(escalation.action());
            lines.add("");
            lines.add("- escalate: **" + (escalation.escalate() ? "yes" : "no") + "**");
            lines.add("- target response: " + formatWindow(escalation.targetResponseTime()));
            lines.add("- notify: " + joinOrNone(escalation.notifyRoles()));
        } else {
            lines.add("No escalation decision recorded.");
        }
        lines.add("");
        return String.join("\n", lines);
    }

    private static String sourceTypes(CorrelationThread thread) {
        List<String> codes = thread.sourceTypes().stream().map(SourceType::code).sorted().toList();
        return "**" + codes.size() + "** (" + String.join(", ", codes) + ")";
    }

    private static String joinOrNone(List<String> values) {
        return values == null || values.isEmpty() ? "none" : String.join(", ", values);
    }

    private static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    static String formatDelta(long seconds) {
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m";
        return String.format(Locale.ROOT, "%.1fh", seconds / 3600.0);
    }

    static String formatWindow(Duration window) {
        if (window == null) return "none";
        if (window.toHours() >= 1 && window.toMinutesPart() == 0) return window.toHours() + " hours";
        return window.toMinutes() + " minutes";
    }
}
