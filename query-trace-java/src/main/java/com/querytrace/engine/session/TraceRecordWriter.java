package com.querytrace.engine.session;

import com.querytrace.engine.config.TraceSettings;
import com.querytrace.engine.io.IoTier;
import com.querytrace.engine.io.IoTierClassifier;
import com.querytrace.engine.io.LatencySample;
import com.querytrace.engine.io.ReadVerification;
import com.querytrace.engine.io.TierAccumulator;
import com.querytrace.engine.io.TierEstimate;
import com.querytrace.engine.plan.PlanNode;
import com.querytrace.engine.plan.PlanTreeWalker;
import com.querytrace.engine.sink.TraceSink;
import com.querytrace.engine.usage.OsUsage;
import com.querytrace.engine.usage.ResourceUsage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Formats trace records and appends them to the current sink. All field names,
 * separators and field order are part of the trace file format.
 *
 * With no sink, or a closed one, every method is a no-op.
 */
public class TraceRecordWriter {

    static final String BANNER    = "***********************************************************************";
    static final String STATEMENT = "=====================================================================";
    static final String SECTION   = "---------------------------------------------------------------------";

    static final int MAX_WAIT_LINES = 100;
    static final String ANOMALY_MARK = "(!)";

    private TraceSink sink;

    void attach(TraceSink sink) {
        this.sink = sink;
    }

    TraceSink detach() {
        TraceSink s = sink;
        sink = null;
        return s;
    }

    TraceSink sink() {
        return sink;
    }

    boolean hasSink() {
        return sink != null && sink.isOpen();
    }

    void line(String text) {
        TraceSink s = sink;
        if (s != null && s.isOpen()) {
            s.write(text);
        }
    }

    // -----------------------------------------------------------------------
    // Session records
    // -----------------------------------------------------------------------

    void header(Instant sessionStart, long pid, TraceSettings settings) {
        line(BANNER);
        line("*** Query Session Trace (10046-style)");
        line("*** Trace File: " + (sink != null ? sink.location() : "<none>"));
        line("*** Session Start: " + sessionStart);
        line("*** Process ID: " + pid);
        line("*** Trace Level: " + settings.getTraceLevel());
        line("*** Options: waits=" + settings.isTraceWaits()
            + " binds=" + settings.isTraceBindVariables()
            + " buffers=" + settings.isTraceBufferStats());
        line("*** OS cache threshold: " + settings.getOsCacheThresholdUs() + " microseconds");
        line(BANNER);
        line("");
    }

    void footer(Instant end, long statementsTraced, Duration sessionDuration) {
        line("");
        line("*** SESSION END at " + end);
        line("*** Total queries traced: " + statementsTraced);
        line("*** Total session duration: " + elapsed(sessionDuration) + " seconds");
        line("*** Trace file closed");
    }

    void levelChange(int level, Instant at) {
        line("");
        line("*** Trace level changed to " + level + " at " + at);
        line("");
    }

    void thresholdChange(int thresholdUs, Instant at) {
        line("");
        line("*** OS cache threshold changed to " + thresholdUs + " microseconds at " + at);
        line("");
    }

    // -----------------------------------------------------------------------
    // Statement records, in emission order
    // -----------------------------------------------------------------------

    void parse(QueryTraceContext ctx, Duration parseTime) {
        line(STATEMENT);
        line("PARSE #" + ctx.statementId());
        line("SQL: " + ctx.statementText());
        line("SQL_ID: " + ctx.fingerprint());
        line("PARSE TIME: " + elapsed(parseTime));
    }

    void binds(long statementId, List<BindParameter> parameters, ValueRenderer renderer) {
        line(SECTION);
        line("BINDS #" + statementId);
        for (int i = 0; i < parameters.size(); i++) {
            BindParameter p = parameters.get(i);
            if (p == null) {
                line("Bind#" + i + " type=0 value=NULL");
                continue;
            }
            String prefix = "Bind#" + i + " type=" + p.typeId() + " ";
            if (p.isNull()) {
                line(prefix + "value=NULL");
                continue;
            }
            line(prefix + "value=" + renderValue(p, renderer));
        }
    }

    void exec(long statementId, Duration execTime, long rows, OsUsage execOsDiff) {
        line(SECTION);
        line("EXEC #" + statementId);
        line("EXEC TIME: ela=" + elapsed(execTime) + " rows=" + rows);
        if (execOsDiff != null) {
            line("  OS CPU: user=" + seconds(execOsDiff.userCpuSeconds())
                + "s sys=" + seconds(execOsDiff.systemCpuSeconds())
                + "s total=" + seconds(execOsDiff.totalCpuSeconds()) + "s");
        }
    }

    /** Writes nothing, not even the separator, when every category is suppressed. */
    void stats(ResourceUsage diff, OsUsage osDiff, boolean bufferStats) {
        List<String> out = new ArrayList<>();
        if (bufferStats) {
            if (diff.hasSharedActivity()) {
                out.add("BUFFER STATS: cr=" + counter(diff.sharedBlocksHit())
                    + " pr=" + counter(diff.sharedBlocksRead())
                    + " pw=" + counter(diff.sharedBlocksWritten())
                    + " dirtied=" + counter(diff.sharedBlocksDirtied()));
            }
            if (diff.hasLocalActivity()) {
                out.add("  local blocks: hit=" + counter(diff.localBlocksHit())
                    + " read=" + counter(diff.localBlocksRead())
                    + " dirtied=" + counter(diff.localBlocksDirtied())
                    + " written=" + counter(diff.localBlocksWritten()));
            }
            if (diff.hasTempActivity()) {
                out.add("  temp blocks: read=" + counter(diff.tempBlocksRead())
                    + " written=" + counter(diff.tempBlocksWritten()));
            }
        }
        if (diff.hasWalActivity()) {
            out.add("WAL STATS: records=" + counter(diff.walRecords())
                + " fpi=" + counter(diff.walFullPageImages())
                + " bytes=" + counter(diff.walBytes()));
        }
        List<String> anomalies = diff.negativeFields();
        if (!anomalies.isEmpty()) {
            out.add("COUNTER ANOMALY: " + String.join(",", anomalies)
                + " went backwards between snapshots (counter reset?)");
        }

        if (osDiff != null) {
            String cpu = "CPU: user=" + seconds(osDiff.userCpuSeconds())
                + " sec system=" + seconds(osDiff.systemCpuSeconds())
                + " sec total=" + seconds(osDiff.totalCpuSeconds()) + " sec";
            if (osDiff.totalCpuSeconds() >= 0 && osDiff.totalCpuSeconds() < 0.01) {
                cpu += " (Note: /proc granularity is ~10ms, very fast queries may show 0.000)";
            }
            out.add(cpu);
            if (osDiff.hasStorageIo()) {
                out.add("STORAGE I/O: read=" + counter(osDiff.readBytes()) + " bytes ("
                    + counter(osDiff.readSyscalls()) + " syscalls) write=" + counter(osDiff.writeBytes())
                    + " bytes (" + counter(osDiff.writeSyscalls()) + " syscalls)");
            }
            if (osDiff.hasAnyIo()) {
                out.add("TOTAL I/O: read=" + counter(osDiff.readChars())
                    + " bytes write=" + counter(osDiff.writeChars()) + " bytes");
            }
            out.add("MEMORY: rss=" + osDiff.residentKb() + " KB peak=" + osDiff.peakKb() + " KB");
            List<String> osAnomalies = osDiff.negativeFields();
            if (!osAnomalies.isEmpty()) {
                out.add("COUNTER ANOMALY: " + String.join(",", osAnomalies)
                    + " went backwards between snapshots (counter reset?)");
            }
        }

        if (out.isEmpty()) return;
        line(SECTION);
        out.forEach(this::line);
    }

    /**
     * Wait events and the three-tier block I/O summary. With per-access samples the tiers are
     * exact classifications; without them the engine-cache tier comes from the hit counter and
     * the remaining reads are split by the estimation heuristic.
     */
    void blockIo(QueryTraceContext ctx, ResourceUsage diff, OsUsage osDiff,
                 IoTierClassifier classifier, int blockSize) {
        List<LatencySample> samples = ctx.samples();
        TierAccumulator tiers = ctx.tiers();
        TierEstimate estimate = null;

        if (tiers.totalCount() == 0) {
            tiers = new TierAccumulator();
            if (diff.sharedBlocksHit() > 0) {
                tiers.add(IoTier.ENGINE_CACHE_HIT, diff.sharedBlocksHit(), 0.0);
            }
            if (diff.sharedBlocksRead() > 0 && diff.blockReadTimeUs() > 0) {
                estimate = classifier.estimate(diff.sharedBlocksRead(), diff.blockReadTimeUs());
                double avg = estimate.averageUs();
                tiers.add(IoTier.OS_CACHE_HIT, estimate.osCacheReads(), avg * estimate.osCacheReads());
                tiers.add(IoTier.DISK_READ, estimate.diskReads(), avg * estimate.diskReads());
            }
        }
        if (tiers.totalCount() == 0) return;

        line(SECTION);
        line("WAIT EVENTS (10046-style):");
        line(SECTION);
        if (!samples.isEmpty()) {
            int shown = 0;
            for (LatencySample s : samples) {
                if (s.tier() == IoTier.ENGINE_CACHE_HIT) continue;
                if (shown == MAX_WAIT_LINES) {
                    line("  ... (showing first " + MAX_WAIT_LINES + " I/O blocks only, total: "
                        + (tiers.count(IoTier.OS_CACHE_HIT) + tiers.count(IoTier.DISK_READ)) + ")");
                    break;
                }
                line(fmt("WAIT #%d: nam='db file sequential read' ela=%.0f block=%s tier=%s",
                    ctx.statementId(), s.latencyUs(), s.blockIdentifier(), s.tier().label()));
                shown++;
            }
            if (shown == 0) {
                line("  (no physical I/O - all blocks from cache)");
            }
            if (ctx.droppedSamples() > 0) {
                line("  (" + ctx.droppedSamples() + " samples beyond the first "
                    + QueryTraceContext.MAX_SAMPLES + " were counted but not retained)");
            }
        }

        line("");
        line("BLOCK I/O SUMMARY:");
        line("Total blocks accessed: " + tiers.totalCount());
        for (IoTier tier : IoTier.values()) {
            StringBuilder sb = new StringBuilder("  ").append(tierName(tier)).append(": ")
                .append(tiers.count(tier)).append(" blocks");
            OptionalDouble avg = tiers.averageLatencyUs(tier);
            if (tier != IoTier.ENGINE_CACHE_HIT && avg.isPresent()) {
                sb.append(fmt(", avg=%.1f us/block", avg.getAsDouble()));
            }
            line(sb.toString());
        }
        if (tiers.totalIoTimeUs() > 0) {
            line(fmt("  Total I/O time: %.2f ms", tiers.totalIoTimeUs() / 1000.0));
        }
        if (estimate != null) {
            line(fmt("  Note: tier split estimated from avg=%.1f us/block against threshold=%d us"
                + " (heuristic, not an exact accounting)", estimate.averageUs(), estimate.thresholdUs()));
        }

        if (osDiff != null) {
            ReadVerification v = IoTierClassifier.verify(
                tiers.count(IoTier.DISK_READ), osDiff.readBytes(), blockSize);
            line("");
            line("Verification from OS physical read counter:");
            line("  Physical reads: " + v.physicalReadBytes() + " bytes (" + v.physicalBlocks() + " blocks)");
            switch (v.outcome()) {
                case MATCH -> line("  Matches disk read count");
                case FEWER_PHYSICAL -> line("  Note: some 'disk' reads may have been from OS cache");
                case MORE_PHYSICAL -> line("  Note: OS reports more physical reads than classified (read-ahead or other activity)");
            }
        }
    }

    void plan(long statementId, PlanNode root, IoTierClassifier classifierOrNull) {
        line(SECTION);
        line("EXECUTION PLAN #" + statementId + ":");
        new PlanTreeWalker(this::line, classifierOrNull).walk(root);
    }

    void nested(QueryTraceContext ctx) {
        line("NESTED STATEMENTS: " + ctx.nestedStatements()
            + " (executed inside #" + ctx.statementId() + ", not traced separately)");
    }

    void statementEnd() {
        line(STATEMENT);
        line("");
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static String renderValue(BindParameter p, ValueRenderer renderer) {
        try {
            String text = renderer.toText(p);
            return "\"" + text + "\"";
        } catch (RenderException | RuntimeException e) {
            return "<unrenderable>";
        }
    }

    private static String tierName(IoTier tier) {
        return switch (tier) {
            case ENGINE_CACHE_HIT -> "Buffer hits (cr)";
            case OS_CACHE_HIT -> "OS cache reads";
            case DISK_READ -> "Disk reads (pr)";
        };
    }

    /** Counter value, marked when a reset made the delta negative. */
    static String counter(long value) {
        return value < 0 ? value + ANOMALY_MARK : Long.toString(value);
    }

    static String seconds(double value) {
        String text = fmt("%.3f", value);
        return value < 0 ? text + ANOMALY_MARK : text;
    }

    /** {@code <secs>.<micros>} with six microsecond digits; negative durations render as zero. */
    static String elapsed(Duration d) {
        if (d == null || d.isNegative()) d = Duration.ZERO;
        return d.getSeconds() + "." + fmt("%06d", d.getNano() / 1000);
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
