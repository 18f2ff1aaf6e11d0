package com.querytrace.engine.session;

import com.querytrace.engine.config.TraceLevel;
import com.querytrace.engine.config.TraceSettings;
import com.querytrace.engine.io.BlockAccess;
import com.querytrace.engine.io.IoTierClassifier;
import com.querytrace.engine.plan.PlanNode;
import com.querytrace.engine.sink.TraceSink;
import com.querytrace.engine.sink.TraceSinkFactory;
import com.querytrace.engine.storage.StatementRegistry;
import com.querytrace.engine.usage.OsUsage;
import com.querytrace.engine.usage.ResourceUsage;
import com.querytrace.engine.usage.SnapshotSource;
import com.querytrace.engine.usage.UsageDiff;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session trace state machine. Two states, disabled and enabled, changed only by
 * {@link #enable()} and {@link #disable()}; the trace level gates what each statement emits but
 * never the state itself.
 *
 * The controller owns a single context slot: at most one statement is traced at a time, and its
 * records are written in phase order PARSE, BINDS, EXEC, STATS, PLAN. A statement that starts
 * planning while the traced statement is executing, or after its execute window closed but
 * before its execution end, is nested inside it; it is counted, not traced.
 *
 * Lifecycle callbacks never throw. A failure inside a callback is logged and the current
 * statement is dropped; the host's statement continues. Public methods are synchronized so a
 * shutdown hook thread can disable tracing safely.
 */
public class SessionTraceController implements QueryLifecycleListener {

    private static final AtomicLong NEXT_SESSION_ID = new AtomicLong();

    private final TraceSettings settings;
    private final SnapshotSource snapshots;
    private final TraceSinkFactory sinkFactory;
    private final ValueRenderer renderer;
    private final Clock clock;
    private final long pid;
    private final StatementRegistry registry;
    private final long sessionId = NEXT_SESSION_ID.incrementAndGet();

    private final TraceRecordWriter records = new TraceRecordWriter();

    private boolean enabled;
    private long sequence;
    private long statementsTraced;
    private Instant sessionStart;
    private IoTierClassifier classifier;

    // the single context slot; null when no statement is being traced
    private QueryTraceContext current;

    /**
     * @param registry statement table for storage-level attribution, shared by every session
     *                 and keyed by {@link #sessionId()}, or null
     */
    public SessionTraceController(TraceSettings settings, SnapshotSource snapshots,
                                  TraceSinkFactory sinkFactory, ValueRenderer renderer,
                                  Clock clock, long pid, StatementRegistry registry) {
        this.settings = settings.validate();
        this.snapshots = snapshots;
        this.sinkFactory = sinkFactory;
        this.renderer = renderer;
        this.clock = clock;
        this.pid = pid;
        this.registry = registry;
        this.classifier = new IoTierClassifier(settings.getOsCacheThresholdUs());
    }

    // -----------------------------------------------------------------------
    // Session operations
    // -----------------------------------------------------------------------

    /** Opens the sink and writes the session header. No-op when already enabled. */
    public synchronized void enable() {
        if (enabled) return;
        enabled = true;
        sessionStart = clock.instant();
        statementsTraced = 0;
        try {
            TraceSink sink = sinkFactory.open();
            records.attach(sink);
            System.err.println("[query-trace] trace file: " + sink.location());
        } catch (IOException | RuntimeException e) {
            System.err.println("[query-trace] WARNING: cannot open trace sink, records will be discarded: " + e.getMessage());
        }
        records.header(sessionStart, pid, settings);
    }

    /**
     * Writes the footer and closes the sink. A statement still open is abandoned without
     * emitting its remaining records. No-op when not enabled.
     */
    public synchronized void disable() {
        if (!enabled) return;
        if (current != null) {
            abandon("tracing disabled");
        }
        Instant end = clock.instant();
        records.footer(end, statementsTraced, Duration.between(sessionStart, end));
        TraceSink sink = records.detach();
        if (sink != null) {
            sink.close();
            System.err.println("[query-trace] trace file closed: " + sink.location());
        }
        enabled = false;
    }

    /**
     * @throws com.querytrace.engine.config.InvalidParameterException when outside [0, 16];
     *         the previous level is kept
     */
    public synchronized void setLevel(int level) {
        settings.setTraceLevel(level);
        if (enabled) {
            records.levelChange(level, clock.instant());
        }
    }

    /**
     * @throws com.querytrace.engine.config.InvalidParameterException when outside [10, 10000];
     *         the previous threshold is kept
     */
    public synchronized void setCacheThreshold(int thresholdUs) {
        settings.setOsCacheThresholdUs(thresholdUs);
        classifier = new IoTierClassifier(thresholdUs);
        if (enabled) {
            records.thresholdChange(thresholdUs, clock.instant());
        }
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public synchronized int level() {
        return settings.getTraceLevel();
    }

    public synchronized int cacheThresholdUs() {
        return classifier.thresholdUs();
    }

    /**
     * Identity of this session, unique within the JVM. Key of the session's slot in the
     * statement table; several sessions share one process id.
     */
    public long sessionId() {
        return sessionId;
    }

    /** Last statement id handed out. Never reset, not even by disable/enable. */
    public synchronized long sequence() {
        return sequence;
    }

    /** Location of the open trace file, empty when disabled or when no sink could be opened. */
    public synchronized Optional<String> getTraceFile() {
        if (!enabled || !records.hasSink()) return Optional.empty();
        return Optional.of(records.sink().location());
    }

    /** The sink records are written to, or null. Used by the storage-level tracer. */
    public synchronized TraceSink currentSink() {
        return records.hasSink() ? records.sink() : null;
    }

    /** Id of the statement being traced, or empty. */
    public synchronized Optional<Long> currentStatementId() {
        return current != null ? Optional.of(current.statementId()) : Optional.empty();
    }

    // -----------------------------------------------------------------------
    // Lifecycle callbacks
    // -----------------------------------------------------------------------

    @Override
    public synchronized void onPlanStart(String statementText) {
        if (!enabled || settings.getTraceLevel() < TraceLevel.BASIC || statementText == null) return;
        try {
            if (current != null) {
                if (current.isExecuting() || current.phase() == QueryTraceContext.Phase.EXECUTED) {
                    current.countNestedStatement();
                    return;
                }
                abandon("a new statement started before it finished");
            }
            QueryTraceContext ctx = new QueryTraceContext(++sequence, statementText, clock.instant(),
                snapshots.readResourceUsage(), snapshots.readOsUsage(pid).orElse(null));
            current = ctx;
            if (registry != null && !registry.register(sessionId, ctx.statementId())) {
                System.err.println("[query-trace] WARNING: statement table full, storage I/O of #"
                    + ctx.statementId() + " will be unattributed");
            }
        } catch (RuntimeException e) {
            drop("plan start", e);
        }
    }

    @Override
    public synchronized void onPlanEnd() {
        QueryTraceContext ctx = current;
        if (ctx == null || ctx.phase() != QueryTraceContext.Phase.PLANNING) return;
        try {
            Instant now = clock.instant();
            ctx.markPlanned(now);
            records.parse(ctx, Duration.between(ctx.parseStart(), now));
        } catch (RuntimeException e) {
            drop("plan end", e);
        }
    }

    @Override
    public synchronized void onBind(List<BindParameter> parameters) {
        QueryTraceContext ctx = current;
        if (ctx == null || ctx.isExecuting() || ctx.phase() == QueryTraceContext.Phase.EXECUTED
            || parameters == null || parameters.isEmpty()) return;
        if (settings.getTraceLevel() < TraceLevel.BINDS || !settings.isTraceBindVariables()) return;
        try {
            ctx.markBound(clock.instant());
            records.binds(ctx.statementId(), parameters, renderer);
        } catch (RuntimeException e) {
            drop("bind", e);
        }
    }

    @Override
    public synchronized void onExecuteStart() {
        QueryTraceContext ctx = current;
        // after the execute window closed only a nested statement can start executing
        if (ctx == null || ctx.phase() == QueryTraceContext.Phase.EXECUTED) return;
        try {
            OsUsage os = ctx.isExecuting() ? null : snapshots.readOsUsage(pid).orElse(null);
            ctx.enterExecute(clock.instant(), os);
        } catch (RuntimeException e) {
            drop("execute start", e);
        }
    }

    @Override
    public synchronized void onExecuteEnd(long rowsProcessed) {
        QueryTraceContext ctx = current;
        if (ctx == null) return;
        try {
            Instant now = clock.instant();
            if (!ctx.exitExecute(now, rowsProcessed)) return;
            OsUsage osDiff = ctx.execOsStart()
                .flatMap(start -> snapshots.readOsUsage(pid).map(end -> UsageDiff.diff(start, end)))
                .orElse(null);
            records.exec(ctx.statementId(), Duration.between(ctx.execStart().orElse(now), now), rowsProcessed, osDiff);
        } catch (RuntimeException e) {
            drop("execute end", e);
        }
    }

    @Override
    public synchronized void onBlockAccess(BlockAccess access) {
        QueryTraceContext ctx = current;
        if (ctx == null || access == null || !wantsWaits()) return;
        try {
            ctx.addSample(classifier.classify(access));
        } catch (RuntimeException e) {
            drop("block access", e);
        }
    }

    @Override
    public synchronized void onExecutionEnd(PlanNode finishedPlan) {
        QueryTraceContext ctx = current;
        // still executing, or a nested statement is pending: this is a nested statement's end
        if (ctx == null || ctx.isExecuting() || ctx.consumeNestedExecutionEnd()) return;
        try {
            finish(ctx, finishedPlan);
        } catch (RuntimeException e) {
            drop("execution end", e);
        } finally {
            release(ctx);
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void finish(QueryTraceContext ctx, PlanNode plan) {
        ResourceUsage diff = UsageDiff.diff(ctx.resourceStart(), snapshots.readResourceUsage());
        OsUsage osDiff = ctx.osStart()
            .flatMap(start -> snapshots.readOsUsage(pid).map(end -> UsageDiff.diff(start, end)))
            .orElse(null);

        records.stats(diff, osDiff, settings.isTraceBufferStats());
        if (!diff.negativeFields().isEmpty()) {
            System.err.println("[query-trace] WARNING: counters went backwards during #" + ctx.statementId()
                + ": " + String.join(",", diff.negativeFields()));
        }
        if (wantsWaits()) {
            records.blockIo(ctx, diff, osDiff, classifier, settings.getBlockSize());
        }
        if (settings.getTraceLevel() >= TraceLevel.PLAN && plan != null) {
            records.plan(ctx.statementId(), plan, wantsWaits() ? classifier : null);
        }
        if (ctx.nestedStatements() > 0) {
            records.nested(ctx);
        }
        records.statementEnd();
        statementsTraced++;
    }

    private boolean wantsWaits() {
        return settings.getTraceLevel() >= TraceLevel.WAITS && settings.isTraceWaits();
    }

    private void abandon(String reason) {
        System.err.println("[query-trace] statement #" + current.statementId() + " abandoned: " + reason);
        release(current);
    }

    private void drop(String hook, RuntimeException e) {
        System.err.println("[query-trace] WARNING: " + hook + " failed, statement "
            + (current != null ? "#" + current.statementId() : "") + " dropped: " + e);
        if (current != null) release(current);
    }

    private void release(QueryTraceContext ctx) {
        if (current == ctx) current = null;
        if (registry != null) registry.unregister(sessionId);
    }
}
