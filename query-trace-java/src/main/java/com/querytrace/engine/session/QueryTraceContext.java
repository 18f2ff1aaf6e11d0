package com.querytrace.engine.session;

import com.querytrace.engine.io.LatencySample;
import com.querytrace.engine.io.TierAccumulator;
import com.querytrace.engine.usage.OsUsage;
import com.querytrace.engine.usage.ResourceUsage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Accumulated state of the one statement a session is currently tracing.
 * Owned by {@link SessionTraceController}; never shared between threads.
 */
public final class QueryTraceContext {

    /** Per-statement cap on retained latency samples. Tier counts keep accumulating past it. */
    public static final int MAX_SAMPLES = 500;

    enum Phase { PLANNING, PLANNED, EXECUTING, EXECUTED }

    private final long statementId;
    private final String statementText;
    private final String fingerprint;

    private final Instant parseStart;
    private Instant parseEnd;
    private Instant bindTime;
    private Instant execStart;
    private Instant execEnd;

    private final ResourceUsage resourceStart;
    private final OsUsage osStart;
    private OsUsage execOsStart;

    private final List<LatencySample> samples = new ArrayList<>();
    private long droppedSamples;
    private final TierAccumulator tiers = new TierAccumulator();

    private Phase phase = Phase.PLANNING;
    // >1 while a nested statement runs inside this statement's execute window
    private int executeDepth;
    private long rowsProcessed;
    private int nestedStatements;
    // nested statements opened after the execute window closed whose execution end is pending
    private int nestedAfterExecute;

    QueryTraceContext(long statementId, String statementText, Instant parseStart,
                      ResourceUsage resourceStart, OsUsage osStart) {
        this.statementId = statementId;
        this.statementText = statementText;
        this.fingerprint = Fingerprint.of(statementText);
        this.parseStart = parseStart;
        this.resourceStart = resourceStart;
        this.osStart = osStart;
    }

    public long statementId()               { return statementId; }
    public String statementText()           { return statementText; }
    public String fingerprint()             { return fingerprint; }
    public Instant parseStart()             { return parseStart; }
    public Optional<Instant> parseEnd()     { return Optional.ofNullable(parseEnd); }
    public Optional<Instant> bindTime()     { return Optional.ofNullable(bindTime); }
    public Optional<Instant> execStart()    { return Optional.ofNullable(execStart); }
    public Optional<Instant> execEnd()      { return Optional.ofNullable(execEnd); }
    public ResourceUsage resourceStart()    { return resourceStart; }
    public Optional<OsUsage> osStart()      { return Optional.ofNullable(osStart); }
    public Optional<OsUsage> execOsStart()  { return Optional.ofNullable(execOsStart); }
    public List<LatencySample> samples()    { return Collections.unmodifiableList(samples); }
    public long droppedSamples()            { return droppedSamples; }
    public TierAccumulator tiers()          { return tiers; }
    public long rowsProcessed()             { return rowsProcessed; }
    public int nestedStatements()           { return nestedStatements; }

    Phase phase() {
        return phase;
    }

    boolean isExecuting() {
        return executeDepth > 0;
    }

    // -----------------------------------------------------------------------
    // Phase transitions (called by the controller only)
    // -----------------------------------------------------------------------

    void markPlanned(Instant at) {
        parseEnd = at;
        phase = Phase.PLANNED;
    }

    void markBound(Instant at) {
        bindTime = at;
    }

    /** Returns true when this call opened the statement's own execute window. */
    boolean enterExecute(Instant at, OsUsage os) {
        executeDepth++;
        if (executeDepth > 1) return false;
        execStart = at;
        execOsStart = os;
        phase = Phase.EXECUTING;
        return true;
    }

    /** Returns true when this call closed the statement's own execute window. */
    boolean exitExecute(Instant at, long rows) {
        if (executeDepth == 0) return false;
        executeDepth--;
        if (executeDepth > 0) return false;
        execEnd = at;
        rowsProcessed = rows;
        phase = Phase.EXECUTED;
        return true;
    }

    void countNestedStatement() {
        nestedStatements++;
        if (phase == Phase.EXECUTED) nestedAfterExecute++;
    }

    /**
     * Consumes one pending nested execution end. Returns false when none is pending, meaning the
     * execution end belongs to this statement.
     */
    boolean consumeNestedExecutionEnd() {
        if (nestedAfterExecute == 0) return false;
        nestedAfterExecute--;
        return true;
    }

    void addSample(LatencySample sample) {
        tiers.add(sample);
        if (samples.size() < MAX_SAMPLES) {
            samples.add(sample);
        } else {
            droppedSamples++;
        }
    }
}
