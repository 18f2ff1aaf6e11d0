package com.querytrace.engine.plan;

import com.querytrace.engine.io.IoTierClassifier;
import com.querytrace.engine.io.TierEstimate;
import com.querytrace.engine.usage.ResourceUsage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Renders a finished plan tree, one indented block per node, in pre-order.
 *
 * Traversal uses an explicit stack, so tree depth is unbounded.
 * Indentation grows two spaces per level up to {@link #MAX_INDENT_DEPTH}; deeper nodes are still
 * visited and rendered at the capped indentation.
 *
 * The walker only reads nodes. Output goes line by line to the consumer given at construction.
 */
public class PlanTreeWalker {

    public static final int MAX_INDENT_DEPTH = 32;

    private final Consumer<String> out;
    private final IoTierClassifier classifier;

    /**
     * @param out        receives each rendered line, without a trailing newline
     * @param classifier when non-null, nodes with timed block reads get an estimated I/O tier breakdown
     */
    public PlanTreeWalker(Consumer<String> out, IoTierClassifier classifier) {
        this.out = out;
        this.classifier = classifier;
    }

    /** Renders the tree rooted at {@code root} and returns the number of nodes visited. */
    public int walk(PlanNode root) {
        int[] visited = {0};
        forEachPreOrder(root, (node, depth) -> {
            renderNode(node, indent(depth));
            visited[0]++;
        });
        return visited[0];
    }

    /**
     * Visits every node reachable through {@link PlanNode#children()} exactly once per
     * reachable path, parents before children, siblings in the order returned.
     */
    public static void forEachPreOrder(PlanNode root, BiConsumer<PlanNode, Integer> visitor) {
        if (root == null) return;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            visitor.accept(frame.node, frame.depth);
            List<PlanNode> children = frame.node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.depth + 1));
            }
        }
    }

    static String indent(int depth) {
        return "  ".repeat(Math.min(depth, MAX_INDENT_DEPTH));
    }

    // -----------------------------------------------------------------------
    // Per-node rendering
    // -----------------------------------------------------------------------

    private void renderNode(PlanNode node, String indent) {
        StringBuilder head = new StringBuilder(indent).append("-> ").append(node.nodeType());
        node.estimate().ifPresent(e -> head.append(fmt(" (cost=%.2f..%.2f rows=%.0f width=%d)",
            e.startupCost(), e.totalCost(), e.rows(), e.width())));

        Instrumentation instr = node.instrumentation().orElse(null);
        if (instr == null || !instr.executed()) {
            out.accept(head.toString());
            return;
        }

        head.append(fmt(" (actual rows=%.0f loops=%.0f)", instr.rowsPerLoop(), instr.loops()));
        out.accept(head.toString());

        node.relationName().ifPresent(r -> out.accept(indent + "   Relation: " + r));
        node.indexName().ifPresent(i -> out.accept(indent + "   Index: " + i));

        double startupMs = instr.startupSeconds() * 1000.0;
        double totalMs = instr.totalSeconds() * 1000.0;
        String timing = fmt("%s   Timing: startup=%.3f ms, total=%.3f ms", indent, startupMs, totalMs);
        if (instr.loops() > 1) {
            timing += fmt(", avg=%.3f ms/loop", totalMs / instr.loops());
        }
        out.accept(timing);

        instr.resourceUsage().ifPresent(usage -> renderUsage(usage, totalMs, indent));
    }

    private void renderUsage(ResourceUsage u, double totalMs, String indent) {
        if (u.hasSharedActivity()) {
            StringBuilder line = new StringBuilder(indent)
                .append("   Buffers: shared hit=").append(u.sharedBlocksHit())
                .append(" read=").append(u.sharedBlocksRead());
            if (u.sharedBlocksDirtied() != 0) line.append(" dirtied=").append(u.sharedBlocksDirtied());
            if (u.sharedBlocksWritten() != 0) line.append(" written=").append(u.sharedBlocksWritten());
            long accessed = u.sharedBlocksHit() + u.sharedBlocksRead();
            if (accessed > 0) {
                line.append(fmt(" (%.1f%% cache hit)", (double) u.sharedBlocksHit() / accessed * 100.0));
            }
            out.accept(line.toString());

            if (classifier != null && u.sharedBlocksRead() > 0 && u.blockReadTimeUs() > 0) {
                renderIoDetail(u, totalMs, indent);
            }
        }

        if (u.hasLocalActivity()) {
            StringBuilder line = new StringBuilder(indent)
                .append("   Local Buffers: hit=").append(u.localBlocksHit())
                .append(" read=").append(u.localBlocksRead());
            if (u.localBlocksDirtied() != 0) line.append(" dirtied=").append(u.localBlocksDirtied());
            if (u.localBlocksWritten() != 0) line.append(" written=").append(u.localBlocksWritten());
            out.accept(line.toString());
        }

        if (u.hasTempActivity()) {
            out.accept(indent + "   Temp Buffers: read=" + u.tempBlocksRead()
                + " written=" + u.tempBlocksWritten());
        }

        if (u.hasWalActivity()) {
            out.accept(indent + "   WAL: records=" + u.walRecords()
                + " fpi=" + u.walFullPageImages() + " bytes=" + u.walBytes());
        }
    }

    private void renderIoDetail(ResourceUsage u, double totalMs, String indent) {
        TierEstimate est = classifier.estimate(u.sharedBlocksRead(), u.blockReadTimeUs());
        double ioMs = u.blockReadTimeUs() / 1000.0;

        StringBuilder line = new StringBuilder(
            fmt("%s   I/O Detail (estimated): total=%.3f ms, avg=%.1f us/block", indent, ioMs, est.averageUs()));
        if (est.osCacheReads() > 0) line.append(", ~").append(est.osCacheReads()).append(" from OS cache");
        if (est.diskReads() > 0) line.append(", ~").append(est.diskReads()).append(" from disk");
        out.accept(line.toString());

        double cpuMs = totalMs - ioMs;
        if (cpuMs > 0) {
            out.accept(fmt("%s   Time breakdown: CPU ~%.3f ms (%.1f%%), I/O ~%.3f ms (%.1f%%)",
                indent, cpuMs, cpuMs / totalMs * 100.0, ioMs, ioMs / totalMs * 100.0));
        }
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }

    private record Frame(PlanNode node, int depth) {}
}
