package com.querytrace.engine.session;

/**
 * Disables tracing on JVM shutdown so the trace file gets its footer and is closed.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class SessionShutdownHook implements Runnable {

    private final SessionTraceController controller;

    public SessionShutdownHook(SessionTraceController controller) {
        this.controller = controller;
    }

    @Override
    public void run() {
        try {
            controller.disable();
        } catch (Exception e) {
            System.err.println("[query-trace] ERROR closing trace file on shutdown: " + e.getMessage());
        }
    }
}
