package com.standallocator.config;

import com.standallocator.domain.ConfigurationException;
import com.standallocator.solver.engine.SolverAdapter;

import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Solver adapter settings, read from environment variables with defaults.
 *
 * STAND_SOLVER_BACKEND             CP_SAT | TIMEFOLD (default CP_SAT)
 * STAND_SOLVER_TIME_LIMIT_SECONDS  wall-clock limit per solve (default 30)
 * STAND_SOLVER_WORKERS             CP-SAT search workers, 0 = solver default (default 0)
 * STAND_SOLVER_UNIMPROVED_SECONDS  Timefold stop after no improvement (default 5)
 */
public final class SolverSettings {

    public static final String BACKEND = "STAND_SOLVER_BACKEND";
    public static final String TIME_LIMIT_SECONDS = "STAND_SOLVER_TIME_LIMIT_SECONDS";
    public static final String WORKERS = "STAND_SOLVER_WORKERS";
    public static final String UNIMPROVED_SECONDS = "STAND_SOLVER_UNIMPROVED_SECONDS";

    private static final SolverBackend DEFAULT_BACKEND = SolverBackend.CP_SAT;
    private static final long DEFAULT_TIME_LIMIT_SECONDS = 30L;
    private static final int DEFAULT_WORKERS = 0;
    private static final long DEFAULT_UNIMPROVED_SECONDS = 5L;

    private final SolverBackend backend;
    private final long timeLimitSeconds;
    private final int workers;
    private final long unimprovedSeconds;

    public SolverSettings(SolverBackend backend, long timeLimitSeconds, int workers, long unimprovedSeconds) {
        if (backend == null) {
            throw new ConfigurationException("Solver backend is required");
        }
        if (timeLimitSeconds <= 0) {
            throw new ConfigurationException(TIME_LIMIT_SECONDS + " must be positive, got " + timeLimitSeconds);
        }
        if (workers < 0) {
            throw new ConfigurationException(WORKERS + " must not be negative, got " + workers);
        }
        if (unimprovedSeconds <= 0) {
            throw new ConfigurationException(UNIMPROVED_SECONDS + " must be positive, got " + unimprovedSeconds);
        }
        this.backend = backend;
        this.timeLimitSeconds = timeLimitSeconds;
        this.workers = workers;
        this.unimprovedSeconds = unimprovedSeconds;
    }

    public static SolverSettings defaults() {
        return new SolverSettings(DEFAULT_BACKEND, DEFAULT_TIME_LIMIT_SECONDS, DEFAULT_WORKERS,
            DEFAULT_UNIMPROVED_SECONDS);
    }

    public static SolverSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static SolverSettings fromEnvironment(Map<String, String> env) {
        String backendName = getEnv(env, BACKEND, DEFAULT_BACKEND.name());
        SolverBackend backend;
        try {
            backend = SolverBackend.valueOf(backendName.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(BACKEND + " must be one of CP_SAT, TIMEFOLD, got " + backendName, e);
        }
        return new SolverSettings(
            backend,
            parseLong(env, TIME_LIMIT_SECONDS, DEFAULT_TIME_LIMIT_SECONDS),
            parseInt(env, WORKERS, DEFAULT_WORKERS),
            parseLong(env, UNIMPROVED_SECONDS, DEFAULT_UNIMPROVED_SECONDS));
    }

    /**
     * Fresh adapter per call, as the allocator expects.
     */
    public Supplier<SolverAdapter> adapterSupplier() {
        return () -> backend.createAdapter(this);
    }

    private static int parseInt(Map<String, String> env, String name, int defaultValue) {
        long value = parseLong(env, name, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ConfigurationException(name + " is out of range, got " + value, e);
        }
    }

    private static long parseLong(Map<String, String> env, String name, long defaultValue) {
        String value = getEnv(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String getEnv(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    // Getters
    public SolverBackend getBackend() { return backend; }
    public long getTimeLimitSeconds() { return timeLimitSeconds; }
    public int getWorkers() { return workers; }
    public long getUnimprovedSeconds() { return unimprovedSeconds; }

    @Override
    public String toString() {
        return "SolverSettings{" + backend + ", limit=" + timeLimitSeconds + "s, workers=" + workers
            + ", unimproved=" + unimprovedSeconds + "s}";
    }
}
