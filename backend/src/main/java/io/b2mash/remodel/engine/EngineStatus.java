package io.b2mash.remodel.engine;

/** Health of the last totals pass: ready means it produced no errors. */
public record EngineStatus(boolean ready, int errorCount, int warningCount, int categories) {}
