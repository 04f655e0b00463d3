package com.example.roster.engine;

/**
 * Entry point of the scheduler. Stateless; every call works on its own run, so
 * independent requests may be planned concurrently.
 */
public class AssignmentEngine {

    private final ShiftCatalog catalog;
    private final SchedulingPolicy policy;

    public AssignmentEngine(ShiftCatalog catalog, SchedulingPolicy policy) {
        this.catalog = catalog;
        this.policy = policy;
    }

    public SchedulingRun newRun(SchedulingRequest request) {
        return new SchedulingRun(request, catalog, policy);
    }

    public CoveragePlan plan(SchedulingRequest request) {
        return newRun(request).execute();
    }

    public ShiftCatalog getCatalog() {
        return catalog;
    }

    public SchedulingPolicy getPolicy() {
        return policy;
    }
}
