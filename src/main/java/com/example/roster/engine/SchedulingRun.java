package com.example.roster.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One execution of the greedy assignment over a fixed snapshot.
 * Phases advance INITIALIZED → EXPANDING → ASSIGNING → FINALIZED; a run executes once.
 */
public final class SchedulingRun {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingRun.class);

    private record Candidate(EmployeeSnapshot employee, int score, long bookedMinutes) {
    }

    // best score first, then least loaded, then lowest id
    private static final Comparator<Candidate> RANKING = Comparator
            .comparingInt(Candidate::score).reversed()
            .thenComparingLong(Candidate::bookedMinutes)
            .thenComparing(c -> c.employee().id());

    private final SchedulingRequest request;
    private final ConstraintEvaluator evaluator;
    private final RequirementExpander expander;
    private final RunLedger ledger;
    private RunPhase phase = RunPhase.INITIALIZED;

    SchedulingRun(SchedulingRequest request, ShiftCatalog catalog, SchedulingPolicy policy) {
        this.request = request;
        this.evaluator = new ConstraintEvaluator(policy);
        this.expander = new RequirementExpander(catalog);
        this.ledger = new RunLedger(catalog, policy.weekStart());
    }

    public RunPhase getPhase() {
        return phase;
    }

    public CoveragePlan execute() {
        if (phase != RunPhase.INITIALIZED) {
            throw new IllegalStateException("Scheduling run already executed (phase " + phase + ")");
        }
        RequestValidator.validate(request);
        logger.info("Scheduling run {}..{} started: {} employees, {} projects, {} existing assignments",
                request.window().start(), request.window().end(), request.employees().size(),
                request.projects().size(), request.existingAssignments().size());

        phase = RunPhase.EXPANDING;
        List<ShiftSlot> slots = expander.expand(request.projects(), request.window());
        request.existingAssignments().forEach(ledger::seed);

        List<EmployeeSnapshot> pool = request.employees().stream()
                .filter(EmployeeSnapshot::active)
                .sorted(Comparator.comparing(EmployeeSnapshot::id))
                .toList();

        phase = RunPhase.ASSIGNING;
        List<Assignment> assignments = new ArrayList<>();
        List<UnfilledSlot> unfilled = new ArrayList<>();
        for (ShiftSlot slot : slots) {
            assignSlot(slot, pool, assignments, unfilled);
        }

        phase = RunPhase.FINALIZED;
        logger.info("Scheduling run {}..{} finished: {} slots, {} assignments, {} short slots",
                request.window().start(), request.window().end(), slots.size(), assignments.size(), unfilled.size());
        return new CoveragePlan(assignments, unfilled);
    }

    private void assignSlot(ShiftSlot slot, List<EmployeeSnapshot> pool,
                            List<Assignment> assignments, List<UnfilledSlot> unfilled) {
        int openSeats = Math.max(0, slot.requiredCount() - ledger.priorCoverageOf(slot));
        if (openSeats == 0) {
            return;
        }

        List<Candidate> candidates = new ArrayList<>();
        for (EmployeeSnapshot employee : pool) {
            if (evaluator.isEligible(employee, slot, ledger)) {
                candidates.add(new Candidate(employee,
                        evaluator.preferenceScore(employee, slot, ledger),
                        ledger.bookedMinutes(employee.id())));
            } else if (logger.isDebugEnabled()) {
                logger.debug("{} {} project {}: employee {} rejected by {}", slot.date(), slot.shiftType(),
                        slot.projectId(), employee.id(), evaluator.firstViolation(employee, slot, ledger).orElse("?"));
            }
        }
        candidates.sort(RANKING);

        int filled = 0;
        for (Candidate candidate : candidates) {
            if (filled >= openSeats) {
                break;
            }
            ledger.book(candidate.employee().id(), slot);
            assignments.add(Assignment.assigned(candidate.employee().id(), slot));
            filled++;
        }

        if (filled < openSeats) {
            unfilled.add(UnfilledSlot.of(slot, openSeats - filled));
            logger.debug("{} {} project {}: {} of {} seats left open", slot.date(), slot.shiftType(),
                    slot.projectId(), openSeats - filled, openSeats);
        }
    }
}
