package com.example.roster.engine;

import java.time.LocalDate;

/**
 * A slot the run could not fully staff. {@code shortfall} is the number of missing employees.
 */
public record UnfilledSlot(Long projectId, LocalDate date, ShiftType shiftType, int shortfall) {

    static UnfilledSlot of(ShiftSlot slot, int shortfall) {
        return new UnfilledSlot(slot.projectId(), slot.date(), slot.shiftType(), shortfall);
    }
}
