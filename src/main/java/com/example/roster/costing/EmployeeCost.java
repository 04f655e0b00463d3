package com.example.roster.costing;

import java.math.BigDecimal;

public record EmployeeCost(Long employeeId, BigDecimal hours, BigDecimal cost, int assignments) {
}
