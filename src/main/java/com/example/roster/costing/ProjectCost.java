package com.example.roster.costing;

import java.math.BigDecimal;

public record ProjectCost(Long projectId, String projectName, BigDecimal hours, BigDecimal cost,
                          int assignments, int employeeCount) {
}
