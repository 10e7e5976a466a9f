package my.budgetcoach.app.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

public record GoalPlan(
		@Schema(description = "Whole months until the deadline, rounded up; at least 1.")
		int monthsRemaining,
		LocalDate targetDate,
		@Schema(description = "Target amount minus current savings, never negative.")
		double remainingAmount,
		double requiredMonthlySaving,
		boolean feasible,
		@Schema(description = "Monthly gap between required saving and current surplus; 0 when feasible.")
		double shortfall
) {
}
