package my.budgetcoach.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record GoalPlanRequest(
		@NotNull Double targetAmount,
		@Schema(description = "Calendar deadline; takes precedence over monthsFromNow.")
		LocalDate deadline,
		@Schema(description = "Deadline as a number of months from today.")
		Integer monthsFromNow,
		@NotNull Double currentMonthlySurplus,
		Double currentSavings,
		@Size(max = 2000) String context
) {
}
