package my.budgetcoach.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record BudgetAnalysisRequest(
		@NotNull Double income,
		@NotNull Map<String, Double> expenses,
		@Schema(description = "Optional liquid savings balance; when absent the monthly surplus is used for runway.")
		Double liquidSavings,
		@Schema(description = "Optional free-text question passed to the narrative generator.")
		@Size(max = 2000) String context
) {
}
