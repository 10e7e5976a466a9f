package my.budgetcoach.app.dto;

import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.FinanceThresholds;

public record FinanceSettingsDto(FinanceThresholds thresholds,
								 BudgetBenchmarks benchmarks,
								 boolean narrativeLlmEnabled) {
}
