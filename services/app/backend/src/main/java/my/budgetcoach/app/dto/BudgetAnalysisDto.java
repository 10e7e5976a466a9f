package my.budgetcoach.app.dto;

import my.budgetcoach.app.model.BudgetReport;

import java.util.List;

public record BudgetAnalysisDto(BudgetReport report,
								List<String> recommendations,
								String narrative,
								String narrativeSource) {
}
