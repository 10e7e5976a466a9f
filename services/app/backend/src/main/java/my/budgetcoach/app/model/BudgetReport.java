package my.budgetcoach.app.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record BudgetReport(
		double income,
		double totalExpenses,
		@Schema(description = "Income minus total expenses; negative when spending exceeds income.")
		double surplus,
		@Schema(description = "Surplus divided by income; undefined when income is zero.")
		Ratio savingsRate,
		@Schema(description = "Months of expenses covered by liquid savings or surplus; undefined when there are no expenses.")
		Ratio emergencyFundMonths,
		List<String> redFlags,
		List<CategoryShare> categoryShares,
		List<String> topCategories
) {
	public BudgetReport {
		redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
		categoryShares = categoryShares == null ? List.of() : List.copyOf(categoryShares);
		topCategories = topCategories == null ? List.of() : List.copyOf(topCategories);
	}

	public boolean hasRedFlags() {
		return !redFlags.isEmpty();
	}
}
