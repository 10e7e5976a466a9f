package my.budgetcoach.app.rules;

import my.budgetcoach.app.model.Ratio;

import java.util.Map;

/**
 * Intermediate figures a red-flag rule is evaluated against.
 */
public record BudgetFigures(double income,
							Map<String, Double> expenses,
							double totalExpenses,
							double surplus,
							Ratio savingsRate,
							Ratio emergencyFundMonths) {
}
