package my.budgetcoach.app.model;

public record CategoryShare(String category,
							double amount,
							Ratio shareOfExpenses,
							Ratio shareOfIncome) {
}
