package my.budgetcoach.app.model;

public record GoalRequest(double targetAmount,
						  GoalDeadline deadline,
						  double currentMonthlySurplus,
						  double currentSavings) {
	public GoalRequest(double targetAmount, GoalDeadline deadline, double currentMonthlySurplus) {
		this(targetAmount, deadline, currentMonthlySurplus, 0.0d);
	}
}
