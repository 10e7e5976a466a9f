package my.budgetcoach.app.dto;

import my.budgetcoach.app.model.GoalPlan;

public record GoalPlanDto(GoalPlan plan,
						  String narrative,
						  String narrativeSource) {
}
