package my.budgetcoach.app.service;

import my.budgetcoach.app.dto.GoalPlanDto;
import my.budgetcoach.app.dto.GoalPlanRequest;
import my.budgetcoach.app.model.GoalDeadline;
import my.budgetcoach.app.model.GoalPlan;
import my.budgetcoach.app.model.GoalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class GoalAdvisorService {
	private static final Logger logger = LoggerFactory.getLogger(GoalAdvisorService.class);

	private final GoalsPlanner goalsPlanner;
	private final FinanceNarrativeService narrativeService;

	public GoalAdvisorService(GoalsPlanner goalsPlanner, FinanceNarrativeService narrativeService) {
		this.goalsPlanner = goalsPlanner;
		this.narrativeService = narrativeService;
	}

	public GoalPlanDto plan(GoalPlanRequest request) {
		if (request == null || request.targetAmount() == null || request.currentMonthlySurplus() == null) {
			throw new InvalidInputException("targetAmount and currentMonthlySurplus are required");
		}
		GoalRequest goal = new GoalRequest(
				request.targetAmount(),
				toDeadline(request),
				request.currentMonthlySurplus(),
				request.currentSavings() == null ? 0.0d : request.currentSavings()
		);
		GoalPlan plan = goalsPlanner.plan(goal);
		logger.debug("Goal planned (monthsRemaining={}, feasible={}).", plan.monthsRemaining(), plan.feasible());
		Narrative narrative = narrativeService.describeGoal(plan, goal.targetAmount(), goal.currentMonthlySurplus(),
				request.context());
		return new GoalPlanDto(plan, narrative.text(), narrative.source());
	}

	private GoalDeadline toDeadline(GoalPlanRequest request) {
		if (request.deadline() != null) {
			return GoalDeadline.on(request.deadline());
		}
		if (request.monthsFromNow() != null) {
			return GoalDeadline.inMonths(request.monthsFromNow());
		}
		throw new InvalidDeadlineException("deadline or monthsFromNow is required");
	}
}
