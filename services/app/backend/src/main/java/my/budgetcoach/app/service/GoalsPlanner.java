package my.budgetcoach.app.service;

import my.budgetcoach.app.model.GoalDeadline;
import my.budgetcoach.app.model.GoalPlan;
import my.budgetcoach.app.model.GoalRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Works out the monthly saving a goal needs and whether the current surplus covers it.
 */
@Service
public class GoalsPlanner {
	private final Clock clock;

	public GoalsPlanner(Clock clock) {
		this.clock = clock == null ? Clock.systemDefaultZone() : clock;
	}

	public GoalPlan plan(GoalRequest request) {
		return plan(request, LocalDate.now(clock));
	}

	public GoalPlan plan(GoalRequest request, LocalDate today) {
		if (request == null) {
			throw new InvalidInputException("goal request is required");
		}
		if (!Double.isFinite(request.targetAmount()) || request.targetAmount() <= 0.0d) {
			throw new InvalidInputException("targetAmount must be a finite number greater than 0");
		}
		if (!Double.isFinite(request.currentMonthlySurplus())) {
			throw new InvalidInputException("currentMonthlySurplus must be a finite number");
		}
		BudgetAnalyzer.requireAmount(request.currentSavings(), "currentSavings");

		LocalDate targetDate = resolveTargetDate(request.deadline(), today);
		int monthsRemaining = monthsUntil(today, targetDate);
		double remainingAmount = Math.max(0.0d, request.targetAmount() - request.currentSavings());
		double requiredMonthlySaving = remainingAmount / monthsRemaining;
		boolean feasible = request.currentMonthlySurplus() >= requiredMonthlySaving;
		double shortfall = Math.max(0.0d, requiredMonthlySaving - request.currentMonthlySurplus());

		return new GoalPlan(monthsRemaining, targetDate, remainingAmount, requiredMonthlySaving, feasible, shortfall);
	}

	static LocalDate resolveTargetDate(GoalDeadline deadline, LocalDate today) {
		if (deadline == null || (deadline.date() == null && deadline.months() == null)) {
			throw new InvalidDeadlineException("deadline is required");
		}
		if (deadline.isCalendarDate()) {
			if (!deadline.date().isAfter(today)) {
				throw new InvalidDeadlineException("deadline " + deadline.date() + " is not in the future");
			}
			return deadline.date();
		}
		if (deadline.months() < 1) {
			throw new InvalidDeadlineException("deadline must be at least 1 month out");
		}
		return today.plusMonths(deadline.months());
	}

	/**
	 * Whole months between the two dates, rounded up. Any future date counts as at least one month.
	 *
	 * @throws InvalidDeadlineException if the distance does not fit in an {@code int}
	 */
	static int monthsUntil(LocalDate today, LocalDate targetDate) {
		long months = ChronoUnit.MONTHS.between(today, targetDate);
		if (today.plusMonths(months).isBefore(targetDate)) {
			months++;
		}
		if (months > Integer.MAX_VALUE) {
			throw new InvalidDeadlineException("deadline " + targetDate + " is too far in the future");
		}
		return (int) Math.max(1L, months);
	}
}
