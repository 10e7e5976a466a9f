package my.budgetcoach.app.model;

import java.time.LocalDate;

/**
 * Goal deadline given either as a calendar date or as a number of months from today.
 */
public record GoalDeadline(LocalDate date, Integer months) {
	public static GoalDeadline on(LocalDate date) {
		return new GoalDeadline(date, null);
	}

	public static GoalDeadline inMonths(int months) {
		return new GoalDeadline(null, months);
	}

	public boolean isCalendarDate() {
		return date != null;
	}
}
