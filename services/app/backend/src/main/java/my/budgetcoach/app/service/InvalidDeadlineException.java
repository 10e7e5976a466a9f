package my.budgetcoach.app.service;

public class InvalidDeadlineException extends FinanceInputException {
	public InvalidDeadlineException(String message) {
		super("invalid_deadline", message);
	}
}
