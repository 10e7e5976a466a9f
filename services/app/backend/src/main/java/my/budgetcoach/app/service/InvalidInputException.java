package my.budgetcoach.app.service;

public class InvalidInputException extends FinanceInputException {
	public InvalidInputException(String message) {
		super("invalid_input", message);
	}
}
