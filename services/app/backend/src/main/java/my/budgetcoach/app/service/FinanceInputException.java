package my.budgetcoach.app.service;

public abstract class FinanceInputException extends IllegalArgumentException {
	private final String code;

	protected FinanceInputException(String code, String message) {
		super(message);
		this.code = code;
	}

	public String getCode() {
		return code;
	}
}
