package my.budgetcoach.app.model;

/**
 * Red-flag thresholds. Shares and rates are fractions in [0, 1].
 */
public record FinanceThresholds(double lowSavingsRate,
								double concentrationShare,
								double emergencyFundMonths) {
	public static final double DEFAULT_LOW_SAVINGS_RATE = 0.10d;
	public static final double DEFAULT_CONCENTRATION_SHARE = 0.40d;
	public static final double DEFAULT_EMERGENCY_FUND_MONTHS = 3.0d;

	public static FinanceThresholds defaults() {
		return new FinanceThresholds(DEFAULT_LOW_SAVINGS_RATE, DEFAULT_CONCENTRATION_SHARE, DEFAULT_EMERGENCY_FUND_MONTHS);
	}
}
