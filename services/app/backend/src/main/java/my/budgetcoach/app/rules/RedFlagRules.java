package my.budgetcoach.app.rules;

import my.budgetcoach.app.model.FinanceThresholds;
import my.budgetcoach.app.model.Ratio;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The default red-flag rule set. Rules run independently and in declaration order.
 */
public final class RedFlagRules {
	public static final String LOW_SAVINGS_RATE = "Low savings rate.";
	public static final String SPENDING_EXCEEDS_INCOME = "Spending exceeds income.";

	private static final List<RedFlagRule> DEFAULTS = List.of(
			new LowSavingsRateRule(),
			new SpendingExceedsIncomeRule(),
			new CategoryConcentrationRule(),
			new EmergencyFundRule()
	);

	private RedFlagRules() {
	}

	public static List<RedFlagRule> defaults() {
		return DEFAULTS;
	}

	public static List<String> evaluate(List<RedFlagRule> rules, BudgetFigures figures, FinanceThresholds thresholds) {
		List<String> flags = new ArrayList<>();
		for (RedFlagRule rule : rules) {
			rule.evaluate(figures, thresholds).ifPresent(flags::add);
		}
		return List.copyOf(flags);
	}

	public static String concentrationMessage(String category) {
		return "High concentration in " + category + ".";
	}

	public static String emergencyFundMessage(double months) {
		String text = BigDecimal.valueOf(months).stripTrailingZeros().toPlainString();
		return "Emergency fund below " + text + " months.";
	}

	static final class LowSavingsRateRule implements RedFlagRule {
		@Override
		public String id() {
			return "low-savings-rate";
		}

		@Override
		public Optional<String> evaluate(BudgetFigures figures, FinanceThresholds thresholds) {
			if (figures.income() > 0.0d && figures.savingsRate().isBelow(thresholds.lowSavingsRate())) {
				return Optional.of(LOW_SAVINGS_RATE);
			}
			return Optional.empty();
		}
	}

	static final class SpendingExceedsIncomeRule implements RedFlagRule {
		@Override
		public String id() {
			return "spending-exceeds-income";
		}

		@Override
		public Optional<String> evaluate(BudgetFigures figures, FinanceThresholds thresholds) {
			return figures.surplus() < 0.0d ? Optional.of(SPENDING_EXCEEDS_INCOME) : Optional.empty();
		}
	}

	/**
	 * Flags the single largest category when its share of total expenses exceeds the ceiling.
	 * Ties keep the category that comes first in the input.
	 */
	static final class CategoryConcentrationRule implements RedFlagRule {
		@Override
		public String id() {
			return "category-concentration";
		}

		@Override
		public Optional<String> evaluate(BudgetFigures figures, FinanceThresholds thresholds) {
			if (figures.totalExpenses() <= 0.0d) {
				return Optional.empty();
			}
			String largest = null;
			double largestAmount = -1.0d;
			for (Map.Entry<String, Double> entry : figures.expenses().entrySet()) {
				if (entry.getValue() > largestAmount) {
					largest = entry.getKey();
					largestAmount = entry.getValue();
				}
			}
			if (largest == null) {
				return Optional.empty();
			}
			Ratio share = Ratio.of(largestAmount, figures.totalExpenses());
			if (share.isAbove(thresholds.concentrationShare())) {
				return Optional.of(concentrationMessage(largest));
			}
			return Optional.empty();
		}
	}

	static final class EmergencyFundRule implements RedFlagRule {
		@Override
		public String id() {
			return "emergency-fund";
		}

		@Override
		public Optional<String> evaluate(BudgetFigures figures, FinanceThresholds thresholds) {
			if (figures.emergencyFundMonths().isBelow(thresholds.emergencyFundMonths())) {
				return Optional.of(emergencyFundMessage(thresholds.emergencyFundMonths()));
			}
			return Optional.empty();
		}
	}
}
