package my.budgetcoach.app.service;

import my.budgetcoach.app.model.BudgetReport;
import my.budgetcoach.app.model.CategoryShare;
import my.budgetcoach.app.model.FinanceThresholds;
import my.budgetcoach.app.model.Ratio;
import my.budgetcoach.app.rules.BudgetFigures;
import my.budgetcoach.app.rules.RedFlagRule;
import my.budgetcoach.app.rules.RedFlagRules;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a monthly income and expense breakdown into a {@link BudgetReport}.
 * <p>
 * The analyzer is stateless: every call reads only its arguments and returns a new report.
 */
@Service
public class BudgetAnalyzer {
	static final int TOP_CATEGORY_LIMIT = 3;

	private final FinanceThresholds thresholds;
	private final List<RedFlagRule> rules;

	@Autowired
	public BudgetAnalyzer(FinanceThresholds thresholds) {
		this(thresholds, RedFlagRules.defaults());
	}

	public BudgetAnalyzer(FinanceThresholds thresholds, List<RedFlagRule> rules) {
		this.thresholds = thresholds == null ? FinanceThresholds.defaults() : thresholds;
		this.rules = rules == null ? RedFlagRules.defaults() : List.copyOf(rules);
	}

	public BudgetReport analyze(double income, Map<String, Double> expenses) {
		return analyze(income, expenses, null);
	}

	/**
	 * @param liquidSavings savings balance to measure runway against; {@code null} uses the monthly surplus
	 */
	public BudgetReport analyze(double income, Map<String, Double> expenses, Double liquidSavings) {
		requireAmount(income, "income");
		Map<String, Double> checked = requireExpenses(expenses);
		if (liquidSavings != null) {
			requireAmount(liquidSavings, "liquidSavings");
		}

		double totalExpenses = 0.0d;
		for (double amount : checked.values()) {
			totalExpenses += amount;
		}
		if (!Double.isFinite(totalExpenses)) {
			throw new InvalidInputException("total expenses exceed the representable range");
		}
		double surplus = income - totalExpenses;
		Ratio savingsRate = income > 0.0d ? Ratio.of(surplus, income) : Ratio.undefined();
		double runwayBalance = liquidSavings == null ? surplus : liquidSavings;
		Ratio emergencyFundMonths = Ratio.of(runwayBalance, totalExpenses);

		BudgetFigures figures = new BudgetFigures(income, checked, totalExpenses, surplus, savingsRate, emergencyFundMonths);
		List<String> redFlags = RedFlagRules.evaluate(rules, figures, thresholds);

		return new BudgetReport(
				income,
				totalExpenses,
				surplus,
				savingsRate,
				emergencyFundMonths,
				redFlags,
				categoryShares(checked, totalExpenses, income),
				topCategories(checked)
		);
	}

	public FinanceThresholds getThresholds() {
		return thresholds;
	}

	private List<CategoryShare> categoryShares(Map<String, Double> expenses, double totalExpenses, double income) {
		List<CategoryShare> shares = new ArrayList<>();
		for (Map.Entry<String, Double> entry : expenses.entrySet()) {
			double amount = entry.getValue();
			shares.add(new CategoryShare(entry.getKey(), amount, Ratio.of(amount, totalExpenses), Ratio.of(amount, income)));
		}
		return shares;
	}

	private List<String> topCategories(Map<String, Double> expenses) {
		// stable sort keeps input order for equal amounts
		return expenses.entrySet().stream()
				.sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
				.limit(TOP_CATEGORY_LIMIT)
				.map(Map.Entry::getKey)
				.toList();
	}

	private Map<String, Double> requireExpenses(Map<String, Double> expenses) {
		if (expenses == null) {
			throw new InvalidInputException("expenses are required");
		}
		Map<String, Double> copy = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : expenses.entrySet()) {
			String category = entry.getKey();
			if (category == null || category.isBlank()) {
				throw new InvalidInputException("expense category must not be blank");
			}
			Double amount = entry.getValue();
			if (amount == null) {
				throw new InvalidInputException("expense '" + category + "' has no amount");
			}
			requireAmount(amount, "expense '" + category + "'");
			copy.put(category, amount);
		}
		return Collections.unmodifiableMap(copy);
	}

	static void requireAmount(double value, String field) {
		if (!Double.isFinite(value)) {
			throw new InvalidInputException(field + " must be a finite number");
		}
		if (value < 0.0d) {
			throw new InvalidInputException(field + " must not be negative");
		}
	}
}
