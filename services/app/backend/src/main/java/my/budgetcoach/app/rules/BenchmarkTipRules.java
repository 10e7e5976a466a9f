package my.budgetcoach.app.rules;

import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.BudgetReport;
import my.budgetcoach.app.model.CategoryShare;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Advice tips comparing spending against rule-of-thumb benchmarks.
 * Unlike red flags these are suggestions and do not affect the report.
 */
public final class BenchmarkTipRules {
	public static final int MAX_TIPS = 6;

	private BenchmarkTipRules() {
	}

	public static List<String> evaluate(BudgetReport report, BudgetBenchmarks benchmarks) {
		if (report == null || benchmarks == null) {
			return List.of();
		}
		List<String> tips = new ArrayList<>();
		if (report.income() > 0.0d) {
			for (CategoryShare share : report.categoryShares()) {
				Double ceiling = benchmarks.ceilingFor(share.category());
				if (ceiling != null && share.shareOfIncome().isAbove(ceiling)) {
					tips.add(String.format(Locale.ROOT, "%s takes %s of income, above the %s benchmark; look for ways to bring it down.",
							share.category(), percent(share.shareOfIncome().value()), percent(ceiling)));
				}
			}
		}
		if (report.savingsRate().isBelow(benchmarks.targetSavingsRate())) {
			tips.add(String.format(Locale.ROOT, "Work the savings rate up towards %s and automate a transfer on payday.",
					percent(benchmarks.targetSavingsRate())));
		}
		if (report.surplus() < 0.0d) {
			tips.add("Spending is above income; pause non-essential purchases until the gap is closed.");
		}
		return tips.size() > MAX_TIPS ? List.copyOf(tips.subList(0, MAX_TIPS)) : List.copyOf(tips);
	}

	private static String percent(double fraction) {
		return String.format(Locale.ROOT, "%.0f%%", fraction * 100.0d);
	}
}
