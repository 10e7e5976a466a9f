package my.budgetcoach.app.rules;

import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.BudgetReport;
import my.budgetcoach.app.model.FinanceThresholds;
import my.budgetcoach.app.service.BudgetAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BenchmarkTipRulesTest {
	private final BudgetAnalyzer analyzer = new BudgetAnalyzer(FinanceThresholds.defaults());

	@Test
	void flagsCategoriesAboveIncomeBenchmarkCaseInsensitively() {
		Map<String, Double> expenses = new LinkedHashMap<>();
		expenses.put("Rent", 1500.0);
		expenses.put("Dining", 200.0);
		BudgetReport report = analyzer.analyze(4000, expenses);

		List<String> tips = BenchmarkTipRules.evaluate(report, BudgetBenchmarks.defaults());

		assertThat(tips).hasSize(1);
		assertThat(tips.get(0)).startsWith("Rent takes 38% of income, above the 30% benchmark");
	}

	@Test
	void suggestsHigherSavingsRateAndClosingTheGap() {
		BudgetReport report = analyzer.analyze(1000, Map.of("groceries", 1100.0));

		List<String> tips = BenchmarkTipRules.evaluate(report, BudgetBenchmarks.defaults());

		assertThat(tips).hasSize(2);
		assertThat(tips.get(0)).contains("20%");
		assertThat(tips.get(1)).contains("Spending is above income");
	}

	@Test
	void noIncomeSkipsCategoryBenchmarks() {
		BudgetReport report = analyzer.analyze(0, Map.of("rent", 500.0));

		List<String> tips = BenchmarkTipRules.evaluate(report, BudgetBenchmarks.defaults());

		assertThat(tips).containsExactly("Spending is above income; pause non-essential purchases until the gap is closed.");
	}

	@Test
	void healthyBudgetHasNoTips() {
		BudgetReport report = analyzer.analyze(5000, Map.of("rent", 1000.0, "groceries", 500.0));

		assertThat(BenchmarkTipRules.evaluate(report, BudgetBenchmarks.defaults())).isEmpty();
	}

	@Test
	void tipsAreCappedAtSix() {
		Map<String, Double> ceilings = new LinkedHashMap<>();
		for (int i = 0; i < 8; i++) {
			ceilings.put("c" + i, 0.01);
		}
		Map<String, Double> expenses = new LinkedHashMap<>();
		for (int i = 0; i < 8; i++) {
			expenses.put("c" + i, 100.0);
		}
		BudgetReport report = analyzer.analyze(1000, expenses);

		List<String> tips = BenchmarkTipRules.evaluate(report, new BudgetBenchmarks(0.2, ceilings));

		assertThat(tips).hasSize(BenchmarkTipRules.MAX_TIPS);
	}
}
