package my.budgetcoach.app.config;

import my.budgetcoach.app.model.BudgetBenchmarks;
import my.budgetcoach.app.model.FinanceThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class FinanceConfig {
	private static final Logger logger = LoggerFactory.getLogger(FinanceConfig.class);

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public FinanceThresholds financeThresholds(AppProperties properties) {
		AppProperties.Finance.Thresholds raw = properties.finance() == null ? null : properties.finance().thresholds();
		FinanceThresholds thresholds = normalize(raw);
		logger.info("Red-flag thresholds: lowSavingsRate={}, concentrationShare={}, emergencyFundMonths={}.",
				thresholds.lowSavingsRate(), thresholds.concentrationShare(), thresholds.emergencyFundMonths());
		return thresholds;
	}

	@Bean
	public BudgetBenchmarks budgetBenchmarks(AppProperties properties) {
		AppProperties.Finance.Benchmarks raw = properties.finance() == null ? null : properties.finance().benchmarks();
		return normalize(raw);
	}

	static FinanceThresholds normalize(AppProperties.Finance.Thresholds raw) {
		if (raw == null) {
			return FinanceThresholds.defaults();
		}
		return new FinanceThresholds(
				clampFraction(raw.lowSavingsRate(), FinanceThresholds.DEFAULT_LOW_SAVINGS_RATE),
				clampFraction(raw.concentrationShare(), FinanceThresholds.DEFAULT_CONCENTRATION_SHARE),
				clampMonths(raw.emergencyFundMonths(), FinanceThresholds.DEFAULT_EMERGENCY_FUND_MONTHS)
		);
	}

	static BudgetBenchmarks normalize(AppProperties.Finance.Benchmarks raw) {
		if (raw == null) {
			return BudgetBenchmarks.defaults();
		}
		Map<String, Double> ceilings = new LinkedHashMap<>();
		Map<String, Double> configured = raw.categoryCeilings() == null || raw.categoryCeilings().isEmpty()
				? BudgetBenchmarks.defaultCeilings()
				: raw.categoryCeilings();
		configured.forEach((category, ceiling) -> ceilings.put(category, clampFraction(ceiling, 1.0d)));
		return new BudgetBenchmarks(
				clampFraction(raw.targetSavingsRate(), BudgetBenchmarks.DEFAULT_TARGET_SAVINGS_RATE),
				ceilings
		);
	}

	static double clampFraction(Double value, double fallback) {
		double resolved = value == null || !Double.isFinite(value) ? fallback : value;
		if (resolved < 0.0d) {
			return 0.0d;
		}
		return Math.min(resolved, 1.0d);
	}

	static double clampMonths(Double value, double fallback) {
		double resolved = value == null || !Double.isFinite(value) ? fallback : value;
		return Math.max(0.0d, resolved);
	}
}
