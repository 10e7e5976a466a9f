package my.budgetcoach.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rule-of-thumb spending ceilings, expressed as a share of income per category.
 */
public record BudgetBenchmarks(double targetSavingsRate, Map<String, Double> categoryCeilings) {
	public static final double DEFAULT_TARGET_SAVINGS_RATE = 0.20d;

	public BudgetBenchmarks {
		Map<String, Double> normalized = new LinkedHashMap<>();
		if (categoryCeilings != null) {
			categoryCeilings.forEach((category, ceiling) -> {
				if (category != null && !category.isBlank() && ceiling != null) {
					normalized.put(category.trim().toLowerCase(Locale.ROOT), ceiling);
				}
			});
		}
		categoryCeilings = Collections.unmodifiableMap(normalized);
	}

	public static BudgetBenchmarks defaults() {
		return new BudgetBenchmarks(DEFAULT_TARGET_SAVINGS_RATE, defaultCeilings());
	}

	public static Map<String, Double> defaultCeilings() {
		Map<String, Double> ceilings = new LinkedHashMap<>();
		ceilings.put("rent", 0.30d);
		ceilings.put("transport", 0.15d);
		ceilings.put("dining", 0.10d);
		ceilings.put("subscriptions", 0.05d);
		ceilings.put("taxes", 0.15d);
		return ceilings;
	}

	public Double ceilingFor(String category) {
		if (category == null) {
			return null;
		}
		return categoryCeilings.get(category.trim().toLowerCase(Locale.ROOT));
	}
}
