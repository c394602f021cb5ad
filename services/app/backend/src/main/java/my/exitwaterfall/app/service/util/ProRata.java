package my.exitwaterfall.app.service.util;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Proportional splitting of an amount over weighted keys. Shared by the carve-out, the preference
 * strategies and the catch-up distribution.
 */
public final class ProRata {
	private ProRata() {
	}

	/**
	 * Splits {@code amount} over the keys proportionally to their weight. Returns an empty map when
	 * the weights sum to zero.
	 */
	public static <K> Map<K, BigDecimal> allocate(Map<K, BigDecimal> weights, BigDecimal amount) {
		if (weights == null || weights.isEmpty() || amount == null) {
			return Map.of();
		}
		BigDecimal totalWeight = Amounts.sum(weights.values());
		if (totalWeight.signum() <= 0) {
			return Map.of();
		}
		return scale(weights, amount, totalWeight);
	}

	/**
	 * Multiplies every value by {@code paid / total}. A zero total yields zero for every key.
	 */
	public static <K> Map<K, BigDecimal> scale(Map<K, BigDecimal> values, BigDecimal paid, BigDecimal total) {
		Map<K, BigDecimal> scaled = new LinkedHashMap<>();
		if (values == null) {
			return scaled;
		}
		boolean zeroTotal = total == null || total.signum() == 0;
		for (Map.Entry<K, BigDecimal> entry : values.entrySet()) {
			BigDecimal value = Amounts.safe(entry.getValue());
			if (zeroTotal || value.signum() <= 0) {
				scaled.put(entry.getKey(), Amounts.ZERO);
				continue;
			}
			scaled.put(entry.getKey(), value.multiply(paid).divide(total, Amounts.MATH));
		}
		return scaled;
	}
}
