package my.exitwaterfall.app.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Capitalization of one shareholder: shares per share class, options per pool (keyed by the
 * pool's round id) and the cash invested across all rounds.
 */
public record ShareholderSummary(
		String shareholderId,
		String shareholderName,
		ShareholderRole role,
		Map<String, Long> sharesByClass,
		Map<String, Long> optionsByPool,
		long totalShares,
		long totalOptions,
		BigDecimal totalInvested
) {
	public ShareholderSummary {
		sharesByClass = sharesByClass == null ? Map.of() : Map.copyOf(sharesByClass);
		optionsByPool = optionsByPool == null ? Map.of() : Map.copyOf(optionsByPool);
	}

	public long fullyDilutedShares() {
		return totalShares + totalOptions;
	}

	public long sharesOf(String shareClass) {
		return shareClass == null ? 0L : sharesByClass.getOrDefault(shareClass, 0L);
	}
}
