package my.exitwaterfall.app.service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decides how much of each preference claim of one seniority rank is paid from the available
 * proceeds. Implementations never pay more than a claim or, in total, more than is available.
 */
public interface PreferencePayoutStrategy {

	/**
	 * @param claims claims in payment order
	 * @param available proceeds left for this seniority rank
	 * @return amount paid per claim, aligned with {@code claims}
	 */
	List<BigDecimal> resolve(List<BigDecimal> claims, BigDecimal available);
}
