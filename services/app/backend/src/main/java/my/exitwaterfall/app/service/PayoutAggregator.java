package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.model.WaterfallPayout;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the accounts into payouts. Option strike cost is netted against gross proceeds and the
 * result floored at zero; whether the options are in the money is not checked.
 */
public class PayoutAggregator {
	private static final int EQUITY_SCALE = 6;

	List<WaterfallPayout> aggregate(WaterfallLedger ledger, WaterfallConfig config) {
		boolean deductStrike = !Boolean.FALSE.equals(config.deductOptionStrike());
		BigDecimal totalAllocated = BigDecimal.valueOf(ledger.totalFullyDilutedShares());
		List<WaterfallPayout> payouts = new ArrayList<>();
		for (ShareholderAccount account : ledger.accounts()) {
			ShareholderSummary summary = account.summary();
			BigDecimal strikeCost = deductStrike ? optionStrikeCost(ledger, summary) : BigDecimal.ZERO;
			BigDecimal total = Amounts.floorAtZero(account.gross().subtract(strikeCost));
			BigDecimal invested = Amounts.safe(summary.totalInvested());
			BigDecimal multiple = invested.signum() > 0
					? Amounts.ratio(total, invested, Amounts.RATIO_SCALE)
					: BigDecimal.ZERO.setScale(Amounts.RATIO_SCALE);
			payouts.add(new WaterfallPayout(
					summary.shareholderId(),
					summary.shareholderName(),
					summary.role(),
					Amounts.money(account.carveOut()),
					Amounts.money(account.preference()),
					Amounts.money(account.participation()),
					Amounts.money(strikeCost),
					Amounts.money(total),
					Amounts.money(invested),
					multiple,
					Amounts.ratio(BigDecimal.valueOf(summary.fullyDilutedShares()), totalAllocated, EQUITY_SCALE)
			));
		}
		return payouts;
	}

	static BigDecimal optionStrikeCost(WaterfallLedger ledger, ShareholderSummary summary) {
		BigDecimal cost = BigDecimal.ZERO;
		for (Map.Entry<String, Long> pool : summary.optionsByPool().entrySet()) {
			Round round = ledger.round(pool.getKey());
			if (round == null || round.strikePrice() == null || pool.getValue() == null) {
				continue;
			}
			cost = cost.add(round.strikePrice().multiply(BigDecimal.valueOf(pool.getValue())));
		}
		return cost;
	}
}
