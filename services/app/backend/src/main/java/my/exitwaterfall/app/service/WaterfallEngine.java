package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.LiquidationPreference;
import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.model.WaterfallPayout;
import my.exitwaterfall.app.model.WaterfallResult;
import my.exitwaterfall.app.service.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Distributes exit proceeds over a cap table: M&amp;A adjustments, carve-out, liquidation
 * preferences, pro-rata catch-up, then per-shareholder aggregation.
 * <p>
 * Stateless; every call works on its own {@link WaterfallLedger}. Inconsistent references in the
 * input are skipped and reported in {@link WaterfallResult#diagnostics()}, invalid values are
 * rejected with {@link IllegalArgumentException}.
 */
@Service
public class WaterfallEngine {
	private static final Logger logger = LoggerFactory.getLogger(WaterfallEngine.class);

	private final WaterfallInputValidator validator = new WaterfallInputValidator();
	private final CapTableSummarizer summarizer = new CapTableSummarizer();
	private final ProceedsAdjustmentCalculator adjustmentCalculator = new ProceedsAdjustmentCalculator();
	private final CarveOutDistributor carveOutDistributor = new CarveOutDistributor();
	private final PreferenceStackResolver preferenceStackResolver = new PreferenceStackResolver();
	private final ProRataDistributor proRataDistributor = new ProRataDistributor();
	private final PayoutAggregator payoutAggregator = new PayoutAggregator();

	public WaterfallResult calculate(CapTable capTable,
									 BigDecimal exitValuation,
									 List<LiquidationPreference> preferences,
									 WaterfallConfig config) {
		WaterfallConfig resolvedConfig = config == null ? WaterfallConfig.defaults() : config;
		List<LiquidationPreference> resolvedPreferences = preferences == null ? List.of() : preferences;
		List<String> errors = validator.validate(capTable, exitValuation, resolvedPreferences, resolvedConfig);
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Invalid waterfall input: " + String.join("; ", errors));
		}

		Map<String, ShareholderSummary> summaries = summarizer.summarize(capTable);
		WaterfallLedger ledger = new WaterfallLedger(capTable, summaries, exitValuation);

		adjustmentCalculator.apply(ledger, resolvedConfig);
		BigDecimal effectiveProceeds = ledger.remaining();
		logger.debug("Distributing {} (exit {}) over {} shareholders", effectiveProceeds, exitValuation, summaries.size());

		carveOutDistributor.distribute(ledger, resolvedConfig);
		preferenceStackResolver.resolve(ledger, resolvedPreferences, resolvedConfig);
		proRataDistributor.distribute(ledger);
		List<WaterfallPayout> payouts = payoutAggregator.aggregate(ledger, resolvedConfig);

		return new WaterfallResult(
				Amounts.money(exitValuation),
				Amounts.money(effectiveProceeds),
				ledger.steps(),
				payouts,
				ledger.conversionDecisions(),
				Amounts.money(ledger.unallocated()),
				ledger.diagnostics()
		);
	}
}
