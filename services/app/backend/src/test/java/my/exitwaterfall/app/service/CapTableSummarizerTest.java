package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.Investment;
import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.model.Shareholder;
import my.exitwaterfall.app.model.ShareholderRole;
import my.exitwaterfall.app.model.ShareholderSummary;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static my.exitwaterfall.app.service.CapTableFixtures.grant;
import static my.exitwaterfall.app.service.CapTableFixtures.investment;
import static my.exitwaterfall.app.service.CapTableFixtures.pool;
import static my.exitwaterfall.app.service.CapTableFixtures.round;
import static my.exitwaterfall.app.service.CapTableFixtures.shareholder;
import static org.assertj.core.api.Assertions.assertThat;

class CapTableSummarizerTest {
	private final CapTableSummarizer summarizer = new CapTableSummarizer();

	@Test
	void aggregatesSharesOptionsAndInvestmentPerShareholder() {
		CapTable capTable = new CapTable("Acme",
				List.of(round("founding", "Ordinary", investment("alice", 100, 1_000)),
						round("seed", "P1", investment("alice", 50_000, 500), investment("bob", 20_000, 200)),
						round("bridge", "P1", investment("alice", 10_000, 100)),
						pool("pool", "0.5")),
				List.of(shareholder("alice", ShareholderRole.FOUNDER), shareholder("bob", ShareholderRole.ANGEL)),
				List.of(grant("bob", "pool", 300), grant("bob", "pool", 200)));

		Map<String, ShareholderSummary> summaries = summarizer.summarize(capTable);

		assertThat(summaries).containsOnlyKeys("alice", "bob");
		ShareholderSummary alice = summaries.get("alice");
		assertThat(alice.sharesByClass()).containsEntry("Ordinary", 1_000L).containsEntry("P1", 600L);
		assertThat(alice.totalShares()).isEqualTo(1_600L);
		assertThat(alice.totalOptions()).isZero();
		assertThat(alice.totalInvested()).isEqualByComparingTo("60100");

		ShareholderSummary bob = summaries.get("bob");
		assertThat(bob.optionsByPool()).containsEntry("pool", 500L);
		assertThat(bob.fullyDilutedShares()).isEqualTo(700L);
	}

	@Test
	void derivesSharesFromPricePerShareWhenMissing() {
		Round round = new Round("seed", "Seed", "P1",
				List.of(new Investment("alice", new BigDecimal("1000"), null)),
				null, new BigDecimal("3"), null, null, null);
		CapTable capTable = new CapTable("Acme", List.of(round),
				List.of(shareholder("alice", ShareholderRole.FOUNDER)), List.of());

		assertThat(summarizer.summarize(capTable).get("alice").sharesOf("P1")).isEqualTo(333L);
	}

	@Test
	void ignoresEntriesForUnknownShareholdersAndDefaultsRole() {
		CapTable capTable = new CapTable("Acme",
				List.of(round("seed", "P1", investment("ghost", 1_000, 1_000), investment("alice", 1_000, 1_000))),
				List.of(new Shareholder("alice", null, null)),
				List.of(grant("ghost", "pool", 100)));

		Map<String, ShareholderSummary> summaries = summarizer.summarize(capTable);

		assertThat(summaries).containsOnlyKeys("alice");
		assertThat(summaries.get("alice").role()).isEqualTo(ShareholderRole.OTHER);
		assertThat(summaries.get("alice").shareholderName()).isEqualTo("alice");
	}
}
