package my.exitwaterfall.app.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.exitwaterfall.app.AppApplication.class)
@ActiveProfiles("test")
class WaterfallApiIntegrationTest {
	private static final String CAP_TABLE = """
			{
			  "startupName": "Acme",
			  "shareholders": [
			    { "id": "founder", "name": "Founder", "role": "Founder" },
			    { "id": "investor", "name": "Investor", "role": "VC" }
			  ],
			  "rounds": [
			    { "id": "founding", "shareClass": "Ordinary",
			      "investments": [ { "shareholderId": "founder", "amount": 0, "shares": 9000000 } ] },
			    { "id": "series-a", "shareClass": "Series A",
			      "investments": [ { "shareholderId": "investor", "amount": 1000000, "shares": 1000000 } ] }
			  ]
			}
			""";

	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void calculatesNonParticipatingPreference() throws Exception {
		String body = """
				{
				  "capTable": %s,
				  "exitValuation": 2000000,
				  "preferences": [
				    { "roundId": "series-a", "multiple": 1, "type": "Non-Participating", "seniority": 1 }
				  ],
				  "config": { "payoutStructure": "standard" }
				}
				""".formatted(CAP_TABLE);

		mockMvc.perform(post("/api/waterfall")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.payouts[0].shareholderId").value("founder"))
				.andExpect(jsonPath("$.payouts[0].totalPayout").value(1000000.0))
				.andExpect(jsonPath("$.payouts[1].preferencePayout").value(1000000.0))
				.andExpect(jsonPath("$.payouts[1].multiple").value(1.0))
				.andExpect(jsonPath("$.conversionAnalysis[0].decision").value("KEEP_PREFERENCE"))
				.andExpect(jsonPath("$.steps[0].label").value("1/ Liqu Pref Series A"));
	}

	@Test
	void unknownRoundIsReportedAsDiagnostic() throws Exception {
		String body = """
				{
				  "capTable": %s,
				  "exitValuation": 1000,
				  "preferences": [
				    { "roundId": "ghost", "multiple": 1, "type": "Participating", "seniority": 1 }
				  ]
				}
				""".formatted(CAP_TABLE);

		mockMvc.perform(post("/api/waterfall")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.diagnostics[0]").value(containsString("ghost")))
				.andExpect(jsonPath("$.payouts[1].totalPayout").value(100.0));
	}

	@Test
	void negativeExitValuationIsRejected() throws Exception {
		String body = """
				{ "capTable": %s, "exitValuation": -5 }
				""".formatted(CAP_TABLE);

		mockMvc.perform(post("/api/waterfall")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));
	}

	@Test
	void invalidPreferenceIsRejectedWithDetail() throws Exception {
		String body = """
				{
				  "capTable": %s,
				  "exitValuation": 1000,
				  "preferences": [ { "roundId": "series-a", "multiple": 1, "type": "Participating", "seniority": 0 } ]
				}
				""".formatted(CAP_TABLE);

		mockMvc.perform(post("/api/waterfall")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value(containsString("preferences[0].seniority")));
	}

	@Test
	void malformedBodyIsRejected() throws Exception {
		mockMvc.perform(post("/api/waterfall")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{ \"capTable\": "))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Malformed request"));
	}

	@Test
	void unknownPathIsReportedAsNotFound() throws Exception {
		mockMvc.perform(get("/api/waterfall/unknown"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.title").value("Not Found"))
				.andExpect(jsonPath("$.detail").value("Resource not found."))
				.andExpect(jsonPath("$.path").value("/api/waterfall/unknown"));
	}

	@Test
	void validateListsErrorsWithoutCalculating() throws Exception {
		String body = """
				{
				  "capTable": %s,
				  "exitValuation": 1000,
				  "preferences": [ { "roundId": "series-a", "multiple": -1, "type": "Participating", "seniority": 1 } ]
				}
				""".formatted(CAP_TABLE);

		mockMvc.perform(post("/api/waterfall/validate")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.valid").value(false))
				.andExpect(jsonPath("$.errors").value(hasItem("preferences[0].multiple must not be negative")));
	}

	@Test
	void demoScenarioRunsAtRequestedExit() throws Exception {
		mockMvc.perform(get("/api/waterfall/demo").param("exitValuation", "1000000"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.exitValuation").value(1000000.0))
				.andExpect(jsonPath("$.payouts[4].shareholderId").value("vc-one"))
				.andExpect(jsonPath("$.payouts[4].preferencePayout").value(1000000.0));
	}

	@Test
	void demoScenarioUsesBundledExitByDefault() throws Exception {
		mockMvc.perform(get("/api/waterfall/demo"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.exitValuation").value(20000000.0))
				.andExpect(jsonPath("$.payouts[4].preferencePayout").value(5000000.0))
				.andExpect(jsonPath("$.payouts[3].preferencePayout").value(1000000.0));
	}
}
