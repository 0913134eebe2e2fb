package com.gauge.controller;

import com.gauge.GaugeTestData;
import com.gauge.model.Gauge;
import com.gauge.model.GaugeStatus;
import com.gauge.repository.GaugeCategoryRepository;
import com.gauge.repository.GaugeRepository;
import com.gauge.repository.IdentifierSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface: status codes, problem details and the X-Actor header.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GaugeSetControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private GaugeRepository gaugeRepository;

    @Autowired
    private GaugeCategoryRepository categoryRepository;

    @Autowired
    private IdentifierSequenceRepository sequenceRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private GaugeTestData data;

    @BeforeEach
    void setUp() {
        data = new GaugeTestData(jdbcTemplate, categoryRepository, sequenceRepository, gaugeRepository);
        data.reset();
    }

    private String pairBody(Gauge go, Gauge noGo) {
        return "{\"goGaugeId\": " + go.getId() + ", \"noGoGaugeId\": " + noGo.getId() + "}";
    }

    /**
     * Test 1: Pairing returns 201 with the new set and its composite state
     */
    @Test
    void testPairReturnsCreatedSet() throws Exception {
        Gauge go = data.spare();
        Gauge noGo = data.spare();

        mockMvc.perform(post("/sets/pair")
                .header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content(pairBody(go, noGo)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.setId").value("SP0100"))
            .andExpect(jsonPath("$.complete").value(true))
            .andExpect(jsonPath("$.goGauge.externalId").value("SP0100A"))
            .andExpect(jsonPath("$.noGoGauge.suffix").value("B"))
            .andExpect(jsonPath("$.compositeStatus.status").value("available"))
            .andExpect(jsonPath("$.seal").value("unsealed"));

        mockMvc.perform(get("/sets/SP0100/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].action").value("paired_from_spares"))
            .andExpect(jsonPath("$[0].actorRef").value("user-7"))
            .andExpect(jsonPath("$[0].metadata.goGaugeId").value(go.getId()));
    }

    /**
     * Test 2: Conflicts map to 409 problem details with code and field
     */
    @Test
    void testAlreadyPairedIsConflict() throws Exception {
        Gauge go = data.spare();
        Gauge noGo = data.spare();
        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(go, noGo)))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(go, data.spare())))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_PAIRED"))
            .andExpect(jsonPath("$.field").value("setId"))
            .andExpect(jsonPath("$.actual").value("SP0100"));
    }

    /**
     * Test 2b: Replace through one set's URL cannot touch a member of another set
     */
    @Test
    void testReplaceChecksSetInPath() throws Exception {
        Gauge go = data.spare();
        Gauge noGo = data.spare();
        Gauge otherGo = data.spare();
        Gauge otherNoGo = data.spare();
        Gauge replacement = data.spare();
        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(go, noGo)))
            .andExpect(jsonPath("$.setId").value("SP0100"));
        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(otherGo, otherNoGo)))
            .andExpect(jsonPath("$.setId").value("SP0101"));

        mockMvc.perform(post("/sets/SP0100/replace").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"existingGaugeId\": " + otherGo.getId() + ", \"replacementGaugeId\": "
                    + replacement.getId() + ", \"reason\": \"damaged\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("NOT_IN_SET"))
            .andExpect(jsonPath("$.expected").value("SP0100"))
            .andExpect(jsonPath("$.actual").value("SP0101"));

        mockMvc.perform(get("/sets/SP0101"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.goGauge.id").value(otherGo.getId()))
            .andExpect(jsonPath("$.goGauge.externalId").value("SP0101A"));

        mockMvc.perform(post("/sets/SP0100/replace").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"existingGaugeId\": " + go.getId() + ", \"replacementGaugeId\": "
                    + replacement.getId() + ", \"reason\": \"damaged\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.goGauge.id").value(replacement.getId()));
    }

    /**
     * Test 3: Other rule violations map to 422, unknown sets to 404
     */
    @Test
    void testValidationAndNotFound() throws Exception {
        Gauge go = data.spare(GaugeTestData.STANDARD, GaugeTestData.HALF_INCH_2A);
        Gauge noGo = data.spare(GaugeTestData.STANDARD, GaugeTestData.HALF_INCH_3A);

        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(go, noGo)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("SPEC_MISMATCH"));

        mockMvc.perform(get("/sets/NOPE"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("GAUGE_NOT_FOUND"));

        mockMvc.perform(post("/sets/NOPE/retire").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content("{\"reason\": \"gone\"}"))
            .andExpect(status().isNotFound());
    }

    /**
     * Test 4: Writes without X-Actor are rejected
     */
    @Test
    void testActorHeaderRequired() throws Exception {
        mockMvc.perform(post("/sets/pair")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(data.spare(), data.spare())))
            .andExpect(status().isBadRequest());
    }

    /**
     * Test 5: Unpair, status cascade and compatibility through HTTP
     */
    @Test
    void testLifecycleEndpoints() throws Exception {
        Gauge go = data.spare();
        Gauge noGo = data.spare();

        mockMvc.perform(get("/sets/compatibility").param("go", go.getId().toString()).param("noGo", noGo.getId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(post("/sets/pair").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content(pairBody(go, noGo)))
            .andExpect(status().isCreated());

        mockMvc.perform(post("/gauges/" + go.getId() + "/status").header("X-Actor", "user-7")
                .contentType(MediaType.APPLICATION_JSON).content("{\"status\": \"out_of_service\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cascaded").value(true))
            .andExpect(jsonPath("$.affectedGaugeIds", hasSize(2)));

        mockMvc.perform(get("/sets/SP0100"))
            .andExpect(jsonPath("$.compositeStatus.status").value("out_of_service"))
            .andExpect(jsonPath("$.compositeStatus.canCheckout").value(false));

        data.withStatus(noGo.getId(), GaugeStatus.CHECKED_OUT);
        mockMvc.perform(post("/sets/SP0100/unpair").header("X-Actor", "user-7"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("CHECKED_OUT"));

        data.withStatus(noGo.getId(), GaugeStatus.AVAILABLE);
        mockMvc.perform(post("/sets/SP0100/unpair").header("X-Actor", "user-7"))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/gauges/spares").param("categoryId", String.valueOf(GaugeTestData.STANDARD)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void testNextIdSuggestion() throws Exception {
        mockMvc.perform(get("/sets/next-id").param("categoryId", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.setId").value("SP0100"));

        mockMvc.perform(get("/sets/next-id").param("categoryId", "99"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("CONFIGURATION"));
    }

    /**
     * Test 6: Registration endpoints
     */
    @Test
    void testRegistration() throws Exception {
        mockMvc.perform(post("/gauges/spares")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"categoryId\": 1, \"serialNumber\": \"T-1\", "
                    + "\"spec\": {\"size\": \".500-20\", \"threadClass\": \"2A\", \"form\": \"UN\", \"type\": \"plug\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.spare").value(true));

        mockMvc.perform(post("/gauges")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"categoryId\": 7, \"serialNumber\": \"C-1\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.externalId").value("CA0001"));
    }
}
