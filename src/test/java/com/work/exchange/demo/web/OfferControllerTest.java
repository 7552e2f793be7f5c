package com.work.exchange.demo.web;

import com.work.exchange.core.Orderbook;
import com.work.exchange.core.OrderbookFacade;
import com.work.exchange.core.clock.SequenceLedgerClock;
import com.work.exchange.core.config.OrderbookConfig;
import com.work.exchange.core.escrow.EscrowHandlerRegistry;
import com.work.exchange.core.escrow.EscrowOutcome;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.lock.LocalOrderbookLock;
import com.work.exchange.core.support.InMemoryAppRegistry;
import com.work.exchange.core.support.InMemoryOfferEventLog;
import com.work.exchange.core.support.SimpleNodeIdProvider;
import com.work.exchange.core.support.InMemoryOfferRepository;
import com.work.exchange.core.support.metrics.NoopExchangeMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class OfferControllerTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";
    private static final String CONSUMER = "0x2222222222222222222222222222222222222222";
    private static final String HANDLER = "0x4444444444444444444444444444444444444444";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        InMemoryAppRegistry apps = new InMemoryAppRegistry();
        EscrowHandlerRegistry handlers = new EscrowHandlerRegistry();
        handlers.register(HANDLER, call -> EscrowOutcome.success("0xbeef"));
        InMemoryOfferEventLog events = new InMemoryOfferEventLog();
        Orderbook orderbook = new Orderbook(OrderbookConfig.defaultConfig(), new InMemoryOfferRepository(), apps,
                handlers, events, new SequenceLedgerClock(1L, true), new OfferIdGenerator());
        OrderbookFacade facade = new OrderbookFacade(orderbook, events, new LocalOrderbookLock(),
                Duration.ofSeconds(1), Duration.ofSeconds(30), new SimpleNodeIdProvider(), new NoopExchangeMetrics(), null);

        mvc = MockMvcBuilders
                .standaloneSetup(new OfferController(facade), new OfferEventController(facade), new AppController(apps))
                .setControllerAdvice(new ExchangeExceptionHandler())
                .build();
    }

    private String prepareBody() {
        return "{\"provider\":\"weather-data\",\"consumer\":\"" + CONSUMER + "\","
                + "\"escrowHandler\":\"" + HANDLER + "\",\"escrowSelector\":\"0x12345678\","
                + "\"dataIds\":[\"0x00000000000000000000000000000000000000a1\"]}";
    }

    private String registerAndPrepare() throws Exception {
        mvc.perform(post("/api/v1/apps").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"weather-data\"}"))
                .andExpect(status().isCreated());
        MvcResult result = mvc.perform(post("/api/v1/offers").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON).content(prepareBody()))
                .andExpect(status().isCreated())
                .andReturn();
        mvc.perform(get("/api/v1/apps/weather-data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value(OWNER));
        JsonNode node = objectMapper.readTree(result.getResponse().getContentAsString());
        return node.get("offerId").asText();
    }

    @Test
    public void full_lifecycle_over_http() throws Exception {
        String offerId = registerAndPrepare();

        mvc.perform(post("/api/v1/offers/" + offerId + "/data-ids").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataIds\":[\"0x00000000000000000000000000000000000000a2\"]}"))
                .andExpect(status().isNoContent());
        mvc.perform(post("/api/v1/offers/" + offerId + "/order").header("X-Caller", OWNER))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/v1/offers/" + offerId + "/members"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerOwner").value(OWNER))
                .andExpect(jsonPath("$.consumer").value(CONSUMER));
        mvc.perform(post("/api/v1/offers/" + offerId + "/settle").header("X-Caller", CONSUMER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settled").value(true))
                .andExpect(jsonPath("$.receipt").value("0xbeef"));
        mvc.perform(get("/api/v1/offers/" + offerId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SETTLED"))
                .andExpect(jsonPath("$.dataIds.length()").value(2));
        mvc.perform(get("/api/v1/offers/events").param("afterSeq", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].type").value("OfferSettled"))
                .andExpect(jsonPath("$[1].type").value("OfferReceipt"))
                .andExpect(jsonPath("$[1].data").value("0xbeef"));
    }

    @Test
    public void errors_map_to_http_status_with_stable_message() throws Exception {
        String offerId = registerAndPrepare();

        mvc.perform(post("/api/v1/offers/" + offerId + "/order").header("X-Caller", CONSUMER))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("should have required authority"));
        mvc.perform(post("/api/v1/offers/" + offerId + "/cancel").header("X-Caller", OWNER))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("pending state only"));
        mvc.perform(get("/api/v1/offers/0x0000000000000000"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("offer does not exist"));
        mvc.perform(post("/api/v1/offers/" + offerId + "/data-ids").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"dataIds\":[\"0x12\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid dataId"));
        mvc.perform(post("/api/v1/apps").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"weather-data\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("app already exists"));
        mvc.perform(get("/api/v1/apps/unknown-app"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("app does not exist"));
    }

    @Test
    public void missing_fields_and_caller_are_bad_requests() throws Exception {
        mvc.perform(post("/api/v1/offers").header("X-Caller", OWNER)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"provider\":\"weather-data\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/v1/offers/0x0000000000000000/order"))
                .andExpect(status().isBadRequest());
    }
}
