package com.work.exchange.demo.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.exchange.core.account.AccountRegistry;
import com.work.exchange.core.clock.SequenceLedgerClock;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.demo.escrow.TokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AccountControllerTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x2222222222222222222222222222222222222222";
    private static final String TOKEN = "0x5555555555555555555555555555555555555555";
    private static final String IDENTITY_HASH = "0x" + "ab".repeat(32);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        AccountRegistry accounts = new AccountRegistry(new OfferIdGenerator(), SequenceLedgerClock.manual(1L));
        mvc = MockMvcBuilders
                .standaloneSetup(new AccountController(accounts), new TokenController(new TokenLedger()))
                .setControllerAdvice(new ExchangeExceptionHandler())
                .build();
    }

    @Test
    public void create_then_read_account() throws Exception {
        String body = mvc.perform(post("/api/v1/accounts").header("X-Caller", ALICE))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String accountId = objectMapper.readTree(body).get("accountId").asText();

        mvc.perform(get("/api/v1/accounts/" + accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value(ALICE))
                .andExpect(jsonPath("$.temporary").value(false));
        mvc.perform(post("/api/v1/accounts").header("X-Caller", ALICE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("account already exists"));
    }

    @Test
    public void temporary_account_is_controlled_by_caller() throws Exception {
        String body = mvc.perform(post("/api/v1/accounts/temporary").header("X-Caller", BOB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identityHash\":\"" + IDENTITY_HASH + "\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String accountId = objectMapper.readTree(body).get("accountId").asText();

        mvc.perform(get("/api/v1/accounts/" + accountId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.controller").value(BOB))
                .andExpect(jsonPath("$.identityHash").value(IDENTITY_HASH))
                .andExpect(jsonPath("$.temporary").value(true));
    }

    @Test
    public void unknown_account_and_bad_input() throws Exception {
        mvc.perform(get("/api/v1/accounts/0x0000000000000000"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/v1/accounts/temporary").header("X-Caller", BOB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"identityHash\":\"0x1234\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/v1/accounts/by-signature")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageHash\":\"" + IDENTITY_HASH + "\",\"signature\":\"0x00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid signature"));
    }

    @Test
    public void demo_token_mint_and_balance() throws Exception {
        mvc.perform(post("/api/v1/demo/tokens/mint")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + TOKEN + "\",\"to\":\"" + ALICE + "\",\"amount\":1000}"))
                .andExpect(status().isNoContent());
        mvc.perform(post("/api/v1/demo/tokens/approve").header("X-Caller", ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + TOKEN + "\",\"spender\":\"" + BOB + "\",\"amount\":10}"))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/v1/demo/tokens/" + TOKEN + "/balances/" + ALICE))
                .andExpect(status().isOk())
                .andExpect(content().string("1000"));
    }
}
