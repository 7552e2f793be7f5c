package com.work.exchange.demo.escrow;

import com.work.exchange.core.Orderbook;
import com.work.exchange.core.clock.SequenceLedgerClock;
import com.work.exchange.core.config.OrderbookConfig;
import com.work.exchange.core.escrow.EscrowCall;
import com.work.exchange.core.escrow.EscrowHandlerRegistry;
import com.work.exchange.core.escrow.EscrowOutcome;
import com.work.exchange.core.event.OfferEventType;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.OfferMembers;
import com.work.exchange.core.model.OfferStatus;
import com.work.exchange.core.model.PrepareOfferCommand;
import com.work.exchange.core.model.SettlementResult;
import com.work.exchange.core.support.InMemoryAppRegistry;
import com.work.exchange.core.support.InMemoryOfferEventLog;
import com.work.exchange.core.support.InMemoryOfferRepository;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes8;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class TokenTransferEscrowHandlerTest {

    private static final String ESCROW = "0x00000000000000000000000000000000000e5c70";
    private static final String TOKEN = "0x7777777777777777777777777777777777777777";
    private static final String OWNER = "0x1111111111111111111111111111111111111111";
    private static final String CONSUMER = "0x2222222222222222222222222222222222222222";

    private final TokenLedger ledger = new TokenLedger();

    private TokenTransferEscrowHandler handler() {
        return new TokenTransferEscrowHandler(ESCROW, ledger, offerId -> new OfferMembers(OWNER, CONSUMER));
    }

    @Test
    public void selector_matches_abi_encoded_transact_call() {
        Function transact = new Function("transact",
                Arrays.<Type>asList(new Bytes8(new byte[8]), new Address(TOKEN), new Uint256(BigInteger.ONE)),
                Collections.<TypeReference<?>>emptyList());
        String calldata = FunctionEncoder.encode(transact);

        assertEquals(10, TokenTransferEscrowHandler.SELECTOR.length());
        assertEquals(calldata.substring(0, 10), TokenTransferEscrowHandler.SELECTOR);
    }

    @Test
    public void moves_funds_from_consumer_to_provider_owner() throws Exception {
        ledger.mint(TOKEN, CONSUMER, BigInteger.valueOf(100));
        ledger.approve(TOKEN, CONSUMER, ESCROW, BigInteger.valueOf(60));

        EscrowOutcome outcome = handler().attempt(new EscrowCall("0x0000000000000001",
                TokenTransferEscrowHandler.SELECTOR, TokenTransferEscrowHandler.encodeArgs(TOKEN, BigInteger.valueOf(40))));

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getReceipt().startsWith("0x"));
        assertEquals(2 + 64 * 4, outcome.getReceipt().length());
        assertEquals(BigInteger.valueOf(60), ledger.balanceOf(TOKEN, CONSUMER));
        assertEquals(BigInteger.valueOf(40), ledger.balanceOf(TOKEN, OWNER));
        assertEquals(BigInteger.valueOf(20), ledger.allowance(TOKEN, CONSUMER, ESCROW));
    }

    @Test
    public void insufficient_allowance_or_balance_reverts_without_changes() {
        ledger.mint(TOKEN, CONSUMER, BigInteger.valueOf(10));
        ledger.approve(TOKEN, CONSUMER, ESCROW, BigInteger.valueOf(5));
        EscrowCall call = new EscrowCall("0x0000000000000001",
                TokenTransferEscrowHandler.SELECTOR, TokenTransferEscrowHandler.encodeArgs(TOKEN, BigInteger.valueOf(8)));

        IllegalStateException allowance = assertThrows(IllegalStateException.class, () -> handler().attempt(call));
        assertEquals("insufficient allowance", allowance.getMessage());

        ledger.approve(TOKEN, CONSUMER, ESCROW, BigInteger.valueOf(50));
        EscrowCall tooMuch = new EscrowCall("0x0000000000000001",
                TokenTransferEscrowHandler.SELECTOR, TokenTransferEscrowHandler.encodeArgs(TOKEN, BigInteger.valueOf(11)));
        IllegalStateException balance = assertThrows(IllegalStateException.class, () -> handler().attempt(tooMuch));
        assertEquals("insufficient balance", balance.getMessage());

        assertEquals(BigInteger.valueOf(10), ledger.balanceOf(TOKEN, CONSUMER));
        assertEquals(BigInteger.ZERO, ledger.balanceOf(TOKEN, OWNER));
    }

    @Test
    public void unknown_selector_is_a_failure_outcome() {
        EscrowOutcome outcome = handler().attempt(new EscrowCall("0x0000000000000001", "0xdeadbeef", "0x"));

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getReason().startsWith("unknown selector"));
    }

    @Test
    public void settles_an_offer_through_the_orderbook() {
        InMemoryAppRegistry apps = new InMemoryAppRegistry();
        apps.register("weather-data", OWNER);
        InMemoryOfferEventLog events = new InMemoryOfferEventLog();
        EscrowHandlerRegistry registry = new EscrowHandlerRegistry();
        AtomicReference<Orderbook> ref = new AtomicReference<>();
        registry.register(ESCROW, new TokenTransferEscrowHandler(ESCROW, ledger, id -> ref.get().getOfferMembers(id)));
        Orderbook orderbook = new Orderbook(OrderbookConfig.defaultConfig(), new InMemoryOfferRepository(), apps,
                registry, events, new SequenceLedgerClock(1L, true), new OfferIdGenerator());
        ref.set(orderbook);

        ledger.mint(TOKEN, CONSUMER, BigInteger.valueOf(500));
        ledger.approve(TOKEN, CONSUMER, ESCROW, BigInteger.valueOf(500));
        String offerId = orderbook.prepare(OWNER, new PrepareOfferCommand("weather-data", CONSUMER,
                new Escrow(ESCROW, TokenTransferEscrowHandler.SELECTOR, TokenTransferEscrowHandler.encodeArgs(TOKEN, BigInteger.valueOf(300))),
                Arrays.asList("0x00000000000000000000000000000000000000a1", "0x00000000000000000000000000000000000000a2")));
        orderbook.order(OWNER, offerId);

        SettlementResult first = orderbook.settle(CONSUMER, offerId);

        assertTrue(first.isSettled());
        assertEquals(OfferStatus.SETTLED, orderbook.getOffer(offerId).getStatus());
        assertEquals(BigInteger.valueOf(300), ledger.balanceOf(TOKEN, OWNER));
        assertEquals(first.getReceipt(), events.ofType(OfferEventType.OFFER_RECEIPT).get(0).getData());

        // 第二笔报价额度不足：escrow 失败，报价保持 PENDING
        String second = orderbook.prepare(OWNER, new PrepareOfferCommand("weather-data", CONSUMER,
                new Escrow(ESCROW, TokenTransferEscrowHandler.SELECTOR, TokenTransferEscrowHandler.encodeArgs(TOKEN, BigInteger.valueOf(300))),
                Arrays.asList("0x00000000000000000000000000000000000000b1")));
        orderbook.order(OWNER, second);
        SettlementResult failed = orderbook.settle(CONSUMER, second);

        assertFalse(failed.isSettled());
        assertEquals("insufficient allowance", failed.getFailureReason());
        assertEquals(OfferStatus.PENDING, orderbook.getOffer(second).getStatus());
        assertEquals(BigInteger.valueOf(200), ledger.balanceOf(TOKEN, CONSUMER));
    }
}
