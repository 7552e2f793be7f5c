package com.work.exchange.demo.web;

import com.work.exchange.demo.escrow.TokenLedger;
import com.work.exchange.demo.web.dto.TokenApproveRequest;
import com.work.exchange.demo.web.dto.TokenMintRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * demo token 账本的操作入口，用于在本地走通 token 转账 escrow 的结算流程。
 */
@RestController
@RequestMapping("/api/v1/demo/tokens")
public class TokenController {

    private final TokenLedger ledger;

    public TokenController(TokenLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping("/mint")
    public ResponseEntity<Void> mint(@Validated @RequestBody TokenMintRequest req) {
        ledger.mint(req.getToken(), req.getTo(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/approve")
    public ResponseEntity<Void> approve(@RequestHeader(OfferController.CALLER_HEADER) String caller,
                                        @Validated @RequestBody TokenApproveRequest req) {
        ledger.approve(req.getToken(), caller, req.getSpender(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{token}/balances/{holder}")
    public ResponseEntity<BigInteger> balanceOf(@PathVariable String token, @PathVariable String holder) {
        return ResponseEntity.ok(ledger.balanceOf(token, holder));
    }
}
