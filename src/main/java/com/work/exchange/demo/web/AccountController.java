package com.work.exchange.demo.web;

import com.work.exchange.core.account.AccountRegistry;
import com.work.exchange.core.model.Account;
import com.work.exchange.demo.web.dto.AccountIdResponse;
import com.work.exchange.demo.web.dto.AccountView;
import com.work.exchange.demo.web.dto.SignatureLookupRequest;
import com.work.exchange.demo.web.dto.TemporaryAccountRequest;
import com.work.exchange.demo.web.dto.UnlockAccountRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 账户注册表的 REST 入口，与 offer 接口互不依赖。
 */
@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final AccountRegistry accountRegistry;

    public AccountController(AccountRegistry accountRegistry) {
        this.accountRegistry = accountRegistry;
    }

    @PostMapping
    public ResponseEntity<AccountIdResponse> create(@RequestHeader(OfferController.CALLER_HEADER) String caller) {
        return ResponseEntity.status(HttpStatus.CREATED).body(idOf(accountRegistry.create(caller)));
    }

    @PostMapping("/temporary")
    public ResponseEntity<AccountIdResponse> createTemporary(@RequestHeader(OfferController.CALLER_HEADER) String caller,
                                                             @Validated @RequestBody TemporaryAccountRequest req) {
        String accountId = accountRegistry.createTemporary(caller, req.getIdentityHash());
        return ResponseEntity.status(HttpStatus.CREATED).body(idOf(accountId));
    }

    @PostMapping("/unlock")
    public ResponseEntity<Void> unlock(@RequestHeader(OfferController.CALLER_HEADER) String caller,
                                       @Validated @RequestBody UnlockAccountRequest req) {
        accountRegistry.unlockTemporary(caller, req.getIdentityPreimage(), req.getNewOwner(), req.getPasswordSignature());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/by-signature")
    public ResponseEntity<AccountIdResponse> bySignature(@Validated @RequestBody SignatureLookupRequest req) {
        return ResponseEntity.ok(idOf(accountRegistry.getAccountIdFromSignature(req.getMessageHash(), req.getSignature())));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountView> get(@PathVariable String accountId) {
        return accountRegistry.find(accountId)
                .map(a -> ResponseEntity.ok(toView(a)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static AccountIdResponse idOf(String accountId) {
        AccountIdResponse resp = new AccountIdResponse();
        resp.setAccountId(accountId);
        return resp;
    }

    private static AccountView toView(Account a) {
        AccountView v = new AccountView();
        v.setAccountId(a.getAccountId());
        v.setOwner(a.getOwner());
        v.setIdentityHash(a.getIdentityHash());
        v.setController(a.getController());
        v.setTemporary(a.isTemporary());
        return v;
    }
}
