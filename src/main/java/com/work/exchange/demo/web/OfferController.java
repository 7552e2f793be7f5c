package com.work.exchange.demo.web;

import com.work.exchange.core.OrderbookFacade;
import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.model.OfferMembers;
import com.work.exchange.core.model.PrepareOfferCommand;
import com.work.exchange.core.model.SettlementResult;
import com.work.exchange.demo.web.dto.DataIdsRequest;
import com.work.exchange.demo.web.dto.OfferIdResponse;
import com.work.exchange.demo.web.dto.OfferMembersView;
import com.work.exchange.demo.web.dto.OfferView;
import com.work.exchange.demo.web.dto.PrepareOfferRequest;
import com.work.exchange.demo.web.dto.SettlementView;
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
 * orderbook 的 REST 适配层：调用方身份由 X-Caller 头携带，鉴权全部在 orderbook 内完成。
 */
@RestController
@RequestMapping("/api/v1/offers")
public class OfferController {

    static final String CALLER_HEADER = "X-Caller";

    private final OrderbookFacade facade;

    public OfferController(OrderbookFacade facade) {
        this.facade = facade;
    }

    @PostMapping
    public ResponseEntity<OfferIdResponse> prepare(@RequestHeader(CALLER_HEADER) String caller,
                                                   @Validated @RequestBody PrepareOfferRequest req) {
        String args = req.getEscrowArgs() == null ? "0x" : req.getEscrowArgs();
        PrepareOfferCommand cmd = new PrepareOfferCommand(
                req.getProvider(),
                req.getConsumer(),
                new Escrow(req.getEscrowHandler(), req.getEscrowSelector(), args),
                req.getDataIds());
        OfferIdResponse resp = new OfferIdResponse();
        resp.setOfferId(facade.prepare(caller, cmd));
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @PostMapping("/{offerId}/data-ids")
    public ResponseEntity<Void> addDataIds(@RequestHeader(CALLER_HEADER) String caller,
                                           @PathVariable String offerId,
                                           @Validated @RequestBody DataIdsRequest req) {
        facade.addDataIds(caller, offerId, req.getDataIds());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{offerId}/order")
    public ResponseEntity<Void> order(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String offerId) {
        facade.order(caller, offerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{offerId}/cancel")
    public ResponseEntity<Void> cancel(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String offerId) {
        facade.cancel(caller, offerId);
        return ResponseEntity.noContent().build();
    }

    /**
     * escrow 失败时仍返回 200，body 中 settled=false。
     */
    @PostMapping("/{offerId}/settle")
    public ResponseEntity<SettlementView> settle(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String offerId) {
        SettlementResult result = facade.settle(caller, offerId);
        SettlementView v = new SettlementView();
        v.setOfferId(result.getOfferId());
        v.setSettled(result.isSettled());
        v.setReceipt(result.getReceipt());
        v.setReason(result.getFailureReason());
        return ResponseEntity.ok(v);
    }

    @PostMapping("/{offerId}/reject")
    public ResponseEntity<Void> reject(@RequestHeader(CALLER_HEADER) String caller, @PathVariable String offerId) {
        facade.reject(caller, offerId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{offerId}")
    public ResponseEntity<OfferView> get(@PathVariable String offerId) {
        return ResponseEntity.ok(toView(facade.getOffer(offerId)));
    }

    @GetMapping("/{offerId}/members")
    public ResponseEntity<OfferMembersView> members(@PathVariable String offerId) {
        OfferMembers members = facade.getOfferMembers(offerId);
        OfferMembersView v = new OfferMembersView();
        v.setProviderOwner(members.getProviderOwner());
        v.setConsumer(members.getConsumer());
        return ResponseEntity.ok(v);
    }

    private OfferView toView(Offer o) {
        OfferView v = new OfferView();
        v.setId(o.getId());
        v.setProvider(o.getProvider());
        v.setConsumer(o.getConsumer());
        v.setEscrowHandler(o.getEscrow().getHandler());
        v.setEscrowSelector(o.getEscrow().getSelector());
        v.setEscrowArgs(o.getEscrow().getArgs());
        v.setDataIds(o.getDataIds());
        v.setAt(o.getAt());
        v.setUntil(o.getUntil());
        v.setStatus(o.getStatus().name());
        return v;
    }
}
