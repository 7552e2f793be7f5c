package com.work.exchange.demo.web;

import com.work.exchange.core.OrderbookFacade;
import com.work.exchange.core.event.OfferEvent;
import com.work.exchange.demo.web.dto.OfferEventView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * poll-only 的事件 feed：调用方记住最后一个 seq，下次以 afterSeq 继续拉取。
 */
@RestController
@RequestMapping("/api/v1/offers/events")
public class OfferEventController {

    private final OrderbookFacade facade;

    public OfferEventController(OrderbookFacade facade) {
        this.facade = facade;
    }

    @GetMapping
    public ResponseEntity<List<OfferEventView>> list(@RequestParam(value = "afterSeq", required = false) Long afterSeq,
                                                     @RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 50 : limit;
        List<OfferEvent> rows = facade.listEvents(afterSeq, l);
        List<OfferEventView> out = new ArrayList<>(rows.size());
        for (OfferEvent e : rows) {
            OfferEventView v = new OfferEventView();
            v.setSeq(e.getSeq());
            v.setType(e.getType().getEventName());
            v.setOfferId(e.getOfferId());
            v.setBy(e.getBy());
            v.setAt(e.getAt());
            v.setData(e.getData());
            out.add(v);
        }
        return ResponseEntity.ok(out);
    }
}
