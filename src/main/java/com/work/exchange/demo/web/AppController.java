package com.work.exchange.demo.web;

import com.work.exchange.core.model.AppInfo;
import com.work.exchange.core.registry.AppRegistry;
import com.work.exchange.demo.web.dto.AppView;
import com.work.exchange.demo.web.dto.RegisterAppRequest;
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

@RestController
@RequestMapping("/api/v1/apps")
public class AppController {

    private final AppRegistry appRegistry;

    public AppController(AppRegistry appRegistry) {
        this.appRegistry = appRegistry;
    }

    @PostMapping
    public ResponseEntity<AppView> register(@RequestHeader(OfferController.CALLER_HEADER) String caller,
                                            @Validated @RequestBody RegisterAppRequest req) {
        AppInfo app = appRegistry.register(req.getName(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(app));
    }

    @GetMapping("/{name}")
    public ResponseEntity<AppView> get(@PathVariable String name) {
        return ResponseEntity.ok(toView(appRegistry.get(name)));
    }

    private AppView toView(AppInfo app) {
        AppView v = new AppView();
        v.setName(app.getName());
        v.setOwner(app.getOwner());
        v.setHashedName(app.getHashedName());
        return v;
    }
}
