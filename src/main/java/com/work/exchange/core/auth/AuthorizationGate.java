package com.work.exchange.core.auth;

import com.work.exchange.core.exception.UnauthorizedException;
import com.work.exchange.core.model.Offer;
import com.work.exchange.core.registry.AppRegistry;

import java.util.Locale;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 授权判定：两条谓词都是无副作用的查询，不满足时抛出 {@link UnauthorizedException}。
 */
public class AuthorizationGate {

    private final AppRegistry appRegistry;

    public AuthorizationGate(AppRegistry appRegistry) {
        this.appRegistry = requireNonNull(appRegistry, "appRegistry");
    }

    /**
     * 调用方是 provider app 的 owner。
     */
    public boolean controlsProvider(String caller, String providerApp) {
        return caller != null && appRegistry.isOwner(providerApp, caller);
    }

    public boolean isConsumer(String caller, Offer offer) {
        return caller != null && offer.getConsumer().equals(caller.toLowerCase(Locale.ROOT));
    }

    public void requireProviderControl(String caller, String providerApp) {
        if (!controlsProvider(caller, providerApp)) {
            throw new UnauthorizedException();
        }
    }

    public void requireProviderControl(String caller, Offer offer) {
        requireProviderControl(caller, offer.getProvider());
    }

    public void requireConsumer(String caller, Offer offer) {
        if (!isConsumer(caller, offer)) {
            throw new UnauthorizedException();
        }
    }
}
