package com.work.exchange.core.support;

import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.model.AppInfo;
import com.work.exchange.core.registry.AppNames;
import com.work.exchange.core.registry.AppRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireValidAppName;

/**
 * 纯内存 app 注册表。app 一经注册不可变更。
 */
public class InMemoryAppRegistry implements AppRegistry {

    private final Map<String, AppInfo> apps = new ConcurrentHashMap<>();

    @Override
    public AppInfo register(String name, String owner) {
        requireValidAppName(name);
        AppInfo app = new AppInfo(name, normalizeAddress(owner, "owner"), AppNames.hash(name));
        if (apps.putIfAbsent(name, app) != null) {
            throw new RegistryException(RegistryException.APP_ALREADY_EXISTS);
        }
        return app;
    }

    @Override
    public boolean exists(String name) {
        return name != null && apps.containsKey(name);
    }

    @Override
    public AppInfo get(String name) {
        AppInfo app = name == null ? null : apps.get(name);
        if (app == null) {
            throw new RegistryException(RegistryException.APP_NOT_FOUND);
        }
        return app;
    }

    @Override
    public boolean isOwner(String name, String identity) {
        AppInfo app = name == null ? null : apps.get(name);
        return app != null && identity != null && app.getOwner().equalsIgnoreCase(identity);
    }
}
