package com.work.exchange.core.model;

public final class AppInfo {

    private final String name;
    private final String owner;
    private final String hashedName;

    public AppInfo(String name, String owner, String hashedName) {
        this.name = name;
        this.owner = owner;
        this.hashedName = hashedName;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public String getHashedName() {
        return hashedName;
    }
}
