package com.work.exchange.demo.web.dto;

/**
 * app 注册信息。
 */
public class AppView {

    private String name;
    private String owner;
    /** keccak256(name)。 */
    private String hashedName;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getHashedName() {
        return hashedName;
    }

    public void setHashedName(String hashedName) {
        this.hashedName = hashedName;
    }
}
