package com.work.oracle.core.model;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;

/**
 * 唯一的结算签名账户。所有 nonce 排序都以该账户为作用域。
 * <p>
 * 私钥不进入 core，只由链客户端持有。
 */
public class SettlementAccount {

    private final String address;

    public SettlementAccount(String address) {
        this.address = requireAddress(address, "address");
    }

    public String getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "SettlementAccount{address=" + address + "}";
    }
}
