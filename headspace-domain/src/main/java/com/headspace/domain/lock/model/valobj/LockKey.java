package com.headspace.domain.lock.model.valobj;

import com.google.common.hash.Hashing;
import com.headspace.types.enums.LockNamespaceEnum;

import java.nio.charset.StandardCharsets;

/**
 * 锁键：命名空间 + 实体键，均在 int4 范围内。
 */
public record LockKey(int namespace, int key) {

    public static LockKey of(LockNamespaceEnum namespace, long entityId) {
        if (namespace == null) {
            throw new IllegalArgumentException("Lock namespace cannot be null");
        }
        if (entityId < Integer.MIN_VALUE || entityId > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Entity id out of int4 range: " + entityId);
        }
        return new LockKey(namespace.getCode(), (int) entityId);
    }

    /**
     * 字符串实体键取 SHA-256 前 4 字节作为有符号 int32。
     */
    public static LockKey fromString(LockNamespaceEnum namespace, String entityKey) {
        if (namespace == null || entityKey == null) {
            throw new IllegalArgumentException("Lock namespace and key cannot be null");
        }
        int hashed = Hashing.sha256().hashString(entityKey, StandardCharsets.UTF_8).asInt();
        return new LockKey(namespace.getCode(), hashed);
    }

    @Override
    public String toString() {
        return namespace + ":" + key;
    }
}
