package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PivotType {
    USER_ID("user_id"),
    DEVICE_ID("device_id"),
    VENDOR_ID("vendor_id"),
    ACTOR_HANDLE("actor_handle"),
    DOMAIN("domain"),
    IPV4("ipv4"),
    IPV6("ipv6"),
    URL("url"),
    EMAIL("email"),
    CVE("cve"),
    MD5("md5"),
    SHA1("sha1"),
    SHA256("sha256");

    private final String code;

    PivotType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PivotType fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim().toLowerCase();
        for (PivotType type : values()) {
            if (type.code.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown pivot type: " + code);
    }
}
