package com.egress.bean;

import com.egress.exception.UnsupportedCountryException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Countries the provider can be asked for.
 */
public enum ProxyCountry {
    US("us"),
    UK("uk"),
    JP("jp"),
    DE("de"),
    FR("fr"),
    CA("ca");

    private final String code;

    ProxyCountry(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ProxyCountry fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new UnsupportedCountryException(code);
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedCountryException(code));
    }
}
