package com.egress.exception;

/**
 * Exception thrown when a country code outside the supported set is requested
 */
public class UnsupportedCountryException extends RuntimeException {

    private final String countryCode;

    public UnsupportedCountryException(String countryCode) {
        super(String.format("Unsupported proxy country '%s' (supported: us, uk, jp, de, fr, ca)", countryCode));
        this.countryCode = countryCode;
    }

    public String getCountryCode() {
        return countryCode;
    }
}
