package com.clawd.core.exception;

/**
 * A provider adapter cannot express part of a normalized request. Raised while building
 * the native request, before anything is sent.
 */
public class UnsupportedCapabilityException extends ClawdException {

    private final String provider;
    private final String capability;

    public UnsupportedCapabilityException(String provider, String capability, String detail) {
        super("Provider '" + provider + "' does not support " + capability + ": " + detail, false);
        this.provider = provider;
        this.capability = capability;
    }

    public String getProvider() {
        return provider;
    }

    public String getCapability() {
        return capability;
    }
}
