package com.hookrelay.exception;

import lombok.Getter;

@Getter
public class UnsupportedProviderException extends HookRejectedException {

    private final String serviceId;

    public UnsupportedProviderException(String serviceId) {
        super("Unsupported Webhook Type / Provider: " + serviceId);
        this.serviceId = serviceId;
    }
}
