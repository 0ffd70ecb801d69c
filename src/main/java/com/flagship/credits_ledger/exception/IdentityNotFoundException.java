package com.flagship.credits_ledger.exception;

import lombok.Getter;

@Getter
public class IdentityNotFoundException extends NotFoundException {

    private final String provider;
    private final String providerUserId;

    public IdentityNotFoundException(String provider, String providerUserId) {
        super(String.format("User mapping not found for %s user %s", provider, providerUserId));
        this.provider = provider;
        this.providerUserId = providerUserId;
    }
}
