package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.Provider;

/** Where to send the user, and the state value the callback must echo back. */
public record AuthorizationRequest(Provider provider, String authorizationUrl, String state) {

    @Override
    public String toString() {
        return "AuthorizationRequest[provider=" + provider + "]";
    }
}
