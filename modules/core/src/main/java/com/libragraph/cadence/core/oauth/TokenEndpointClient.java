package com.libragraph.cadence.core.oauth;

import com.libragraph.cadence.core.credential.ClientConfig;

/**
 * Calls a provider's token endpoint. A reply carrying an OAuth {@code error} is
 * returned as-is; transport failures and unreadable replies throw
 * {@link TokenExchangeException}.
 */
public interface TokenEndpointClient {

    TokenResponse exchangeCode(ClientConfig client, String code, String redirectUri);

    TokenResponse refresh(ClientConfig client, String refreshToken);
}
