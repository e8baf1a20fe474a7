package com.libragraph.cadence.core.support;

import com.libragraph.cadence.core.credential.ClientConfig;
import com.libragraph.cadence.core.oauth.TokenEndpointClient;
import com.libragraph.cadence.core.oauth.TokenResponse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/** Scripted token endpoint: answers queued responses in order and records each call. */
public class FakeTokenEndpoint implements TokenEndpointClient {

    private final Deque<Supplier<TokenResponse>> script = new ArrayDeque<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeTokenEndpoint respond(TokenResponse response) {
        script.add(() -> response);
        return this;
    }

    public FakeTokenEndpoint respond(Supplier<TokenResponse> response) {
        script.add(response);
        return this;
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public TokenResponse exchangeCode(ClientConfig client, String code, String redirectUri) {
        calls.add("exchange:" + code);
        return next();
    }

    @Override
    public TokenResponse refresh(ClientConfig client, String refreshToken) {
        calls.add("refresh:" + refreshToken);
        return next();
    }

    private synchronized TokenResponse next() {
        Supplier<TokenResponse> response = script.poll();
        if (response == null) {
            throw new AssertionError("Unexpected token endpoint call");
        }
        return response.get();
    }
}
