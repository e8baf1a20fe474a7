package com.libragraph.cadence.api;

import com.libragraph.cadence.core.credential.MissingCredentialsException;
import com.libragraph.cadence.core.credential.Provider;
import com.libragraph.cadence.core.crypto.DecryptionException;
import com.libragraph.cadence.core.error.ConfigurationException;
import com.libragraph.cadence.core.error.ResourceNotFoundException;
import com.libragraph.cadence.core.error.ValidationException;
import com.libragraph.cadence.core.oauth.ExpiredCredentialsException;
import com.libragraph.cadence.core.oauth.InvalidGrantException;
import com.libragraph.cadence.core.oauth.InvalidStateException;
import com.libragraph.cadence.core.oauth.TokenExchangeException;
import com.libragraph.cadence.core.scheduler.JobConflictException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionMapperTest {

    @Test
    void callerErrorsMapToClientStatuses() {
        assertThat(ApiExceptionMapper.statusFor(new ValidationException("bad", "time"))).isEqualTo(400);
        assertThat(ApiExceptionMapper.statusFor(new InvalidStateException("stale"))).isEqualTo(400);
        assertThat(ApiExceptionMapper.statusFor(new MissingCredentialsException(1, Provider.GOOGLE))).isEqualTo(400);
        assertThat(ApiExceptionMapper.statusFor(new InvalidGrantException("revoked"))).isEqualTo(401);
        assertThat(ApiExceptionMapper.statusFor(new ExpiredCredentialsException("expired"))).isEqualTo(401);
        assertThat(ApiExceptionMapper.statusFor(new ResourceNotFoundException("gone"))).isEqualTo(404);
        assertThat(ApiExceptionMapper.statusFor(new JobConflictException("job_1"))).isEqualTo(409);
    }

    @Test
    void serverErrorsMapTo5xx() {
        assertThat(ApiExceptionMapper.statusFor(new TokenExchangeException("timeout"))).isEqualTo(502);
        assertThat(ApiExceptionMapper.statusFor(new DecryptionException("tampered"))).isEqualTo(500);
        assertThat(ApiExceptionMapper.statusFor(new ConfigurationException("no key"))).isEqualTo(500);
        assertThat(ApiExceptionMapper.statusFor(new IllegalStateException("boom"))).isEqualTo(500);
    }

    @Test
    void validationBodyNamesFields() {
        ValidationException e = new ValidationException(
                "Missing required fields in credentials document: [client_secret]", List.of("client_secret"));

        ErrorResponse body = ApiExceptionMapper.toBody(e, 400);

        assertThat(body.error()).isEqualTo("Validation");
        assertThat(body.message()).contains("client_secret");
        assertThat(body.fields()).containsExactly("client_secret");
    }

    @Test
    void internalErrorsHideDetail() {
        ErrorResponse body = ApiExceptionMapper.toBody(new DecryptionException("key mismatch for tenant 7"), 500);

        assertThat(body.message()).isEqualTo(ApiExceptionMapper.GENERIC_MESSAGE);
        assertThat(body.message()).doesNotContain("tenant 7");
    }
}
