package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseActions;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CentralAuthTokenVerifierTest {

    private MockRestServiceServer central;
    private CentralAuthTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        central = MockRestServiceServer.bindTo(restTemplate).build();
        verifier = new CentralAuthTokenVerifier(restTemplate, "http://central/");
    }

    @Test
    void user_wrapped_response_is_accepted() {
        expectMe().andRespond(withSuccess("{\"user\":{\"id\":\"u-1\",\"username\":\"alice\"}}",
                MediaType.APPLICATION_JSON));

        AuthenticatedUser user = verifier.verify("tok");

        assertThat(user.getUserId()).isEqualTo("u-1");
        assertThat(user.getUsername()).isEqualTo("alice");
        central.verify();
    }

    @Test
    void bare_user_response_is_accepted_and_username_falls_back_to_id() {
        expectMe().andRespond(withSuccess("{\"id\":\"u-2\"}", MediaType.APPLICATION_JSON));

        AuthenticatedUser user = verifier.verify("tok");

        assertThat(user.getUserId()).isEqualTo("u-2");
        assertThat(user.getUsername()).isEqualTo("u-2");
    }

    @Test
    void rejected_token_is_an_authentication_failure() {
        expectMe().andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> verifier.verify("tok"))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.AUTHENTICATION);
    }

    @Test
    void response_without_user_id_is_an_authentication_failure() {
        expectMe().andRespond(withSuccess("{\"user\":{\"username\":\"ghost\"}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> verifier.verify("tok"))
                .isInstanceOf(RealtimeException.class)
                .hasMessage("Central auth returned no user id");
    }

    @Test
    void blank_token_never_reaches_central() {
        assertThatThrownBy(() -> verifier.verify(" "))
                .extracting("kind").isEqualTo(FailureKind.AUTHENTICATION);

        central.verify();
    }

    private ResponseActions expectMe() {
        return central.expect(requestTo("http://central/api/auth/me"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok"));
    }
}
