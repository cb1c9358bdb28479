package com.example.persession.services;

import com.example.persession.models.LoginResponse;
import com.example.persession.models.LoginStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LoginEvaluatorTest {

    private static final String LOGIN_URL = "https://example.com/login";

    @Mock
    private RequestSender sender;

    private LoginEvaluator loginEvaluator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        loginEvaluator = new LoginEvaluator(sender);
    }

    @Test
    void emptyUrlIsNotLoggedInWithoutAnyRequest() {
        assertThat(loginEvaluator.isLoggedIn("")).isFalse();
        assertThat(loginEvaluator.isLoggedIn(null)).isFalse();

        verifyNoInteractions(sender);
    }

    @Test
    void foundMeansLoggedIn() {
        when(sender.send(any(), anyBoolean())).thenReturn(ResponseEntity.status(HttpStatus.FOUND).build());

        assertThat(loginEvaluator.isLoggedIn(LOGIN_URL)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 301, 303, 307, 308, 401, 500})
    void anyOtherStatusMeansNotLoggedIn(int status) {
        when(sender.send(any(), anyBoolean())).thenReturn(ResponseEntity.status(status).build());

        assertThat(loginEvaluator.isLoggedIn(LOGIN_URL)).isFalse();
    }

    @Test
    void probeIsAGetWithRedirectsDisabled() {
        when(sender.send(any(), anyBoolean())).thenReturn(ResponseEntity.ok().build());

        loginEvaluator.isLoggedIn(LOGIN_URL);

        ArgumentCaptor<ClientRequest> request = ArgumentCaptor.forClass(ClientRequest.class);
        verify(sender).send(request.capture(), eq(false));
        assertThat(request.getValue().method()).isEqualTo(HttpMethod.GET);
        assertThat(request.getValue().url()).isEqualTo(URI.create(LOGIN_URL));
    }

    @Test
    void loginPostsThenProbesTheSameUrl() {
        ResponseEntity<String> postResponse = ResponseEntity.ok("welcome");
        when(sender.send(any(), eq(true))).thenReturn(postResponse);
        when(sender.send(any(), eq(false))).thenReturn(ResponseEntity.status(HttpStatus.FOUND).build());
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("user", "alice");
        form.add("password", "secret");

        LoginResponse response = loginEvaluator.login(LOGIN_URL, form, null);

        assertThat(response.getLoginStatus()).isEqualTo(LoginStatus.SUCCESS);
        assertThat(response.getResponse()).isSameAs(postResponse);
        assertThat(response.getBody()).isEqualTo("welcome");

        ArgumentCaptor<ClientRequest> requests = ArgumentCaptor.forClass(ClientRequest.class);
        verify(sender, times(2)).send(requests.capture(), anyBoolean());
        List<ClientRequest> sent = requests.getAllValues();
        assertThat(sent.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.get(0).url()).isEqualTo(URI.create(LOGIN_URL));
        assertThat(sent.get(1).method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.get(1).url()).isEqualTo(URI.create(LOGIN_URL));
    }

    @Test
    void loginFailsWhenProbeIsNotARedirect() {
        when(sender.send(any(), anyBoolean())).thenReturn(ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("nope"));

        LoginResponse response = loginEvaluator.login(LOGIN_URL, new LinkedMultiValueMap<>(), null);

        assertThat(response.getLoginStatus()).isEqualTo(LoginStatus.FAILURE);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void extraHeadersGoOnTheLoginPost() {
        when(sender.send(any(), anyBoolean())).thenReturn(ResponseEntity.ok().build());
        HttpHeaders extra = new HttpHeaders();
        extra.set("X-CSRF-Token", "t0k3n");

        loginEvaluator.login(LOGIN_URL, new LinkedMultiValueMap<>(), extra);

        ArgumentCaptor<ClientRequest> request = ArgumentCaptor.forClass(ClientRequest.class);
        verify(sender).send(request.capture(), eq(true));
        assertThat(request.getValue().headers().getFirst("X-CSRF-Token")).isEqualTo("t0k3n");
    }
}
