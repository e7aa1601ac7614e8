package com.example.gatekeeper.authz.filter;

import com.example.gatekeeper.auth.context.AuthenticatedPrincipal;
import com.example.gatekeeper.authz.annotation.RequiresPermission;
import com.example.gatekeeper.authz.model.AuthorizationRequest;
import com.example.gatekeeper.authz.service.AuthorizationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PermissionAuthorizationFilterTest {

    @Mock
    private RequestMappingHandlerMapping handlerMapping;

    @Mock
    private AuthorizationService authorizationService;

    private PermissionAuthorizationFilter filter;
    private AtomicInteger chainCalls;
    private WebFilterChain chain;

    private final AuthenticatedPrincipal principal =
            new AuthenticatedPrincipal("u1", "acme", "s1", "j1", "10.0.0.9", "junit");

    @BeforeEach
    void setUp() {
        filter = new PermissionAuthorizationFilter(handlerMapping, authorizationService, new ObjectMapper()
                .findAndRegisterModules());
        chainCalls = new AtomicInteger();
        chain = exchange -> {
            chainCalls.incrementAndGet();
            return Mono.empty();
        };
    }

    static class TestController {

        @RequiresPermission(resource = "audit_log", action = "read")
        public void verify() {
        }

        @RequiresPermission(resource = "project", action = "update", resourceIdVariable = "projectId")
        public void update() {
        }

        public void open() {
        }
    }

    private void handler(String methodName) throws NoSuchMethodException {
        HandlerMethod method = new HandlerMethod(new TestController(), TestController.class.getMethod(methodName));
        when(handlerMapping.getHandler(any())).thenReturn(Mono.<Object>just(method));
    }

    private MockServerWebExchange authenticatedExchange() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/test"));
        exchange.getAttributes().put(AuthenticatedPrincipal.EXCHANGE_ATTRIBUTE, principal);
        return exchange;
    }

    @Test
    @DisplayName("should pass through when no handler matches")
    void shouldPassWithoutHandler() {
        when(handlerMapping.getHandler(any())).thenReturn(Mono.empty());

        StepVerifier.create(filter.filter(authenticatedExchange(), chain)).verifyComplete();

        assertThat(chainCalls).hasValue(1);
        verifyNoInteractions(authorizationService);
    }

    @Test
    @DisplayName("should pass through handlers without the annotation")
    void shouldPassUnannotatedHandler() throws Exception {
        handler("open");

        StepVerifier.create(filter.filter(authenticatedExchange(), chain)).verifyComplete();

        assertThat(chainCalls).hasValue(1);
        verifyNoInteractions(authorizationService);
    }

    @Test
    @DisplayName("should reject annotated handlers without a principal")
    void shouldRejectWithoutPrincipal() throws Exception {
        handler("verify");
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/test"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(chainCalls).hasValue(0);
    }

    @Test
    @DisplayName("should continue when the permission is granted")
    void shouldAllowGrantedPermission() throws Exception {
        handler("verify");
        when(authorizationService.isAuthorized(any())).thenReturn(Mono.just(true));

        StepVerifier.create(filter.filter(authenticatedExchange(), chain)).verifyComplete();

        assertThat(chainCalls).hasValue(1);
        ArgumentCaptor<AuthorizationRequest> captor = ArgumentCaptor.forClass(AuthorizationRequest.class);
        verify(authorizationService).isAuthorized(captor.capture());
        AuthorizationRequest request = captor.getValue();
        assertThat(request.principalId()).isEqualTo("u1");
        assertThat(request.organizationId()).isEqualTo("acme");
        assertThat(request.resourceType()).isEqualTo("audit_log");
        assertThat(request.action()).isEqualTo("read");
        assertThat(request.resourceId()).isNull();
        assertThat(request.context())
                .containsEntry("client_ip", "10.0.0.9")
                .containsEntry("user_agent", "junit");
    }

    @Test
    @DisplayName("should take the resource id from the path variable")
    void shouldUsePathVariable() throws Exception {
        handler("update");
        when(authorizationService.isAuthorized(any())).thenReturn(Mono.just(true));
        MockServerWebExchange exchange = authenticatedExchange();
        exchange.getAttributes().put(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("projectId", "p-42"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        ArgumentCaptor<AuthorizationRequest> captor = ArgumentCaptor.forClass(AuthorizationRequest.class);
        verify(authorizationService).isAuthorized(captor.capture());
        assertThat(captor.getValue().resourceId()).isEqualTo("p-42");
        assertThat(captor.getValue().resource()).isEqualTo("project:p-42");
        assertThat(chainCalls).hasValue(1);
    }

    @Test
    @DisplayName("should answer 403 with the required permission when denied")
    void shouldForbidDeniedPermission() throws Exception {
        handler("verify");
        when(authorizationService.isAuthorized(any())).thenReturn(Mono.just(false));
        MockServerWebExchange exchange = authenticatedExchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(exchange.getResponse().getBodyAsString().block())
                .contains("\"code\":\"PERMISSION_DENIED\"")
                .contains("\"required\":\"audit_log:read\"");
        assertThat(chainCalls).hasValue(0);
    }
}
