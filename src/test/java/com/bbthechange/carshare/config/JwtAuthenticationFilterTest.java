package com.bbthechange.carshare.config;

import com.bbthechange.carshare.service.AuthService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Authentication filter Tests")
class JwtAuthenticationFilterTest {

    @Mock
    private AuthService authService;

    @Mock
    private FilterChain filterChain;

    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        response = new MockHttpServletResponse();
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private static MockHttpServletRequest request(String method, String path, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Nested
    @DisplayName("Rider token filter")
    class RiderFilter {

        private JwtAuthenticationFilter filter;

        @BeforeEach
        void setUp() {
            filter = new JwtAuthenticationFilter(authService);
        }

        @Test
        void doFilterInternal_ValidRiderToken_SetsClientRoleAndAttribute() throws ServletException, IOException {
            // Given
            MockHttpServletRequest request = request("GET", "/cars", "Bearer rider-token");
            when(authService.resolveClientId("rider-token")).thenReturn(Optional.of("client-1"));

            // When
            filter.doFilterInternal(request, response, filterChain);

            // Then
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            assertThat(authentication.getPrincipal()).isEqualTo("client-1");
            assertThat(authentication.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_CLIENT");
            assertThat(request.getAttribute(JwtAuthenticationFilter.CLIENT_ID_ATTRIBUTE)).isEqualTo("client-1");
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void doFilterInternal_RejectedToken_ContinuesUnauthenticated() throws ServletException, IOException {
            MockHttpServletRequest request = request("GET", "/cars", "Bearer stale-token");
            when(authService.resolveClientId("stale-token")).thenReturn(Optional.empty());

            filter.doFilterInternal(request, response, filterChain);

            assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
            assertThat(request.getAttribute(JwtAuthenticationFilter.CLIENT_ID_ATTRIBUTE)).isNull();
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void doFilterInternal_NoHeader_DoesNotConsultAuthService() throws ServletException, IOException {
            MockHttpServletRequest request = request("GET", "/cars", null);

            filter.doFilterInternal(request, response, filterChain);

            verifyNoInteractions(authService);
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void shouldNotFilter_SkipsPublicAndCarPaths() {
            assertThat(filter.shouldNotFilter(request("POST", "/register", null))).isTrue();
            assertThat(filter.shouldNotFilter(request("POST", "/login", null))).isTrue();
            assertThat(filter.shouldNotFilter(request("GET", "/car/commands", null))).isTrue();
            assertThat(filter.shouldNotFilter(request("POST", "/rentals/start", null))).isFalse();
        }
    }

    @Nested
    @DisplayName("Car token filter")
    class CarFilter {

        private CarSessionAuthenticationFilter filter;

        @BeforeEach
        void setUp() {
            filter = new CarSessionAuthenticationFilter(authService);
        }

        @Test
        void doFilterInternal_ValidCarToken_SetsCarRoleAndVin() throws ServletException, IOException {
            MockHttpServletRequest request = request("GET", "/car/commands", "Bearer car-token");
            when(authService.resolveVin("car-token")).thenReturn(Optional.of("VIN-001"));

            filter.doFilterInternal(request, response, filterChain);

            assertThat(SecurityContextHolder.getContext().getAuthentication().getAuthorities())
                    .extracting(Object::toString).containsExactly("ROLE_CAR");
            assertThat(request.getAttribute(CarSessionAuthenticationFilter.VIN_ATTRIBUTE)).isEqualTo("VIN-001");
        }

        @Test
        void doFilterInternal_RiderTokenOnCarPath_LeavesRequestUnauthenticated() throws ServletException, IOException {
            MockHttpServletRequest request = request("POST", "/car/ack", "Bearer rider-token");
            when(authService.resolveVin("rider-token")).thenReturn(Optional.empty());

            filter.doFilterInternal(request, response, filterChain);

            assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
            verify(authService, never()).resolveClientId(any());
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void shouldNotFilter_OnlyGuardsCarPathsExceptRegister() {
            assertThat(filter.shouldNotFilter(request("POST", "/car/register", null))).isTrue();
            assertThat(filter.shouldNotFilter(request("GET", "/cars", null))).isTrue();
            assertThat(filter.shouldNotFilter(request("POST", "/car/heartbeat", null))).isFalse();
        }
    }

    @Nested
    @DisplayName("Entry point")
    class EntryPoint {

        @Test
        void commence_WithBearerToken_ReportsTokenInvalid() throws IOException {
            new JwtAuthenticationEntryPoint().commence(request("GET", "/cars", "Bearer old"), response, null);

            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("TOKEN_INVALID");
        }

        @Test
        void commence_WithoutToken_ReportsAuthenticationRequired() throws IOException {
            new JwtAuthenticationEntryPoint().commence(request("GET", "/cars", null), response, null);

            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("AUTHENTICATION_REQUIRED");
        }
    }
}
