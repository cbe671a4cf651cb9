package com.bbthechange.carshare.config;

import com.bbthechange.carshare.service.AuthService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates telematics clients on /car/** from the car token issued by /car/register.
 * Only applies to car endpoints, so a car token never reaches rider endpoints.
 */
@Component
public class CarSessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(CarSessionAuthenticationFilter.class);

    public static final String VIN_ATTRIBUTE = "vin";
    private static final String CAR_PATH_PREFIX = "/car/";
    private static final String CAR_REGISTER_PATH = "/car/register";

    private final AuthService authService;

    public CarSessionAuthenticationFilter(AuthService authService) {
        this.authService = authService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith(CAR_PATH_PREFIX) || path.equals(CAR_REGISTER_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith(JwtAuthenticationFilter.BEARER_PREFIX)) {
            String token = authHeader.substring(JwtAuthenticationFilter.BEARER_PREFIX.length());
            authService.resolveVin(token).ifPresentOrElse(vin -> {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        vin, null, List.of(new SimpleGrantedAuthority("ROLE_CAR")));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                request.setAttribute(VIN_ATTRIBUTE, vin);
            }, () -> logger.warn("Invalid or expired car token for request: {} {}", request.getMethod(), request.getRequestURI()));
        } else {
            logger.debug("No car token on {} {}", request.getMethod(), request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }
}
