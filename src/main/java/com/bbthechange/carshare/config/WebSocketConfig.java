package com.bbthechange.carshare.config;

import com.bbthechange.carshare.websocket.RentalChannelHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String CHANNEL_PATH = "/ws";

    private final RentalChannelHandler rentalChannelHandler;

    public WebSocketConfig(RentalChannelHandler rentalChannelHandler) {
        this.rentalChannelHandler = rentalChannelHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(rentalChannelHandler, CHANNEL_PATH)
                .setAllowedOriginPatterns("*");
    }
}
