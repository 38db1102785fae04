package com.example.proctorstream.config;

import com.example.proctorstream.ws.ProctorWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping proctoringWebSocketMapping(ProctorWebSocketHandler handler) {
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of("/ws/proctoring", handler), -1);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
