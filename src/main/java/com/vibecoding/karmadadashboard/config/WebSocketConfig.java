package com.vibecoding.karmadadashboard.config;

import com.vibecoding.karmadadashboard.terminal.NodeTerminalHandler;
import com.vibecoding.karmadadashboard.terminal.PodTerminalHandler;
import com.vibecoding.karmadadashboard.terminal.TerminalAccessInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PodTerminalHandler podTerminalHandler;
    private final NodeTerminalHandler nodeTerminalHandler;
    private final TerminalAccessInterceptor terminalAccessInterceptor;

    public WebSocketConfig(PodTerminalHandler podTerminalHandler, NodeTerminalHandler nodeTerminalHandler,
                           TerminalAccessInterceptor terminalAccessInterceptor) {
        this.podTerminalHandler = podTerminalHandler;
        this.nodeTerminalHandler = nodeTerminalHandler;
        this.terminalAccessInterceptor = terminalAccessInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(podTerminalHandler, "/api/v1/terminal")
            .addInterceptors(terminalAccessInterceptor)
            .setAllowedOriginPatterns("*");
        registry.addHandler(nodeTerminalHandler, "/api/v1/node-terminal")
            .addInterceptors(terminalAccessInterceptor)
            .setAllowedOriginPatterns("*");
    }
}
