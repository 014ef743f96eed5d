package com.vibecoding.karmadadashboard.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/livez")
    public String livez() {
        return "ok";
    }

    @GetMapping("/readyz")
    public String readyz() {
        return "ok";
    }
}
