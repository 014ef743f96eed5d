package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.service.PorchProxyService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Porch API 프록시. 응답은 upstream 그대로 (envelope 없음)
 */
@RestController
@RequestMapping("/api/v1/mgmt/porch")
@RequiredArgsConstructor
public class PorchController {

    private final PorchProxyService porchProxyService;

    @RequestMapping(value = "/repository", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<byte[]> repositories(
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        return porchProxyService.repositories(request, body);
    }

    @RequestMapping(value = "/repository/{name}", method = {RequestMethod.GET, RequestMethod.PUT, RequestMethod.DELETE})
    public ResponseEntity<byte[]> repository(
        @PathVariable String name,
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        return porchProxyService.repository(name, request, body);
    }

    @RequestMapping(value = "/packagerevision", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<byte[]> packageRevisions(
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        return porchProxyService.packageRevisions(request, body);
    }

    @RequestMapping(value = "/packagerevision/{name}", method = {RequestMethod.GET, RequestMethod.PUT, RequestMethod.DELETE})
    public ResponseEntity<byte[]> packageRevision(
        @PathVariable String name,
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        return porchProxyService.packageRevision(name, request, body);
    }

    @RequestMapping(value = "/packagerevisionresources/{name}", method = {RequestMethod.GET, RequestMethod.PUT})
    public ResponseEntity<byte[]> packageRevisionResources(
        @PathVariable String name,
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        return porchProxyService.packageRevisionResources(name, request, body);
    }
}
