package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.pkg.PackageResourceList;
import com.vibecoding.karmadadashboard.service.PackageService;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * config.porch.kpt.dev Repository / PackageRev CR
 */
@RestController
@RequestMapping("/api/v1/mgmt/package")
@RequiredArgsConstructor
public class PackageController {

    private static final Logger log = LoggerFactory.getLogger(PackageController.class);

    private final PackageService packageService;

    // ========== Repository ==========

    @GetMapping("/repository")
    public BaseResponse<PackageResourceList> listRepositories() {
        log.info("Listing package repositories");
        return BaseResponse.success(packageService.list(GroupVersionResource.PORCH_REPOSITORY));
    }

    @GetMapping("/repository/{name}")
    public BaseResponse<GenericKubernetesResource> getRepository(@PathVariable String name) {
        return BaseResponse.success(packageService.get(GroupVersionResource.PORCH_REPOSITORY, name));
    }

    @PostMapping("/repository")
    public BaseResponse<GenericKubernetesResource> createRepository(@RequestBody GenericKubernetesResource body) {
        return BaseResponse.success(packageService.create(GroupVersionResource.PORCH_REPOSITORY, body));
    }

    @PutMapping("/repository/{name}")
    public BaseResponse<GenericKubernetesResource> updateRepository(
        @PathVariable String name,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(packageService.update(GroupVersionResource.PORCH_REPOSITORY, name, body));
    }

    @DeleteMapping("/repository/{name}")
    public BaseResponse<Map<String, String>> deleteRepository(@PathVariable String name) {
        return BaseResponse.success(packageService.delete(GroupVersionResource.PORCH_REPOSITORY, name));
    }

    // ========== PackageRev ==========

    @GetMapping("/packagerev")
    public BaseResponse<PackageResourceList> listPackageRevs() {
        log.info("Listing package revisions");
        return BaseResponse.success(packageService.list(GroupVersionResource.PORCH_PACKAGE_REV));
    }

    @GetMapping("/packagerev/{name}")
    public BaseResponse<GenericKubernetesResource> getPackageRev(@PathVariable String name) {
        return BaseResponse.success(packageService.get(GroupVersionResource.PORCH_PACKAGE_REV, name));
    }

    @PostMapping("/packagerev")
    public BaseResponse<GenericKubernetesResource> createPackageRev(@RequestBody GenericKubernetesResource body) {
        return BaseResponse.success(packageService.create(GroupVersionResource.PORCH_PACKAGE_REV, body));
    }

    @PutMapping("/packagerev/{name}")
    public BaseResponse<GenericKubernetesResource> updatePackageRev(
        @PathVariable String name,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(packageService.update(GroupVersionResource.PORCH_PACKAGE_REV, name, body));
    }

    @DeleteMapping("/packagerev/{name}")
    public BaseResponse<Map<String, String>> deletePackageRev(@PathVariable String name) {
        return BaseResponse.success(packageService.delete(GroupVersionResource.PORCH_PACKAGE_REV, name));
    }
}
