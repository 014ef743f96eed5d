package com.vibecoding.karmadadashboard.config;

import com.vibecoding.karmadadashboard.web.ClusterTargetArgumentResolver;
import com.vibecoding.karmadadashboard.web.DataSelectQueryArgumentResolver;
import com.vibecoding.karmadadashboard.web.MemberClusterInterceptor;
import com.vibecoding.karmadadashboard.web.MgmtAdminInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final MemberClusterInterceptor memberClusterInterceptor;
    private final MgmtAdminInterceptor mgmtAdminInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(memberClusterInterceptor).addPathPatterns("/api/v1/member/*/**");
        registry.addInterceptor(mgmtAdminInterceptor).addPathPatterns("/api/v1/mgmt/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new ClusterTargetArgumentResolver());
        resolvers.add(new DataSelectQueryArgumentResolver());
    }
}
