package com.vibecoding.karmadadashboard.web;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * 요청 경로 prefix 로 대상 클러스터를 결정한다
 * - /api/v1/member/{clustername}/... : 멤버 클러스터
 * - /api/v1/mgmt/... : 관리 클러스터
 * - 그 외 : Karmada 컨트롤 플레인
 */
public class ClusterTargetArgumentResolver implements HandlerMethodArgumentResolver {

    static final String MEMBER_PREFIX = "/api/v1/member/";
    static final String MGMT_PREFIX = "/api/v1/mgmt/";
    static final String CLUSTER_NAME_VARIABLE = "clustername";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ClusterTarget.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        return resolve(request);
    }

    @SuppressWarnings("unchecked")
    public static ClusterTarget resolve(HttpServletRequest request) {
        String path = pathWithinApplication(request);
        if (path.startsWith(MEMBER_PREFIX)) {
            Map<String, String> variables = (Map<String, String>) request.getAttribute(
                HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
            String clusterName = variables != null ? variables.get(CLUSTER_NAME_VARIABLE) : null;
            if (clusterName == null) {
                clusterName = memberClusterName(path);
            }
            if (clusterName == null || clusterName.isBlank()) {
                throw new BadRequestException("cluster name is required");
            }
            return ClusterTarget.member(clusterName);
        }
        if (path.startsWith(MGMT_PREFIX) || path.equals("/api/v1/mgmt")) {
            return ClusterTarget.mgmt();
        }
        return ClusterTarget.karmada();
    }

    static String memberClusterName(String path) {
        if (!path.startsWith(MEMBER_PREFIX)) {
            return null;
        }
        String rest = path.substring(MEMBER_PREFIX.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
