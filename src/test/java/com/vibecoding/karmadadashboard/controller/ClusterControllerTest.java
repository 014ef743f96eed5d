package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.exception.GlobalExceptionHandler;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.ListMeta;
import com.vibecoding.karmadadashboard.model.cluster.Cluster;
import com.vibecoding.karmadadashboard.model.cluster.ClusterList;
import com.vibecoding.karmadadashboard.service.ClusterService;
import com.vibecoding.karmadadashboard.service.ClusterUserService;
import com.vibecoding.karmadadashboard.web.DataSelectQueryArgumentResolver;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ClusterControllerTest {

    private ClusterService clusterService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clusterService = mock(ClusterService.class);
        mockMvc = MockMvcBuilders
            .standaloneSetup(new ClusterController(clusterService, mock(ClusterUserService.class)))
            .setCustomArgumentResolvers(new DataSelectQueryArgumentResolver())
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void listIsWrappedInEnvelope() throws Exception {
        Cluster cluster = new Cluster();
        cluster.setObjectMeta(new ObjectMetaBuilder().withName("member1").build());
        when(clusterService.listClusters(isNull(), any(DataSelectQuery.class)))
            .thenReturn(new ClusterList(new ListMeta(1), List.of(cluster), new ArrayList<>()));

        mockMvc.perform(get("/api/v1/cluster").param("itemsPerPage", "10").param("page", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.message").value("success"))
            .andExpect(jsonPath("$.data.listMeta.totalItems").value(1))
            .andExpect(jsonPath("$.data.clusters[0].objectMeta.name").value("member1"));

        ArgumentCaptor<DataSelectQuery> query = ArgumentCaptor.forClass(DataSelectQuery.class);
        verify(clusterService).listClusters(isNull(), query.capture());
        assertEquals(10, query.getValue().getItemsPerPage());
    }

    @Test
    void missingClusterIsErrorEnvelope() throws Exception {
        when(clusterService.getClusterDetail("ghost"))
            .thenThrow(new K8sResourceNotFoundException("Cluster", null, "ghost"));

        mockMvc.perform(get("/api/v1/cluster/ghost"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(500))
            .andExpect(jsonPath("$.message").value("Cluster not found: ghost"));
    }

    @Test
    void joinValidatesBody() throws Exception {
        mockMvc.perform(post("/api/v1/cluster")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"memberClusterName\":\"member1\",\"syncMode\":\"Push\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(400));

        verify(clusterService, never()).joinCluster(any(), any());
    }

    @Test
    void deleteDelegates() throws Exception {
        mockMvc.perform(delete("/api/v1/cluster/member1"))
            .andExpect(jsonPath("$.code").value(200))
            .andExpect(jsonPath("$.data").value("ok"));

        verify(clusterService).deleteCluster(eq("member1"));
    }
}
