package com.openforge.mindstore.web;

import com.openforge.mindstore.admin.AdminProperties;
import com.openforge.mindstore.admin.CollectionAdmin;
import com.openforge.mindstore.config.AppConfig;
import com.openforge.mindstore.layer.MemoryLayer;
import com.openforge.mindstore.layer.MemoryLayerManager;
import com.openforge.mindstore.layer.MemoryLayerMapping;
import com.openforge.mindstore.vector.VectorBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MemoryAdminControllerTest {

    private CollectionAdmin admin;
    private MemoryLayerManager layerManager;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        admin = mock(CollectionAdmin.class);
        layerManager = mock(MemoryLayerManager.class);
        MemoryAdminController controller = new MemoryAdminController(admin, layerManager, AdminProperties.defaults());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(
                        new StringHttpMessageConverter(StandardCharsets.UTF_8),
                        new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    // ==================== Health ====================

    @Test
    void shouldCheckHealthAtDefaultDimension() throws Exception {
        when(admin.healthCheck(768)).thenReturn(List.of());

        mockMvc.perform(get("/api/memory/health"))
                .andExpect(status().isOk());

        verify(admin).healthCheck(768);
    }

    @Test
    void shouldRejectNonPositiveDimension() throws Exception {
        mockMvc.perform(get("/api/memory/health").param("dimension", "0"))
                .andExpect(status().isBadRequest());

        verify(admin, never()).healthCheck(anyInt());
    }

    @Test
    void shouldHealOnlyWhenConfirmed() throws Exception {
        when(admin.autoHeal(1536, false)).thenReturn(List.of());
        when(admin.autoHeal(1536, true)).thenReturn(List.of("core"));

        mockMvc.perform(post("/api/memory/heal").param("dimension", "1536"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmed").value(false))
                .andExpect(jsonPath("$.healed.length()").value(0));

        mockMvc.perform(post("/api/memory/heal").param("dimension", "1536").param("confirm", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.target_dimension").value(1536))
                .andExpect(jsonPath("$.healed[0]").value("core"));
    }

    @Test
    void shouldMapBackendOutageToServiceUnavailable() throws Exception {
        when(admin.getAllCollections()).thenThrow(new VectorBackendException("down"));

        mockMvc.perform(get("/api/memory/collections"))
                .andExpect(status().isServiceUnavailable());
    }

    // ==================== Layers ====================

    @Test
    void shouldListLayersWithCounts() throws Exception {
        when(layerManager.getMappings()).thenReturn(List.of(
                new MemoryLayerMapping(MemoryLayer.WORKING, List.of("mindstore_neuro_thoughts"), "Active", 1.0)));
        when(layerManager.getLayerVectorCount(MemoryLayer.WORKING)).thenReturn(42L);

        mockMvc.perform(get("/api/memory/layers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].layer").value("WORKING"))
                .andExpect(jsonPath("$[0].vector_count").value(42))
                .andExpect(jsonPath("$[0].retention_priority").value(1.0));
    }

    @Test
    void shouldClearLayerCaseInsensitively() throws Exception {
        when(layerManager.clearMemoryLayer(MemoryLayer.EPISODIC, true)).thenReturn(true);

        mockMvc.perform(delete("/api/memory/layers/episodic").param("confirm", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.layer").value("EPISODIC"))
                .andExpect(jsonPath("$.cleared").value(true));
    }

    @Test
    void shouldRejectUnknownLayer() throws Exception {
        mockMvc.perform(delete("/api/memory/layers/dreaming").param("confirm", "true"))
                .andExpect(status().isBadRequest());

        verify(layerManager, never()).clearMemoryLayer(any(), anyBoolean());
    }

    @Test
    void shouldServeMemoryMapAsText() throws Exception {
        when(layerManager.getMemoryMap()).thenReturn("MINDSTORE MEMORY ARCHITECTURE");

        mockMvc.perform(get("/api/memory/map"))
                .andExpect(status().isOk())
                .andExpect(content().string("MINDSTORE MEMORY ARCHITECTURE"));
    }
}
