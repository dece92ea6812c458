package me.christianrobert.bsontranspiler.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.bsontranspiler.config.service.ConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConfigRestServiceTest {

    private ConfigRestService resource;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        resource = new ConfigRestService();
        resource.configService = configService;
    }

    @Test
    void putAcceptsPositiveLimit() {
        // When
        Response response = resource.putSetting(ConfigService.EVALUATOR_MAX_OPERATIONS, Map.of("value", 50000));

        // Then
        assertEquals(200, response.getStatus());
        assertEquals(50000, configService.getConfigValue(ConfigService.EVALUATOR_MAX_OPERATIONS));
    }

    @Test
    void putRejectsNegativeOperationLimit() {
        // When
        Response response = resource.putSetting(ConfigService.EVALUATOR_MAX_OPERATIONS, Map.of("value", -1));

        // Then: rejected and the evaluator keeps its previous budget
        assertEquals(400, response.getStatus());
        assertEquals(10000, configService.getConfigValue(ConfigService.EVALUATOR_MAX_OPERATIONS));
    }

    @Test
    void putRejectsNullValue() {
        Map<String, Object> body = new HashMap<>();
        body.put("value", null);

        Response response = resource.putSetting(ConfigService.TRANSPILER_INCLUDE_AST, body);

        assertEquals(400, response.getStatus());
        assertEquals(Boolean.FALSE, configService.getConfigValueAsBoolean(ConfigService.TRANSPILER_INCLUDE_AST));
    }

    @Test
    void putWithoutValueFieldIsBadRequest() {
        Response response = resource.putSetting(ConfigService.EVALUATOR_MAX_DEPTH, Map.of("other", 3));

        assertEquals(400, response.getStatus());
    }

    @Test
    void unknownKeyIsNotFound() {
        assertEquals(404, resource.getSetting("no.such.key").getStatus());
        assertEquals(404, resource.putSetting("no.such.key", Map.of("value", 1)).getStatus());
        assertFalse(configService.hasConfigKey("no.such.key"));
    }

    @Test
    void bulkUpdateWithOneInvalidValueChangesNothing() {
        Response response = resource.updateSettings(Map.of(
                ConfigService.EVALUATOR_MAX_DEPTH, 50,
                ConfigService.TRANSPILER_MAX_NESTING_DEPTH, 0));

        assertEquals(400, response.getStatus());
        assertEquals(200, configService.getConfigValue(ConfigService.EVALUATOR_MAX_DEPTH));
    }

    @Test
    void bulkUpdateRequiresSettings() {
        ConfigService mockService = Mockito.mock(ConfigService.class);
        resource.configService = mockService;

        Response response = resource.updateSettings(Map.of());

        assertEquals(400, response.getStatus());
        verify(mockService, never()).updateConfiguration(any());
    }

    @Test
    void validationMessageIsPassedThrough() {
        // Given
        ConfigService mockService = Mockito.mock(ConfigService.class);
        when(mockService.hasConfigKey(anyString())).thenReturn(true);
        doThrow(new IllegalArgumentException("evaluator.max-depth must be a positive integer, got: x"))
                .when(mockService).setConfigValue(ConfigService.EVALUATOR_MAX_DEPTH, "x");
        resource.configService = mockService;

        // When
        Response response = resource.putSetting(ConfigService.EVALUATOR_MAX_DEPTH, Map.of("value", "x"));

        // Then
        assertEquals(400, response.getStatus());
        Map<?, ?> entity = (Map<?, ?>) response.getEntity();
        assertEquals("evaluator.max-depth must be a positive integer, got: x", entity.get("error"));
    }

    @Test
    void getAndResetReturnSettings() {
        configService.setConfigValue(ConfigService.EVALUATOR_MAX_DEPTH, 10);

        Response single = resource.getSetting(ConfigService.EVALUATOR_MAX_DEPTH);
        assertEquals(200, single.getStatus());
        assertEquals(10, ((Map<?, ?>) single.getEntity()).get("value"));

        Response reset = resource.resetSettings();
        assertEquals(200, reset.getStatus());
        assertEquals(200, configService.getConfigValue(ConfigService.EVALUATOR_MAX_DEPTH));
        assertEquals(200, resource.getSettings().getStatus());
    }
}
