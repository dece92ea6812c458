package me.christianrobert.bsontranspiler.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.bsontranspiler.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST access to the transpiler settings held by {@link ConfigService}.
 *
 * <pre>
 * curl http://localhost:8080/api/config
 * curl -X PUT http://localhost:8080/api/config/evaluator.max-operations \
 *   -H "Content-Type: application/json" --data '{"value": 50000}'
 * </pre>
 *
 * <p>Values are checked by {@link ConfigService#validate}. A rejected value answers 400 and
 * changes nothing; only existing settings can be changed one by one.
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getSettings() {
        log.debug("Listing transpiler settings");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response updateSettings(Map<String, Object> settings) {
        if (settings == null || settings.isEmpty()) {
            return error(Response.Status.BAD_REQUEST, "Request body must contain at least one setting");
        }

        log.info("Updating {} transpiler settings", settings.size());
        try {
            configService.updateConfiguration(settings);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected settings update: {}", e.getMessage());
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @GET
    @Path("/{key}")
    public Response getSetting(@PathParam("key") String key) {
        if (!configService.hasConfigKey(key)) {
            return error(Response.Status.NOT_FOUND, "Unknown setting: " + key);
        }
        return Response.ok(setting(key)).build();
    }

    @PUT
    @Path("/{key}")
    public Response putSetting(@PathParam("key") String key, Map<String, Object> body) {
        if (!configService.hasConfigKey(key)) {
            return error(Response.Status.NOT_FOUND, "Unknown setting: " + key);
        }
        if (body == null || !body.containsKey("value")) {
            return error(Response.Status.BAD_REQUEST, "Request body must contain a 'value' field");
        }

        try {
            configService.setConfigValue(key, body.get("value"));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected setting {}: {}", key, e.getMessage());
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }

        log.info("Setting {} changed to {}", key, body.get("value"));
        return Response.ok(setting(key)).build();
    }

    @POST
    @Path("/reset")
    public Response resetSettings() {
        log.info("Resetting transpiler settings to defaults");
        configService.resetToDefaults();
        return Response.ok(configService.getAllConfiguration()).build();
    }

    private Map<String, Object> setting(String key) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("key", key);
        entry.put("value", configService.getConfigValue(key));
        return entry;
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .entity(Map.of("status", status.getStatusCode(), "error", message))
                .build();
    }
}
