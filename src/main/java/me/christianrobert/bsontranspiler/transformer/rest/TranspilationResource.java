package me.christianrobert.bsontranspiler.transformer.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.bsontranspiler.transformer.context.TransformationResult;
import me.christianrobert.bsontranspiler.transformer.service.TranspilationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for translating Mongo shell expressions into Python 3.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/transpile/python?showAst=true" \
 *   -H "Content-Type: text/plain" \
 *   --data '{_id: ObjectId("5ab901c29ee65f5c8550c5b9")}'
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "sourceExpression": "{_id: ObjectId(\"5ab901c29ee65f5c8550c5b9\")}",
 *   "pythonCode": "{'_id': ObjectId('5ab901c29ee65f5c8550c5b9')}",
 *   "errorMessage": null
 * }
 * </pre>
 *
 * <p>Without {@code showAst} the {@code transpiler.include-ast} setting decides whether the AST is included.
 *
 * <p>Always returns HTTP 200. A rejected expression is a valid outcome, check "success".
 */
@Path("/api/transpile")
@Produces(MediaType.APPLICATION_JSON)
public class TranspilationResource {

    private static final Logger log = LoggerFactory.getLogger(TranspilationResource.class);

    @Inject
    TranspilationService transpilationService;

    @POST
    @Path("/python")
    @Consumes(MediaType.TEXT_PLAIN)
    public TransformationResult transpile(
            @QueryParam("showAst") Boolean showAst,
            String source
    ) {
        log.info("Transpilation request received via REST API");
        log.trace("Shell expression: {}", source);

        if (source == null || source.trim().isEmpty()) {
            log.warn("Empty expression received");
            return TransformationResult.failure("", "Expression cannot be empty");
        }

        TransformationResult result = showAst == null
                ? transpilationService.transpile(source)
                : transpilationService.transpile(source, showAst);

        if (result.isSuccess()) {
            log.info("Transpilation succeeded");
            if (result.hasAstTree()) {
                log.debug("AST tree included in response");
            }
        } else {
            log.warn("Transpilation failed: {}", result.getErrorMessage());
        }

        return result;
    }
}
