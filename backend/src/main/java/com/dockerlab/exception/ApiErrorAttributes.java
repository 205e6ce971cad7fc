package com.dockerlab.exception;

import com.dockerlab.config.AppProperties;
import com.dockerlab.config.RouteCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.WebRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body for failures that never reach a controller, such as a request rejected by the
 * security firewall or an exception thrown from a filter. These are rendered by the container's
 * {@code /error} page, so they get the same {@code {success:false, error, detail?}} shape as
 * {@link GlobalExceptionHandler}.
 */
@Component
@RequiredArgsConstructor
public class ApiErrorAttributes extends DefaultErrorAttributes {

    private static final String NO_MESSAGE = "No message available";

    private final AppProperties appProperties;
    private final RouteCatalog routeCatalog;

    @Override
    public Map<String, Object> getErrorAttributes(WebRequest webRequest, ErrorAttributeOptions options) {
        Map<String, Object> defaults = super.getErrorAttributes(webRequest,
            ErrorAttributeOptions.of(ErrorAttributeOptions.Include.MESSAGE));

        Object status = defaults.get("status");
        HttpStatus resolved = status instanceof Integer ? HttpStatus.resolve((Integer) status) : null;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        if (resolved == HttpStatus.NOT_FOUND) {
            body.put("error", "Route not found");
            body.put("available_routes", routeCatalog.paths());
            return body;
        }
        body.put("error", resolved == null ? "Internal server error" : resolved.getReasonPhrase());

        String message = (String) defaults.get("message");
        if (!appProperties.isProduction() && StringUtils.hasText(message) && !NO_MESSAGE.equals(message)) {
            body.put("detail", message);
        }
        return body;
    }
}
