package oauth.web;

import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import oauth.exceptions.BaseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.servlet.ModelAndView;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every error that was not handled by an endpoint. Browser facing authorization URLs get the HTML error
 * page, everything else JSON.
 */
@RestController
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    private static final Log LOG = LogFactory.getLog(ErrorController.class);

    private final DefaultErrorAttributes errorAttributes;

    public ErrorController() {
        this.errorAttributes = new DefaultErrorAttributes();
    }

    @RequestMapping("${server.error.path:${error.path:/error}}")
    public Object error(HttpServletRequest request) {
        ServletWebRequest webRequest = new ServletWebRequest(request);
        Map<String, Object> attributes = errorAttributes.getErrorAttributes(webRequest, ErrorAttributeOptions.defaults());

        Throwable error = errorAttributes.getError(webRequest);
        if (error != null && !(error instanceof BaseException) && error.getCause() != null) {
            error = error.getCause();
        }
        Object status = attributes.get("status");
        HttpStatus statusCode = status instanceof Integer && HttpStatus.resolve((Integer) status) != null ?
                HttpStatus.resolve((Integer) status) : HttpStatus.INTERNAL_SERVER_ERROR;

        String errorCode = defaultErrorCode(statusCode);
        String description = statusCode.getReasonPhrase();
        if (error != null) {
            ResponseStatus annotation = AnnotationUtils.findAnnotation(error.getClass(), ResponseStatus.class);
            if (annotation != null) {
                statusCode = annotation.value();
            }
            if (error instanceof BaseException) {
                errorCode = ((BaseException) error).getErrorCode();
                description = error.getMessage();
            } else if (statusCode.is5xxServerError()) {
                LOG.error("Error has occurred", error);
                errorCode = "server_error";
                description = "An unexpected error occurred";
            } else {
                errorCode = defaultErrorCode(statusCode);
                description = statusCode == HttpStatus.BAD_REQUEST ? "Malformed request" : error.getMessage();
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", errorCode);
        result.put("error_description", description);
        result.put("status", statusCode.value());

        Object path = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);
        if (path != null && path.toString().startsWith("/oauth/authorize")) {
            return new ModelAndView("oauth_error", result, statusCode);
        }
        return new ResponseEntity<>(result, statusCode);
    }

    private String defaultErrorCode(HttpStatus statusCode) {
        switch (statusCode) {
            case BAD_REQUEST:
                return "invalid_request";
            case UNAUTHORIZED:
                return "unauthorized";
            case FORBIDDEN:
                return "forbidden";
            case NOT_FOUND:
                return "not_found";
            case METHOD_NOT_ALLOWED:
                return "method_not_allowed";
            case UNSUPPORTED_MEDIA_TYPE:
                return "invalid_request";
            default:
                return statusCode.is5xxServerError() ? "server_error" : statusCode.name().toLowerCase();
        }
    }
}
