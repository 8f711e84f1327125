package fr.imt.stackpilot.stackpilot.presentation.web;

import fr.imt.stackpilot.stackpilot.exception.DeploymentNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.DockerOperationException;
import fr.imt.stackpilot.stackpilot.exception.QueueRejectedException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.StackpilotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * This @RestControllerAdvice intercepts all responses from @RestController
 * classes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== Domain Exception Handlers =====

    @ExceptionHandler({RepositoryNotFoundException.class, DeploymentNotFoundException.class})
    public ResponseEntity<HttpResponse<Void>> handleResourceNotFound(StackpilotException ex) {
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(QueueRejectedException.class)
    public ResponseEntity<HttpResponse<Void>> handleQueueRejected(QueueRejectedException ex) {
        log.warn("Deployment request rejected: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        HttpStatus status = ex.getReason() == QueueRejectedException.Reason.STOPPED
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.CONFLICT;
        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(DockerOperationException.class)
    public ResponseEntity<HttpResponse<Void>> handleDockerOperationError(DockerOperationException ex) {
        log.error("Docker operation failed: {}", ex.getMessage(), ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Fallback handler for any StackpilotException not handled above.
     */
    @ExceptionHandler(StackpilotException.class)
    public ResponseEntity<HttpResponse<Void>> handleStackpilotException(StackpilotException ex) {
        log.error("Stackpilot exception: {}", ex.getMessage(), ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                ex.getErrorCode(),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ===== Framework Exception Handlers =====

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<HttpResponse<Void>> handleNoResourceFoundException(NoResourceFoundException ex) {
        log.debug("No resource found: {}", ex.getMessage());
        HttpResponse<Void> errorResponse = HttpResponse.error("Resource Not Found");
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<HttpResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "Invalid Request",
                "Invalid value for " + ex.getName()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<HttpResponse<Void>> handleWrongHttpVerb(HttpRequestMethodNotSupportedException ex) {
        log.warn("{} not supported here, expected one of {}", ex.getMethod(), ex.getSupportedHttpMethods());
        return new ResponseEntity<>(HttpResponse.error("Method Not Allowed", ex.getMessage()),
                HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<HttpResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return new ResponseEntity<>(HttpResponse.error("Invalid Request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<HttpResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled exception on the deployment API", ex);
        HttpResponse<Void> errorResponse = HttpResponse.error(
                "INTERNAL_ERR",
                "Unexpected error, see the orchestrator logs"
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
