package fr.imt.stackpilot.stackpilot.presentation.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope of error responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HttpResponse<T> {

    private boolean success;
    private T data;
    private String error;
    private String message;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> HttpResponse<T> error(String error) {
        return HttpResponse.<T>builder()
                .success(false)
                .error(error)
                .build();
    }

    public static <T> HttpResponse<T> error(String error, String message) {
        return HttpResponse.<T>builder()
                .success(false)
                .error(error)
                .message(message)
                .build();
    }
}
