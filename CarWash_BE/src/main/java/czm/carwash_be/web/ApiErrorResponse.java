package czm.carwash_be.web;

import org.springframework.http.HttpStatus;

/**
 * Error envelope returned by every endpoint: {@code {"error": {code, message, details, httpStatus, requestId}}}.
 */
public class ApiErrorResponse {
    public ErrorBody error;

    public static class ErrorBody {
        public String code;
        public String message;
        public String details;
        public int httpStatus;
        public String requestId;
    }

    public static ApiErrorResponse of(String code, String message, String details, HttpStatus status) {
        ApiErrorResponse response = new ApiErrorResponse();
        response.error = new ErrorBody();
        response.error.code = code;
        response.error.message = message;
        response.error.details = details;
        response.error.httpStatus = status.value();
        return response;
    }

    public static ApiErrorResponse of(ApiException exception) {
        return of(exception.getCode(), exception.getMessage(), exception.getDetails(), exception.getStatus());
    }
}
