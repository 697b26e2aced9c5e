package com.eyelevel.mediamigrator.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all operator API responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the operator.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * Extra detail about a failed request.
     */
    private final String errorDetail;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    public static <T> ApiResponse<T> success(String displayMessage, T response) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .response(response)
                          .showMessage(displayMessage != null)
                          .statusCode(200)
                          .build();
    }

    public static <T> ApiResponse<T> error(String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    public static <T> ApiResponse<T> error(String displayMessage, String errorDetail) {
        return ApiResponse.<T>builder()
                          .displayMessage(displayMessage)
                          .errorDetail(errorDetail)
                          .showMessage(true)
                          .build();
    }
}
