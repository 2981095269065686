package com.fleetmanager.analytics.dto;

import lombok.*;

/**
 * Response envelope for every analytics, record and fleet endpoint.
 *
 * Carries the computed aggregate untouched in {@code data}; units, rounding and
 * currency are left to whoever renders it.
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(message)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiResponse {

    private boolean success;
    private String message;
    private Object data;

    /** Successful response with a payload. */
    public static ApiResponse success(Object data, String message) {
        return ApiResponse.builder().success(true).message(message).data(data).build();
    }

    /** Failed response; no payload. */
    public static ApiResponse error(String message) {
        return ApiResponse.builder().success(false).message(message).build();
    }

}
