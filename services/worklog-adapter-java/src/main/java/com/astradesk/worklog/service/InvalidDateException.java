package com.astradesk.worklog.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A date bound that is neither {@code YYYY-MM-DD} nor {@code DD-MM-YYYY}/{@code DD/MM/YYYY}.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidDateException extends RuntimeException {

    public InvalidDateException(String field, String value) {
        super("%s must be YYYY-MM-DD, DD-MM-YYYY or DD/MM/YYYY, got '%s'".formatted(field, value));
    }
}
