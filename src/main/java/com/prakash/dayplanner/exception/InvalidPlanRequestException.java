package com.prakash.dayplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST) // Rejected before the planner runs
public class InvalidPlanRequestException extends RuntimeException {

    public InvalidPlanRequestException(String message) {
        super(message);
    }
}
