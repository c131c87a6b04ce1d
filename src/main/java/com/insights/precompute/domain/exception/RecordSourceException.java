package com.insights.precompute.domain.exception;

public class RecordSourceException extends AggregationException {

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
