package com.ogt.jobs.exception;

import lombok.Getter;

@Getter
public class BatchTooLargeException extends BusinessException {

    private final int rows;
    private final int maxRows;

    public BatchTooLargeException(int rows, int maxRows) {
        super("Maximum batch size exceeded: " + rows + " rows submitted, at most " + maxRows + " allowed");
        this.rows = rows;
        this.maxRows = maxRows;
    }
}
