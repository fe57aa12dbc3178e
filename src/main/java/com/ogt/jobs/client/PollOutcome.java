package com.ogt.jobs.client;

import com.ogt.jobs.dto.JobStatusResponse;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class PollOutcome {

    private final JobStatusResponse lastStatus;
    private final int polls;

    // true si se agotó la espera máxima antes de un estado terminal
    private final boolean timedOut;
}
