package com.deepansh.agentplatform.registry.report;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ResetReport {

    public enum Status { RESET, NO_SESSION }

    String userId;
    Status status;
    int agentsReset;
    @Singular
    List<String> errors;
}
