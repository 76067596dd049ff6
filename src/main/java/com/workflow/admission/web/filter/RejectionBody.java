package com.workflow.admission.web.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workflow.admission.ratelimit.rule.AdmissionDecision;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RejectionBody(boolean success, Error error) {

    public static final String CODE = "RATE_LIMIT_EXCEEDED";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(String code, String message, Long retryAfter, Boolean blocked, String limitType) {}

    public static RejectionBody of(AdmissionDecision dec) {
        return new RejectionBody(false, new Error(CODE, dec.message(),
                dec.retryAfterOpt().orElse(null), dec.blocked(), dec.limitType()));
    }
}
