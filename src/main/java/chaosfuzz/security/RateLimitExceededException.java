package chaosfuzz.security;

import java.time.Duration;

import chaosfuzz.runtime.AdmissionException;

public class RateLimitExceededException extends AdmissionException {

    private static final long serialVersionUID = 1L;

    public RateLimitExceededException(int limit, Duration window) {
        super(String.format("Rate limit of %d operations per %d s exceeded", limit, window.toSeconds()));
    }
}
