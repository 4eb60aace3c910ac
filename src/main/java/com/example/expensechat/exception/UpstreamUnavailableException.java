package com.example.expensechat.exception;

import com.example.expensechat.config.ErrorConfig;
import lombok.Getter;

@Getter
public class UpstreamUnavailableException extends GatewayException {
    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(ErrorConfig.UPSTREAM_UNAVAILABLE, message, cause);
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message) {
        super(ErrorConfig.UPSTREAM_UNAVAILABLE, message);
        this.upstream = upstream;
    }
}
