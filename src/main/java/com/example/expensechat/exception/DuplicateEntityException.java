package com.example.expensechat.exception;

import com.example.expensechat.config.ErrorConfig;
import lombok.Getter;

@Getter
public class DuplicateEntityException extends GatewayException {
    private final String entity;
    private final String name;

    public DuplicateEntityException(String entity, String name) {
        super(ErrorConfig.DUPLICATE_ENTITY, "%s \"%s\" already exists".formatted(entity, name));
        this.entity = entity;
        this.name = name;
    }
}
