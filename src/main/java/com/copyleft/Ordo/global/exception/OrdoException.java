package com.copyleft.Ordo.global.exception;

import com.copyleft.Ordo.global.constant.ErrorCode;
import lombok.Getter;

@Getter
public class OrdoException extends RuntimeException {

    private final ErrorCode errorCode;

    public OrdoException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }
}
