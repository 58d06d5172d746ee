package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class WebSocketPayloadReader {

    private final ObjectMapper objectMapper;

    public <T> T read(JsonNode payload, Class<T> type) {
        if (payload == null || payload.isNull()) {
            throw new OrdoException(ErrorCode.INVALID_REQUEST);
        }
        try {
            T dto = objectMapper.treeToValue(payload, type);
            if (dto == null) {
                throw new OrdoException(ErrorCode.INVALID_REQUEST);
            }
            return dto;
        } catch (JsonProcessingException e) {
            throw new OrdoException(ErrorCode.INVALID_REQUEST);
        }
    }

    public static String require(String value) {
        if (!StringUtils.hasText(value)) {
            throw new OrdoException(ErrorCode.INVALID_REQUEST);
        }
        return value;
    }
}
