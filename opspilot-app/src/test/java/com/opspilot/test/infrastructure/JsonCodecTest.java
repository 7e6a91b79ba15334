package com.opspilot.test.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opspilot.infrastructure.util.JsonCodec;
import com.opspilot.types.enums.ResponseCode;
import com.opspilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

public class JsonCodecTest {

    private final JsonCodec jsonCodec = new JsonCodec(new ObjectMapper());

    @Test
    public void shouldReadObjectWrappedInProse() {
        Map<String, Object> payload = jsonCodec.readObjectLeniently(
                "Sure! Here is the plan:\n```json\n{\"metric\":\"rows\",\"limit\":3}\n```");

        Assertions.assertEquals("rows", payload.get("metric"));
        Assertions.assertEquals(3, payload.get("limit"));
    }

    @Test
    public void shouldReturnNullForUnreadableContent() {
        Assertions.assertNull(jsonCodec.readObjectLeniently("no json here"));
        Assertions.assertNull(jsonCodec.readObjectLeniently("{broken"));
        Assertions.assertNull(jsonCodec.readObjectLeniently("  "));
    }

    @Test
    public void shouldRaiseAppExceptionForStrictRead() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> jsonCodec.readMap("[1,2"));

        Assertions.assertEquals(ResponseCode.UN_ERROR.getCode(), ex.getCode());
    }
}
