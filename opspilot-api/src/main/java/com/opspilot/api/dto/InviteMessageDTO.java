package com.opspilot.api.dto;

import lombok.Data;

/**
 * 邀请文案。
 */
@Data
public class InviteMessageDTO {

    private String message;
}
