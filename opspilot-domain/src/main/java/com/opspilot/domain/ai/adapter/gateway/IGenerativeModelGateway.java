package com.opspilot.domain.ai.adapter.gateway;

import java.util.Map;

/**
 * 生成式模型端口。
 * <p>
 * 两个操作都是可选能力：未配置模型、调用超时、输出不合法时一律返回 null，
 * 永不向调用方抛出异常。调用方据此走确定性路径。
 * </p>
 *
 * @author opspilot
 * @since 2026-03-02
 */
public interface IGenerativeModelGateway {

    /**
     * 按指令返回 JSON 对象。
     *
     * @param instruction 完整指令
     * @return 解析后的 JSON 对象；无结果时返回 null
     */
    Map<String, Object> generateJson(String instruction);

    /**
     * 按指令返回纯文本。
     *
     * @param instruction 完整指令
     * @return 去除首尾空白的文本；无结果时返回 null
     */
    String generateText(String instruction);

    /**
     * 当前生效的模型标识，用于调用记录。
     */
    String getModelName();
}
