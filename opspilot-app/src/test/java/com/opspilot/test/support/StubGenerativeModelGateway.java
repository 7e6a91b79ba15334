package com.opspilot.test.support;

import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 固定返回值的模型网关，记录收到的指令。
 */
public class StubGenerativeModelGateway implements IGenerativeModelGateway {

    private final List<String> instructions = new ArrayList<>();
    private Map<String, Object> jsonResult;
    private String textResult;
    private RuntimeException failure;

    public static StubGenerativeModelGateway unavailable() {
        return new StubGenerativeModelGateway();
    }

    public static StubGenerativeModelGateway returningJson(Map<String, Object> jsonResult) {
        StubGenerativeModelGateway gateway = new StubGenerativeModelGateway();
        gateway.jsonResult = jsonResult;
        return gateway;
    }

    public static StubGenerativeModelGateway returningText(String textResult) {
        StubGenerativeModelGateway gateway = new StubGenerativeModelGateway();
        gateway.textResult = textResult;
        return gateway;
    }

    public static StubGenerativeModelGateway failing(RuntimeException failure) {
        StubGenerativeModelGateway gateway = new StubGenerativeModelGateway();
        gateway.failure = failure;
        return gateway;
    }

    @Override
    public Map<String, Object> generateJson(String instruction) {
        instructions.add(instruction);
        if (failure != null) {
            throw failure;
        }
        return jsonResult;
    }

    @Override
    public String generateText(String instruction) {
        instructions.add(instruction);
        if (failure != null) {
            throw failure;
        }
        return textResult;
    }

    @Override
    public String getModelName() {
        return "stub-model";
    }

    public List<String> getInstructions() {
        return instructions;
    }

    public int getCallCount() {
        return instructions.size();
    }
}
