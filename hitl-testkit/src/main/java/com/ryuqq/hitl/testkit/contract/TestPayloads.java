package com.ryuqq.hitl.testkit.contract;

import com.ryuqq.hitl.core.model.ApprovalPayload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Test fixtures for approval payloads.
 *
 * <p>Models the tool calls a policy layer typically guards.</p>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class TestPayloads {

    private TestPayloads() {
    }

    /**
     * A destructive file operation.
     *
     * @param path file path argument
     * @return delete_file payload
     */
    public static ApprovalPayload deleteFile(String path) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("path", path);
        return ApprovalPayload.of("delete_file", "Delete a file from the filesystem", arguments);
    }

    /**
     * A command execution with arguments in a fixed order.
     *
     * @param command shell command
     * @param workingDirectory working directory
     * @return execute_command payload
     */
    public static ApprovalPayload executeCommand(String command, String workingDirectory) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("command", command);
        arguments.put("cwd", workingDirectory);
        return ApprovalPayload.of("execute_command", "Run a shell command", arguments);
    }

    /**
     * A payload identified only by name.
     *
     * @param name tool name
     * @return payload without description or arguments
     */
    public static ApprovalPayload named(String name) {
        return ApprovalPayload.of(name);
    }
}
