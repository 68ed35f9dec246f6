package com.deepansh.sectools.tool.impl;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.CommandAllowlist;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import com.deepansh.sectools.core.ProcessInvoker;
import com.deepansh.sectools.core.ResponseNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RunCommandToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ProcessInvoker invoker;
    private RunCommandTool tool;

    @BeforeEach
    void setUp() {
        invoker = mock(ProcessInvoker.class);
        when(invoker.run(anyList(), any(Duration.class), anySet()))
                .thenReturn(ExternalCallResult.processCompleted(Outcome.SUCCESS, 0, "root\n", "", null));
        tool = new RunCommandTool(new CommandAllowlist(List.of("whoami", "uname", "df")), invoker,
                new ResponseNormalizer(objectMapper), ToolProperties.defaults());
    }

    @Test
    void execute_allowedCommand_runsTokenizedArgv() {
        String result = tool.execute(Map.of("command", "uname -a"));

        assertThat(result).isEqualTo("root\n");
        verify(invoker).run(eq(List.of("uname", "-a")), eq(Duration.ofSeconds(30)), eq(ProcessInvoker.EXIT_OK));
    }

    @Test
    void execute_quotedArgument_staysOneToken() {
        tool.execute(Map.of("command", "df -h '/mnt/my disk'"));

        verify(invoker).run(eq(List.of("df", "-h", "/mnt/my disk")), any(Duration.class), anySet());
    }

    @ParameterizedTest
    @ValueSource(strings = {"rm -rf /", "bash -c whoami", "/usr/bin/whoami", "curl http://evil"})
    void execute_commandNotOnAllowlist_isBlocked(String command) throws Exception {
        JsonNode json = objectMapper.readTree(tool.execute(Map.of("command", command)));

        assertThat(json.get("error").asText())
                .contains("is not allowed")
                .endsWith("Allowed commands: df, uname, whoami");
        verifyNoInteractions(invoker);
    }

    @Test
    void execute_shellMetacharactersReachProgramAsArguments() {
        tool.execute(Map.of("command", "whoami; rm -rf /"));

        // "whoami;" is not an allowlisted name, so nothing runs
        verifyNoInteractions(invoker);
    }

    @Test
    void execute_timeoutIsClamped() {
        tool.execute(Map.of("command", "whoami", "timeout_seconds", 10_000));
        verify(invoker).run(anyList(), eq(Duration.ofSeconds(300)), anySet());
    }

    @Test
    void execute_zeroTimeout_clampsToOneSecond() {
        tool.execute(Map.of("command", "whoami", "timeout_seconds", 0));
        verify(invoker).run(anyList(), eq(Duration.ofSeconds(1)), anySet());
    }

    @Test
    void execute_unbalancedQuote_returnsError() throws Exception {
        JsonNode json = objectMapper.readTree(tool.execute(Map.of("command", "whoami 'oops")));

        assertThat(json.get("error").asText()).isEqualTo("No closing quotation");
        verifyNoInteractions(invoker);
    }

    @Test
    void execute_missingCommand_returnsError() throws Exception {
        JsonNode json = objectMapper.readTree(tool.execute(Map.of()));

        assertThat(json.get("error").asText()).isEqualTo("'command' is required");
    }

    @Test
    void description_listsAllowedCommands() {
        assertThat(tool.getDescription()).contains("df, uname, whoami");
    }
}
