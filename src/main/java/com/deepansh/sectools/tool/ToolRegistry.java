package com.deepansh.sectools.tool;

import com.deepansh.sectools.core.ResponseNormalizer;
import com.deepansh.sectools.exception.UnknownToolException;
import com.deepansh.sectools.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Central registry for all SecurityTool implementations.
 *
 * Spring auto-discovers every @Component that implements SecurityTool
 * and injects them as a List<SecurityTool>. We index them by name for O(1) dispatch.
 *
 * Tool execution errors are caught here and returned as {"error": ...}
 * so no exception ever reaches the caller from inside a tool.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, SecurityTool> tools;
    private final ResponseNormalizer normalizer;

    public ToolRegistry(List<SecurityTool> toolBeans, ResponseNormalizer normalizer) {
        this.normalizer = normalizer;
        Map<String, SecurityTool> byName = new TreeMap<>();
        toolBeans.forEach(tool -> {
            SecurityTool previous = byName.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            log.info("Registered tool: [{}]", tool.getName());
        });
        this.tools = Map.copyOf(byName);
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    /**
     * Dispatches a tool call and returns its JSON response.
     *
     * @throws UnknownToolException if no tool has that name; everything that
     *         happens inside a tool is reported in the returned JSON instead
     */
    public String execute(ToolCall toolCall) {
        SecurityTool tool = tools.get(toolCall.getToolName());
        if (tool == null) {
            log.warn("Unknown tool requested: [{}]", toolCall.getToolName());
            throw new UnknownToolException(toolCall.getToolName(), getToolNames());
        }

        log.info("Executing tool: [{}] with args: {}", toolCall.getToolName(), toolCall.getArguments().keySet());

        long start = System.currentTimeMillis();
        try {
            String result = tool.execute(toolCall.getArguments());
            log.info("Tool [{}] completed in {}ms", toolCall.getToolName(), System.currentTimeMillis() - start);
            log.debug("Tool [{}] returned: {}", toolCall.getToolName(), result);
            return result;
        } catch (Exception e) {
            // Tools handle their own errors; this only catches programming mistakes
            log.error("Unexpected error in tool [{}]", toolCall.getToolName(), e);
            return normalizer.error("Tool execution failed: " + e.getMessage());
        }
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public Set<String> getToolNames() {
        return new TreeSet<>(tools.keySet());
    }

    public int toolCount() {
        return tools.size();
    }
}
