package com.openforge.llmkit.tool;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named tools available to one conversation.
 *
 * The map is guarded by a single lock so that registration, description and
 * execution may be called from different threads. The executor itself runs
 * outside the lock: a slow tool never blocks {@link #register(Tool)}.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, Tool> tools = new HashMap<>();
    private final ReentrantLock     lock  = new ReentrantLock();

    /** Inserts the tool, replacing any tool already registered under the same name. */
    public void register(Tool tool) {
        lock.lock();
        try {
            Tool previous = tools.put(tool.name(), tool);
            if (previous != null) {
                log.debug("[Tools] Replaced tool '{}'", tool.name());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of every registered tool in the shape both providers expect.
     * Order follows map iteration; callers must not depend on it.
     */
    public List<ToolDefinition> describe() {
        lock.lock();
        try {
            List<ToolDefinition> definitions = new ArrayList<>(tools.size());
            for (Tool tool : tools.values()) {
                definitions.add(tool.toDefinition());
            }
            return definitions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the named tool.
     *
     * @throws ToolNotFoundException if no tool is registered under {@code name}
     * @throws ToolException         whatever the tool itself raised, unchanged
     */
    public String execute(String name, JsonNode arguments) throws ToolException {
        Tool tool;
        lock.lock();
        try {
            tool = tools.get(name);
        } finally {
            lock.unlock();
        }
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool.executor().execute(arguments);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int size() {
        lock.lock();
        try {
            return tools.size();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> names() {
        lock.lock();
        try {
            return Set.copyOf(tools.keySet());
        } finally {
            lock.unlock();
        }
    }
}
