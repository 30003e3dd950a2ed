package io.github.drompincen.screencontrol.runtime.tools;

import io.github.drompincen.screencontrol.protocol.api.ToolCategory;
import io.github.drompincen.screencontrol.protocol.api.ToolInvocation;

/**
 * Executes every tool of one category. Implementations must be safe to call from
 * several transport threads at once.
 */
public interface ToolProvider {

    ToolCategory category();

    ToolResult execute(ToolInvocation invocation);
}
