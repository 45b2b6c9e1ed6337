package com.deepansh.coderflow.tool;

import java.util.List;

/**
 * Source of tools discovered at startup rather than declared as beans,
 * e.g. tools listed by a remote gateway.
 */
public interface ToolProvider {

    List<AgentTool> loadTools();
}
