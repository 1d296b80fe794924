package com.bko.delegation.orchestration.api;

import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolResult;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Access to the external tools workers may use.
 */
public interface ToolGateway {

    /**
     * Tools a worker of the given role may see. Engine-owned operations are never included.
     */
    List<ToolDescriptor> listSafeTools(@Nullable String role);

    /**
     * Calls a tool. Failures are reported in the result, not thrown.
     */
    ToolResult callTool(String name, Map<String, Object> arguments);
}
