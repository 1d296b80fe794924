package com.bko.delegation.orchestration;

import java.util.List;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Engine-owned operations; never offered to workers
    public static final String TOOL_SPAWN_AGENT = "spawn_agent";
    public static final String TOOL_SPAWN_AGENTS_PARALLEL = "spawn_agents_parallel";
    public static final String TOOL_VALIDATE_OUTPUT = "validate_output";
    public static final String TOOL_LIST_ROLES = "list_roles";
    public static final String TOOL_GET_SESSION_STATS = "get_session_stats";
    public static final List<String> ENGINE_TOOL_NAMES = List.of(
            TOOL_SPAWN_AGENT, TOOL_SPAWN_AGENTS_PARALLEL, TOOL_VALIDATE_OUTPUT, TOOL_LIST_ROLES, TOOL_GET_SESSION_STATS);

    // LLM request purposes
    public static final String PURPOSE_WORKER_TURN = "worker-turn";

    public static final String DEFAULT_ROLE = "default";
    public static final String VALIDATOR_VERSION = "3.0";
    public static final String SERVER_MCP = "mcp";
    public static final String SERVER_LOCAL = "local";

    // Worker prompt. Rendered with angle-bracket delimiters, so the text itself must not contain them.
    public static final String WORKER_PROMPT_TEMPLATE = """
            ---
            You are operating as a specialized sub-agent delegated by a primary agent.
            Agent Type: <role>
            Session: <sessionId>

            SUB-AGENT REQUIREMENTS:
            1. You cannot delegate work: orchestration operations are not available to you
            2. You have full access to the tools listed below
            3. Respond ONLY in the JSON format specified below
            4. Complete the specific task assigned with full domain expertise
            5. Propose memory operations but do not execute them directly
            6. Provide confidence level and completion status

            EXECUTION CONSTRAINTS:
            - Maximum conversation turns: <maxIterations>
            - Plan your tool usage efficiently within this limit
            - If approaching the limit, prioritize completing the task over exhaustive analysis

            TOOL ACCESS GUIDELINES:
            - Use EXACT tool names from the list below
            - If a tool fails you will receive guidance and alternatives
            - Without native tool calling, request a tool with: <toolCallFormat>
            - Only use tools that are explicitly listed as available

            <toolDocumentation>

            DOMAIN EXPERTISE:
            <instructions>

            RESPONSE FORMAT REQUIRED:
            <outputSchema>

            TASK ASSIGNMENT:
            Task: <task>

            Context: <context>

            Expected Deliverables: <expectedDeliverables>

            Provide authentic specialist analysis rather than generic responses. Focus on what a real <role> would deliver.
            """;

    public static final String TOOL_CALL_FORMAT = "{\"tool\": \"tool_name\", \"arguments\": {...}}";

    public static final String WORKER_OUTPUT_SCHEMA = """
            {
              "deliverables": {
                "analysis": "Primary domain-specific analysis result",
                "recommendations": ["Actionable recommendations from your expertise"],
                "documents": ["Documents created or referenced"],
                "technical_details": "Specific technical insights from your domain"
              },
              "memory_operations": [
                {
                  "operation": "create_entities",
                  "data": {"entities": [{"name": "DomainConcept", "entityType": "concept", "observations": ["..."]}]}
                }
              ],
              "metadata": {
                "chatmode": "%s",
                "task_completion_status": "complete|partial|failed",
                "processing_time": "elapsed time",
                "confidence_level": "high|medium|low"
              }
            }""";

    public static final String WORKER_KICKOFF_MESSAGE =
            "Execute the task assigned above. Use the available tools as needed, then reply with the required JSON response.";

    public static final String NO_TOOLS_DOCUMENTATION = "AVAILABLE TOOLS: none. Answer from the task and context alone.";

    // Tool error coaching
    public static final String TOOL_NOT_AVAILABLE_MESSAGE = "Tool \"%s\" is not available.%s Available tools: %s.";
    public static final String TOOL_FAILED_MESSAGE = "Tool \"%s\" failed: %s. Available tools: %s.";
    public static final String TOOL_RESULT_MESSAGE = "Tool \"%s\" result:\n%s";
    public static final String TOOL_NOT_FOUND = "Tool not found";

    // Refinement
    public static final String REFINEMENT_PROMPT_TEMPLATE = """
            REFINEMENT REQUEST

            Your previous response scored %.2f (threshold: %.2f). Please refine your response addressing the following areas:

            AREAS NEEDING IMPROVEMENT:
            %s

            SPECIFIC FEEDBACK:
            %s

            REFINEMENT SUGGESTIONS:
            %s

            ORIGINAL TASK:
            %s

            YOUR PREVIOUS RESPONSE:
            %s

            QUALITY REQUIREMENTS:
            %s

            Please provide a refined response that addresses these issues while maintaining the same JSON format structure.""";

    public static final String NO_REFINEMENT_NEEDED = "Quality threshold met";
}
