package com.bko.delegation.orchestration.service;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.api.CompletionGateway;
import com.bko.delegation.orchestration.model.CompletionReply;
import com.bko.delegation.orchestration.model.ConversationMessage;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Completion API over Spring AI's {@link ChatClient}. Framework-internal tool execution is switched off so
 * tool calls come back to the caller.
 */
@Service
@Slf4j
public class ChatClientCompletionGateway implements CompletionGateway {

    private final ChatClient chatClient;
    private final DelegationProperties properties;
    private final JsonProcessingService jsonProcessingService;

    public ChatClientCompletionGateway(ChatClient chatClient,
                                       DelegationProperties properties,
                                       JsonProcessingService jsonProcessingService) {
        this.chatClient = chatClient;
        this.properties = properties;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public CompletionReply complete(List<ConversationMessage> messages, List<ToolDescriptor> tools) {
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder().internalToolExecutionEnabled(false);
        String model = properties.getExecution().getModel();
        if (StringUtils.hasText(model)) {
            options.model(model);
        }
        ChatClient.ChatClientRequestSpec spec = chatClient.prompt()
                .messages(toMessages(messages))
                .options(options.build());
        if (tools != null && !tools.isEmpty()) {
            List<ToolCallback> callbacks = new ArrayList<>();
            tools.forEach(tool -> callbacks.add(new DescriptorToolCallback(tool)));
            spec = spec.toolCallbacks(callbacks);
        }
        ChatResponse response = spec.call().chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            log.warn("Completion returned no output. messages={}", messages.size());
            return CompletionReply.text("");
        }
        AssistantMessage output = response.getResult().getOutput();
        List<ToolRequest> toolCalls = new ArrayList<>();
        if (output.hasToolCalls()) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                toolCalls.add(new ToolRequest(call.name(),
                        jsonProcessingService.readArguments(call.name(), call.arguments()), call.id()));
            }
        }
        return new CompletionReply(output.getText(), toolCalls);
    }

    private List<Message> toMessages(List<ConversationMessage> messages) {
        List<Message> converted = new ArrayList<>(messages.size());
        for (ConversationMessage message : messages) {
            switch (message.kind()) {
                case SYSTEM -> converted.add(new SystemMessage(message.content()));
                case USER -> converted.add(new UserMessage(message.content()));
                case ASSISTANT -> converted.add(toAssistantMessage(message));
                case TOOL -> converted.add(new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                        message.toolCallId(), message.toolName(), message.content()))));
            }
        }
        return converted;
    }

    private AssistantMessage toAssistantMessage(ConversationMessage message) {
        List<AssistantMessage.ToolCall> calls = new ArrayList<>();
        for (ToolRequest request : message.toolRequests()) {
            if (request.isNative()) {
                calls.add(new AssistantMessage.ToolCall(request.callId(), "function", request.tool(),
                        jsonProcessingService.toJson(request.arguments())));
            }
        }
        return new AssistantMessage(message.content(), Map.of(), calls);
    }
}
