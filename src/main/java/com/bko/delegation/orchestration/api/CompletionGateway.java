package com.bko.delegation.orchestration.api;

import com.bko.delegation.orchestration.model.CompletionReply;
import com.bko.delegation.orchestration.model.ConversationMessage;
import com.bko.delegation.orchestration.model.ToolDescriptor;

import java.util.List;

/**
 * One turn against the language model. Implementations must not execute tools themselves.
 */
public interface CompletionGateway {

    CompletionReply complete(List<ConversationMessage> messages, List<ToolDescriptor> tools);
}
