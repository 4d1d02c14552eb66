package io.github.drompincen.agentchat.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Document(collection = "conversations")
public class ConversationDocument {

    @Id
    private String conversationId;
    private String agentSessionId;
    private String title;
    private Instant startTime;

    @Indexed
    private Instant endTime;
    private int messageCount;
    private double totalCost;
    private long totalTokensInput;
    private long totalTokensOutput;
    private String firstUserMessage;
    private String lastUserMessage;
    private List<Map<String, Object>> messages = new ArrayList<>();

    public ConversationDocument() {}

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public String getAgentSessionId() { return agentSessionId; }
    public void setAgentSessionId(String agentSessionId) { this.agentSessionId = agentSessionId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }

    public int getMessageCount() { return messageCount; }
    public void setMessageCount(int messageCount) { this.messageCount = messageCount; }

    public double getTotalCost() { return totalCost; }
    public void setTotalCost(double totalCost) { this.totalCost = totalCost; }

    public long getTotalTokensInput() { return totalTokensInput; }
    public void setTotalTokensInput(long totalTokensInput) { this.totalTokensInput = totalTokensInput; }

    public long getTotalTokensOutput() { return totalTokensOutput; }
    public void setTotalTokensOutput(long totalTokensOutput) { this.totalTokensOutput = totalTokensOutput; }

    public String getFirstUserMessage() { return firstUserMessage; }
    public void setFirstUserMessage(String firstUserMessage) { this.firstUserMessage = firstUserMessage; }

    public String getLastUserMessage() { return lastUserMessage; }
    public void setLastUserMessage(String lastUserMessage) { this.lastUserMessage = lastUserMessage; }

    public List<Map<String, Object>> getMessages() { return messages; }
    public void setMessages(List<Map<String, Object>> messages) { this.messages = messages; }
}
