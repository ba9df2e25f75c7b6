package com.deskmate.models;

public class ConversationTurn {
    private final TurnRole role;
    private final String content;

    public ConversationTurn(TurnRole role, String content) {
        this.role = role;
        this.content = content != null ? content : "";
    }

    public static ConversationTurn system(String content) {
        return new ConversationTurn(TurnRole.SYSTEM, content);
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(TurnRole.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(TurnRole.ASSISTANT, content);
    }

    public TurnRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }
}
