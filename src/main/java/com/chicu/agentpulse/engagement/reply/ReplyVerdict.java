package com.chicu.agentpulse.engagement.reply;

public record ReplyVerdict(boolean respond, String reason) {

    public static ReplyVerdict respond(String reason) {
        return new ReplyVerdict(true, reason);
    }

    public static ReplyVerdict skip(String reason) {
        return new ReplyVerdict(false, reason);
    }
}
