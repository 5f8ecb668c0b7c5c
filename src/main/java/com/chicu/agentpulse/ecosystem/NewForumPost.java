package com.chicu.agentpulse.ecosystem;

import java.util.List;

public record NewForumPost(
        String title,
        String body,
        List<String> tags
) {}
